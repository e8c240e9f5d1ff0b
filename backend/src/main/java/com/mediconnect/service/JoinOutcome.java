package com.mediconnect.service;

import com.mediconnect.entity.ConsultationStatus;
import com.mediconnect.exception.ErrorCode;
import com.mediconnect.room.ParticipantHandle;
import lombok.Value;

import java.util.List;

@Value
public class JoinOutcome {
    ParticipantHandle handle;
    ConsultationStatus status;
    String accessToken;
    List<ErrorCode> warnings;
}
