package com.mediconnect.room;

import com.mediconnect.entity.ParticipantRole;
import com.mediconnect.entity.ParticipantStatus;
import lombok.Value;

import java.time.Instant;

@Value
public class ParticipantSnapshot {
    String userId;
    ParticipantRole role;
    ParticipantStatus status;
    Instant joinedAt;
    Instant leftAt;
    MediaState mediaState;
    ConnectionQuality quality;
    int disconnections;
}
