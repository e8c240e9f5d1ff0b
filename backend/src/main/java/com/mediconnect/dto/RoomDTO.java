package com.mediconnect.dto;

import com.mediconnect.entity.Consultation;
import com.mediconnect.exception.ErrorCode;
import lombok.*;

import java.util.List;
import java.util.UUID;

public class RoomDTO {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Response {
        private String roomId;
        private UUID consultationId;
        private Consultation.TransportMode transportMode;
        private String roomToken;
        private boolean created;
        private int activeParticipants;
        private List<ErrorCode> warnings;
    }
}
