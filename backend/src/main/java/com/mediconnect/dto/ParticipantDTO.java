package com.mediconnect.dto;

import com.mediconnect.entity.ParticipantRole;
import com.mediconnect.entity.ParticipantStatus;
import com.mediconnect.room.ConnectionEvent;
import com.mediconnect.room.ConnectionQuality;
import com.mediconnect.room.MediaChange;
import com.mediconnect.room.MediaState;
import lombok.*;

import java.time.Instant;
import java.util.List;

public class ParticipantDTO {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class InviteRequest {
        private String userId;
        private ParticipantRole role;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Response {
        private String userId;
        private ParticipantRole role;
        private ParticipantStatus status;
        private Instant joinedAt;
        private Instant leftAt;
        private Long durationSeconds;
        private MediaState mediaState;
        private ConnectionQuality quality;
        private int disconnections;
        private boolean live;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Summary {
        private String userId;
        private ParticipantRole role;
        private ParticipantStatus status;
        private Instant joinedAt;
        private Instant leftAt;
        private long durationSeconds;
        private List<MediaChange> mediaTimeline;
        private List<ConnectionEvent> connectionHistory;
    }
}
