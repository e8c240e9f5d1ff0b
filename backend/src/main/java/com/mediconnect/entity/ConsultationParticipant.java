package com.mediconnect.entity;

import jakarta.persistence.*;
import lombok.*;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;

/**
 * Durable summary of one person's presence in a consultation. Rewritten whenever the live
 * room reports a change; the (consultation, user) pair is unique so retries update in place.
 */
@Entity
@Table(name = "consultation_participants", uniqueConstraints = {
    @UniqueConstraint(name = "uk_participant_consultation_user", columnNames = {"consultation_id", "user_id"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConsultationParticipant extends BaseEntity {

    @Column(name = "consultation_id", nullable = false)
    private UUID consultationId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private ParticipantRole role;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ParticipantStatus status;

    @Column(name = "joined_at")
    private Instant joinedAt;

    @Column(name = "left_at")
    private Instant leftAt;

    @Column(name = "duration_seconds")
    private long durationSeconds;

    @Column(name = "audio_enabled")
    private boolean audioEnabled;

    @Column(name = "video_enabled")
    private boolean videoEnabled;

    @Column(name = "screen_share_enabled")
    private boolean screenShareEnabled;

    @Column(name = "disconnection_count")
    private int disconnectionCount;

    @Column(name = "last_quality")
    private String lastQuality;

    public static UUID idFor(UUID consultationId, String userId) {
        return UUID.nameUUIDFromBytes((consultationId + ":" + userId).getBytes(StandardCharsets.UTF_8));
    }
}
