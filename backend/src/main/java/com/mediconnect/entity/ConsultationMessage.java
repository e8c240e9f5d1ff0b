package com.mediconnect.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "consultation_messages", indexes = {
    @Index(name = "idx_message_consultation", columnList = "consultation_id, created_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConsultationMessage extends BaseEntity {

    @Column(name = "consultation_id", nullable = false)
    private UUID consultationId;

    @Column(name = "sender_id", nullable = false)
    private String senderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "sender_role", nullable = false)
    private ParticipantRole senderRole;

    @Enumerated(EnumType.STRING)
    @Column(name = "message_type", nullable = false)
    private MessageType type;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String content;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "consultation_message_attachments", joinColumns = @JoinColumn(name = "message_id"))
    @Builder.Default
    private List<Attachment> attachments = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private MessageStatus status;

    @Column(name = "reply_to")
    private UUID replyTo;

    @Column(name = "room_sequence")
    private Long roomSequence;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Column(name = "read_at")
    private Instant readAt;

    public enum MessageType {
        TEXT,
        FILE,
        IMAGE,
        SYSTEM,
        SIGNALING
    }

    @Embeddable
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Attachment {
        private String name;
        private String url;
        @Column(name = "mime_type")
        private String mimeType;
        private Long size;
    }
}
