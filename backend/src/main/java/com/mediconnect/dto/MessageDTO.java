package com.mediconnect.dto;

import com.mediconnect.entity.ConsultationMessage;
import com.mediconnect.entity.MessageStatus;
import com.mediconnect.entity.ParticipantRole;
import com.mediconnect.exception.ErrorCode;
import lombok.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public class MessageDTO {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SendRequest {
        private ConsultationMessage.MessageType type;
        private String content;
        private List<Attachment> attachments;
        private UUID replyTo;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Response {
        private UUID id;
        private UUID consultationId;
        private String senderId;
        private ParticipantRole senderRole;
        private ConsultationMessage.MessageType type;
        private String content;
        private List<Attachment> attachments;
        private MessageStatus status;
        private UUID replyTo;
        private Long sequence;
        private Instant createdAt;
        private Instant deliveredAt;
        private Instant readAt;
        private List<ErrorCode> warnings;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Attachment {
        private String name;
        private String url;
        private String mimeType;
        private Long size;
    }
}
