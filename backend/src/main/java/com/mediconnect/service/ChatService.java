package com.mediconnect.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediconnect.dto.MessageDTO;
import com.mediconnect.dto.RoomEnvelope;
import com.mediconnect.entity.Consultation;
import com.mediconnect.entity.ConsultationMessage;
import com.mediconnect.entity.MessageStatus;
import com.mediconnect.entity.ParticipantRole;
import com.mediconnect.exception.ErrorCode;
import com.mediconnect.exception.ForbiddenOperationException;
import com.mediconnect.exception.InvalidRequestException;
import com.mediconnect.exception.MessageNotFoundException;
import com.mediconnect.lifecycle.ConsultationLifecycle;
import com.mediconnect.persistence.ConsultationStore;
import com.mediconnect.persistence.PersistenceWriter;
import com.mediconnect.room.Room;
import com.mediconnect.room.SessionRegistry;
import com.mediconnect.signaling.RelayResult;
import com.mediconnect.signaling.SignalingRelay;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Consultation chat. Messages are fanned out through the room first and stored afterwards;
 * a message nobody received stays SENT and is replayed when a participant joins.
 */
@Service
@Slf4j
public class ChatService {

    private final ConsultationLifecycle lifecycle;
    private final ConsultationStore store;
    private final PersistenceWriter writer;
    private final SessionRegistry registry;
    private final SignalingRelay relay;
    private final ObjectMapper objectMapper;
    private final Executor persistenceExecutor;
    private final Clock clock;

    public ChatService(ConsultationLifecycle lifecycle,
                       ConsultationStore store,
                       PersistenceWriter writer,
                       SessionRegistry registry,
                       SignalingRelay relay,
                       ObjectMapper objectMapper,
                       @Qualifier("persistenceExecutor") Executor persistenceExecutor,
                       Clock clock) {
        this.lifecycle = lifecycle;
        this.store = store;
        this.writer = writer;
        this.registry = registry;
        this.relay = relay;
        this.objectMapper = objectMapper;
        this.persistenceExecutor = persistenceExecutor;
        this.clock = clock;
    }

    /**
     * Chat sent by a joined participant over the socket. Stored once the fan-out finishes.
     */
    public CompletableFuture<MessageDTO.Response> sendFromRoom(String roomId, String senderId, MessageDTO.SendRequest request) {
        Room room = registry.requireRoom(roomId);
        ConsultationMessage message = newMessage(room.getConsultationId(), senderId, room.roleOf(senderId), request);
        CompletableFuture<RelayResult> delivery = relay.relay(roomId, senderId, null, chatEnvelope(message));
        return delivery.handle((result, error) -> {
            if (result != null) {
                applyDelivery(message, result);
            } else {
                log.debug("Message {} not fanned out, kept as SENT: {}", message.getId(), error.getMessage());
            }
            writer.submit(messageKey(message.getId()), () -> store.appendMessage(message));
            return mapToResponse(message, List.of());
        });
    }

    /**
     * Chat posted over REST. Stored before the call returns; pushed to the live room if there is one.
     */
    public MessageDTO.Response send(UUID consultationId, String senderId, MessageDTO.SendRequest request) {
        Consultation consultation = lifecycle.require(consultationId);
        ParticipantRole role = roleIn(consultation, senderId);
        ConsultationMessage message = newMessage(consultationId, senderId, role, request);

        boolean persisted = writer.writeNow(messageKey(message.getId()), () -> store.appendMessage(message));
        List<ErrorCode> warnings = persisted ? List.of() : List.of(ErrorCode.PERSISTENCE_DEGRADED);

        if (registry.findRoom(consultation.getRoomId()).isPresent()) {
            relay.publish(consultation.getRoomId(), senderId, null, chatEnvelope(message))
                .thenAccept(result -> {
                    if (result.isDelivered()) {
                        markDelivered(message.getId());
                    }
                });
        }
        log.debug("Message {} posted to consultation {} by {}", message.getId(), consultationId, senderId);
        return mapToResponse(message, warnings);
    }

    /**
     * Pushes messages nobody has received yet to a participant who just joined.
     */
    public void replayPending(UUID consultationId, String roomId, String userId) {
        try {
            persistenceExecutor.execute(() -> replay(consultationId, roomId, userId));
        } catch (RejectedExecutionException e) {
            log.warn("Could not schedule chat replay for {} in room {}", userId, roomId);
        }
    }

    public MessageDTO.Response markRead(UUID consultationId, UUID messageId, String readerId) {
        ConsultationMessage message = store.findMessage(messageId)
            .filter(m -> m.getConsultationId().equals(consultationId))
            .orElseThrow(() -> new MessageNotFoundException("Message not found: " + messageId));
        if (readerId.equals(message.getSenderId()) || !message.getStatus().canAdvanceTo(MessageStatus.READ)) {
            return mapToResponse(message, List.of());
        }

        Instant now = clock.instant();
        boolean persisted = writer.writeNow(statusKey(messageId),
            () -> store.updateMessageStatus(messageId, MessageStatus.READ, now));
        if (message.getDeliveredAt() == null) {
            message.setDeliveredAt(now);
        }
        message.setStatus(MessageStatus.READ);
        message.setReadAt(now);
        return mapToResponse(message, persisted ? List.of() : List.of(ErrorCode.PERSISTENCE_DEGRADED));
    }

    public List<MessageDTO.Response> listMessages(UUID consultationId) {
        lifecycle.require(consultationId);
        return store.findMessages(consultationId).stream()
            .map(m -> mapToResponse(m, null))
            .collect(Collectors.toList());
    }

    private void replay(UUID consultationId, String roomId, String userId) {
        List<ConsultationMessage> pending;
        try {
            pending = store.findUndeliveredMessages(consultationId);
        } catch (RuntimeException e) {
            log.warn("Chat replay for {} skipped, store unavailable: {}", userId, e.getMessage());
            return;
        }
        int replayed = 0;
        for (ConsultationMessage message : pending) {
            if (message.getSenderId().equals(userId)) {
                continue;
            }
            replayed++;
            relay.publish(roomId, null, userId, chatEnvelope(message))
                .thenAccept(result -> {
                    if (result.isDelivered()) {
                        markDelivered(message.getId());
                    }
                })
                .exceptionally(e -> {
                    log.debug("Replay of message {} to {} not delivered: {}", message.getId(), userId, e.getMessage());
                    return null;
                });
        }
        if (replayed > 0) {
            log.info("Replayed {} pending message(s) to {} in room {}", replayed, userId, roomId);
        }
    }

    private void markDelivered(UUID messageId) {
        Instant now = clock.instant();
        writer.submit(statusKey(messageId), () -> store.updateMessageStatus(messageId, MessageStatus.DELIVERED, now));
    }

    private void applyDelivery(ConsultationMessage message, RelayResult result) {
        message.setRoomSequence(result.getSequence());
        if (result.isDelivered()) {
            message.setStatus(MessageStatus.DELIVERED);
            message.setDeliveredAt(clock.instant());
        }
    }

    private ConsultationMessage newMessage(UUID consultationId, String senderId, ParticipantRole role,
                                           MessageDTO.SendRequest request) {
        if (request == null || request.getContent() == null || request.getContent().isBlank()) {
            throw new InvalidRequestException("Message content is required");
        }
        List<ConsultationMessage.Attachment> attachments = new ArrayList<>();
        if (request.getAttachments() != null) {
            request.getAttachments().forEach(a -> attachments.add(ConsultationMessage.Attachment.builder()
                .name(a.getName())
                .url(a.getUrl())
                .mimeType(a.getMimeType())
                .size(a.getSize())
                .build()));
        }
        ConsultationMessage message = ConsultationMessage.builder()
            .consultationId(consultationId)
            .senderId(senderId)
            .senderRole(role)
            .type(request.getType() != null ? request.getType() : ConsultationMessage.MessageType.TEXT)
            .content(request.getContent())
            .attachments(attachments)
            .status(MessageStatus.SENT)
            .replyTo(request.getReplyTo())
            .build();
        message.setId(UUID.randomUUID());
        message.setCreatedAt(clock.instant());
        return message;
    }

    private RoomEnvelope chatEnvelope(ConsultationMessage message) {
        return RoomEnvelope.builder()
            .type(RoomEnvelope.Type.CHAT_MESSAGE)
            .fromUserId(message.getSenderId())
            .payload(objectMapper.valueToTree(mapToResponse(message, null)))
            .build();
    }

    private static ParticipantRole roleIn(Consultation consultation, String userId) {
        if (userId.equals(consultation.getDoctorId())) {
            return ParticipantRole.DOCTOR;
        }
        if (userId.equals(consultation.getPatientId())) {
            return ParticipantRole.PATIENT;
        }
        throw new ForbiddenOperationException("User " + userId + " is not a party to consultation " + consultation.getId());
    }

    private static String messageKey(UUID messageId) {
        return "message:" + messageId;
    }

    private static String statusKey(UUID messageId) {
        return "message:" + messageId + ":status";
    }

    static MessageDTO.Response mapToResponse(ConsultationMessage message, List<ErrorCode> warnings) {
        List<MessageDTO.Attachment> attachments = Optional.ofNullable(message.getAttachments())
            .orElse(List.of())
            .stream()
            .map(a -> MessageDTO.Attachment.builder()
                .name(a.getName())
                .url(a.getUrl())
                .mimeType(a.getMimeType())
                .size(a.getSize())
                .build())
            .collect(Collectors.toList());
        return MessageDTO.Response.builder()
            .id(message.getId())
            .consultationId(message.getConsultationId())
            .senderId(message.getSenderId())
            .senderRole(message.getSenderRole())
            .type(message.getType())
            .content(message.getContent())
            .attachments(attachments)
            .status(message.getStatus())
            .replyTo(message.getReplyTo())
            .sequence(message.getRoomSequence())
            .createdAt(message.getCreatedAt())
            .deliveredAt(message.getDeliveredAt())
            .readAt(message.getReadAt())
            .warnings(warnings)
            .build();
    }
}
