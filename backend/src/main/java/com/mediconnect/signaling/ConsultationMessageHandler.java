package com.mediconnect.signaling;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediconnect.dto.MessageDTO;
import com.mediconnect.dto.RoomEnvelope;
import com.mediconnect.entity.ParticipantRole;
import com.mediconnect.exception.ConsultationException;
import com.mediconnect.exception.ErrorCode;
import com.mediconnect.exception.ForbiddenOperationException;
import com.mediconnect.exception.MalformedMessageException;
import com.mediconnect.exception.NotJoinedException;
import com.mediconnect.room.ConnectionBinding;
import com.mediconnect.room.ConnectionQuality;
import com.mediconnect.room.MediaState;
import com.mediconnect.room.SessionRegistry;
import com.mediconnect.service.ChatService;
import com.mediconnect.service.ConsultationRoomService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Entry point for every envelope a client sends. Failures are answered with an error
 * envelope to the sending connection only.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConsultationMessageHandler {

    private final ConsultationRoomService roomService;
    private final ChatService chatService;
    private final SignalingRelay relay;
    private final SessionRegistry registry;
    private final ConnectionGateway gateway;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * @param principalName the user the connection authenticated as, or null if it did not
     */
    public void handle(String connectionId, String principalName, RoomEnvelope envelope) {
        String roomId = envelope != null ? envelope.getRoomId() : null;
        try {
            if (principalName == null || principalName.isBlank()) {
                throw new ForbiddenOperationException("Connection is not authenticated");
            }
            validate(envelope);
            if (envelope.getType() == RoomEnvelope.Type.JOIN) {
                join(connectionId, principalName, envelope);
                return;
            }

            String userId = boundUser(connectionId, principalName, envelope);
            if (envelope.getType().isSignaling()) {
                if (envelope.getPayload() == null) {
                    throw new MalformedMessageException(envelope.getType().getWireName() + " needs a payload");
                }
                reportFailure(connectionId, roomId, relay.relay(roomId, userId, envelope.getToUserId(),
                    RoomEnvelope.builder().type(envelope.getType()).payload(envelope.getPayload()).build()));
                return;
            }
            switch (envelope.getType()) {
                case LEAVE -> roomService.leave(roomId, userId);
                case MEDIA_STATE -> roomService.updateMedia(roomId, userId, read(envelope.getPayload(), MediaState.class));
                case CONNECTION_QUALITY -> roomService.updateQuality(roomId, userId, quality(envelope.getPayload()));
                case CHAT_MESSAGE -> reportFailure(connectionId, roomId, chatService.sendFromRoom(roomId, userId,
                    read(envelope.getPayload(), MessageDTO.SendRequest.class)));
                default -> throw new MalformedMessageException(envelope.getType().getWireName()
                    + " is sent by the server only");
            }
        } catch (ConsultationException e) {
            log.debug("Rejected envelope from {}: {} {}", connectionId, e.getCode(), e.getMessage());
            sendError(connectionId, roomId, e.getCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Failed to handle envelope from {}: {}", connectionId, e.getMessage(), e);
            sendError(connectionId, roomId, ErrorCode.INTERNAL_ERROR, "Internal error");
        }
    }

    /**
     * The client's transport closed. A participant who did not leave is recorded as disconnected.
     */
    public void onConnectionClosed(String connectionId) {
        try {
            roomService.connectionLost(connectionId, "connection closed");
        } catch (ConsultationException e) {
            log.debug("Nothing to record for closed connection {}: {}", connectionId, e.getMessage());
        }
    }

    private void join(String connectionId, String principalName, RoomEnvelope envelope) {
        if (envelope.getFromUserId() != null && !envelope.getFromUserId().equals(principalName)) {
            throw new MalformedMessageException("fromUserId does not match the authenticated user");
        }
        JsonNode role = envelope.getPayload() != null ? envelope.getPayload().get("role") : null;
        if (role == null || !role.isTextual()) {
            throw new MalformedMessageException("join needs payload.role");
        }
        ParticipantRole participantRole;
        try {
            participantRole = ParticipantRole.valueOf(role.asText().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MalformedMessageException("Unknown role: " + role.asText());
        }
        roomService.join(envelope.getRoomId(), principalName, participantRole, connectionId);
    }

    private void validate(RoomEnvelope envelope) {
        if (envelope == null || envelope.getType() == null) {
            throw new MalformedMessageException("Envelope type is missing or unknown");
        }
        if (envelope.getRoomId() == null || envelope.getRoomId().isBlank()) {
            throw new MalformedMessageException("Envelope roomId is missing");
        }
        if (!envelope.getType().isClientOriginated()) {
            throw new MalformedMessageException(envelope.getType().getWireName() + " is sent by the server only");
        }
    }

    private String boundUser(String connectionId, String principalName, RoomEnvelope envelope) {
        ConnectionBinding binding = registry.findByConnection(connectionId)
            .orElseThrow(() -> new NotJoinedException("Connection has not joined a room"));
        if (!binding.getUserId().equals(principalName)) {
            throw new ForbiddenOperationException("Connection is joined as another user");
        }
        if (!binding.getRoomId().equals(envelope.getRoomId())) {
            throw new NotJoinedException("Connection is joined to a different room");
        }
        if (envelope.getFromUserId() != null && !envelope.getFromUserId().equals(binding.getUserId())) {
            throw new MalformedMessageException("fromUserId does not match the connection's user");
        }
        return binding.getUserId();
    }

    private ConnectionQuality quality(JsonNode payload) {
        JsonNode value = payload != null ? payload.get("quality") : null;
        if (value == null || !value.isTextual()) {
            throw new MalformedMessageException("connection-quality needs payload.quality");
        }
        try {
            return ConnectionQuality.valueOf(value.asText().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MalformedMessageException("Unknown quality: " + value.asText());
        }
    }

    private <T> T read(JsonNode payload, Class<T> type) {
        if (payload == null || payload.isNull()) {
            throw new MalformedMessageException("Payload is missing");
        }
        try {
            return objectMapper.treeToValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Payload is not a valid " + type.getSimpleName());
        }
    }

    private void reportFailure(String connectionId, String roomId, CompletableFuture<?> delivery) {
        delivery.whenComplete((result, error) -> {
            if (error == null) {
                return;
            }
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            if (cause instanceof ConsultationException) {
                sendError(connectionId, roomId, ((ConsultationException) cause).getCode(), cause.getMessage());
            } else {
                log.error("Delivery from {} failed: {}", connectionId, cause.getMessage(), cause);
                sendError(connectionId, roomId, ErrorCode.INTERNAL_ERROR, "Delivery failed");
            }
        });
    }

    private void sendError(String connectionId, String roomId, ErrorCode code, String message) {
        try {
            gateway.send(connectionId, RoomEnvelope.error(roomId, code, message, clock.instant()));
        } catch (RuntimeException e) {
            log.warn("Could not send {} to connection {}: {}", code, connectionId, e.getMessage());
        }
    }
}
