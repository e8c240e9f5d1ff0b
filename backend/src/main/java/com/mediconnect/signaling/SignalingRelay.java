package com.mediconnect.signaling;

import com.mediconnect.dto.RoomEnvelope;
import com.mediconnect.exception.NotJoinedException;
import com.mediconnect.exception.RecipientUnavailableException;
import com.mediconnect.exception.RoomClosedException;
import com.mediconnect.room.Recipient;
import com.mediconnect.room.Room;
import com.mediconnect.room.SessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Forwards payloads between participants of a room. Everything for one room goes through
 * that room's dispatcher, so payloads from one sender arrive in the order they were relayed.
 * Delivery is best effort and at most once.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SignalingRelay {

    private final SessionRegistry registry;
    private final ConnectionGateway gateway;
    private final Clock clock;

    /**
     * Relays a participant's payload to {@code toUserId}, or to every other joined
     * participant when it is null. The future fails with {@link RecipientUnavailableException}
     * when a direct target is not joined at delivery time.
     */
    public CompletableFuture<RelayResult> relay(String roomId, String fromUserId, String toUserId, RoomEnvelope envelope) {
        Room room = registry.requireRoom(roomId);
        if (room.isClosed()) {
            throw new RoomClosedException("Room " + roomId + " is closed");
        }
        if (!room.isJoined(fromUserId)) {
            throw new NotJoinedException("User " + fromUserId + " is not joined in room " + roomId);
        }
        return dispatch(room, fromUserId, toUserId, envelope);
    }

    /**
     * Sends a server notice through the room's dispatcher, so it is ordered with relayed
     * traffic. {@code excludeUserId} is skipped on broadcast.
     */
    public CompletableFuture<RelayResult> publish(String roomId, String excludeUserId, String toUserId, RoomEnvelope envelope) {
        return registry.findRoom(roomId)
            .map(room -> dispatch(room, excludeUserId, toUserId, envelope))
            .orElseGet(() -> CompletableFuture.completedFuture(new RelayResult(-1, List.of(), List.of())));
    }

    private CompletableFuture<RelayResult> dispatch(Room room, String fromUserId, String toUserId, RoomEnvelope envelope) {
        CompletableFuture<RelayResult> future = new CompletableFuture<>();
        Instant now = clock.instant();
        RoomEnvelope outbound = envelope.toBuilder()
            .roomId(room.getRoomId())
            .fromUserId(envelope.getFromUserId() != null ? envelope.getFromUserId() : fromUserId)
            .toUserId(toUserId)
            .timestamp(envelope.getTimestamp() != null ? envelope.getTimestamp() : now)
            .build();
        long sequence = room.enqueue(seq -> () -> deliver(room, fromUserId, toUserId,
            outbound.toBuilder().sequence(seq).build(), future), now);
        if (sequence < 0) {
            future.completeExceptionally(new RoomClosedException("Room " + room.getRoomId() + " is closed"));
        }
        return future;
    }

    private void deliver(Room room, String fromUserId, String toUserId, RoomEnvelope envelope,
                         CompletableFuture<RelayResult> future) {
        List<Recipient> recipients = room.recipients(fromUserId, toUserId);
        if (toUserId != null && recipients.isEmpty()) {
            log.debug("Dropped {} #{} in room {}: {} is not joined",
                envelope.getType(), envelope.getSequence(), room.getRoomId(), toUserId);
            future.completeExceptionally(new RecipientUnavailableException(
                "User " + toUserId + " is not joined in room " + room.getRoomId()));
            return;
        }

        List<String> delivered = new ArrayList<>(recipients.size());
        List<String> failed = new ArrayList<>();
        for (Recipient recipient : recipients) {
            try {
                gateway.send(recipient.getConnectionId(), envelope);
                delivered.add(recipient.getUserId());
            } catch (RuntimeException e) {
                failed.add(recipient.getUserId());
                log.warn("Delivery of {} #{} to {} in room {} failed: {}", envelope.getType(),
                    envelope.getSequence(), recipient.getUserId(), room.getRoomId(), e.getMessage());
            }
        }
        log.debug("Relayed {} #{} in room {} to {}", envelope.getType(), envelope.getSequence(),
            room.getRoomId(), delivered);
        future.complete(new RelayResult(envelope.getSequence(), delivered, failed));
    }
}
