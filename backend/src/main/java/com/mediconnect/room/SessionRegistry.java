package com.mediconnect.room;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.mediconnect.dto.RoomEnvelope;
import com.mediconnect.entity.ParticipantRole;
import com.mediconnect.exception.AlreadyExistsException;
import com.mediconnect.exception.RoomInvariantViolationException;
import com.mediconnect.exception.RoomNotFoundException;
import com.mediconnect.signaling.ConnectionGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Owns every live room and the indexes used to find them.
 */
@Component
@Slf4j
public class SessionRegistry {

    private final Map<String, Room> rooms = new ConcurrentHashMap<>();
    private final Map<UUID, String> roomsByConsultation = new ConcurrentHashMap<>();
    private final Map<String, ConnectionBinding> connections = new ConcurrentHashMap<>();

    private final ConnectionGateway gateway;
    private final Executor relayExecutor;
    private final RoomPolicy policy;
    private final Clock clock;

    public SessionRegistry(ConnectionGateway gateway,
                           @Qualifier("relayExecutor") Executor relayExecutor,
                           RoomPolicy policy,
                           Clock clock) {
        this.gateway = gateway;
        this.relayExecutor = relayExecutor;
        this.policy = policy;
        this.clock = clock;
    }

    public String createRoom(RoomDescriptor descriptor) {
        UUID consultationId = descriptor.getConsultationId();
        String roomId = descriptor.getRoomId();

        String live = roomsByConsultation.get(consultationId);
        if (live != null && rooms.containsKey(live)) {
            throw new AlreadyExistsException("Consultation " + consultationId + " already has live room " + live);
        }

        Room room = new Room(roomId, consultationId, descriptor.getTransport(),
            new RoomDispatcher(roomId, relayExecutor), clock.instant());
        Room existing = rooms.putIfAbsent(roomId, room);
        if (existing != null) {
            if (!existing.getConsultationId().equals(consultationId)) {
                log.error("Room {} is bound to consultation {} but was requested for {}; aborting room",
                    roomId, existing.getConsultationId(), consultationId);
                closeRoom(roomId, "room bound to another consultation");
                throw new RoomInvariantViolationException("Room " + roomId + " belongs to another consultation");
            }
            throw new AlreadyExistsException("Room " + roomId + " is already live");
        }

        String previous = roomsByConsultation.putIfAbsent(consultationId, roomId);
        if (previous != null && !previous.equals(roomId)) {
            rooms.remove(roomId, room);
            room.dispatcher().shutdown();
            throw new AlreadyExistsException("Consultation " + consultationId + " already has live room " + previous);
        }

        log.info("Room {} opened for consultation {} ({} transport)",
            roomId, consultationId, descriptor.getTransport().mode());
        return roomId;
    }

    /**
     * Joins the user to the room. A second join by the same user resumes its participant
     * record and replaces its connection.
     */
    public ParticipantHandle joinRoom(String roomId, String userId, ParticipantRole role, String connectionId) {
        Room room = requireRoom(roomId);
        ParticipantHandle handle = room.join(userId, role, connectionId, policy, clock.instant());
        connections.put(connectionId, new ConnectionBinding(roomId, userId));
        if (handle.getSupersededConnectionId() != null) {
            connections.remove(handle.getSupersededConnectionId());
        }
        log.info("User {} joined room {} as {}{}", userId, roomId, role,
            handle.isReconnected() ? " (reconnected)" : "");
        return handle;
    }

    public ParticipantSummary leaveRoom(String roomId, String userId) {
        Room room = requireRoom(roomId);
        Instant now = clock.instant();
        String connectionId = room.leave(userId, now);
        if (connectionId != null) {
            connections.remove(connectionId);
        }
        log.info("User {} left room {}", userId, roomId);
        return room.summary(userId, now);
    }

    public List<ParticipantSnapshot> listParticipants(String roomId) {
        return requireRoom(roomId).participants();
    }

    public int activeParticipantCount(String roomId) {
        return requireRoom(roomId).activeParticipantCount();
    }

    /**
     * Closes the room: remaining participants are told through the room dispatcher, marked
     * left, and the transport is torn down. Calling it again for the same room is a no-op.
     */
    public Optional<ClosedRoom> closeRoom(String roomId, String reason) {
        Room room = rooms.get(roomId);
        if (room == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        List<Recipient> remaining = room.close(now);
        if (remaining == null) {
            return Optional.empty();
        }

        RoomEnvelope notice = RoomEnvelope.notice(RoomEnvelope.Type.ROOM_CLOSED, roomId,
            JsonNodeFactory.instance.objectNode().put("reason", reason), now);
        RoomDispatcher dispatcher = room.dispatcher();
        for (Recipient recipient : remaining) {
            dispatcher.submit(() -> sendClosedNotice(recipient, notice));
            connections.remove(recipient.getConnectionId());
        }
        dispatcher.shutdown();

        rooms.remove(roomId, room);
        roomsByConsultation.remove(room.getConsultationId(), roomId);

        try {
            room.getTransport().teardown();
        } catch (RuntimeException e) {
            log.warn("Transport teardown failed for room {}: {}", roomId, e.getMessage());
        }

        log.info("Room {} closed ({}); {} participant(s) notified", roomId, reason, remaining.size());
        return Optional.of(new ClosedRoom(roomId, room.getConsultationId(), reason, room.summaries(now)));
    }

    public Room requireRoom(String roomId) {
        Room room = rooms.get(roomId);
        if (room == null) {
            throw new RoomNotFoundException("Room not found: " + roomId);
        }
        return room;
    }

    public Optional<Room> findRoom(String roomId) {
        return Optional.ofNullable(rooms.get(roomId));
    }

    public Optional<Room> findByConsultation(UUID consultationId) {
        String roomId = roomsByConsultation.get(consultationId);
        return roomId == null ? Optional.empty() : findRoom(roomId);
    }

    public Optional<ConnectionBinding> findByConnection(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public List<String> findExpiredRooms(Instant now) {
        return rooms.values().stream()
            .filter(room -> room.isExpired(now, policy))
            .map(Room::getRoomId)
            .collect(Collectors.toList());
    }

    public int openRoomCount() {
        return rooms.size();
    }

    void unbind(String connectionId) {
        if (connectionId != null) {
            connections.remove(connectionId);
        }
    }

    Clock clock() {
        return clock;
    }

    private void sendClosedNotice(Recipient recipient, RoomEnvelope notice) {
        try {
            gateway.send(recipient.getConnectionId(), notice.toBuilder().toUserId(recipient.getUserId()).build());
        } catch (RuntimeException e) {
            log.warn("Could not notify {} that room {} closed: {}",
                recipient.getUserId(), notice.getRoomId(), e.getMessage());
        }
    }
}
