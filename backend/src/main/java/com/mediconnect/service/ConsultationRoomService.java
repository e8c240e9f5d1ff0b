package com.mediconnect.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mediconnect.dto.RoomEnvelope;
import com.mediconnect.entity.Consultation;
import com.mediconnect.entity.ParticipantRole;
import com.mediconnect.exception.AlreadyExistsException;
import com.mediconnect.exception.ConsultationException;
import com.mediconnect.exception.ErrorCode;
import com.mediconnect.exception.ForbiddenOperationException;
import com.mediconnect.exception.RoomClosedException;
import com.mediconnect.exception.RoomNotFoundException;
import com.mediconnect.lifecycle.ConsultationLifecycle;
import com.mediconnect.lifecycle.ConsultationTerminatedEvent;
import com.mediconnect.lifecycle.TransitionResult;
import com.mediconnect.persistence.ConsultationStore;
import com.mediconnect.persistence.PersistenceWriter;
import com.mediconnect.room.ClosedRoom;
import com.mediconnect.room.ConnectionBinding;
import com.mediconnect.room.ConnectionQuality;
import com.mediconnect.room.MediaState;
import com.mediconnect.room.ParticipantHandle;
import com.mediconnect.room.ParticipantSnapshot;
import com.mediconnect.room.ParticipantSummary;
import com.mediconnect.room.ParticipantTracker;
import com.mediconnect.room.Room;
import com.mediconnect.room.RoomDescriptor;
import com.mediconnect.room.RoomPolicy;
import com.mediconnect.room.SessionRegistry;
import com.mediconnect.signaling.SignalingRelay;
import com.mediconnect.transport.DirectTransport;
import com.mediconnect.transport.RoomTransport;
import com.mediconnect.transport.TransportSelection;
import com.mediconnect.transport.TransportSelector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ties the live room to the consultation behind it: opens rooms on demand, feeds joins and
 * departures into the lifecycle, announces them to the room and closes rooms whose
 * consultation has ended.
 */
@Service
@Slf4j
public class ConsultationRoomService {

    private static final int OPEN_LOCK_STRIPES = 64;

    private final ReentrantLock[] openLocks = new ReentrantLock[OPEN_LOCK_STRIPES];

    private final SessionRegistry registry;
    private final ParticipantTracker tracker;
    private final ConsultationLifecycle lifecycle;
    private final TransportSelector transportSelector;
    private final SignalingRelay relay;
    private final ChatService chatService;
    private final ConsultationStore store;
    private final PersistenceWriter writer;
    private final ObjectMapper objectMapper;
    private final RoomPolicy policy;
    private final Clock clock;

    public ConsultationRoomService(SessionRegistry registry,
                                   ParticipantTracker tracker,
                                   ConsultationLifecycle lifecycle,
                                   TransportSelector transportSelector,
                                   SignalingRelay relay,
                                   ChatService chatService,
                                   ConsultationStore store,
                                   PersistenceWriter writer,
                                   ObjectMapper objectMapper,
                                   RoomPolicy policy,
                                   Clock clock) {
        this.registry = registry;
        this.tracker = tracker;
        this.lifecycle = lifecycle;
        this.transportSelector = transportSelector;
        this.relay = relay;
        this.chatService = chatService;
        this.store = store;
        this.writer = writer;
        this.objectMapper = objectMapper;
        this.policy = policy;
        this.clock = clock;
        for (int i = 0; i < OPEN_LOCK_STRIPES; i++) {
            openLocks[i] = new ReentrantLock();
        }
    }

    public RoomOpening openRoom(UUID consultationId) {
        Consultation consultation = lifecycle.require(consultationId);
        requireOpen(consultation);
        return ensureRoom(consultation);
    }

    public JoinOutcome join(String roomId, String userId, ParticipantRole role, String connectionId) {
        Consultation consultation = lifecycle.findByRoom(roomId)
            .orElseThrow(() -> new RoomNotFoundException("Room not found: " + roomId));
        requireOpen(consultation);
        requireInvited(consultation, userId, role);

        RoomOpening opening = ensureRoom(consultation);
        List<ErrorCode> warnings = new ArrayList<>(opening.getWarnings());

        ParticipantHandle handle = registry.joinRoom(roomId, userId, role, connectionId);
        TransitionResult transition;
        try {
            transition = lifecycle.onParticipantJoined(consultation.getId(), userId, role);
        } catch (RuntimeException e) {
            log.warn("Join of {} to room {} rolled back: {}", userId, roomId, e.getMessage());
            registry.leaveRoom(roomId, userId);
            throw e;
        }
        warnings.addAll(transition.getWarnings());
        persistSummary(consultation.getId(), tracker.getSummary(roomId, userId));

        RoomTransport transport = opening.getTransport();
        String accessToken = transport.accessTokenFor(userId);

        ObjectNode joined = objectMapper.createObjectNode()
            .put("consultationId", consultation.getId().toString())
            .put("status", transition.getConsultation().getStatus().name())
            .put("role", role.name())
            .put("reconnected", handle.isReconnected())
            .put("transportMode", transport.mode().name());
        joined.put("roomToken", transport.roomToken());
        joined.put("accessToken", accessToken);
        joined.set("participants", objectMapper.valueToTree(registry.listParticipants(roomId)));
        relay.publish(roomId, null, userId, RoomEnvelope.notice(RoomEnvelope.Type.ROOM_JOINED, roomId, joined, clock.instant()));

        relay.publish(roomId, userId, null, RoomEnvelope.notice(RoomEnvelope.Type.PARTICIPANT_JOINED, roomId,
            participantPayload(userId, role).put("reconnected", handle.isReconnected()), clock.instant()));

        chatService.replayPending(consultation.getId(), roomId, userId);
        return new JoinOutcome(handle, transition.getConsultation().getStatus(), accessToken, warnings);
    }

    public ParticipantSummary leave(String roomId, String userId) {
        Room room = registry.requireRoom(roomId);
        ParticipantRole role = room.roleOf(userId);
        ParticipantSummary summary = registry.leaveRoom(roomId, userId);
        persistSummary(room.getConsultationId(), summary);
        relay.publish(roomId, userId, null, RoomEnvelope.notice(RoomEnvelope.Type.PARTICIPANT_LEFT, roomId,
            participantPayload(userId, role), clock.instant()));
        return summary;
    }

    /**
     * The transport under a connection went away without a leave. The participant keeps its
     * slot for the reconnect grace.
     */
    public Optional<ParticipantSummary> connectionLost(String connectionId, String reason) {
        Optional<ConnectionBinding> binding = registry.findByConnection(connectionId);
        if (binding.isEmpty()) {
            return Optional.empty();
        }
        String roomId = binding.get().getRoomId();
        String userId = binding.get().getUserId();
        Optional<Room> room = registry.findRoom(roomId);
        if (room.isEmpty() || !room.get().isJoined(userId)) {
            return Optional.empty();
        }
        ParticipantSummary summary = tracker.recordDisconnection(roomId, userId, reason);
        persistSummary(room.get().getConsultationId(), summary);
        relay.publish(roomId, userId, null, RoomEnvelope.notice(RoomEnvelope.Type.PARTICIPANT_DISCONNECTED, roomId,
            participantPayload(userId, summary.getRole()).put("reason", reason), clock.instant()));
        return Optional.of(summary);
    }

    public ParticipantSnapshot updateMedia(String roomId, String userId, MediaState state) {
        ParticipantSnapshot snapshot = tracker.updateMediaState(roomId, userId, state);
        JsonNode payload = objectMapper.valueToTree(state);
        relay.relay(roomId, userId, null, RoomEnvelope.builder()
            .type(RoomEnvelope.Type.MEDIA_STATE)
            .payload(payload)
            .build());
        return snapshot;
    }

    public ParticipantSnapshot updateQuality(String roomId, String userId, ConnectionQuality quality) {
        return tracker.updateConnectionQuality(roomId, userId, quality);
    }

    @EventListener
    public void onConsultationTerminated(ConsultationTerminatedEvent event) {
        closeAndRecord(event.getRoomId(), "consultation " + event.getStatus().name().toLowerCase());
    }

    /**
     * Closes rooms that sat empty past the grace period or saw no activity past the idle timeout.
     */
    public int sweepRooms() {
        Instant now = clock.instant();
        int closed = 0;
        for (String roomId : registry.findExpiredRooms(now)) {
            if (closeAndRecord(roomId, "inactive").isPresent()) {
                closed++;
            }
        }
        if (closed > 0) {
            log.info("Closed {} inactive room(s); {} still open", closed, registry.openRoomCount());
        }
        return closed;
    }

    /**
     * Marks scheduled consultations nobody joined as no-shows once they are overdue.
     */
    public int detectNoShows() {
        Instant cutoff = clock.instant().minus(policy.getNoShowAfter());
        List<Consultation> overdue = store.findOverdueScheduled(cutoff);
        int marked = 0;
        for (Consultation consultation : overdue) {
            try {
                if (lifecycle.markNoShow(consultation.getId()).statusChanged()) {
                    marked++;
                }
            } catch (ConsultationException e) {
                log.debug("Consultation {} not marked no-show: {}", consultation.getId(), e.getMessage());
            }
        }
        if (marked > 0) {
            log.info("Marked {} consultation(s) as no-show", marked);
        }
        return marked;
    }

    private Optional<ClosedRoom> closeAndRecord(String roomId, String reason) {
        Optional<ClosedRoom> closed = registry.closeRoom(roomId, reason);
        closed.ifPresent(room -> room.getSummaries()
            .forEach(summary -> persistSummary(room.getConsultationId(), summary)));
        return closed;
    }

    private RoomOpening ensureRoom(Consultation consultation) {
        String roomId = consultation.getRoomId();
        Optional<Room> live = registry.findRoom(roomId);
        if (live.isPresent()) {
            return existing(live.get());
        }

        ReentrantLock lock = openLocks[Math.floorMod(roomId.hashCode(), OPEN_LOCK_STRIPES)];
        lock.lock();
        try {
            live = registry.findRoom(roomId);
            if (live.isPresent()) {
                return existing(live.get());
            }

            TransportSelection selection = consultation.getType() == Consultation.ConsultationType.CHAT
                ? new TransportSelection(DirectTransport.INSTANCE, false)
                : transportSelector.selectTransport(consultation.getId(), roomId);
            RoomTransport transport = selection.getTransport();
            try {
                registry.createRoom(new RoomDescriptor(consultation.getId(), roomId, transport));
            } catch (AlreadyExistsException e) {
                transport.teardown();
                return registry.findRoom(roomId).map(this::existing).orElseThrow(() -> e);
            }

            List<ErrorCode> warnings = new ArrayList<>();
            if (selection.isDegraded()) {
                warnings.add(ErrorCode.TRANSPORT_UNAVAILABLE);
            }
            warnings.addAll(lifecycle.recordTransport(consultation.getId(), transport.mode(), transport.roomToken())
                .getWarnings());
            return new RoomOpening(roomId, consultation.getId(), transport, true, warnings);
        } finally {
            lock.unlock();
        }
    }

    private RoomOpening existing(Room room) {
        return new RoomOpening(room.getRoomId(), room.getConsultationId(), room.getTransport(), false, List.of());
    }

    private void persistSummary(UUID consultationId, ParticipantSummary summary) {
        writer.submit("participant:" + consultationId + ":" + summary.getUserId(),
            () -> store.saveParticipantSummary(consultationId, summary));
    }

    private ObjectNode participantPayload(String userId, ParticipantRole role) {
        return objectMapper.createObjectNode()
            .put("userId", userId)
            .put("role", role.name());
    }

    /**
     * The doctor and patient slots belong to the consultation's own doctor and patient; nurses
     * and observers need an invitation in that role.
     */
    private void requireInvited(Consultation consultation, String userId, ParticipantRole role) {
        boolean allowed;
        if (role == ParticipantRole.DOCTOR) {
            allowed = userId.equals(consultation.getDoctorId());
        } else if (role == ParticipantRole.PATIENT) {
            allowed = userId.equals(consultation.getPatientId());
        } else {
            allowed = store.findParticipants(consultation.getId()).stream()
                .anyMatch(p -> p.getUserId().equals(userId) && p.getRole() == role);
        }
        if (!allowed) {
            throw new ForbiddenOperationException("User " + userId + " may not join consultation "
                + consultation.getId() + " as " + role);
        }
    }

    private static void requireOpen(Consultation consultation) {
        if (consultation.getStatus().isTerminal()) {
            throw new RoomClosedException("Consultation " + consultation.getId() + " is "
                + consultation.getStatus());
        }
    }
}
