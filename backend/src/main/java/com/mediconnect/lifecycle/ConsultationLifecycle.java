package com.mediconnect.lifecycle;

import com.mediconnect.entity.Consultation;
import com.mediconnect.entity.ConsultationStatus;
import com.mediconnect.entity.ParticipantRole;
import com.mediconnect.exception.ConsultationNotFoundException;
import com.mediconnect.exception.ErrorCode;
import com.mediconnect.exception.ForbiddenOperationException;
import com.mediconnect.exception.InvalidRequestException;
import com.mediconnect.exception.InvalidTransitionException;
import com.mediconnect.persistence.ConsultationStore;
import com.mediconnect.persistence.PersistenceWriter;
import com.mediconnect.room.RoomPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Consultation state machine. A consultation being transitioned is held in memory with its
 * own lock; it is reloaded from the store, checked and changed under that lock, then written
 * through with a version check. A write rejected because the row moved on is retried against
 * the reloaded row. A failed write does not roll the transition back: the result carries a
 * warning, the write is retried in the background and the consultation stays in memory until
 * it lands.
 */
@Component
@Slf4j
public class ConsultationLifecycle {

    private static final int MAX_CONFLICTS = 3;

    private final Map<UUID, Tracked> tracked = new ConcurrentHashMap<>();
    private final Map<String, UUID> roomIndex = new ConcurrentHashMap<>();

    private final ConsultationStore store;
    private final PersistenceWriter writer;
    private final ApplicationEventPublisher events;
    private final RoomPolicy policy;
    private final Clock clock;

    public ConsultationLifecycle(ConsultationStore store,
                                 PersistenceWriter writer,
                                 ApplicationEventPublisher events,
                                 RoomPolicy policy,
                                 Clock clock) {
        this.store = store;
        this.writer = writer;
        this.events = events;
        this.policy = policy;
        this.clock = clock;
    }

    /**
     * Writes a newly created consultation. It stays in memory only while that write is pending.
     */
    public TransitionResult register(Consultation consultation) {
        UUID consultationId = consultation.getId();
        Tracked entry = new Tracked();
        entry.consultation = consultation.copy();
        if (tracked.putIfAbsent(consultationId, entry) != null) {
            throw new InvalidRequestException("Consultation " + consultationId + " already registered");
        }
        roomIndex.put(consultation.getRoomId(), consultationId);
        entry.lock.lock();
        try {
            boolean persisted = writer.writeNow(recordKey(consultationId), () -> persistRecord(entry));
            return result(entry, consultation.getStatus(), true, persisted);
        } finally {
            evictIfSettled(consultationId, entry);
            entry.lock.unlock();
        }
    }

    public TransitionResult onParticipantJoined(UUID consultationId, String userId, ParticipantRole role) {
        return transition(consultationId, (c, now) -> {
            ConsultationStatus status = c.getStatus();
            if (status.isTerminal()) {
                return false;
            }
            boolean changed = false;
            if (role == ParticipantRole.DOCTOR) {
                if (c.getDoctorJoinedAt() == null) {
                    c.setDoctorJoinedAt(now);
                    changed = true;
                }
                if (status == ConsultationStatus.SCHEDULED || status == ConsultationStatus.WAITING) {
                    begin(c, now);
                    changed = true;
                }
            } else {
                if (role == ParticipantRole.PATIENT && c.getPatientJoinedAt() == null) {
                    c.setPatientJoinedAt(now);
                    changed = true;
                }
                if (status == ConsultationStatus.SCHEDULED) {
                    c.setStatus(ConsultationStatus.WAITING);
                    changed = true;
                }
            }
            return changed;
        });
    }

    public TransitionResult start(UUID consultationId, String userId, boolean admin) {
        return transition(consultationId, (c, now) -> {
            requireDoctorOrAdmin(c, userId, admin, "start");
            requireTransition(c, ConsultationStatus.IN_PROGRESS);
            if (c.getDoctorJoinedAt() == null && c.getDoctorId().equals(userId)) {
                c.setDoctorJoinedAt(now);
            }
            begin(c, now);
            return true;
        });
    }

    public TransitionResult end(UUID consultationId, String userId, boolean admin) {
        return transition(consultationId, (c, now) -> {
            requireDoctorOrAdmin(c, userId, admin, "end");
            if (c.getStatus() != ConsultationStatus.IN_PROGRESS) {
                throw new InvalidTransitionException("Consultation " + c.getId() + " cannot end from " + c.getStatus());
            }
            Instant start = c.getActualStartTime() != null ? c.getActualStartTime() : now;
            long seconds = Math.max(0, Duration.between(start, now).getSeconds());
            c.setStatus(ConsultationStatus.COMPLETED);
            c.setActualEndTime(now);
            c.setDurationSeconds(seconds);
            c.setDurationMinutes((int) (seconds / 60));
            return true;
        });
    }

    public TransitionResult cancel(UUID consultationId, String reason, String cancelledBy) {
        if (reason == null || reason.isBlank()) {
            throw new InvalidRequestException("Cancellation reason is required");
        }
        if (cancelledBy == null || cancelledBy.isBlank()) {
            throw new InvalidRequestException("Cancelling user is required");
        }
        return transition(consultationId, (c, now) -> {
            requireTransition(c, ConsultationStatus.CANCELLED);
            c.setStatus(ConsultationStatus.CANCELLED);
            c.setCancellationReason(reason);
            c.setCancelledBy(cancelledBy);
            c.setCancelledAt(now);
            if (c.getActualStartTime() != null) {
                c.setActualEndTime(now);
                long seconds = Math.max(0, Duration.between(c.getActualStartTime(), now).getSeconds());
                c.setDurationSeconds(seconds);
                c.setDurationMinutes((int) (seconds / 60));
            }
            return true;
        });
    }

    public TransitionResult markNoShow(UUID consultationId) {
        return transition(consultationId, (c, now) -> {
            requireTransition(c, ConsultationStatus.NO_SHOW);
            Instant due = c.getScheduledStartTime().plus(policy.getNoShowAfter());
            if (now.isBefore(due)) {
                throw new InvalidTransitionException("Consultation " + c.getId() + " is not overdue until " + due);
            }
            if (c.getPatientJoinedAt() != null || c.getDoctorJoinedAt() != null) {
                throw new InvalidTransitionException("Consultation " + c.getId() + " had participants join");
            }
            c.setStatus(ConsultationStatus.NO_SHOW);
            return true;
        });
    }

    /**
     * Records the transport the room was opened with.
     */
    public TransitionResult recordTransport(UUID consultationId, Consultation.TransportMode mode, String managedRoomRef) {
        return transition(consultationId, (c, now) -> {
            if (mode == c.getTransportMode() && Objects.equals(managedRoomRef, c.getManagedRoomRef())) {
                return false;
            }
            c.setTransportMode(mode);
            c.setManagedRoomRef(managedRoomRef);
            return true;
        });
    }

    /**
     * Applies a non-lifecycle change (clinical fields, notes, feedback) under the
     * consultation's lock and writes the full record.
     */
    public TransitionResult amend(UUID consultationId, Consumer<Consultation> change) {
        return apply(consultationId, (c, now) -> {
            ConsultationStatus before = c.getStatus();
            change.accept(c);
            c.setStatus(before);
            return true;
        }, true);
    }

    /**
     * Current state. A consultation with a buffered write is written again first and is
     * served from memory while that write is still failing.
     */
    public Optional<Consultation> find(UUID consultationId) {
        Tracked entry = tracked.get(consultationId);
        if (entry != null) {
            entry.lock.lock();
            try {
                if (!entry.evicted && entry.consultation != null) {
                    reconcile(consultationId);
                    if (isPersistencePending(consultationId)) {
                        return Optional.of(entry.consultation.copy());
                    }
                }
            } finally {
                evictIfSettled(consultationId, entry);
                entry.lock.unlock();
            }
        }
        return store.findConsultation(consultationId);
    }

    public Consultation require(UUID consultationId) {
        return find(consultationId)
            .orElseThrow(() -> new ConsultationNotFoundException("Consultation not found: " + consultationId));
    }

    public Optional<Consultation> findByRoom(String roomId) {
        UUID id = roomIndex.get(roomId);
        if (id != null) {
            Optional<Consultation> live = find(id);
            if (live.isPresent()) {
                return live;
            }
        }
        return store.findByRoomId(roomId);
    }

    public boolean isPersistencePending(UUID consultationId) {
        return writer.isPending(statusKey(consultationId)) || writer.isPending(recordKey(consultationId));
    }

    int trackedCount() {
        return tracked.size();
    }

    private TransitionResult transition(UUID consultationId, Mutation mutation) {
        return apply(consultationId, mutation, false);
    }

    private TransitionResult apply(UUID consultationId, Mutation mutation, boolean fullRecord) {
        int conflicts = 0;
        while (true) {
            Tracked entry = track(consultationId);
            TransitionResult outcome;
            entry.lock.lock();
            try {
                if (entry.evicted) {
                    continue;
                }
                refresh(consultationId, entry);
                Consultation c = entry.consultation;
                ConsultationStatus previous = c.getStatus();
                if (!mutation.apply(c, clock.instant())) {
                    return result(entry, previous, false, true);
                }
                boolean persisted;
                try {
                    persisted = fullRecord
                        ? writer.writeNow(recordKey(consultationId), () -> persistRecord(entry))
                        : writer.writeNow(statusKey(consultationId), () -> persistStatus(entry));
                } catch (OptimisticLockingFailureException e) {
                    conflicts++;
                    discard(consultationId);
                    if (conflicts >= MAX_CONFLICTS) {
                        throw new InvalidTransitionException("Consultation " + consultationId
                            + " keeps changing in the store; try again");
                    }
                    log.info("Consultation {} changed in the store; reloading ({}/{})",
                        consultationId, conflicts, MAX_CONFLICTS);
                    continue;
                }
                if (!persisted) {
                    log.warn("Consultation {} changed to {} but was not persisted; write buffered",
                        consultationId, c.getStatus());
                }
                outcome = result(entry, previous, true, persisted);
                if (previous != c.getStatus()) {
                    log.info("Consultation {} {} -> {}", consultationId, previous, c.getStatus());
                }
            } finally {
                evictIfSettled(consultationId, entry);
                entry.lock.unlock();
            }
            if (outcome.statusChanged() && outcome.getConsultation().getStatus().isTerminal()) {
                events.publishEvent(new ConsultationTerminatedEvent(consultationId,
                    outcome.getConsultation().getRoomId(), outcome.getConsultation().getStatus()));
            }
            return outcome;
        }
    }

    private Tracked track(UUID consultationId) {
        Tracked entry = tracked.get(consultationId);
        if (entry != null) {
            return entry;
        }
        Tracked fresh = new Tracked();
        Tracked existing = tracked.putIfAbsent(consultationId, fresh);
        return existing != null ? existing : fresh;
    }

    // Memory is authoritative only while a write is buffered; otherwise the store is.
    private void refresh(UUID consultationId, Tracked entry) {
        if (entry.consultation != null && isPersistencePending(consultationId)) {
            return;
        }
        Consultation loaded = store.findConsultation(consultationId)
            .orElseThrow(() -> new ConsultationNotFoundException("Consultation not found: " + consultationId));
        entry.consultation = loaded.copy();
        roomIndex.put(loaded.getRoomId(), consultationId);
    }

    // The stored row wins; the entry is evicted on unlock and the next attempt reloads.
    private void discard(UUID consultationId) {
        writer.discard(statusKey(consultationId));
        writer.discard(recordKey(consultationId));
    }

    private void reconcile(UUID consultationId) {
        boolean statusWritten = writer.flush(statusKey(consultationId));
        boolean recordWritten = writer.flush(recordKey(consultationId));
        if (!statusWritten || !recordWritten) {
            log.warn("Consultation {} still has unpersisted changes", consultationId);
        }
    }

    private void evictIfSettled(UUID consultationId, Tracked entry) {
        if (entry.evicted || (entry.consultation != null && isPersistencePending(consultationId))) {
            return;
        }
        entry.evicted = true;
        if (entry.consultation != null) {
            roomIndex.remove(entry.consultation.getRoomId(), consultationId);
        }
        tracked.remove(consultationId, entry);
    }

    private void persistStatus(Tracked entry) {
        entry.lock.lock();
        try {
            Consultation saved = store.updateConsultationStatus(entry.consultation.copy());
            entry.consultation.setVersion(saved.getVersion());
        } finally {
            entry.lock.unlock();
        }
    }

    private void persistRecord(Tracked entry) {
        entry.lock.lock();
        try {
            Consultation saved = store.saveConsultation(entry.consultation.copy());
            entry.consultation.setVersion(saved.getVersion());
        } finally {
            entry.lock.unlock();
        }
    }

    private TransitionResult result(Tracked entry, ConsultationStatus previous, boolean applied, boolean persisted) {
        List<ErrorCode> warnings = persisted ? List.of() : List.of(ErrorCode.PERSISTENCE_DEGRADED);
        return new TransitionResult(entry.consultation.copy(), previous, applied, warnings);
    }

    private static void begin(Consultation c, Instant now) {
        c.setStatus(ConsultationStatus.IN_PROGRESS);
        if (c.getActualStartTime() == null) {
            c.setActualStartTime(now);
        }
    }

    private static void requireTransition(Consultation c, ConsultationStatus target) {
        if (!c.getStatus().canTransitionTo(target)) {
            throw new InvalidTransitionException("Consultation " + c.getId() + " cannot move from "
                + c.getStatus() + " to " + target);
        }
    }

    private static void requireDoctorOrAdmin(Consultation c, String userId, boolean admin, String action) {
        if (!admin && (userId == null || !userId.equals(c.getDoctorId()))) {
            throw new ForbiddenOperationException("Only the consultation's doctor or an admin may " + action + " it");
        }
    }

    private static String statusKey(UUID consultationId) {
        return "consultation:" + consultationId + ":status";
    }

    private static String recordKey(UUID consultationId) {
        return "consultation:" + consultationId + ":record";
    }

    @FunctionalInterface
    private interface Mutation {
        /**
         * @return true if the consultation changed
         */
        boolean apply(Consultation consultation, Instant now);
    }

    private static final class Tracked {
        private final ReentrantLock lock = new ReentrantLock();
        private Consultation consultation;
        private boolean evicted;
    }
}
