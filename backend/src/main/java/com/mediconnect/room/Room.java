package com.mediconnect.room;

import com.mediconnect.entity.ParticipantRole;
import com.mediconnect.entity.ParticipantStatus;
import com.mediconnect.exception.NotJoinedException;
import com.mediconnect.exception.RoleConflictException;
import com.mediconnect.exception.RoomClosedException;
import com.mediconnect.transport.RoomTransport;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongFunction;

/**
 * Live binding of a consultation to its connected participants. Membership changes take the
 * room's own lock; no lock is shared between rooms.
 */
public class Room {

    @Getter
    private final String roomId;
    @Getter
    private final UUID consultationId;
    @Getter
    private final RoomTransport transport;
    @Getter
    private final Instant createdAt;

    private final RoomDispatcher dispatcher;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ParticipantSession> participants = new LinkedHashMap<>();

    private long sequence;
    private volatile boolean closed;
    private volatile Instant lastActivity;
    private Instant emptySince;

    Room(String roomId, UUID consultationId, RoomTransport transport, RoomDispatcher dispatcher, Instant now) {
        this.roomId = roomId;
        this.consultationId = consultationId;
        this.transport = transport;
        this.dispatcher = dispatcher;
        this.createdAt = now;
        this.lastActivity = now;
        this.emptySince = now;
    }

    public boolean isClosed() {
        return closed;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    ParticipantHandle join(String userId, ParticipantRole role, String connectionId, RoomPolicy policy, Instant now) {
        lock.lock();
        try {
            if (closed) {
                throw new RoomClosedException("Room " + roomId + " is closed");
            }
            ParticipantSession existing = participants.get(userId);
            if (existing != null && existing.getRole() != role) {
                throw new RoleConflictException("User " + userId + " is already in room " + roomId
                    + " as " + existing.getRole());
            }
            if (role == ParticipantRole.DOCTOR) {
                for (ParticipantSession other : participants.values()) {
                    if (other.getRole() == ParticipantRole.DOCTOR
                        && !other.getUserId().equals(userId)
                        && other.holdsSlot(now, policy.getReconnectGrace())) {
                        throw new RoleConflictException("Room " + roomId + " already has an active doctor");
                    }
                }
            }

            ParticipantSession session = existing != null ? existing : new ParticipantSession(userId, role);
            String superseded = session.isJoined() && !connectionId.equals(session.getConnectionId())
                ? session.getConnectionId() : null;
            boolean reconnected = session.join(connectionId, now);
            participants.putIfAbsent(userId, session);

            emptySince = null;
            lastActivity = now;
            return new ParticipantHandle(roomId, consultationId, userId, role,
                connectionId, reconnected, superseded);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the connection id the user held, or null if the user was not connected
     */
    String leave(String userId, Instant now) {
        lock.lock();
        try {
            ParticipantSession session = require(userId);
            String connectionId = session.getConnectionId();
            if (session.getStatus() != ParticipantStatus.LEFT) {
                session.leave(now);
            }
            afterDeparture(now);
            return connectionId;
        } finally {
            lock.unlock();
        }
    }

    String disconnect(String userId, String reason, Instant now) {
        lock.lock();
        try {
            ParticipantSession session = requireJoined(userId);
            String connectionId = session.getConnectionId();
            session.disconnect(now, reason);
            afterDeparture(now);
            return connectionId;
        } finally {
            lock.unlock();
        }
    }

    ParticipantSnapshot updateMedia(String userId, MediaState state, Instant now) {
        lock.lock();
        try {
            ParticipantSession session = requireJoined(userId);
            session.updateMedia(state, now);
            lastActivity = now;
            return session.snapshot();
        } finally {
            lock.unlock();
        }
    }

    ParticipantSnapshot updateQuality(String userId, ConnectionQuality quality, Instant now) {
        lock.lock();
        try {
            ParticipantSession session = requireJoined(userId);
            session.updateQuality(quality);
            lastActivity = now;
            return session.snapshot();
        } finally {
            lock.unlock();
        }
    }

    public boolean isJoined(String userId) {
        lock.lock();
        try {
            ParticipantSession session = participants.get(userId);
            return session != null && session.isJoined();
        } finally {
            lock.unlock();
        }
    }

    public ParticipantRole roleOf(String userId) {
        lock.lock();
        try {
            return require(userId).getRole();
        } finally {
            lock.unlock();
        }
    }

    public int activeParticipantCount() {
        lock.lock();
        try {
            return (int) participants.values().stream().filter(ParticipantSession::isJoined).count();
        } finally {
            lock.unlock();
        }
    }

    /**
     * All participants ever seen in this room, in order of first join.
     */
    public List<ParticipantSnapshot> participants() {
        lock.lock();
        try {
            List<ParticipantSnapshot> result = new ArrayList<>(participants.size());
            participants.values().forEach(p -> result.add(p.snapshot()));
            return result;
        } finally {
            lock.unlock();
        }
    }

    public ParticipantSummary summary(String userId, Instant now) {
        lock.lock();
        try {
            return require(userId).summary(now);
        } finally {
            lock.unlock();
        }
    }

    public List<ParticipantSummary> summaries(Instant now) {
        lock.lock();
        try {
            List<ParticipantSummary> result = new ArrayList<>(participants.size());
            participants.values().forEach(p -> result.add(p.summary(now)));
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Joined participants a payload should reach: the single target when {@code toUserId} is
     * set, otherwise everyone except {@code excludeUserId}. Resolved when the task runs, so a
     * participant who left meanwhile is skipped.
     */
    public List<Recipient> recipients(String excludeUserId, String toUserId) {
        lock.lock();
        try {
            List<Recipient> result = new ArrayList<>();
            if (toUserId != null) {
                ParticipantSession target = participants.get(toUserId);
                if (target != null && target.isJoined()) {
                    result.add(new Recipient(toUserId, target.getConnectionId()));
                }
                return result;
            }
            for (ParticipantSession p : participants.values()) {
                if (p.isJoined() && !p.getUserId().equals(excludeUserId)) {
                    result.add(new Recipient(p.getUserId(), p.getConnectionId()));
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Assigns the next room sequence number and queues the task built for it. Both happen
     * under the room lock, so sequence order equals delivery order.
     *
     * @return the assigned sequence, or -1 if the room no longer accepts deliveries
     */
    public long enqueue(LongFunction<Runnable> taskForSequence, Instant now) {
        lock.lock();
        try {
            if (closed || dispatcher.isShutdown()) {
                return -1;
            }
            long next = ++sequence;
            lastActivity = now;
            return dispatcher.submit(taskForSequence.apply(next)) ? next : -1;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the room closed and every joined participant as left.
     *
     * @return the recipients that were still connected, or null if the room was already closed
     */
    List<Recipient> close(Instant now) {
        lock.lock();
        try {
            if (closed) {
                return null;
            }
            closed = true;
            List<Recipient> remaining = new ArrayList<>();
            for (ParticipantSession p : participants.values()) {
                if (p.isJoined()) {
                    remaining.add(new Recipient(p.getUserId(), p.getConnectionId()));
                    p.leave(now);
                } else if (p.getStatus() == ParticipantStatus.DISCONNECTED) {
                    p.leave(now);
                }
            }
            return remaining;
        } finally {
            lock.unlock();
        }
    }

    RoomDispatcher dispatcher() {
        return dispatcher;
    }

    boolean isExpired(Instant now, RoomPolicy policy) {
        lock.lock();
        try {
            if (emptySince != null && !now.isBefore(emptySince.plus(policy.getEmptyRoomGrace()))) {
                return true;
            }
            return !now.isBefore(lastActivity.plus(policy.getIdleTimeout()));
        } finally {
            lock.unlock();
        }
    }

    private void afterDeparture(Instant now) {
        lastActivity = now;
        boolean anyoneJoined = participants.values().stream().anyMatch(ParticipantSession::isJoined);
        if (!anyoneJoined && emptySince == null) {
            emptySince = now;
        }
    }

    private ParticipantSession require(String userId) {
        ParticipantSession session = participants.get(userId);
        if (session == null) {
            throw new NotJoinedException("User " + userId + " has no session in room " + roomId);
        }
        return session;
    }

    private ParticipantSession requireJoined(String userId) {
        ParticipantSession session = require(userId);
        if (!session.isJoined()) {
            throw new NotJoinedException("User " + userId + " is not joined in room " + roomId
                + " (status " + session.getStatus() + ")");
        }
        return session;
    }
}
