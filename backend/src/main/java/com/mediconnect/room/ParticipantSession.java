package com.mediconnect.room;

import com.mediconnect.entity.ParticipantRole;
import com.mediconnect.entity.ParticipantStatus;
import lombok.Getter;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-connection bookkeeping for one user inside one room. Instances are only touched while
 * the owning {@link Room}'s lock is held; everything leaving the room is copied into a
 * {@link ParticipantSnapshot} or {@link ParticipantSummary}.
 */
class ParticipantSession {

    @Getter
    private final String userId;
    @Getter
    private final ParticipantRole role;

    @Getter
    private ParticipantStatus status = ParticipantStatus.INVITED;
    @Getter
    private String connectionId;
    private Instant firstJoinedAt;
    private Instant openIntervalStart;
    private Instant leftAt;
    private Instant disconnectedAt;
    private MediaState mediaState = MediaState.INITIAL;
    private ConnectionQuality quality;

    private final List<Interval> closedIntervals = new ArrayList<>();
    private final List<ConnectionEvent> connectionHistory = new ArrayList<>();
    private final List<MediaChange> mediaTimeline = new ArrayList<>();

    ParticipantSession(String userId, ParticipantRole role) {
        this.userId = userId;
        this.role = role;
    }

    boolean isJoined() {
        return status == ParticipantStatus.JOINED;
    }

    /**
     * A slot stays reserved while the participant is joined, or disconnected for less than
     * the reconnect grace.
     */
    boolean holdsSlot(Instant now, Duration reconnectGrace) {
        if (status == ParticipantStatus.JOINED) {
            return true;
        }
        return status == ParticipantStatus.DISCONNECTED
            && disconnectedAt != null
            && now.isBefore(disconnectedAt.plus(reconnectGrace));
    }

    /**
     * @return true when this join resumes a disconnected session
     */
    boolean join(String newConnectionId, Instant now) {
        boolean reconnect = status == ParticipantStatus.DISCONNECTED;
        if (reconnect) {
            connectionHistory.add(new ConnectionEvent(now, ConnectionEvent.Kind.RECONNECTED,
                "rejoined after " + Duration.between(disconnectedAt, now).toSeconds() + "s"));
        }
        if (status != ParticipantStatus.JOINED) {
            openIntervalStart = now;
            if (firstJoinedAt == null) {
                firstJoinedAt = now;
            }
            mediaState = MediaState.INITIAL;
            mediaTimeline.add(new MediaChange(now, mediaState));
        }
        status = ParticipantStatus.JOINED;
        connectionId = newConnectionId;
        leftAt = null;
        disconnectedAt = null;
        return reconnect;
    }

    void leave(Instant now) {
        closeInterval(now);
        status = ParticipantStatus.LEFT;
        leftAt = now;
        connectionId = null;
    }

    void disconnect(Instant now, String reason) {
        closeInterval(now);
        status = ParticipantStatus.DISCONNECTED;
        disconnectedAt = now;
        leftAt = now;
        connectionId = null;
        connectionHistory.add(new ConnectionEvent(now, ConnectionEvent.Kind.DISCONNECTED, reason));
    }

    void updateMedia(MediaState state, Instant now) {
        mediaState = state;
        mediaTimeline.add(new MediaChange(now, state));
    }

    void updateQuality(ConnectionQuality newQuality) {
        quality = newQuality;
    }

    private void closeInterval(Instant now) {
        if (openIntervalStart != null) {
            closedIntervals.add(new Interval(openIntervalStart, now));
            openIntervalStart = null;
        }
    }

    long durationSeconds(Instant now) {
        long total = 0;
        for (Interval interval : closedIntervals) {
            total += Duration.between(interval.getStart(), interval.getEnd()).toSeconds();
        }
        if (openIntervalStart != null) {
            total += Duration.between(openIntervalStart, now).toSeconds();
        }
        return total;
    }

    int disconnectionCount() {
        return (int) connectionHistory.stream()
            .filter(e -> e.getKind() == ConnectionEvent.Kind.DISCONNECTED)
            .count();
    }

    ParticipantSnapshot snapshot() {
        return new ParticipantSnapshot(userId, role, status, firstJoinedAt, leftAt,
            mediaState, quality, disconnectionCount());
    }

    ParticipantSummary summary(Instant now) {
        return new ParticipantSummary(userId, role, status, firstJoinedAt, leftAt,
            durationSeconds(now), mediaState, quality,
            List.copyOf(mediaTimeline), List.copyOf(connectionHistory));
    }

    @Value
    private static class Interval {
        Instant start;
        Instant end;
    }
}
