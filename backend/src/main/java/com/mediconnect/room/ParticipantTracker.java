package com.mediconnect.room;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Media, quality and connection bookkeeping for participants of live rooms.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ParticipantTracker {

    private final SessionRegistry registry;

    /**
     * Records a new media state for a joined participant and appends it to the media timeline.
     */
    public ParticipantSnapshot updateMediaState(String roomId, String userId, MediaState state) {
        ParticipantSnapshot snapshot = registry.requireRoom(roomId)
            .updateMedia(userId, state, registry.clock().instant());
        log.debug("Media state of {} in room {}: {}", userId, roomId, state);
        return snapshot;
    }

    public ParticipantSnapshot updateConnectionQuality(String roomId, String userId, ConnectionQuality quality) {
        return registry.requireRoom(roomId).updateQuality(userId, quality, registry.clock().instant());
    }

    /**
     * Flips a joined participant to DISCONNECTED and keeps its record, so a join within the
     * reconnect grace resumes it.
     */
    public ParticipantSummary recordDisconnection(String roomId, String userId, String reason) {
        Room room = registry.requireRoom(roomId);
        Instant now = registry.clock().instant();
        String connectionId = room.disconnect(userId, reason, now);
        registry.unbind(connectionId);
        log.info("User {} disconnected from room {}: {}", userId, roomId, reason);
        return room.summary(userId, now);
    }

    public ParticipantSummary getSummary(String roomId, String userId) {
        return registry.requireRoom(roomId).summary(userId, registry.clock().instant());
    }
}
