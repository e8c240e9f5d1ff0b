package com.mediconnect.transport;

import com.mediconnect.entity.Consultation;

/**
 * Media path chosen for a room when it opens. The choice never changes for the room's lifetime.
 */
public interface RoomTransport {

    Consultation.TransportMode mode();

    /**
     * Reference to the room on the managed provider, or null for direct peer-to-peer rooms.
     */
    String roomToken();

    /**
     * Credential a participant presents to the media provider, or null when none is needed.
     */
    String accessTokenFor(String userId);

    /**
     * Releases provider resources. Safe to call more than once.
     */
    void teardown();
}
