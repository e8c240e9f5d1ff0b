package com.mediconnect.signaling;

import com.mediconnect.dto.RoomEnvelope;

/**
 * Push channel to a single client connection.
 */
public interface ConnectionGateway {

    /**
     * Delivers the envelope to the connection. Implementations must not block on the client.
     */
    void send(String connectionId, RoomEnvelope envelope);
}
