package com.mediconnect.transport;

import com.mediconnect.exception.TransportUnavailableException;

/**
 * Hosted media service that can run a room on behalf of the participants.
 */
public interface ManagedVideoProvider {

    boolean isConfigured();

    boolean isHealthy();

    /**
     * @return the provider's reference for the new room
     * @throws TransportUnavailableException when the provider cannot create it
     */
    String createManagedRoom(String roomId);

    void teardownManagedRoom(String roomId);

    String issueAccessToken(String roomId, String userId);
}
