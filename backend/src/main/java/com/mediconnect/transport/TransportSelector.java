package com.mediconnect.transport;

import com.mediconnect.exception.TransportUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Picks managed media when the provider is configured and healthy, direct otherwise.
 * A provider failure never fails the room; it only degrades it to direct.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransportSelector {

    private final ManagedVideoProvider provider;

    public TransportSelection selectTransport(UUID consultationId, String roomId) {
        if (!provider.isConfigured()) {
            return new TransportSelection(DirectTransport.INSTANCE, false);
        }
        if (!provider.isHealthy()) {
            log.warn("Managed video provider unhealthy; consultation {} uses direct transport", consultationId);
            return new TransportSelection(DirectTransport.INSTANCE, true);
        }
        try {
            String roomToken = provider.createManagedRoom(roomId);
            log.info("Managed room {} created for consultation {}", roomId, consultationId);
            return new TransportSelection(new ManagedTransport(roomId, roomToken, provider), false);
        } catch (TransportUnavailableException e) {
            log.warn("Managed room creation failed for consultation {}, falling back to direct: {}",
                consultationId, e.getMessage());
            return new TransportSelection(DirectTransport.INSTANCE, true);
        }
    }
}
