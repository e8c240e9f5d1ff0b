package com.mediconnect.transport;

import com.mediconnect.entity.Consultation;
import com.mediconnect.exception.TransportUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
public class ManagedTransport implements RoomTransport {

    private final String roomId;
    private final String roomToken;
    private final ManagedVideoProvider provider;
    private final AtomicBoolean tornDown = new AtomicBoolean();

    public ManagedTransport(String roomId, String roomToken, ManagedVideoProvider provider) {
        this.roomId = roomId;
        this.roomToken = roomToken;
        this.provider = provider;
    }

    @Override
    public Consultation.TransportMode mode() {
        return Consultation.TransportMode.MANAGED;
    }

    @Override
    public String roomToken() {
        return roomToken;
    }

    @Override
    public String accessTokenFor(String userId) {
        try {
            return provider.issueAccessToken(roomId, userId);
        } catch (TransportUnavailableException e) {
            log.warn("No media token for {} in room {}: {}", userId, roomId, e.getMessage());
            return null;
        }
    }

    @Override
    public void teardown() {
        if (!tornDown.compareAndSet(false, true)) {
            return;
        }
        try {
            provider.teardownManagedRoom(roomId);
            log.info("Managed room {} torn down", roomId);
        } catch (TransportUnavailableException e) {
            log.warn("Managed room {} could not be torn down: {}", roomId, e.getMessage());
        }
    }

    public boolean isTornDown() {
        return tornDown.get();
    }

    @Override
    public String toString() {
        return "ManagedTransport[" + roomId + "]";
    }
}
