package com.mediconnect.transport;

import com.mediconnect.entity.Consultation;

/**
 * Peer-to-peer media: signaling goes through the relay and nothing is held on a provider.
 */
public final class DirectTransport implements RoomTransport {

    public static final DirectTransport INSTANCE = new DirectTransport();

    private DirectTransport() {
    }

    @Override
    public Consultation.TransportMode mode() {
        return Consultation.TransportMode.DIRECT;
    }

    @Override
    public String roomToken() {
        return null;
    }

    @Override
    public String accessTokenFor(String userId) {
        return null;
    }

    @Override
    public void teardown() {
        // nothing held
    }

    @Override
    public String toString() {
        return "DirectTransport";
    }
}
