package com.mediconnect.transport;

import lombok.Value;

/**
 * {@code degraded} is set when managed media was wanted but the room fell back to direct.
 */
@Value
public class TransportSelection {
    RoomTransport transport;
    boolean degraded;
}
