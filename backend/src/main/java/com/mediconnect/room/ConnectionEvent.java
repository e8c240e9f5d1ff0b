package com.mediconnect.room;

import lombok.Value;

import java.time.Instant;

@Value
public class ConnectionEvent {

    public enum Kind {
        DISCONNECTED,
        RECONNECTED
    }

    Instant at;
    Kind kind;
    String reason;
}
