package com.mediconnect.room;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Time bounds applied to live rooms and scheduled consultations.
 */
@Value
@Builder
public class RoomPolicy {

    public static final RoomPolicy DEFAULTS = RoomPolicy.builder().build();

    /** How long a room may sit with nobody joined before the sweep closes it. */
    @Builder.Default
    Duration emptyRoomGrace = Duration.ofMinutes(2);

    /** How long a disconnected participant keeps its slot. */
    @Builder.Default
    Duration reconnectGrace = Duration.ofMinutes(2);

    /** Rooms with no join, leave, media or relay activity for this long are closed. */
    @Builder.Default
    Duration idleTimeout = Duration.ofMinutes(30);

    /** A scheduled consultation nobody joined becomes a no-show this long after its start time. */
    @Builder.Default
    Duration noShowAfter = Duration.ofMinutes(15);
}
