package com.mediconnect.room;

import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Final state of a room at the moment it was closed.
 */
@Value
public class ClosedRoom {
    String roomId;
    UUID consultationId;
    String reason;
    List<ParticipantSummary> summaries;
}
