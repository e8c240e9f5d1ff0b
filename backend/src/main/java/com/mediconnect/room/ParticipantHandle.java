package com.mediconnect.room;

import com.mediconnect.entity.ParticipantRole;
import lombok.Value;

import java.util.UUID;

/**
 * Result of a successful join. {@code supersededConnectionId} is set when the user already
 * had a live connection in the room that the new one replaced.
 */
@Value
public class ParticipantHandle {
    String roomId;
    UUID consultationId;
    String userId;
    ParticipantRole role;
    String connectionId;
    boolean reconnected;
    String supersededConnectionId;
}
