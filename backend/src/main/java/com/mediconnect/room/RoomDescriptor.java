package com.mediconnect.room;

import com.mediconnect.transport.RoomTransport;
import lombok.NonNull;
import lombok.Value;

import java.util.UUID;

@Value
public class RoomDescriptor {
    @NonNull UUID consultationId;
    @NonNull String roomId;
    @NonNull RoomTransport transport;
}
