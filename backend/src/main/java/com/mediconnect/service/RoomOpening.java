package com.mediconnect.service;

import com.mediconnect.exception.ErrorCode;
import com.mediconnect.transport.RoomTransport;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
public class RoomOpening {
    String roomId;
    UUID consultationId;
    RoomTransport transport;
    boolean created;
    List<ErrorCode> warnings;
}
