package com.mediconnect.room;

import lombok.Value;

@Value
public class ConnectionBinding {
    String roomId;
    String userId;
}
