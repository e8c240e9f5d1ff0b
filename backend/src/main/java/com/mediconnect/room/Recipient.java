package com.mediconnect.room;

import lombok.Value;

@Value
public class Recipient {
    String userId;
    String connectionId;
}
