package com.mediconnect.signaling;

import lombok.Value;

import java.util.List;

@Value
public class RelayResult {
    long sequence;
    List<String> deliveredTo;
    List<String> failed;

    public boolean isDelivered() {
        return !deliveredTo.isEmpty();
    }
}
