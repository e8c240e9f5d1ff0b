package com.mediconnect.room;

import lombok.Value;

import java.time.Instant;

@Value
public class MediaChange {
    Instant at;
    MediaState state;
}
