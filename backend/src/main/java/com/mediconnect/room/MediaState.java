package com.mediconnect.room;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class MediaState {

    public static final MediaState INITIAL = MediaState.builder()
        .audioEnabled(true)
        .videoEnabled(true)
        .build();

    boolean audioEnabled;
    boolean audioMuted;
    boolean videoEnabled;
    boolean videoMuted;
    boolean screenShareEnabled;
}
