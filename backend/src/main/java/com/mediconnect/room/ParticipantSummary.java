package com.mediconnect.room;

import com.mediconnect.entity.ParticipantRole;
import com.mediconnect.entity.ParticipantStatus;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Computed on demand from the participant's join intervals, so repeated reads never drift
 * from the recorded events.
 */
@Value
public class ParticipantSummary {
    String userId;
    ParticipantRole role;
    ParticipantStatus status;
    Instant joinedAt;
    Instant leftAt;
    long durationSeconds;
    MediaState mediaState;
    ConnectionQuality quality;
    List<MediaChange> mediaTimeline;
    List<ConnectionEvent> connectionHistory;
}
