package com.mediconnect.lifecycle;

import com.mediconnect.entity.ConsultationStatus;
import lombok.Value;

import java.util.UUID;

/**
 * Published once when a consultation reaches COMPLETED, CANCELLED or NO_SHOW.
 */
@Value
public class ConsultationTerminatedEvent {
    UUID consultationId;
    String roomId;
    ConsultationStatus status;
}
