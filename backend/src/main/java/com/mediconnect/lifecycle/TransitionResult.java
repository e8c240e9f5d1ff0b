package com.mediconnect.lifecycle;

import com.mediconnect.entity.Consultation;
import com.mediconnect.entity.ConsultationStatus;
import com.mediconnect.exception.ErrorCode;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a lifecycle operation. {@code applied} is false when the call was a no-op,
 * such as a second doctor join on a consultation already in progress.
 */
@Value
public class TransitionResult {
    Consultation consultation;
    ConsultationStatus previousStatus;
    boolean applied;
    List<ErrorCode> warnings;

    public boolean statusChanged() {
        return applied && previousStatus != consultation.getStatus();
    }

    public boolean isPersistenceDegraded() {
        return warnings.contains(ErrorCode.PERSISTENCE_DEGRADED);
    }
}
