package com.mediconnect.entity;

import java.util.EnumSet;
import java.util.Set;

public enum ConsultationStatus {
    SCHEDULED,
    WAITING,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED,
    NO_SHOW;

    private static final Set<ConsultationStatus> TERMINAL = EnumSet.of(COMPLETED, CANCELLED, NO_SHOW);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /**
     * Allowed edges of the lifecycle. SCHEDULED may skip WAITING when the doctor is the
     * first to arrive.
     */
    public boolean canTransitionTo(ConsultationStatus target) {
        return switch (this) {
            case SCHEDULED -> target == WAITING || target == IN_PROGRESS
                || target == CANCELLED || target == NO_SHOW;
            case WAITING -> target == IN_PROGRESS || target == CANCELLED;
            case IN_PROGRESS -> target == COMPLETED || target == CANCELLED;
            case COMPLETED, CANCELLED, NO_SHOW -> false;
        };
    }
}
