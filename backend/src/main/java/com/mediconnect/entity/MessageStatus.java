package com.mediconnect.entity;

public enum MessageStatus {
    SENT,
    DELIVERED,
    READ,
    FAILED;

    /**
     * SENT -> DELIVERED -> READ only moves forward. FAILED is reachable from SENT alone.
     */
    public boolean canAdvanceTo(MessageStatus next) {
        if (next == FAILED) {
            return this == SENT;
        }
        if (this == FAILED) {
            return false;
        }
        return next.ordinal() > ordinal();
    }
}
