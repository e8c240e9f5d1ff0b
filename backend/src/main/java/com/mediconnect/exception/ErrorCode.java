package com.mediconnect.exception;

public enum ErrorCode {
    ROOM_NOT_FOUND,
    ROOM_CLOSED,
    ALREADY_EXISTS,
    ROLE_CONFLICT,
    INVALID_TRANSITION,
    NOT_JOINED,
    RECIPIENT_UNAVAILABLE,
    CONSULTATION_NOT_FOUND,
    MESSAGE_NOT_FOUND,
    FORBIDDEN,
    MALFORMED_MESSAGE,
    ROOM_INVARIANT_VIOLATION,
    INVALID_REQUEST,
    INTERNAL_ERROR,

    // Warnings: reported in results, never propagated to callers
    PERSISTENCE_DEGRADED,
    TRANSPORT_UNAVAILABLE
}
