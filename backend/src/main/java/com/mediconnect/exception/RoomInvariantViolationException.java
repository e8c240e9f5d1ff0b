package com.mediconnect.exception;

public class RoomInvariantViolationException extends ConsultationException {

    public RoomInvariantViolationException(String message) {
        super(ErrorCode.ROOM_INVARIANT_VIOLATION, message);
    }
}
