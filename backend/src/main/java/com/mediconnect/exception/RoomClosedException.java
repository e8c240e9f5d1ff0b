package com.mediconnect.exception;

public class RoomClosedException extends ConsultationException {

    public RoomClosedException(String message) {
        super(ErrorCode.ROOM_CLOSED, message);
    }
}
