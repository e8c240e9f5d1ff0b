package com.mediconnect.exception;

public class RoomNotFoundException extends ConsultationException {

    public RoomNotFoundException(String message) {
        super(ErrorCode.ROOM_NOT_FOUND, message);
    }
}
