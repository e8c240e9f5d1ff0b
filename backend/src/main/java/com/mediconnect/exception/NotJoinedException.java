package com.mediconnect.exception;

public class NotJoinedException extends ConsultationException {

    public NotJoinedException(String message) {
        super(ErrorCode.NOT_JOINED, message);
    }
}
