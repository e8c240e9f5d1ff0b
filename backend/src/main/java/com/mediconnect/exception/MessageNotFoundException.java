package com.mediconnect.exception;

public class MessageNotFoundException extends ConsultationException {

    public MessageNotFoundException(String message) {
        super(ErrorCode.MESSAGE_NOT_FOUND, message);
    }
}
