package com.mediconnect.exception;

public class InvalidRequestException extends ConsultationException {

    public InvalidRequestException(String message) {
        super(ErrorCode.INVALID_REQUEST, message);
    }
}
