package com.mediconnect.exception;

public class AlreadyExistsException extends ConsultationException {

    public AlreadyExistsException(String message) {
        super(ErrorCode.ALREADY_EXISTS, message);
    }
}
