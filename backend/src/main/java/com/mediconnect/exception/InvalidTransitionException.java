package com.mediconnect.exception;

public class InvalidTransitionException extends ConsultationException {

    public InvalidTransitionException(String message) {
        super(ErrorCode.INVALID_TRANSITION, message);
    }
}
