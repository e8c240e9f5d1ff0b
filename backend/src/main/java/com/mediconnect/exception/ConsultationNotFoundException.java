package com.mediconnect.exception;

public class ConsultationNotFoundException extends ConsultationException {

    public ConsultationNotFoundException(String message) {
        super(ErrorCode.CONSULTATION_NOT_FOUND, message);
    }
}
