package com.mediconnect.exception;

public class ForbiddenOperationException extends ConsultationException {

    public ForbiddenOperationException(String message) {
        super(ErrorCode.FORBIDDEN, message);
    }
}
