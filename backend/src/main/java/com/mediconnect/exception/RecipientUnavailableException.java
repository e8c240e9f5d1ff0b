package com.mediconnect.exception;

public class RecipientUnavailableException extends ConsultationException {

    public RecipientUnavailableException(String message) {
        super(ErrorCode.RECIPIENT_UNAVAILABLE, message);
    }
}
