package com.mediconnect.exception;

public class MalformedMessageException extends ConsultationException {

    public MalformedMessageException(String message) {
        super(ErrorCode.MALFORMED_MESSAGE, message);
    }
}
