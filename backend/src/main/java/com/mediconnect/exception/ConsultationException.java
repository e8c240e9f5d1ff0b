package com.mediconnect.exception;

import lombok.Getter;

/**
 * Base type for every error the consultation core reports to a caller.
 * Socket clients receive the {@link ErrorCode} in an error envelope, REST clients
 * get it in the response body.
 */
@Getter
public class ConsultationException extends RuntimeException {

    private final ErrorCode code;

    public ConsultationException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ConsultationException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
