package com.mediconnect.exception;

/**
 * Raised by a managed video provider that cannot serve a request. Callers fall back to
 * direct signaling instead of failing the join.
 */
public class TransportUnavailableException extends ConsultationException {

    public TransportUnavailableException(String message) {
        super(ErrorCode.TRANSPORT_UNAVAILABLE, message);
    }

    public TransportUnavailableException(String message, Throwable cause) {
        super(ErrorCode.TRANSPORT_UNAVAILABLE, message, cause);
    }
}
