package com.mediconnect.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(ConsultationException.class)
    public ResponseEntity<Map<String, Object>> handleConsultationException(ConsultationException e) {
        HttpStatus status = statusFor(e.getCode());
        if (status.is5xxServerError()) {
            log.error("Request failed: {} {}", e.getCode(), e.getMessage(), e);
        } else {
            log.debug("Request rejected: {} {}", e.getCode(), e.getMessage());
        }
        return body(status, e.getCode(), e.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleBadInput(Exception e) {
        return body(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_REQUEST, "Malformed request: " + e.getMessage());
    }

    static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
            case ROOM_NOT_FOUND, CONSULTATION_NOT_FOUND, MESSAGE_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ROOM_CLOSED, ALREADY_EXISTS, ROLE_CONFLICT, INVALID_TRANSITION -> HttpStatus.CONFLICT;
            case NOT_JOINED, RECIPIENT_UNAVAILABLE, MALFORMED_MESSAGE, INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case ROOM_INVARIANT_VIOLATION, INTERNAL_ERROR, PERSISTENCE_DEGRADED, TRANSPORT_UNAVAILABLE ->
                HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, ErrorCode code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", code.name());
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(body);
    }
}
