package com.mediconnect.exception;

public class RoleConflictException extends ConsultationException {

    public RoleConflictException(String message) {
        super(ErrorCode.ROLE_CONFLICT, message);
    }
}
