package com.communitycare.reporting.exception;

public enum ErrorKind {
    VALIDATION_ERROR,
    CONFLICT,
    UNAUTHORIZED,
    FORBIDDEN,
    NOT_FOUND,
    INVALID_TRANSITION
}
