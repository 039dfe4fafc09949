package com.communitycare.reporting.exception;

public class ValidationException extends ReportingException {
    private final String field;

    public ValidationException(String field, String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
        this.field = field;
    }

    public String getField() { return field; }
}
