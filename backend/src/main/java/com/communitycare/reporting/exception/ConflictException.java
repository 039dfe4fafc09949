package com.communitycare.reporting.exception;

public class ConflictException extends ReportingException {
    private final String field;

    public ConflictException(String field, String message) {
        super(ErrorKind.CONFLICT, message);
        this.field = field;
    }

    public String getField() { return field; }
}
