package com.communitycare.reporting.exception;

public class NotFoundException extends ReportingException {
    public NotFoundException(String entity, Long id) {
        super(ErrorKind.NOT_FOUND, entity + " not found: " + id);
    }
}
