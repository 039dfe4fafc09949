package com.communitycare.reporting.exception;

public class UnauthorizedException extends ReportingException {
    public UnauthorizedException(String message) {
        super(ErrorKind.UNAUTHORIZED, message);
    }
}
