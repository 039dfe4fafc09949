package com.communitycare.reporting.exception;

public class InvalidTransitionException extends ReportingException {
    public InvalidTransitionException(String requestedStatus) {
        super(ErrorKind.INVALID_TRANSITION,
                "Unknown report status '" + requestedStatus + "'; expected one of Pending, In Progress, Resolved");
    }
}
