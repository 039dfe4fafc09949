package com.communitycare.reporting.exception;

public class ForbiddenException extends ReportingException {

    public enum Reason { ROLE_REQUIRED, NOT_OWNER, SELF_MODIFICATION }

    private final Reason reason;

    public ForbiddenException(Reason reason, String message) {
        super(ErrorKind.FORBIDDEN, message);
        this.reason = reason;
    }

    public static ForbiddenException adminRequired(String operation) {
        return new ForbiddenException(Reason.ROLE_REQUIRED, "Administrator role required to " + operation);
    }

    public Reason getReason() { return reason; }
}
