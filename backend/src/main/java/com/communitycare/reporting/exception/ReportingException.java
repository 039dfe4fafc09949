package com.communitycare.reporting.exception;

/**
 * Base type for every business-rule rejection raised by the reporting services. Callers branch on
 * {@link #getKind()}; anything that is not a ReportingException is an infrastructure failure.
 */
public abstract class ReportingException extends RuntimeException {
    private final ErrorKind kind;

    protected ReportingException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() { return kind; }
}
