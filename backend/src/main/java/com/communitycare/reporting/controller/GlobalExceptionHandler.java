package com.communitycare.reporting.controller;

import com.communitycare.reporting.dto.ErrorResponse;
import com.communitycare.reporting.exception.ConflictException;
import com.communitycare.reporting.exception.ErrorKind;
import com.communitycare.reporting.exception.ForbiddenException;
import com.communitycare.reporting.exception.ReportingException;
import com.communitycare.reporting.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/** Maps reporting errors to HTTP responses whose {@code error} field is the {@link ErrorKind}. */
@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ReportingException.class)
    public ResponseEntity<ErrorResponse> handleReporting(ReportingException ex) {
        HttpStatus status = statusFor(ex.getKind());
        String field = null;
        String reason = null;
        if (ex instanceof ValidationException v) field = v.getField();
        if (ex instanceof ConflictException c) field = c.getField();
        if (ex instanceof ForbiddenException f && f.getReason() != null) reason = f.getReason().name();
        log.debug("[API] {} -> {}: {}", ex.getKind(), status.value(), ex.getMessage());
        return ResponseEntity.status(status)
                .body(new ErrorResponse(Instant.now(), status.value(), ex.getKind().name(), ex.getMessage(), field, reason));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleMalformed(Exception ex) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse(Instant.now(), 400, ErrorKind.VALIDATION_ERROR.name(), "Malformed request: " + ex.getMessage(), null, null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("[API] Unexpected failure", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(Instant.now(), 500, "INTERNAL_ERROR", "The request could not be completed", null, null));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION_ERROR -> HttpStatus.BAD_REQUEST;
            case CONFLICT -> HttpStatus.CONFLICT;
            case UNAUTHORIZED -> HttpStatus.UNAUTHORIZED;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_TRANSITION -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
    }
}
