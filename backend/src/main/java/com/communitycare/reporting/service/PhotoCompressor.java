package com.communitycare.reporting.service;

/**
 * Turns an uploaded photo into the reference stored on a report. Implementations must never hand back
 * the raw upload; unreadable input is rejected with a validation error on the {@code photo} field.
 */
public interface PhotoCompressor {

    String compress(String photo);
}
