package com.communitycare.reporting.model;

public enum AuditAction {
    UPDATE_STATUS,
    DELETE,
    UPDATE_ROLE,
    LOGOUT
}
