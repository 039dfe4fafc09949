package com.communitycare.reporting.model;

public enum AuditTargetType {
    REPORT("report"),
    USER("user"),
    SYSTEM("system");

    private final String label;

    AuditTargetType(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }

    public static AuditTargetType fromLabel(String raw) {
        if (raw == null) return null;
        for (AuditTargetType t : values()) {
            if (t.label.equalsIgnoreCase(raw.trim())) return t;
        }
        return null;
    }
}
