package com.communitycare.reporting.model;

import com.communitycare.reporting.util.LabelNormalizer;

public enum UserRole {
    USER("user"),
    ADMIN("admin");

    private final String label;

    UserRole(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }

    /** Accepts "admin", "Admin", " ADMIN " and the like; returns null when nothing matches. */
    public static UserRole fromLabel(String raw) {
        String key = LabelNormalizer.enumKey(raw);
        if (key == null) return null;
        for (UserRole r : values()) {
            if (r.name().equals(key)) return r;
        }
        return null;
    }
}
