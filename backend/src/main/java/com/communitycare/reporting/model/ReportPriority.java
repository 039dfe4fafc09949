package com.communitycare.reporting.model;

import com.communitycare.reporting.util.LabelNormalizer;

public enum ReportPriority {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High"),
    EMERGENCY("Emergency");

    private final String label;

    ReportPriority(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }

    /** Decorated labels such as "🔴 High - Requires immediate attention" resolve to HIGH. */
    public static ReportPriority fromLabel(String raw) {
        String key = LabelNormalizer.enumKey(LabelNormalizer.canonical(raw));
        if (key == null) return null;
        for (ReportPriority p : values()) {
            if (p.name().equals(key)) return p;
        }
        return null;
    }
}
