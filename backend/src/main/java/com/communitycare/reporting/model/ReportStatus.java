package com.communitycare.reporting.model;

import com.communitycare.reporting.util.LabelNormalizer;

/**
 * Workflow state of a report. Any state may move to any other (including itself);
 * there is no terminal state, so resolved reports can be reopened.
 */
public enum ReportStatus {
    PENDING("Pending"),
    IN_PROGRESS("In Progress"),
    RESOLVED("Resolved");

    private final String label;

    ReportStatus(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }

    /**
     * Resolves a status from its label or a case/punctuation variant of it
     * ("in_progress", "IN PROGRESS", "in-progress"). Returns null for anything outside the defined set.
     */
    public static ReportStatus fromLabel(String raw) {
        String key = LabelNormalizer.enumKey(raw);
        if (key == null) return null;
        for (ReportStatus s : values()) {
            if (s.name().equals(key)) return s;
        }
        return null;
    }
}
