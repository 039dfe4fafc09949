package com.communitycare.reporting.dto;

public record ReportStatsDTO(long total, long pending, long inProgress, long resolved) {}
