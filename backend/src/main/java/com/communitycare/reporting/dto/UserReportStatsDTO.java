package com.communitycare.reporting.dto;

public record UserReportStatsDTO(Long userId, long myReports) {}
