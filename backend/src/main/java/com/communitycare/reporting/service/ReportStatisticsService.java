package com.communitycare.reporting.service;

import com.communitycare.reporting.dto.ReportStatsDTO;
import com.communitycare.reporting.dto.UserReportStatsDTO;
import com.communitycare.reporting.model.ReportStatus;
import com.communitycare.reporting.repository.ReportRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Dashboard counters. Computed from the store on every call; nothing is cached. */
@Service
@Transactional(readOnly = true)
public class ReportStatisticsService {

    private final ReportRepository reportRepository;

    public ReportStatisticsService(ReportRepository reportRepository) {
        this.reportRepository = reportRepository;
    }

    public ReportStatsDTO globalStats() {
        return new ReportStatsDTO(
                reportRepository.count(),
                reportRepository.countByStatus(ReportStatus.PENDING),
                reportRepository.countByStatus(ReportStatus.IN_PROGRESS),
                reportRepository.countByStatus(ReportStatus.RESOLVED)
        );
    }

    public UserReportStatsDTO userStats(Long userId) {
        return new UserReportStatsDTO(userId, reportRepository.countByUserId(userId));
    }
}
