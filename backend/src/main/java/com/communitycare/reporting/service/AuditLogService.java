package com.communitycare.reporting.service;

import com.communitycare.reporting.auth.Actor;
import com.communitycare.reporting.config.ReportingSettings;
import com.communitycare.reporting.dto.AuditLogEntryDTO;
import com.communitycare.reporting.exception.ForbiddenException;
import com.communitycare.reporting.model.AdminLog;
import com.communitycare.reporting.model.AuditAction;
import com.communitycare.reporting.model.AuditTargetType;
import com.communitycare.reporting.repository.AdminLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/** Append-only history of administrative actions. */
@Service
@Transactional(readOnly = true)
public class AuditLogService {
    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);

    private final AdminLogRepository adminLogRepository;
    private final ReportingSettings settings;

    public AuditLogService(AdminLogRepository adminLogRepository, ReportingSettings settings) {
        this.adminLogRepository = adminLogRepository;
        this.settings = settings;
    }

    /**
     * Appends an entry. Runs in the caller's transaction when there is one, so a failed write here
     * rolls back the mutation being audited.
     */
    @Transactional
    public AdminLog record(Long adminId, AuditAction action, AuditTargetType targetType, Long targetId, String details) {
        AdminLog entry = adminLogRepository.save(new AdminLog(adminId, action, targetType, targetId, details));
        log.info("[AUDIT] admin={} action={} target={}#{} details='{}'", adminId, action, targetType.getLabel(),
                targetId == null ? "N/A" : targetId, details);
        return entry;
    }

    /** Newest entries first; a null or out-of-range limit is clamped to the configured bounds. */
    public List<AuditLogEntryDTO> list(Actor actor, Integer limit) {
        requireAdmin(actor, "view the audit log");
        int size = limit == null ? settings.getAuditDefaultLimit() : limit;
        size = Math.min(Math.max(1, size), settings.getAuditMaxLimit());
        return adminLogRepository.findRecentWithAdminName(PageRequest.of(0, size));
    }

    @Transactional
    public long clear(Actor actor) {
        requireAdmin(actor, "clear the audit log");
        long removed = adminLogRepository.count();
        adminLogRepository.deleteAllInBatch();
        log.warn("[AUDIT][CLEAR] admin={} removed {} entries", actor.id(), removed);
        return removed;
    }

    private static void requireAdmin(Actor actor, String operation) {
        if (actor == null || !actor.isAdmin()) {
            throw ForbiddenException.adminRequired(operation);
        }
    }
}
