package com.communitycare.reporting.service;

import com.communitycare.reporting.auth.Actor;
import com.communitycare.reporting.dto.ReportDTO;
import com.communitycare.reporting.dto.ReportDraft;
import com.communitycare.reporting.exception.ForbiddenException;
import com.communitycare.reporting.exception.InvalidTransitionException;
import com.communitycare.reporting.exception.NotFoundException;
import com.communitycare.reporting.exception.UnauthorizedException;
import com.communitycare.reporting.exception.ValidationException;
import com.communitycare.reporting.model.AuditAction;
import com.communitycare.reporting.model.AuditTargetType;
import com.communitycare.reporting.model.Report;
import com.communitycare.reporting.model.ReportPriority;
import com.communitycare.reporting.model.ReportStatus;
import com.communitycare.reporting.model.UserAccount;
import com.communitycare.reporting.repository.NotificationRepository;
import com.communitycare.reporting.repository.ReportRepository;
import com.communitycare.reporting.repository.UserAccountRepository;
import com.communitycare.reporting.util.LabelNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Owns the report workflow: submission, status transitions and deletion, together with the
 * notification and audit entries each of them must produce. Every mutating method runs in a single
 * transaction, so a report never changes state without its side effects becoming visible with it.
 */
@Service
@Transactional(readOnly = true)
public class ReportLifecycleService {
    private static final Logger log = LoggerFactory.getLogger(ReportLifecycleService.class);

    static final String STATUS_MESSAGE = "Your report status has been updated to %s";

    public enum Scope {
        ALL, MINE;

        public static Scope parse(String raw) {
            if (raw == null || raw.isBlank()) return MINE;
            String key = LabelNormalizer.enumKey(raw);
            for (Scope s : values()) {
                if (s.name().equals(key)) return s;
            }
            throw new ValidationException("scope", "scope must be 'all' or 'mine'");
        }
    }

    private final ReportRepository reportRepository;
    private final UserAccountRepository userRepository;
    private final NotificationRepository notificationRepository;
    private final NotificationService notificationService;
    private final AuditLogService auditLogService;
    private final PhotoCompressor photoCompressor;

    public ReportLifecycleService(ReportRepository reportRepository,
                                  UserAccountRepository userRepository,
                                  NotificationRepository notificationRepository,
                                  NotificationService notificationService,
                                  AuditLogService auditLogService,
                                  PhotoCompressor photoCompressor) {
        this.reportRepository = reportRepository;
        this.userRepository = userRepository;
        this.notificationRepository = notificationRepository;
        this.notificationService = notificationService;
        this.auditLogService = auditLogService;
        this.photoCompressor = photoCompressor;
    }

    /** Files a new report owned by the actor. The stored status is always Pending; no notification is sent. */
    @Transactional
    public ReportDTO submitReport(Actor actor, ReportDraft draft) {
        if (actor == null) throw new UnauthorizedException("No acting user");
        if (draft == null) throw new ValidationException("draft", "Report details are required");

        String problemType = required("problemType", LabelNormalizer.canonical(draft.getProblemType()), 100);
        String location = required("location", draft.getLocation(), 0);
        String issue = required("issueDescription", draft.getIssueDescription(), 0);
        String reportedDate = required("reportedDate", draft.getReportedDate(), 50);
        required("priority", draft.getPriority(), 0);
        ReportPriority priority = ReportPriority.fromLabel(draft.getPriority());
        if (priority == null) {
            throw new ValidationException("priority", "Unknown priority '" + draft.getPriority() + "'; expected Low, Medium, High or Emergency");
        }
        checkRange("latitude", draft.getLatitude(), 90);
        checkRange("longitude", draft.getLongitude(), 180);
        String givenName = draft.getReporterName() == null || draft.getReporterName().isBlank()
                ? null : required("reporterName", draft.getReporterName(), 255);

        UserAccount owner = userRepository.findById(actor.id())
                .orElseThrow(() -> new NotFoundException("User", actor.id()));

        String reporterName = givenName != null ? givenName : owner.getUsername();

        Report report = new Report(owner.getId(), reporterName, problemType, location, issue, reportedDate, priority);
        report.setStatus(ReportStatus.PENDING);
        report.setLatitude(draft.getLatitude());
        report.setLongitude(draft.getLongitude());
        if (draft.getPhoto() != null && !draft.getPhoto().isBlank()) {
            report.setPhotoRef(photoCompressor.compress(draft.getPhoto()));
        }
        Report saved = reportRepository.save(report);
        log.info("[REPORT][SUBMIT] id={} user={} type='{}' priority={} photo={}", saved.getId(), owner.getId(),
                problemType, priority.getLabel(), saved.getPhotoRef() != null);
        return ReportDTO.from(saved);
    }

    /**
     * Moves a report to {@code newStatus}. Any defined status is accepted from any other, including the
     * current one; each call appends exactly one notification for the owner and one audit entry.
     */
    @Transactional
    public ReportDTO transitionStatus(Actor actor, Long reportId, String newStatus) {
        requireAdmin(actor, "change report status");
        ReportStatus target = ReportStatus.fromLabel(newStatus);
        if (target == null) {
            log.warn("[REPORT][TRANSITION] admin={} report={} rejected status '{}'", actor.id(), reportId, newStatus);
            throw new InvalidTransitionException(newStatus);
        }
        Report report = reportRepository.findById(reportId)
                .orElseThrow(() -> new NotFoundException("Report", reportId));

        ReportStatus previous = report.getStatus();
        report.setStatus(target);
        reportRepository.save(report);

        notificationService.notify(report.getUserId(), report.getId(), String.format(STATUS_MESSAGE, target.getLabel()));
        auditLogService.record(actor.id(), AuditAction.UPDATE_STATUS, AuditTargetType.REPORT, report.getId(),
                "Status changed to " + target.getLabel());
        log.info("[REPORT][TRANSITION] report={} {} -> {} by admin={}", report.getId(),
                previous != null ? previous.getLabel() : null, target.getLabel(), actor.id());
        return ReportDTO.from(report);
    }

    /** Removes a report and its notifications. The owner is not told. */
    @Transactional
    public void deleteReport(Actor actor, Long reportId) {
        requireAdmin(actor, "delete reports");
        Report report = reportRepository.findById(reportId)
                .orElseThrow(() -> new NotFoundException("Report", reportId));
        String details = "Deleted: " + report.getProblemType() + " - " + report.getLocation();

        notificationRepository.deleteByReportIds(List.of(reportId));
        reportRepository.deleteById(reportId);
        auditLogService.record(actor.id(), AuditAction.DELETE, AuditTargetType.REPORT, reportId, details);
        log.info("[REPORT][DELETE] report={} by admin={}", reportId, actor.id());
    }

    /** Newest first by id. {@link Scope#ALL} needs an admin and carries each owner's username. */
    public List<ReportDTO> listReports(Actor actor, Scope scope) {
        if (actor == null) throw new UnauthorizedException("No acting user");
        if (scope == Scope.ALL) {
            requireAdmin(actor, "list all reports");
            List<Report> reports = reportRepository.findAllByOrderByIdDesc();
            Set<Long> ownerIds = reports.stream().map(Report::getUserId).collect(Collectors.toSet());
            Map<Long, String> names = userRepository.findAllById(ownerIds).stream()
                    .collect(Collectors.toMap(UserAccount::getId, UserAccount::getUsername));
            return reports.stream().map(r -> {
                ReportDTO dto = ReportDTO.from(r);
                dto.setSubmittedBy(names.get(r.getUserId()));
                return dto;
            }).collect(Collectors.toList());
        }
        return reportRepository.findByUserIdOrderByIdDesc(actor.id()).stream()
                .map(ReportDTO::from)
                .collect(Collectors.toList());
    }

    public ReportDTO getReport(Actor actor, Long reportId) {
        if (actor == null) throw new UnauthorizedException("No acting user");
        Report report = reportRepository.findById(reportId)
                .orElseThrow(() -> new NotFoundException("Report", reportId));
        if (!actor.isAdmin() && !report.getUserId().equals(actor.id())) {
            throw new ForbiddenException(ForbiddenException.Reason.NOT_OWNER, "Report " + reportId + " belongs to another user");
        }
        ReportDTO dto = ReportDTO.from(report);
        userRepository.findById(report.getUserId())
                .map(UserAccount::getUsername)
                .ifPresent(dto::setSubmittedBy);
        return dto;
    }

    private static void requireAdmin(Actor actor, String operation) {
        if (actor == null) throw new UnauthorizedException("No acting user");
        if (!actor.isAdmin()) {
            log.warn("[REPORT] user={} attempted to {} without admin role", actor.id(), operation);
            throw ForbiddenException.adminRequired(operation);
        }
    }

    private static String required(String field, String value, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, field + " is required");
        }
        String trimmed = value.trim();
        if (maxLength > 0 && trimmed.length() > maxLength) {
            throw new ValidationException(field, field + " must be at most " + maxLength + " characters");
        }
        return trimmed;
    }

    private static void checkRange(String field, Double value, double bound) {
        if (value == null) return;
        if (value.isNaN() || value < -bound || value > bound) {
            throw new ValidationException(field, field + " must be between -" + (int) bound + " and " + (int) bound);
        }
    }
}
