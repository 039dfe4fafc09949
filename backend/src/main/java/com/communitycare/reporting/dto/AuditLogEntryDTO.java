package com.communitycare.reporting.dto;

import com.communitycare.reporting.model.AuditAction;
import com.communitycare.reporting.model.AuditTargetType;

import java.time.LocalDateTime;

public class AuditLogEntryDTO {
    private Long id;
    private Long adminId;
    private String adminName;
    private String action;
    private String targetType;
    private Long targetId;
    private String details;
    private LocalDateTime createdAt;

    public AuditLogEntryDTO() {}

    // Used by the JPQL constructor expression in AdminLogRepository
    public AuditLogEntryDTO(Long id, Long adminId, String adminName, AuditAction action, AuditTargetType targetType,
                            Long targetId, String details, LocalDateTime createdAt) {
        this.id = id;
        this.adminId = adminId;
        this.adminName = adminName;
        this.action = action != null ? action.name() : null;
        this.targetType = targetType != null ? targetType.getLabel() : null;
        this.targetId = targetId;
        this.details = details;
        this.createdAt = createdAt;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getAdminId() { return adminId; }
    public void setAdminId(Long adminId) { this.adminId = adminId; }
    public String getAdminName() { return adminName; }
    public void setAdminName(String adminName) { this.adminName = adminName; }
    public String getAction() { return action; }
    public void setAction(String action) { this.action = action; }
    public String getTargetType() { return targetType; }
    public void setTargetType(String targetType) { this.targetType = targetType; }
    public Long getTargetId() { return targetId; }
    public void setTargetId(Long targetId) { this.targetId = targetId; }
    public String getDetails() { return details; }
    public void setDetails(String details) { this.details = details; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }
}
