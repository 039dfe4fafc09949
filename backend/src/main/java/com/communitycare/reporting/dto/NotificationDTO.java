package com.communitycare.reporting.dto;

import com.communitycare.reporting.model.Notification;

import java.time.LocalDateTime;

public class NotificationDTO {
    private Long id;
    private Long reportId;
    private String message;
    private String type;
    private boolean read;
    private LocalDateTime createdAt;

    public NotificationDTO() {}

    public NotificationDTO(Long id, Long reportId, String message, String type, boolean read, LocalDateTime createdAt) {
        this.id = id;
        this.reportId = reportId;
        this.message = message;
        this.type = type;
        this.read = read;
        this.createdAt = createdAt;
    }

    public static NotificationDTO from(Notification n) {
        return new NotificationDTO(n.getId(), n.getReportId(), n.getMessage(), n.getType(), n.isRead(), n.getCreatedAt());
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getReportId() { return reportId; }
    public void setReportId(Long reportId) { this.reportId = reportId; }
    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
    public boolean isRead() { return read; }
    public void setRead(boolean read) { this.read = read; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }
}
