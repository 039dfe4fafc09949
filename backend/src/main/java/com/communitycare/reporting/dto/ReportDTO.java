package com.communitycare.reporting.dto;

import com.communitycare.reporting.model.Report;

import java.time.LocalDateTime;

public class ReportDTO {
    private Long id;
    private Long userId;
    private String submittedBy; // owner's username, filled for admin listings
    private String reporterName;
    private String problemType;
    private String location;
    private String issueDescription;
    private String reportedDate;
    private String status;
    private String priority;
    private String photoRef;
    private Double latitude;
    private Double longitude;
    private LocalDateTime createdAt;

    public ReportDTO() {}

    public static ReportDTO from(Report r) {
        ReportDTO dto = new ReportDTO();
        dto.id = r.getId();
        dto.userId = r.getUserId();
        dto.reporterName = r.getReporterName();
        dto.problemType = r.getProblemType();
        dto.location = r.getLocation();
        dto.issueDescription = r.getIssueDescription();
        dto.reportedDate = r.getReportedDate();
        dto.status = r.getStatus() != null ? r.getStatus().getLabel() : null;
        dto.priority = r.getPriority() != null ? r.getPriority().getLabel() : null;
        dto.photoRef = r.getPhotoRef();
        dto.latitude = r.getLatitude();
        dto.longitude = r.getLongitude();
        dto.createdAt = r.getCreatedAt();
        return dto;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getUserId() { return userId; }
    public void setUserId(Long userId) { this.userId = userId; }
    public String getSubmittedBy() { return submittedBy; }
    public void setSubmittedBy(String submittedBy) { this.submittedBy = submittedBy; }
    public String getReporterName() { return reporterName; }
    public void setReporterName(String reporterName) { this.reporterName = reporterName; }
    public String getProblemType() { return problemType; }
    public void setProblemType(String problemType) { this.problemType = problemType; }
    public String getLocation() { return location; }
    public void setLocation(String location) { this.location = location; }
    public String getIssueDescription() { return issueDescription; }
    public void setIssueDescription(String issueDescription) { this.issueDescription = issueDescription; }
    public String getReportedDate() { return reportedDate; }
    public void setReportedDate(String reportedDate) { this.reportedDate = reportedDate; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public String getPriority() { return priority; }
    public void setPriority(String priority) { this.priority = priority; }
    public String getPhotoRef() { return photoRef; }
    public void setPhotoRef(String photoRef) { this.photoRef = photoRef; }
    public Double getLatitude() { return latitude; }
    public void setLatitude(Double latitude) { this.latitude = latitude; }
    public Double getLongitude() { return longitude; }
    public void setLongitude(Double longitude) { this.longitude = longitude; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }
}
