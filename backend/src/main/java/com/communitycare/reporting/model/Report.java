package com.communitycare.reporting.model;

import jakarta.persistence.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "reports", indexes = {
        @Index(name = "idx_reports_user_id", columnList = "user_id"),
        @Index(name = "idx_reports_status", columnList = "status"),
        @Index(name = "idx_reports_created_at", columnList = "created_at")
})
public class Report {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "name", nullable = false)
    private String reporterName;

    @Column(name = "problem_type", nullable = false, length = 100)
    private String problemType;

    @Column(nullable = false, columnDefinition = "text")
    private String location;

    @Column(name = "issue", nullable = false, columnDefinition = "text")
    private String issueDescription;

    // Free-form date entered by the reporter, not the server timestamp
    @Column(name = "date", nullable = false, length = 50)
    private String reportedDate;

    @Convert(converter = ReportStatusConverter.class)
    @Column(nullable = false, length = 20)
    private ReportStatus status = ReportStatus.PENDING;

    @Convert(converter = ReportPriorityConverter.class)
    @Column(nullable = false, length = 20)
    private ReportPriority priority = ReportPriority.MEDIUM;

    @Column(name = "photo_data", columnDefinition = "text")
    private String photoRef;

    private Double latitude;

    private Double longitude;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public Report() {}

    public Report(Long userId, String reporterName, String problemType, String location,
                  String issueDescription, String reportedDate, ReportPriority priority) {
        this.userId = userId;
        this.reporterName = reporterName;
        this.problemType = problemType;
        this.location = location;
        this.issueDescription = issueDescription;
        this.reportedDate = reportedDate;
        this.priority = priority;
    }

    @PrePersist
    public void prePersist() {
        if (createdAt == null) createdAt = LocalDateTime.now();
        if (status == null) status = ReportStatus.PENDING;
        if (priority == null) priority = ReportPriority.MEDIUM;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Long getUserId() { return userId; }
    public void setUserId(Long userId) { this.userId = userId; }

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

    public ReportStatus getStatus() { return status; }
    public void setStatus(ReportStatus status) { this.status = status; }

    public ReportPriority getPriority() { return priority; }
    public void setPriority(ReportPriority priority) { this.priority = priority; }

    public String getPhotoRef() { return photoRef; }
    public void setPhotoRef(String photoRef) { this.photoRef = photoRef; }

    public Double getLatitude() { return latitude; }
    public void setLatitude(Double latitude) { this.latitude = latitude; }

    public Double getLongitude() { return longitude; }
    public void setLongitude(Double longitude) { this.longitude = longitude; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }
}
