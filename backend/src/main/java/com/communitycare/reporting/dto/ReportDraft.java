package com.communitycare.reporting.dto;

/**
 * Incoming report as submitted by a client. Labels may still carry display decoration
 * (emoji, " - description" suffix); the lifecycle service normalizes them.
 */
public class ReportDraft {
    private String reporterName;
    private String problemType;
    private String location;
    private String issueDescription;
    private String reportedDate;
    private String priority;
    private String photo; // base64, optionally a data URI
    private Double latitude;
    private Double longitude;

    public ReportDraft() {}

    public ReportDraft(String problemType, String location, String issueDescription, String reportedDate, String priority) {
        this.problemType = problemType;
        this.location = location;
        this.issueDescription = issueDescription;
        this.reportedDate = reportedDate;
        this.priority = priority;
    }

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
    public String getPriority() { return priority; }
    public void setPriority(String priority) { this.priority = priority; }
    public String getPhoto() { return photo; }
    public void setPhoto(String photo) { this.photo = photo; }
    public Double getLatitude() { return latitude; }
    public void setLatitude(Double latitude) { this.latitude = latitude; }
    public Double getLongitude() { return longitude; }
    public void setLongitude(Double longitude) { this.longitude = longitude; }
}
