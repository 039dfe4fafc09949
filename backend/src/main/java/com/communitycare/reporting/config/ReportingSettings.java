package com.communitycare.reporting.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class ReportingSettings {
    @Value("${communitycare.audit.default-limit:50}")
    private int auditDefaultLimit;

    @Value("${communitycare.audit.max-limit:100}")
    private int auditMaxLimit;

    @Value("${communitycare.photo.max-width:800}")
    private int photoMaxWidth;

    @Value("${communitycare.photo.max-height:600}")
    private int photoMaxHeight;

    @Value("${communitycare.photo.quality:0.85}")
    private float photoQuality;

    @Value("${communitycare.photo.max-bytes:5242880}")
    private long photoMaxBytes;

    // Bounds the decoded bitmap; a small file may declare very large dimensions
    @Value("${communitycare.photo.max-pixels:40000000}")
    private long photoMaxPixels;

    public ReportingSettings() {}

    public ReportingSettings(int auditDefaultLimit, int auditMaxLimit, int photoMaxWidth, int photoMaxHeight,
                             float photoQuality, long photoMaxBytes, long photoMaxPixels) {
        this.auditDefaultLimit = auditDefaultLimit;
        this.auditMaxLimit = auditMaxLimit;
        this.photoMaxWidth = photoMaxWidth;
        this.photoMaxHeight = photoMaxHeight;
        this.photoQuality = photoQuality;
        this.photoMaxBytes = photoMaxBytes;
        this.photoMaxPixels = photoMaxPixels;
    }

    /** Values matching the property defaults; used by tests that construct services by hand. */
    public static ReportingSettings defaults() {
        return new ReportingSettings(50, 100, 800, 600, 0.85f, 5L * 1024 * 1024, 40_000_000L);
    }

    public int getAuditDefaultLimit() { return auditDefaultLimit; }
    public int getAuditMaxLimit() { return auditMaxLimit; }
    public int getPhotoMaxWidth() { return photoMaxWidth; }
    public int getPhotoMaxHeight() { return photoMaxHeight; }
    public float getPhotoQuality() { return photoQuality; }
    public long getPhotoMaxBytes() { return photoMaxBytes; }
    public long getPhotoMaxPixels() { return photoMaxPixels; }
}
