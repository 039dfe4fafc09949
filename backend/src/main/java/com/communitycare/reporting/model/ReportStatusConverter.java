package com.communitycare.reporting.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link ReportStatus} as its display label ("In Progress") so the column keeps the values
 * existing databases already hold.
 */
@Converter
public class ReportStatusConverter implements AttributeConverter<ReportStatus, String> {

    @Override
    public String convertToDatabaseColumn(ReportStatus status) {
        return status == null ? null : status.getLabel();
    }

    @Override
    public ReportStatus convertToEntityAttribute(String dbData) {
        if (dbData == null) return null;
        ReportStatus status = ReportStatus.fromLabel(dbData);
        if (status == null) {
            throw new IllegalArgumentException("Unknown report status in database: " + dbData);
        }
        return status;
    }
}
