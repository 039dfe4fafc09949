package com.communitycare.reporting.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class ReportPriorityConverter implements AttributeConverter<ReportPriority, String> {

    @Override
    public String convertToDatabaseColumn(ReportPriority priority) {
        return priority == null ? null : priority.getLabel();
    }

    @Override
    public ReportPriority convertToEntityAttribute(String dbData) {
        if (dbData == null) return null;
        ReportPriority priority = ReportPriority.fromLabel(dbData);
        if (priority == null) {
            throw new IllegalArgumentException("Unknown report priority in database: " + dbData);
        }
        return priority;
    }
}
