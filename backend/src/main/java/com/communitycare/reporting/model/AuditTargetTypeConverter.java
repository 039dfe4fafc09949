package com.communitycare.reporting.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class AuditTargetTypeConverter implements AttributeConverter<AuditTargetType, String> {

    @Override
    public String convertToDatabaseColumn(AuditTargetType type) {
        return type == null ? null : type.getLabel();
    }

    @Override
    public AuditTargetType convertToEntityAttribute(String dbData) {
        if (dbData == null) return null;
        AuditTargetType type = AuditTargetType.fromLabel(dbData);
        if (type == null) {
            throw new IllegalArgumentException("Unknown audit target type in database: " + dbData);
        }
        return type;
    }
}
