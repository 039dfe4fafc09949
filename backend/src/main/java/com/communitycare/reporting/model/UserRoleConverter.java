package com.communitycare.reporting.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class UserRoleConverter implements AttributeConverter<UserRole, String> {

    @Override
    public String convertToDatabaseColumn(UserRole role) {
        return role == null ? null : role.getLabel();
    }

    @Override
    public UserRole convertToEntityAttribute(String dbData) {
        if (dbData == null) return null;
        UserRole role = UserRole.fromLabel(dbData);
        if (role == null) {
            throw new IllegalArgumentException("Unknown user role in database: " + dbData);
        }
        return role;
    }
}
