package com.mike.recipeimporter.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class UrlStatusConverter implements AttributeConverter<UrlStatus, String> {

    @Override
    public String convertToDatabaseColumn(UrlStatus status) {
        return status == null ? null : status.dbValue();
    }

    @Override
    public UrlStatus convertToEntityAttribute(String value) {
        return value == null ? null : UrlStatus.fromDbValue(value);
    }
}
