package com.contentcuration.curator.converter;

import com.contentcuration.curator.entity.SourceType;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Source types are stored under their lower-case wire value (youtube, podcast, rss).
 */
@Converter
public class SourceTypeConverter implements AttributeConverter<SourceType, String> {

    @Override
    public String convertToDatabaseColumn(SourceType attribute) {
        return attribute != null ? attribute.getValue() : null;
    }

    @Override
    public SourceType convertToEntityAttribute(String dbData) {
        return dbData != null ? SourceType.fromValue(dbData) : null;
    }
}
