package com.contentcuration.curator.converter;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Stores timestamps as fixed-width ISO-8601 text.
 *
 * <p>The fixed width keeps lexical order equal to chronological order, so range comparisons on
 * the text columns behave like comparisons on the timestamps. Reads accept any ISO local
 * date-time, including values written by other tools without fractional seconds.
 */
@Converter
public class IsoTimestampConverter implements AttributeConverter<LocalDateTime, String> {

    public static final DateTimeFormatter STORAGE_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSS");

    @Override
    public String convertToDatabaseColumn(LocalDateTime attribute) {
        if (attribute == null) {
            return null;
        }
        return attribute.truncatedTo(ChronoUnit.MICROS).format(STORAGE_FORMAT);
    }

    @Override
    public LocalDateTime convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        return LocalDateTime.parse(dbData.trim().replace(' ', 'T'));
    }
}
