package com.labbackup.api.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.labbackup.api.model.entity.RetentionConfig;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

/**
 * JPA converter for storing a schedule's {@link RetentionConfig} as JSON in a TEXT column,
 * e.g. {@code {"daily":7,"weekly":4,"monthly":12,"yearly":5}}.
 */
@Slf4j
@Converter
public class RetentionConfigConverter implements AttributeConverter<RetentionConfig, String> {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Override
    public String convertToDatabaseColumn(RetentionConfig attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize retention config to JSON: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public RetentionConfig convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(dbData, RetentionConfig.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize retention config JSON: {}", e.getMessage());
            return null;
        }
    }
}
