package com.labbackup.api.util;

import com.labbackup.api.model.entity.RetentionConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RetentionConfigConverter")
class RetentionConfigConverterTest {

    private final RetentionConfigConverter converter = new RetentionConfigConverter();

    @Test
    @DisplayName("should store tiers as JSON")
    void shouldWriteJson() {
        String json = converter.convertToDatabaseColumn(RetentionConfig.of(7, 4, 12, 5));

        assertThat(json).contains("\"daily\":7").contains("\"yearly\":5");
        assertThat(converter.convertToEntityAttribute(json)).isEqualTo(RetentionConfig.of(7, 4, 12, 5));
    }

    @Test
    @DisplayName("should ignore unknown fields and default missing tiers to zero")
    void shouldReadPartialJson() {
        RetentionConfig config = converter.convertToEntityAttribute("{\"daily\":3,\"hourly\":24}");

        assertThat(config).isEqualTo(RetentionConfig.of(3, 0, 0, 0));
    }

    @Test
    @DisplayName("should map null and blank columns to null")
    void shouldHandleEmpty() {
        assertThat(converter.convertToDatabaseColumn(null)).isNull();
        assertThat(converter.convertToEntityAttribute(null)).isNull();
        assertThat(converter.convertToEntityAttribute(" ")).isNull();
    }

    @Test
    @DisplayName("should return null for unreadable JSON")
    void shouldTolerateCorruptJson() {
        assertThat(converter.convertToEntityAttribute("{daily")).isNull();
    }
}
