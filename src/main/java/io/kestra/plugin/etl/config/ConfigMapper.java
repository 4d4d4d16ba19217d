package io.kestra.plugin.etl.config;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.kestra.plugin.etl.InvalidConfigurationException;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads configuration documents. YAML is a superset of JSON, so one mapper handles both.
 */
final class ConfigMapper {
    private static final ObjectMapper MAPPER = YAMLMapper.builder()
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .build();

    private ConfigMapper() {
    }

    static <T> T read(InputStream input, Class<T> type) throws InvalidConfigurationException {
        try {
            T value = MAPPER.readValue(input, type);
            if (value == null) {
                throw new InvalidConfigurationException("Empty " + type.getSimpleName() + " document");
            }
            return value;
        } catch (IOException e) {
            throw new InvalidConfigurationException("Invalid " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}
