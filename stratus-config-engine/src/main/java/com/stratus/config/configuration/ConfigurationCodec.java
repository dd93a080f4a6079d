package com.stratus.config.configuration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.stratus.config.error.ValidationException;
import com.stratus.config.error.Violation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Converts configuration values to and from their at-rest string form, and configuration
 * sets to and from the json, yaml and env exchange formats.
 */
public class ConfigurationCodec {

    private static final TypeReference<Map<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public ConfigurationCodec(ObjectMapper jsonMapper) {
        this.jsonMapper = jsonMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.yamlMapper = new ObjectMapper(new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));
    }

    // =========================================================================
    // Value encoding
    // =========================================================================

    /**
     * String form of a value: strings as-is, everything else as JSON.
     */
    public String toPlaintext(Object value) {
        if (value instanceof String text) {
            return text;
        }
        try {
            return jsonMapper.writer().without(SerializationFeature.INDENT_OUTPUT).writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be serialized: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Restore a value of the declared type from its string form.
     */
    public Object fromPlaintext(String plaintext, ConfigurationType type) throws JsonProcessingException {
        if (type == null) {
            return plaintext;
        }
        return switch (type) {
            case STRING, YAML, ENV -> plaintext;
            case BOOLEAN -> jsonMapper.readValue(plaintext, Boolean.class);
            case NUMBER -> jsonMapper.readValue(plaintext, Number.class);
            case JSON -> jsonMapper.readValue(plaintext, Object.class);
        };
    }

    // =========================================================================
    // Export
    // =========================================================================

    public String export(List<Configuration> configurations, ExportFormat format) {
        try {
            return switch (format) {
                case JSON -> jsonMapper.writeValueAsString(toDocuments(configurations));
                case YAML -> yamlMapper.writeValueAsString(toDocuments(configurations));
                case ENV -> configurations.stream()
                        .map(config -> config.getKey() + "=" + toPlaintext(config.getValue()))
                        .collect(Collectors.joining("\n"));
            };
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to export configurations", e);
        }
    }

    private static List<Map<String, Object>> toDocuments(List<Configuration> configurations) {
        List<Map<String, Object>> documents = new ArrayList<>();
        for (Configuration config : configurations) {
            Map<String, Object> document = new LinkedHashMap<>();
            document.put("key", config.getKey());
            document.put("value", config.getValue());
            document.put("type", config.getType() != null ? config.getType().getValue() : null);
            document.put("isSecret", config.isSecret());
            document.put("description", config.getDescription());
            document.put("tags", config.getTags());
            documents.add(document);
        }
        return documents;
    }

    // =========================================================================
    // Import
    // =========================================================================

    /**
     * Parse an import document into configuration drafts.
     * <p>
     * A top-level list is read as exported documents. A top-level object is flattened into
     * {@code .}-joined keys with types inferred from the values. Env input is split on the
     * first {@code =} of each line.
     *
     * @throws ValidationException if the document cannot be parsed
     */
    public List<Configuration> parseImport(String data, ExportFormat format) {
        Object parsed;
        try {
            parsed = switch (format) {
                case JSON -> jsonMapper.readValue(data, Object.class);
                case YAML -> yamlMapper.readValue(data, Object.class);
                case ENV -> parseEnv(data);
            };
        } catch (JsonProcessingException e) {
            throw new ValidationException("Import failed", List.of(new Violation("data", "parse",
                    "Failed to parse import data: " + e.getOriginalMessage())));
        }

        if (parsed instanceof List<?> documents) {
            return fromDocuments(documents);
        }
        if (parsed instanceof Map<?, ?> values) {
            List<Configuration> drafts = new ArrayList<>();
            flatten("", values, drafts);
            return drafts;
        }
        if (parsed == null) {
            return List.of();
        }
        throw new ValidationException("Import failed", List.of(new Violation("data", "shape",
                "Import data must be an object or a list of configurations")));
    }

    private static Map<String, Object> parseEnv(String data) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (String line : data.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            int separator = trimmed.indexOf('=');
            if (separator <= 0) {
                continue;
            }
            values.put(trimmed.substring(0, separator).trim(), trimmed.substring(separator + 1).trim());
        }
        return values;
    }

    private static void flatten(String prefix, Map<?, ?> values, List<Configuration> drafts) {
        values.forEach((rawKey, value) -> {
            String key = prefix.isEmpty() ? String.valueOf(rawKey) : prefix + "." + rawKey;
            if (value instanceof Map<?, ?> nested && !nested.isEmpty()) {
                flatten(key, nested, drafts);
            } else {
                drafts.add(Configuration.builder()
                        .key(key)
                        .value(value)
                        .type(ConfigurationType.infer(value))
                        .build());
            }
        });
    }

    private List<Configuration> fromDocuments(List<?> documents) {
        List<Configuration> drafts = new ArrayList<>();
        for (Object item : documents) {
            if (!(item instanceof Map<?, ?>)) {
                continue;
            }
            Map<String, Object> document = jsonMapper.convertValue(item, DOCUMENT_TYPE);
            Object value = document.get("value");
            Object type = document.get("type");
            Map<String, String> tags = new LinkedHashMap<>();
            if (document.get("tags") instanceof Map<?, ?> rawTags) {
                rawTags.forEach((k, v) -> tags.put(String.valueOf(k), String.valueOf(v)));
            }
            drafts.add(Configuration.builder()
                    .key(document.get("key") != null ? String.valueOf(document.get("key")) : null)
                    .name(document.get("name") != null ? String.valueOf(document.get("name")) : null)
                    .value(value)
                    .type(type != null ? parseType(String.valueOf(type)) : ConfigurationType.infer(value))
                    .secret(Boolean.TRUE.equals(document.get("isSecret")))
                    .description(document.get("description") != null ? String.valueOf(document.get("description")) : null)
                    .tags(tags)
                    .build());
        }
        return drafts;
    }

    // Unknown types surface as a missing type in validation
    private static ConfigurationType parseType(String type) {
        try {
            return ConfigurationType.fromValue(type);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
