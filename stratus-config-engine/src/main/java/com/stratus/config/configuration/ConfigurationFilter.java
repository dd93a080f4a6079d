package com.stratus.config.configuration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;
import java.util.Map;

/**
 * Criteria for listing configurations. All set criteria must match.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConfigurationFilter {

    private String environmentId;

    /** Case-insensitive substring of name or key */
    private String search;

    private ConfigurationType type;

    private Boolean secret;

    /** Tags that must be present with equal values */
    private Map<String, String> tags;

    public static ConfigurationFilter forEnvironment(String environmentId) {
        return ConfigurationFilter.builder().environmentId(environmentId).build();
    }

    public boolean matches(Configuration config) {
        if (environmentId != null && !environmentId.equals(config.getEnvironmentId())) {
            return false;
        }
        if (type != null && type != config.getType()) {
            return false;
        }
        if (secret != null && secret != config.isSecret()) {
            return false;
        }
        if (search != null && !search.isBlank()) {
            String needle = search.toLowerCase(Locale.ROOT);
            boolean nameMatches = config.getName() != null && config.getName().toLowerCase(Locale.ROOT).contains(needle);
            boolean keyMatches = config.getKey() != null && config.getKey().toLowerCase(Locale.ROOT).contains(needle);
            if (!nameMatches && !keyMatches) {
                return false;
            }
        }
        if (tags != null && !tags.isEmpty()) {
            Map<String, String> actual = config.getTags();
            for (Map.Entry<String, String> tag : tags.entrySet()) {
                if (actual == null || !tag.getValue().equals(actual.get(tag.getKey()))) {
                    return false;
                }
            }
        }
        return true;
    }
}
