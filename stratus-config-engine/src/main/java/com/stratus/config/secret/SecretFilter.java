package com.stratus.config.secret;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;
import java.util.Map;

/**
 * Listing filter. Unset fields match everything; {@code name} is a case-insensitive substring.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SecretFilter {

    private String environmentId;

    private String name;

    private String path;

    private SecretType type;

    private Map<String, String> tags;

    private String createdBy;

    public static SecretFilter forEnvironment(String environmentId) {
        return SecretFilter.builder().environmentId(environmentId).build();
    }

    public boolean matches(Secret secret) {
        if (environmentId != null && !environmentId.equals(secret.getEnvironmentId())) {
            return false;
        }
        if (name != null && (secret.getName() == null
                || !secret.getName().toLowerCase(Locale.ROOT).contains(name.toLowerCase(Locale.ROOT)))) {
            return false;
        }
        if (path != null && !path.equals(secret.getPath())) {
            return false;
        }
        if (type != null && type != secret.getType()) {
            return false;
        }
        if (createdBy != null && !createdBy.equals(secret.getCreatedBy())) {
            return false;
        }
        if (tags != null) {
            for (Map.Entry<String, String> tag : tags.entrySet()) {
                if (secret.getTags() == null || !tag.getValue().equals(secret.getTags().get(tag.getKey()))) {
                    return false;
                }
            }
        }
        return true;
    }
}
