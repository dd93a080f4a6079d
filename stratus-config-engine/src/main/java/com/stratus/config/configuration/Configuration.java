package com.stratus.config.configuration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Typed, versioned configuration entry scoped to an environment.
 * <p>
 * {@code (environmentId, key)} is unique. When {@code secret} is set the stored value is an
 * encryption token; reads through {@link ConfigurationService} return it decrypted.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Configuration {

    /** Unique configuration identifier */
    private String id;

    /** Owning environment */
    private String environmentId;

    /** Display name */
    private String name;

    /** Lookup key, unique within the environment */
    private String key;

    /** String, Number, Boolean, Map or List depending on {@link #type} */
    private Object value;

    private ConfigurationType type;

    /** Encrypt the value at rest */
    private boolean secret;

    /** Current version, starting at 1 */
    private int version;

    private String description;

    @Builder.Default
    private Map<String, String> tags = new HashMap<>();

    private String createdBy;

    private Instant createdAt;

    private Instant updatedAt;

    /**
     * Deep enough copy for repository isolation: the tag map is not shared.
     */
    public Configuration copy() {
        return toBuilder()
                .tags(tags != null ? new HashMap<>(tags) : new HashMap<>())
                .build();
    }

    public Configuration withValue(Object newValue) {
        Configuration copy = copy();
        copy.setValue(newValue);
        return copy;
    }
}
