package com.stratus.config.secret;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Engine-side record of a secret. The value lives only in the secret backend at {@link #path};
 * this record carries metadata, the checksum of the current value and the version bookkeeping.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Secret {

    private String id;

    private String name;

    /** Backend path, unique across secrets */
    private String path;

    private String environmentId;

    private SecretType type;

    private String description;

    /** Engine version, 1 at creation and incremented on every value write */
    private int version;

    /** Backend version holding the current value, null until a value is written */
    private Integer backendVersion;

    private SecretRotationConfig rotationConfig;

    private SecretMetadata metadata;

    /** Names of backend policies granted on this secret */
    @Builder.Default
    private List<String> accessPolicies = new ArrayList<>();

    @Builder.Default
    private Map<String, String> tags = new HashMap<>();

    private String createdBy;

    private String updatedBy;

    private Instant createdAt;

    private Instant updatedAt;

    private Instant lastAccessedAt;

    private Instant lastRotatedAt;

    public Secret copy() {
        return toBuilder()
                .rotationConfig(rotationConfig != null ? rotationConfig.copy() : null)
                .metadata(metadata != null ? metadata.copy() : null)
                .accessPolicies(accessPolicies != null ? new ArrayList<>(accessPolicies) : new ArrayList<>())
                .tags(tags != null ? new HashMap<>(tags) : new HashMap<>())
                .build();
    }
}
