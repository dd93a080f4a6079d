package com.stratus.config.secret;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * History row for one value write. Holds the hash of the value, never the value.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SecretVersion {

    private String id;

    private String secretId;

    private int version;

    /** Backend version the value was written as, used for rollback reads */
    private Integer backendVersion;

    private String valueHash;

    private SecretMetadata metadata;

    private String createdBy;

    private Instant createdAt;

    /** Only the newest row is active */
    private boolean active;

    public SecretVersion copy() {
        return toBuilder()
                .metadata(metadata != null ? metadata.copy() : null)
                .build();
    }
}
