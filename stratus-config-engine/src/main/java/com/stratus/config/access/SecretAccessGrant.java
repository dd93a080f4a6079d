package com.stratus.config.access;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Permissions held by one principal on one secret, mirrored by a backend policy named
 * {@link #policyName}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SecretAccessGrant {

    private String policyName;

    private String secretId;

    private String principalId;

    /** user, role or service */
    @Builder.Default
    private String principalType = "user";

    @Builder.Default
    private Set<SecretPermission> permissions = EnumSet.noneOf(SecretPermission.class);

    private String createdBy;

    private Instant createdAt;

    public boolean covers(SecretPermission permission) {
        return permissions != null && permissions.contains(permission);
    }

    public SecretAccessGrant copy() {
        return toBuilder()
                .permissions(permissions == null || permissions.isEmpty()
                        ? EnumSet.noneOf(SecretPermission.class)
                        : EnumSet.copyOf(permissions))
                .build();
    }
}
