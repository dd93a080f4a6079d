package com.stratus.config.access;

import com.stratus.config.error.ValidationException;
import com.stratus.config.error.Violation;
import com.stratus.vault.VaultConnector;
import com.stratus.vault.VaultProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Per-secret access control. Grants are materialized as backend policies so the backend
 * enforces them too; decisions fall through to the {@link PermissionOracle} when no grant
 * covers the request.
 */
@Slf4j
public class AccessControlGate {

    private static final Pattern UNSAFE_POLICY_CHARS = Pattern.compile("[^a-zA-Z0-9_-]");
    private static final Set<String> PRINCIPAL_TYPES = Set.of("user", "role", "service");

    private final VaultConnector connector;
    private final VaultProperties vaultProperties;
    private final PermissionOracle oracle;

    // secretId -> principalId -> grant
    private final Map<String, Map<String, SecretAccessGrant>> grants = new ConcurrentHashMap<>();

    public AccessControlGate(VaultConnector connector, VaultProperties vaultProperties, PermissionOracle oracle) {
        this.connector = connector;
        this.vaultProperties = vaultProperties;
        this.oracle = oracle;
    }

    /**
     * Create (or replace) the backend policy for the grant and record it.
     *
     * @param secretPath backend path of the secret the grant applies to
     * @throws ValidationException if the principal or permissions are missing
     */
    public SecretAccessGrant grantAccess(String secretId, String secretPath, SecretAccessGrant grant) {
        List<Violation> violations = new ArrayList<>();
        if (grant.getPrincipalId() == null || grant.getPrincipalId().isBlank()) {
            violations.add(Violation.required("principalId", "Principal ID is required"));
        }
        if (grant.getPermissions() == null || grant.getPermissions().isEmpty()) {
            violations.add(Violation.required("permissions", "At least one permission is required"));
        }
        if (grant.getPrincipalType() != null && !PRINCIPAL_TYPES.contains(grant.getPrincipalType())) {
            violations.add(new Violation("principalType", "enum", "Principal type must be one of user, role, service"));
        }
        if (!violations.isEmpty()) {
            throw new ValidationException("Access grant validation failed", violations);
        }

        String policyName = grant.getPolicyName() != null
                ? grant.getPolicyName()
                : policyName(secretId, grant.getPrincipalId());
        connector.createPolicy(policyName, renderPolicy(secretPath, grant.getPermissions()));

        SecretAccessGrant recorded = grant.copy();
        recorded.setPolicyName(policyName);
        recorded.setSecretId(secretId);
        if (recorded.getCreatedAt() == null) {
            recorded.setCreatedAt(Instant.now());
        }
        grants.computeIfAbsent(secretId, k -> new ConcurrentHashMap<>()).put(recorded.getPrincipalId(), recorded);
        log.info("Granted {} on secret {} to {} via policy {}",
                recorded.getPermissions(), secretId, recorded.getPrincipalId(), policyName);
        return recorded.copy();
    }

    /**
     * Delete the principal's backend policy and grant.
     *
     * @return the removed grant, or {@code null} if the principal had none
     */
    public SecretAccessGrant revokeAccess(String secretId, String principalId) {
        Map<String, SecretAccessGrant> secretGrants = grants.get(secretId);
        SecretAccessGrant grant = secretGrants != null ? secretGrants.get(principalId) : null;
        if (grant == null) {
            return null;
        }
        connector.deletePolicy(grant.getPolicyName());
        secretGrants.remove(principalId);
        log.info("Revoked access on secret {} from {}", secretId, principalId);
        return grant.copy();
    }

    /**
     * Drop every grant on a deleted secret. Policy deletion is best effort.
     */
    public void revokeAll(String secretId) {
        Map<String, SecretAccessGrant> secretGrants = grants.remove(secretId);
        if (secretGrants == null) {
            return;
        }
        secretGrants.values().forEach(grant -> {
            try {
                connector.deletePolicy(grant.getPolicyName());
            } catch (RuntimeException e) {
                log.warn("Failed to delete policy {} for secret {}: {}", grant.getPolicyName(), secretId, e.getMessage());
            }
        });
    }

    public boolean checkPermission(String secretId, String principalId, SecretPermission permission) {
        Map<String, SecretAccessGrant> secretGrants = grants.get(secretId);
        if (secretGrants != null) {
            SecretAccessGrant grant = secretGrants.get(principalId);
            if (grant != null && grant.covers(permission)) {
                return true;
            }
        }
        return oracle.hasPermission(principalId, "secret:" + secretId, permission.getValue());
    }

    public List<SecretAccessGrant> listPrincipals(String secretId) {
        List<SecretAccessGrant> result = new ArrayList<>();
        grants.getOrDefault(secretId, Map.of()).values().forEach(grant -> result.add(grant.copy()));
        result.sort(Comparator.comparing(SecretAccessGrant::getPrincipalId));
        return result;
    }

    /**
     * HCL policy granting the mapped capabilities on the secret's data path, plus {@code list}
     * on its metadata path when listing is granted.
     */
    String renderPolicy(String secretPath, Set<SecretPermission> permissions) {
        Set<String> capabilities = new LinkedHashSet<>();
        permissions.stream()
                .sorted()
                .filter(permission -> permission != SecretPermission.LIST)
                .forEach(permission -> capabilities.add(permission.getCapability()));

        StringBuilder policy = new StringBuilder();
        if (!capabilities.isEmpty()) {
            appendPathBlock(policy, vaultProperties.buildDataPath(secretPath), capabilities);
        }
        if (permissions.contains(SecretPermission.LIST)) {
            appendPathBlock(policy, vaultProperties.buildMetadataPath(secretPath), Set.of("list"));
        }
        return policy.toString();
    }

    private static void appendPathBlock(StringBuilder policy, String path, Set<String> capabilities) {
        if (policy.length() > 0) {
            policy.append('\n');
        }
        policy.append("path \"").append(path).append("\" {\n")
                .append("  capabilities = [");
        int i = 0;
        for (String capability : capabilities) {
            if (i++ > 0) {
                policy.append(", ");
            }
            policy.append('"').append(capability).append('"');
        }
        policy.append("]\n}\n");
    }

    static String policyName(String secretId, String principalId) {
        return "secret-" + UNSAFE_POLICY_CHARS.matcher(secretId).replaceAll("_")
                + "-" + UNSAFE_POLICY_CHARS.matcher(principalId).replaceAll("_");
    }
}
