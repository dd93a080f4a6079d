package com.stratus.config.access;

/**
 * External RBAC decision point consulted when no local grant covers a request.
 */
@FunctionalInterface
public interface PermissionOracle {

    /**
     * @param principalId authenticated caller
     * @param resource    resource identifier, {@code secret:<id>} for secrets
     * @param action      permission value such as {@code read}
     */
    boolean hasPermission(String principalId, String resource, String action);

    static PermissionOracle denyAll() {
        return (principalId, resource, action) -> false;
    }
}
