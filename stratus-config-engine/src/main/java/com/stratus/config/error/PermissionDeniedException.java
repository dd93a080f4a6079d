package com.stratus.config.error;

public class PermissionDeniedException extends ConfigEngineException {

    private final String principalId;
    private final String permission;

    public PermissionDeniedException(String principalId, String resource, String permission) {
        super(ErrorCode.PERMISSION_DENIED,
                "Principal " + principalId + " lacks " + permission + " permission on " + resource);
        this.principalId = principalId;
        this.permission = permission;
    }

    public String getPrincipalId() {
        return principalId;
    }

    public String getPermission() {
        return permission;
    }
}
