package com.stratus.config.access;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Operations that can be granted on a secret, each mapped to the backend capability that
 * enforces it.
 */
public enum SecretPermission {
    READ("read", "read"),
    WRITE("write", "create"),
    UPDATE("update", "update"),
    DELETE("delete", "delete"),
    LIST("list", "list"),
    ROTATE("rotate", "update");

    private final String value;
    private final String capability;

    SecretPermission(String value, String capability) {
        this.value = value;
        this.capability = capability;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getCapability() {
        return capability;
    }

    @JsonCreator
    public static SecretPermission fromValue(String value) {
        for (SecretPermission permission : values()) {
            if (permission.value.equalsIgnoreCase(value)) {
                return permission;
            }
        }
        throw new IllegalArgumentException("Unknown secret permission: " + value);
    }
}
