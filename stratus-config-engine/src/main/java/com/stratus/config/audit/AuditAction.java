package com.stratus.config.audit;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AuditAction {
    CREATE("create"),
    READ("read"),
    UPDATE("update"),
    DELETE("delete"),
    ROTATE("rotate"),
    GRANT_ACCESS("grant_access"),
    REVOKE_ACCESS("revoke_access");

    private final String value;

    AuditAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
