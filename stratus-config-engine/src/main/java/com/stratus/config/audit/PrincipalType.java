package com.stratus.config.audit;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PrincipalType {
    USER,
    SERVICE,
    SYSTEM;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
