package com.stratus.config.secret;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SecretType {
    PASSWORD("password"),
    API_KEY("api_key"),
    CERTIFICATE("certificate"),
    PRIVATE_KEY("private_key"),
    DATABASE_CREDENTIAL("database_credential"),
    OAUTH_TOKEN("oauth_token"),
    CUSTOM("custom");

    private final String value;

    SecretType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SecretType fromValue(String value) {
        for (SecretType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown secret type: " + value);
    }
}
