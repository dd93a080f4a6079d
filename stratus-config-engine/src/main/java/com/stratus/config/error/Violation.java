package com.stratus.config.error;

/**
 * A single violated rule.
 *
 * @param field   the offending field, or a JSON pointer for schema violations
 * @param code    short rule identifier such as {@code required} or {@code pattern}
 * @param message human-readable description
 */
public record Violation(String field, String code, String message) {

    public static Violation required(String field, String message) {
        return new Violation(field, "required", message);
    }
}
