package com.stratus.config.error;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Input failed validation. Always carries every violated rule, never just the first.
 */
public class ValidationException extends ConfigEngineException {

    private final List<Violation> violations;

    public ValidationException(String prefix, List<Violation> violations) {
        super(ErrorCode.VALIDATION_FAILED, prefix + ": " + violations.stream()
                .map(Violation::message)
                .collect(Collectors.joining(", ")));
        this.violations = List.copyOf(violations);
    }

    public ValidationException(List<Violation> violations) {
        this("Validation failed", violations);
    }

    public List<Violation> getViolations() {
        return violations;
    }
}
