package com.stratus.config.template;

import com.stratus.config.error.Violation;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Validates values against a {@link ConfigurationSchema}, collecting every violation with
 * the JSON pointer of the offending value. Properties absent from the schema are allowed.
 */
public class SchemaValidator {

    static final Set<String> TYPES = Set.of("object", "string", "number", "integer", "boolean", "array");

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    /**
     * Check that a schema is well formed: known types, compilable patterns, sane bounds and
     * required names that refer to declared properties.
     */
    public List<Violation> validateSchema(ConfigurationSchema schema) {
        List<Violation> violations = new ArrayList<>();
        if (!"object".equals(schema.getType())) {
            violations.add(new Violation("", "schema", "root schema type must be object"));
        }
        checkProperty("", schema.asProperty(), violations);
        return violations;
    }

    private void checkProperty(String path, SchemaProperty property, List<Violation> violations) {
        if (property.getType() == null || !TYPES.contains(property.getType())) {
            violations.add(new Violation(path, "schema", "unknown type '" + property.getType() + "' at " + pointer(path)));
        }
        if (property.getPattern() != null) {
            try {
                Pattern.compile(property.getPattern());
            } catch (PatternSyntaxException e) {
                violations.add(new Violation(path, "schema", "invalid pattern at " + pointer(path)));
            }
        }
        if (property.getMinimum() != null && property.getMaximum() != null
                && property.getMinimum() > property.getMaximum()) {
            violations.add(new Violation(path, "schema", "minimum exceeds maximum at " + pointer(path)));
        }
        if (property.getRequired() != null) {
            for (String name : property.getRequired()) {
                if (property.getProperties() == null || !property.getProperties().containsKey(name)) {
                    violations.add(new Violation(path, "schema",
                            "required property '" + name + "' is not declared at " + pointer(path)));
                }
            }
        }
        if (property.getProperties() != null) {
            property.getProperties().forEach((name, nested) -> {
                if (nested == null) {
                    violations.add(new Violation(path + "/" + name, "schema", "missing definition at " + pointer(path + "/" + name)));
                } else {
                    checkProperty(path + "/" + name, nested, violations);
                }
            });
        }
        if (property.getItems() != null) {
            checkProperty(path + "/items", property.getItems(), violations);
        }
    }

    /**
     * Validate a value tree against the schema.
     */
    public List<Violation> validate(Object value, ConfigurationSchema schema) {
        List<Violation> violations = new ArrayList<>();
        validateValue("", value, schema.asProperty(), violations);
        return violations;
    }

    private void validateValue(String path, Object value, SchemaProperty property, List<Violation> violations) {
        if (value == null) {
            violations.add(violation(path, "type", "must be " + property.getType()));
            return;
        }
        if (!matchesType(value, property.getType())) {
            violations.add(violation(path, "type", "must be " + property.getType()));
            return;
        }

        if (property.getEnumValues() != null && !property.getEnumValues().isEmpty()
                && property.getEnumValues().stream().noneMatch(allowed -> sameValue(allowed, value))) {
            violations.add(violation(path, "enum", "must be equal to one of the allowed values"));
        }

        if (value instanceof String text) {
            if (property.getPattern() != null && !Pattern.compile(property.getPattern()).matcher(text).find()) {
                violations.add(violation(path, "pattern", "must match pattern \"" + property.getPattern() + "\""));
            }
            if (property.getFormat() != null && !matchesFormat(text, property.getFormat())) {
                violations.add(violation(path, "format", "must match format \"" + property.getFormat() + "\""));
            }
        }

        if (value instanceof Number number) {
            double numeric = number.doubleValue();
            if (property.getMinimum() != null && numeric < property.getMinimum()) {
                violations.add(violation(path, "minimum", "must be >= " + formatBound(property.getMinimum())));
            }
            if (property.getMaximum() != null && numeric > property.getMaximum()) {
                violations.add(violation(path, "maximum", "must be <= " + formatBound(property.getMaximum())));
            }
        }

        if (value instanceof Map<?, ?> object) {
            if (property.getRequired() != null) {
                for (String name : property.getRequired()) {
                    if (!object.containsKey(name)) {
                        violations.add(violation(path, "required", "must have required property '" + name + "'"));
                    }
                }
            }
            if (property.getProperties() != null) {
                property.getProperties().forEach((name, nested) -> {
                    if (nested != null && object.containsKey(name)) {
                        validateValue(path + "/" + name, object.get(name), nested, violations);
                    }
                });
            }
        }

        if (value instanceof List<?> array && property.getItems() != null) {
            for (int i = 0; i < array.size(); i++) {
                validateValue(path + "/" + i, array.get(i), property.getItems(), violations);
            }
        }
    }

    private static boolean matchesType(Object value, String type) {
        if (type == null) {
            return true;
        }
        return switch (type) {
            case "object" -> value instanceof Map;
            case "array" -> value instanceof List;
            case "string" -> value instanceof String;
            case "boolean" -> value instanceof Boolean;
            case "number" -> value instanceof Number;
            case "integer" -> isInteger(value);
            default -> false;
        };
    }

    private static boolean isInteger(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return true;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().scale() <= 0;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return !Double.isInfinite(d) && d == Math.rint(d);
        }
        return false;
    }

    private static boolean sameValue(Object allowed, Object value) {
        if (allowed instanceof Number a && value instanceof Number b) {
            return a.doubleValue() == b.doubleValue();
        }
        return allowed != null && allowed.equals(value);
    }

    // Unknown formats, password included, are annotations only
    private static boolean matchesFormat(String text, String format) {
        return switch (format) {
            case "email" -> EMAIL.matcher(text).matches();
            case "uri" -> isUri(text);
            case "uuid" -> isUuid(text);
            default -> true;
        };
    }

    private static boolean isUri(String text) {
        try {
            return new URI(text).getScheme() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static boolean isUuid(String text) {
        try {
            UUID.fromString(text);
            return text.length() == 36;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static String formatBound(double bound) {
        return bound == Math.rint(bound) ? String.valueOf((long) bound) : String.valueOf(bound);
    }

    private static Violation violation(String path, String code, String message) {
        return new Violation(pointer(path), code, "Validation error at " + pointer(path) + ": " + message);
    }

    private static String pointer(String path) {
        return path.isEmpty() ? "/" : path;
    }
}
