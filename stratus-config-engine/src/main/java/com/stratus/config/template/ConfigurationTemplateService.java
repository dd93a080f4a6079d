package com.stratus.config.template;

import com.stratus.config.configuration.BulkOperation;
import com.stratus.config.configuration.BulkResult;
import com.stratus.config.configuration.Configuration;
import com.stratus.config.configuration.ConfigurationService;
import com.stratus.config.configuration.ConfigurationType;
import com.stratus.config.error.ConflictException;
import com.stratus.config.error.NotFoundException;
import com.stratus.config.error.ValidationException;
import com.stratus.config.error.Violation;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Manages configuration templates and expands them into per-environment configurations.
 */
@Slf4j
public class ConfigurationTemplateService {

    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9._-]+$");

    private final TemplateRepository repository;
    private final SchemaValidator schemaValidator;
    private final ConfigurationService configurationService;

    public ConfigurationTemplateService(TemplateRepository repository,
                                        SchemaValidator schemaValidator,
                                        ConfigurationService configurationService) {
        this.repository = repository;
        this.schemaValidator = schemaValidator;
        this.configurationService = configurationService;
    }

    public ConfigurationTemplate createTemplate(ConfigurationTemplate template, String principalId) {
        List<Violation> violations = validateTemplate(template);
        if (!violations.isEmpty()) {
            throw new ValidationException("Template validation failed", violations);
        }
        if (repository.findByName(template.getName()).isPresent()) {
            throw new ConflictException("Template with name " + template.getName() + " already exists");
        }

        Instant now = Instant.now();
        ConfigurationTemplate record = template.toBuilder()
                .id(UUID.randomUUID().toString())
                .createdBy(principalId)
                .createdAt(now)
                .updatedAt(now)
                .build();
        ConfigurationTemplate saved = repository.save(record);
        log.info("Created template {} ({})", saved.getName(), saved.getId());
        return saved;
    }

    public Optional<ConfigurationTemplate> getTemplate(String id) {
        return repository.findById(id);
    }

    /**
     * Merge the non-null fields of {@code changes} into the stored template and re-validate.
     */
    public ConfigurationTemplate updateTemplate(String id, ConfigurationTemplate changes) {
        ConfigurationTemplate existing = repository.findById(id)
                .orElseThrow(() -> notFound(id));

        ConfigurationTemplate.ConfigurationTemplateBuilder merged = existing.toBuilder().updatedAt(Instant.now());
        if (changes.getName() != null) {
            merged.name(changes.getName());
        }
        if (changes.getDescription() != null) {
            merged.description(changes.getDescription());
        }
        if (changes.getSchema() != null) {
            merged.schema(changes.getSchema());
        }
        if (changes.getDefaultValues() != null && !changes.getDefaultValues().isEmpty()) {
            merged.defaultValues(changes.getDefaultValues());
        }
        if (changes.getTags() != null && !changes.getTags().isEmpty()) {
            merged.tags(changes.getTags());
        }
        ConfigurationTemplate updated = merged.build();

        List<Violation> violations = validateTemplate(updated);
        if (!violations.isEmpty()) {
            throw new ValidationException("Template validation failed", violations);
        }
        return repository.save(updated);
    }

    public void deleteTemplate(String id) {
        repository.findById(id).orElseThrow(() -> notFound(id));
        repository.delete(id);
        log.info("Deleted template {}", id);
    }

    public List<ConfigurationTemplate> listTemplates() {
        return repository.findAll();
    }

    /**
     * Name, schema presence and shape, and defaults checked against the schema.
     */
    public List<Violation> validateTemplate(ConfigurationTemplate template) {
        List<Violation> violations = new ArrayList<>();
        if (template.getName() == null || template.getName().isBlank()) {
            violations.add(Violation.required("name", "Template name is required"));
        } else if (!NAME_PATTERN.matcher(template.getName()).matches()) {
            violations.add(new Violation("name", "pattern",
                    "Template name must contain only alphanumeric characters, underscores, dots, and hyphens"));
        }

        if (template.getSchema() == null) {
            violations.add(Violation.required("schema", "Template schema is required"));
            return violations;
        }

        List<Violation> schemaViolations = schemaValidator.validateSchema(template.getSchema());
        schemaViolations.forEach(v -> violations.add(
                new Violation("schema" + v.field(), v.code(), "Schema validation error: " + v.message())));

        if (schemaViolations.isEmpty() && template.getDefaultValues() != null && !template.getDefaultValues().isEmpty()) {
            schemaValidator.validate(template.getDefaultValues(), template.getSchema()).forEach(v -> violations.add(
                    new Violation(v.field(), v.code(), v.message().replaceFirst("^Validation error", "Default value error"))));
        }
        return violations;
    }

    /**
     * Merge defaults with overrides, validate against the schema, flatten to dotted keys and
     * bulk-create the resulting configurations in the environment.
     *
     * @throws NotFoundException   if the template does not exist
     * @throws ValidationException aggregating every schema violation
     */
    public BulkResult<Configuration> applyTemplate(String templateId,
                                                   String environmentId,
                                                   Map<String, Object> overrides,
                                                   String principalId) {
        ConfigurationTemplate template = repository.findById(templateId)
                .orElseThrow(() -> notFound(templateId));

        Map<String, Object> values = new LinkedHashMap<>();
        if (template.getDefaultValues() != null) {
            values.putAll(template.getDefaultValues());
        }
        if (overrides != null) {
            values.putAll(overrides);
        }

        List<Violation> violations = schemaValidator.validate(values, template.getSchema());
        if (!violations.isEmpty()) {
            throw new ValidationException("Template values validation failed", violations);
        }

        List<Configuration> drafts = new ArrayList<>();
        extract(values, template.getSchema().getProperties(), "", drafts);
        drafts.forEach(draft -> draft.setDescription("Generated from template: " + template.getName()));

        log.info("Applying template {} to environment {} ({} entries)", template.getName(), environmentId, drafts.size());
        return configurationService.bulkCreate(BulkOperation.builder()
                .environmentId(environmentId)
                .configurations(drafts)
                .changeDescription("Applied template: " + template.getName())
                .build(), principalId);
    }

    private static void extract(Map<String, Object> values,
                                Map<String, SchemaProperty> properties,
                                String prefix,
                                List<Configuration> drafts) {
        if (properties == null) {
            return;
        }
        values.forEach((name, value) -> {
            SchemaProperty property = properties.get(name);
            if (property == null) {
                return;
            }
            String key = prefix.isEmpty() ? name : prefix + "." + name;
            if ("object".equals(property.getType()) && property.getProperties() != null && value instanceof Map<?, ?> nested) {
                Map<String, Object> nestedValues = new LinkedHashMap<>();
                nested.forEach((k, v) -> nestedValues.put(String.valueOf(k), v));
                extract(nestedValues, property.getProperties(), key, drafts);
            } else {
                drafts.add(Configuration.builder()
                        .key(key)
                        .value(value)
                        .type(toConfigurationType(property.getType()))
                        .secret(isSecret(name, property))
                        .build());
            }
        });
    }

    static ConfigurationType toConfigurationType(String schemaType) {
        if (schemaType == null) {
            return ConfigurationType.STRING;
        }
        return switch (schemaType) {
            case "number", "integer" -> ConfigurationType.NUMBER;
            case "boolean" -> ConfigurationType.BOOLEAN;
            case "object", "array" -> ConfigurationType.JSON;
            default -> ConfigurationType.STRING;
        };
    }

    static boolean isSecret(String name, SchemaProperty property) {
        String lower = name.toLowerCase(Locale.ROOT);
        return "password".equals(property.getFormat()) || lower.contains("secret") || lower.contains("password");
    }

    private static NotFoundException notFound(String id) {
        return new NotFoundException("Template with id " + id + " not found");
    }
}
