package com.stratus.config.template;

import com.stratus.config.configuration.BulkOperation;
import com.stratus.config.configuration.BulkResult;
import com.stratus.config.configuration.Configuration;
import com.stratus.config.configuration.ConfigurationService;
import com.stratus.config.configuration.ConfigurationType;
import com.stratus.config.error.ConflictException;
import com.stratus.config.error.NotFoundException;
import com.stratus.config.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ConfigurationTemplateService Tests")
class ConfigurationTemplateServiceTest {

    @Mock
    private ConfigurationService configurationService;

    private ConfigurationTemplateService service;

    @BeforeEach
    void setUp() {
        service = new ConfigurationTemplateService(new InMemoryTemplateRepository(), new SchemaValidator(),
                configurationService);
    }

    private static ConfigurationTemplate databaseTemplate() {
        Map<String, SchemaProperty> connection = new LinkedHashMap<>();
        connection.put("host", SchemaProperty.builder().type("string").build());
        connection.put("port", SchemaProperty.builder().type("integer").build());

        Map<String, SchemaProperty> properties = new LinkedHashMap<>();
        properties.put("database", SchemaProperty.builder().type("object").properties(connection).build());
        properties.put("db_password", SchemaProperty.builder().type("string").build());
        properties.put("pool", SchemaProperty.builder().type("number").minimum(1.0).build());

        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("database", Map.of("host", "localhost", "port", 5432));
        defaults.put("pool", 10);

        return ConfigurationTemplate.builder()
                .name("postgres-service")
                .schema(ConfigurationSchema.builder()
                        .properties(properties)
                        .required(List.of("pool"))
                        .build())
                .defaultValues(defaults)
                .build();
    }

    @Nested
    @DisplayName("Template lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should create and find a template")
        void shouldCreateTemplate() {
            // When
            ConfigurationTemplate created = service.createTemplate(databaseTemplate(), "user-1");

            // Then
            assertThat(created.getId()).isNotBlank();
            assertThat(created.getCreatedBy()).isEqualTo("user-1");
            assertThat(service.getTemplate(created.getId())).isPresent();
            assertThat(service.listTemplates()).hasSize(1);
        }

        @Test
        @DisplayName("should reject a duplicate name")
        void shouldRejectDuplicateName() {
            service.createTemplate(databaseTemplate(), "user-1");

            assertThatThrownBy(() -> service.createTemplate(databaseTemplate(), "user-2"))
                    .isInstanceOf(ConflictException.class);
        }

        @Test
        @DisplayName("should report name, schema and default problems together")
        void shouldValidateTemplate() {
            // Given
            ConfigurationTemplate template = databaseTemplate();
            template.setName("bad name");
            template.getDefaultValues().put("pool", 0);

            // When / Then
            assertThatThrownBy(() -> service.createTemplate(template, "user-1"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("Template name must contain only")
                    .hasMessageContaining("Default value error at /pool: must be >= 1");
        }

        @Test
        @DisplayName("should merge non-null fields on update")
        void shouldUpdateTemplate() {
            // Given
            ConfigurationTemplate created = service.createTemplate(databaseTemplate(), "user-1");

            // When
            ConfigurationTemplate updated = service.updateTemplate(created.getId(),
                    ConfigurationTemplate.builder().description("Postgres defaults").build());

            // Then
            assertThat(updated.getDescription()).isEqualTo("Postgres defaults");
            assertThat(updated.getName()).isEqualTo("postgres-service");
            assertThat(updated.getDefaultValues()).containsKey("pool");
        }

        @Test
        @DisplayName("should fail to delete an unknown template")
        void shouldFailDeleteUnknown() {
            assertThatThrownBy(() -> service.deleteTemplate("missing"))
                    .isInstanceOf(NotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Applying templates")
    class ApplyTests {

        @Test
        @DisplayName("should flatten merged values into typed configurations")
        void shouldApplyTemplate() {
            // Given
            ConfigurationTemplate template = service.createTemplate(databaseTemplate(), "user-1");
            when(configurationService.bulkCreate(any(BulkOperation.class), eq("user-1"))).thenReturn(new BulkResult<>());

            // When
            service.applyTemplate(template.getId(), "env-1", Map.of("db_password", "s3cr3t", "pool", 20), "user-1");

            // Then
            ArgumentCaptor<BulkOperation> captor = ArgumentCaptor.forClass(BulkOperation.class);
            verify(configurationService).bulkCreate(captor.capture(), eq("user-1"));
            BulkOperation operation = captor.getValue();
            assertThat(operation.getEnvironmentId()).isEqualTo("env-1");

            Map<String, Configuration> byKey = new LinkedHashMap<>();
            operation.getConfigurations().forEach(config -> byKey.put(config.getKey(), config));
            assertThat(byKey).containsOnlyKeys("database.host", "database.port", "db_password", "pool");
            assertThat(byKey.get("database.port").getType()).isEqualTo(ConfigurationType.NUMBER);
            assertThat(byKey.get("pool").getValue()).isEqualTo(20);
            assertThat(byKey.get("db_password").isSecret()).isTrue();
            assertThat(byKey.get("database.host").isSecret()).isFalse();
            assertThat(byKey.get("database.host").getDescription()).isEqualTo("Generated from template: postgres-service");
        }

        @Test
        @DisplayName("should refuse values that violate the schema")
        void shouldRejectInvalidValues() {
            // Given
            ConfigurationTemplate template = service.createTemplate(databaseTemplate(), "user-1");

            // When / Then
            assertThatThrownBy(() -> service.applyTemplate(template.getId(), "env-1", Map.of("pool", 0), "user-1"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageStartingWith("Template values validation failed")
                    .hasMessageContaining("Validation error at /pool: must be >= 1");
            verify(configurationService, never()).bulkCreate(any(), any());
        }
    }
}
