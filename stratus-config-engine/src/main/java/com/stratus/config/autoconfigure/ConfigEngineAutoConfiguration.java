package com.stratus.config.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stratus.config.access.AccessControlGate;
import com.stratus.config.access.PermissionOracle;
import com.stratus.config.audit.AuditLogRepository;
import com.stratus.config.audit.AuditLogService;
import com.stratus.config.audit.InMemoryAuditLogRepository;
import com.stratus.config.configuration.ConfigurationCodec;
import com.stratus.config.configuration.ConfigurationRepository;
import com.stratus.config.configuration.ConfigurationService;
import com.stratus.config.configuration.ConfigurationValidator;
import com.stratus.config.configuration.InMemoryConfigurationRepository;
import com.stratus.config.crypto.EncryptionEngine;
import com.stratus.config.observability.ConfigEngineMetrics;
import com.stratus.config.rotation.ApiKeyRotationHandler;
import com.stratus.config.rotation.PasswordRotationHandler;
import com.stratus.config.rotation.RotationHandler;
import com.stratus.config.rotation.RotationHandlerRegistry;
import com.stratus.config.rotation.RotationScheduler;
import com.stratus.config.secret.InMemorySecretRepository;
import com.stratus.config.secret.SecretRepository;
import com.stratus.config.secret.SecretsService;
import com.stratus.config.template.ConfigurationTemplateService;
import com.stratus.config.template.InMemoryTemplateRepository;
import com.stratus.config.template.SchemaValidator;
import com.stratus.config.template.TemplateRepository;
import com.stratus.vault.VaultConnector;
import com.stratus.vault.VaultConnectorAutoConfiguration;
import com.stratus.vault.VaultProperties;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.ArrayList;
import java.util.List;

/**
 * Wires the configuration and secrets engine.
 * <p>
 * Every repository defaults to its in-memory implementation and can be replaced by declaring a
 * bean of the repository interface. The secrets side is only configured when a
 * {@link VaultConnector} is available.
 *
 * <pre>{@code
 * stratus:
 *   config-engine:
 *     encryption:
 *       key: ${CONFIG_ENCRYPTION_KEY}
 *     rotation:
 *       pool-size: 2
 *   secrets:
 *     provider: vault
 * }</pre>
 */
@Slf4j
@AutoConfiguration(after = {VaultConnectorAutoConfiguration.class, JacksonAutoConfiguration.class})
@EnableConfigurationProperties(ConfigEngineProperties.class)
public class ConfigEngineAutoConfiguration {

    // =========================================================================
    // Shared infrastructure
    // =========================================================================

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper().findAndRegisterModules();
    }

    @Bean
    @ConditionalOnMissingBean
    public ConfigEngineMetrics configEngineMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        return new ConfigEngineMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public EncryptionEngine encryptionEngine(ConfigEngineProperties properties) {
        return EncryptionEngine.create(properties.getEncryption().getKey(),
                properties.getEncryption().isAllowGeneratedKey());
    }

    // =========================================================================
    // Configurations and templates
    // =========================================================================

    @Bean
    @ConditionalOnMissingBean
    public ConfigurationRepository configurationRepository() {
        return new InMemoryConfigurationRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public ConfigurationService configurationService(ConfigurationRepository repository,
                                                     ObjectMapper objectMapper,
                                                     EncryptionEngine encryptionEngine,
                                                     ConfigEngineMetrics metrics,
                                                     ConfigEngineProperties properties) {
        return new ConfigurationService(repository,
                new ConfigurationValidator(objectMapper),
                encryptionEngine,
                new ConfigurationCodec(objectMapper),
                metrics,
                properties.getExport().getRedactionMarker());
    }

    @Bean
    @ConditionalOnMissingBean
    public TemplateRepository templateRepository() {
        return new InMemoryTemplateRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public ConfigurationTemplateService configurationTemplateService(TemplateRepository repository,
                                                                     ConfigurationService configurationService) {
        return new ConfigurationTemplateService(repository, new SchemaValidator(), configurationService);
    }

    // =========================================================================
    // Secrets
    // =========================================================================

    @Bean
    @ConditionalOnMissingBean
    public AuditLogRepository auditLogRepository() {
        return new InMemoryAuditLogRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditLogService auditLogService(AuditLogRepository repository, ConfigEngineProperties properties) {
        return new AuditLogService(repository, properties.getAudit().getDefaultLimit());
    }

    @Bean
    @ConditionalOnMissingBean
    public PermissionOracle permissionOracle() {
        log.warn("No PermissionOracle configured; only explicit grants authorize secret operations");
        return PermissionOracle.denyAll();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(VaultConnector.class)
    public AccessControlGate accessControlGate(VaultConnector connector,
                                               VaultProperties vaultProperties,
                                               PermissionOracle permissionOracle) {
        return new AccessControlGate(connector, vaultProperties, permissionOracle);
    }

    @Bean
    @ConditionalOnMissingBean
    public SecretRepository secretRepository() {
        return new InMemorySecretRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(VaultConnector.class)
    public SecretsService secretsService(SecretRepository repository,
                                         VaultConnector connector,
                                         AccessControlGate accessControlGate,
                                         AuditLogService auditLogService,
                                         ConfigEngineMetrics metrics) {
        return new SecretsService(repository, connector, accessControlGate, auditLogService, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public RotationHandlerRegistry rotationHandlerRegistry(ConfigEngineProperties properties,
                                                           ObjectProvider<RotationHandler> customHandlers) {
        ConfigEngineProperties.Rotation rotation = properties.getRotation();
        List<RotationHandler> handlers = new ArrayList<>();
        handlers.add(new PasswordRotationHandler(rotation.getPasswordLength(), rotation.getPasswordCharset()));
        handlers.add(new ApiKeyRotationHandler(rotation.getApiKeyPrefix()));
        customHandlers.orderedStream().forEach(handlers::add);
        return new RotationHandlerRegistry(handlers);
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    @ConditionalOnBean(VaultConnector.class)
    public RotationScheduler rotationScheduler(SecretRepository repository,
                                               SecretsService secretsService,
                                               RotationHandlerRegistry handlerRegistry,
                                               AuditLogService auditLogService,
                                               ConfigEngineMetrics metrics,
                                               ConfigEngineProperties properties) {
        RotationScheduler scheduler = new RotationScheduler(repository, secretsService, handlerRegistry,
                auditLogService, metrics, properties.getRotation().getPoolSize());
        secretsService.setRotationScheduler(scheduler);
        log.info("Secret rotation scheduler started with handlers {}", handlerRegistry.getTypes());
        return scheduler;
    }
}
