package com.stratus.vault;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;

/**
 * Auto-configuration that wires a shared {@link VaultConnector} backed by either Vault or
 * the in-memory development connector.
 * <p>
 * The connector is connected on startup unless {@code stratus.secrets.connect-on-startup}
 * is false, and disconnected when the context closes.
 */
@AutoConfiguration
@EnableConfigurationProperties({SecretsBackendProperties.class, VaultProperties.class})
@ConditionalOnProperty(prefix = "stratus.secrets", name = "enabled", havingValue = "true", matchIfMissing = true)
public class VaultConnectorAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(VaultConnectorAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public VaultTokenSessionStore vaultTokenSessionStore(VaultProperties vaultProperties) {
        return new VaultTokenSessionStore(vaultProperties.getTokenStore());
    }

    @Bean(destroyMethod = "disconnect")
    @ConditionalOnMissingBean
    public VaultConnector vaultConnector(SecretsBackendProperties backendProperties,
                                         VaultProperties vaultProperties,
                                         VaultTokenSessionStore tokenStore,
                                         ObjectProvider<RestTemplateBuilder> restTemplateBuilder,
                                         ObjectProvider<MeterRegistry> meterRegistry) {
        VaultConnector connector;
        if ("vault".equalsIgnoreCase(backendProperties.getProvider())) {
            log.info("Configuring Vault-backed VaultConnector at {}", vaultProperties.getUri());
            RestTemplate restTemplate = restTemplateBuilder.getIfAvailable(RestTemplateBuilder::new)
                    .setConnectTimeout(vaultProperties.getConnectionTimeout())
                    .setReadTimeout(vaultProperties.getReadTimeout())
                    .build();
            connector = new HttpVaultConnector(vaultProperties, restTemplate,
                    new VaultRetryPolicy(vaultProperties.getRetry()), tokenStore,
                    Optional.ofNullable(meterRegistry.getIfAvailable()));
        } else {
            log.info("Configuring in-memory VaultConnector (development/testing)");
            connector = new InMemoryVaultConnector(tokenStore);
        }

        if (backendProperties.isConnectOnStartup()) {
            connector.connect();
        }
        return connector;
    }
}
