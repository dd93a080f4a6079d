package com.stratus.vault;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Shared configuration for selecting the secret backend behind {@link VaultConnector}.
 */
@ConfigurationProperties(prefix = "stratus.secrets")
public class SecretsBackendProperties {

    /**
     * Enable connector auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Backend to use (inmemory | vault).
     */
    private String provider = "inmemory";

    /**
     * Call {@link VaultConnector#connect()} when the application context starts.
     */
    private boolean connectOnStartup = true;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public boolean isConnectOnStartup() {
        return connectOnStartup;
    }

    public void setConnectOnStartup(boolean connectOnStartup) {
        this.connectOnStartup = connectOnStartup;
    }
}
