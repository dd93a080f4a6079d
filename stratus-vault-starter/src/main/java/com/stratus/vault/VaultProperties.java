package com.stratus.vault;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the HashiCorp Vault connector.
 * <p>
 * Supports multiple authentication methods:
 * <ul>
 *   <li>Token - Direct token authentication (dev/testing)</li>
 *   <li>AppRole - Machine-to-machine authentication (production)</li>
 *   <li>Kubernetes - Service account authentication (K8s environments)</li>
 * </ul>
 * <p>
 * Configuration example:
 * <pre>
 * stratus:
 *   secrets:
 *     provider: vault
 *   vault:
 *     uri: https://vault.example.com:8200
 *     authentication: approle
 *     role-id: ${VAULT_ROLE_ID}
 *     secret-id: ${VAULT_SECRET_ID}
 *     mount-path: secret
 *     retry:
 *       max-attempts: 3
 *       base-delay: 1s
 * </pre>
 */
@ConfigurationProperties(prefix = "stratus.vault")
public class VaultProperties {

    /**
     * Vault server URI.
     */
    private String uri = "http://localhost:8200";

    /**
     * Authentication method: token, approle, or kubernetes.
     */
    private AuthMethod authentication = AuthMethod.TOKEN;

    /**
     * Vault token for token authentication.
     */
    private String token;

    /**
     * AppRole role ID for approle authentication.
     */
    private String roleId;

    /**
     * AppRole secret ID for approle authentication.
     */
    private String secretId;

    /**
     * Kubernetes auth mount path.
     */
    private String kubernetesPath = "kubernetes";

    /**
     * Kubernetes service account token path.
     */
    private String kubernetesTokenPath = "/var/run/secrets/kubernetes.io/serviceaccount/token";

    /**
     * Kubernetes role for authentication.
     */
    private String kubernetesRole;

    /**
     * Mount path of the KV v2 secrets engine.
     */
    private String mountPath = "secret";

    /**
     * Connection timeout.
     */
    private Duration connectionTimeout = Duration.ofSeconds(5);

    /**
     * Read timeout applied to every request, independent of the retry budget.
     */
    private Duration readTimeout = Duration.ofSeconds(30);

    /**
     * Namespace for Vault Enterprise.
     */
    private String namespace;

    /**
     * Enable renewal of the connector's own token (AppRole/Kubernetes only).
     */
    private boolean tokenRenewal = true;

    /**
     * Token renewal check interval.
     */
    private Duration tokenRenewalInterval = Duration.ofMinutes(5);

    /**
     * Retry configuration.
     */
    private RetryConfig retry = new RetryConfig();

    /**
     * Issued token session store configuration.
     */
    private TokenStoreConfig tokenStore = new TokenStoreConfig();

    public enum AuthMethod {
        TOKEN,
        APPROLE,
        KUBERNETES
    }

    /**
     * Bounded retry with linear backoff: the wait before attempt {@code n + 1}
     * is {@code baseDelay * n}.
     */
    public static class RetryConfig {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(1);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }
    }

    public static class TokenStoreConfig {
        private Duration defaultTtl = Duration.ofHours(1);
        private int maxSize = 10_000;

        public Duration getDefaultTtl() {
            return defaultTtl;
        }

        public void setDefaultTtl(Duration defaultTtl) {
            this.defaultTtl = defaultTtl;
        }

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }
    }

    // Getters and Setters

    public String getUri() {
        return uri;
    }

    public void setUri(String uri) {
        this.uri = uri;
    }

    public AuthMethod getAuthentication() {
        return authentication;
    }

    public void setAuthentication(AuthMethod authentication) {
        this.authentication = authentication;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public String getRoleId() {
        return roleId;
    }

    public void setRoleId(String roleId) {
        this.roleId = roleId;
    }

    public String getSecretId() {
        return secretId;
    }

    public void setSecretId(String secretId) {
        this.secretId = secretId;
    }

    public String getKubernetesPath() {
        return kubernetesPath;
    }

    public void setKubernetesPath(String kubernetesPath) {
        this.kubernetesPath = kubernetesPath;
    }

    public String getKubernetesTokenPath() {
        return kubernetesTokenPath;
    }

    public void setKubernetesTokenPath(String kubernetesTokenPath) {
        this.kubernetesTokenPath = kubernetesTokenPath;
    }

    public String getKubernetesRole() {
        return kubernetesRole;
    }

    public void setKubernetesRole(String kubernetesRole) {
        this.kubernetesRole = kubernetesRole;
    }

    public String getMountPath() {
        return mountPath;
    }

    public void setMountPath(String mountPath) {
        this.mountPath = mountPath;
    }

    public Duration getConnectionTimeout() {
        return connectionTimeout;
    }

    public void setConnectionTimeout(Duration connectionTimeout) {
        this.connectionTimeout = connectionTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public boolean isTokenRenewal() {
        return tokenRenewal;
    }

    public void setTokenRenewal(boolean tokenRenewal) {
        this.tokenRenewal = tokenRenewal;
    }

    public Duration getTokenRenewalInterval() {
        return tokenRenewalInterval;
    }

    public void setTokenRenewalInterval(Duration tokenRenewalInterval) {
        this.tokenRenewalInterval = tokenRenewalInterval;
    }

    public RetryConfig getRetry() {
        return retry;
    }

    public void setRetry(RetryConfig retry) {
        this.retry = retry;
    }

    public TokenStoreConfig getTokenStore() {
        return tokenStore;
    }

    public void setTokenStore(TokenStoreConfig tokenStore) {
        this.tokenStore = tokenStore;
    }

    /**
     * Build the KV v2 data path for a secret.
     */
    public String buildDataPath(String path) {
        return buildMountPath("data", path);
    }

    /**
     * Build the KV v2 metadata path for a secret.
     */
    public String buildMetadataPath(String path) {
        return buildMountPath("metadata", path);
    }

    /**
     * Build the KV v2 destroy path for a secret.
     */
    public String buildDestroyPath(String path) {
        return buildMountPath("destroy", path);
    }

    private String buildMountPath(String segment, String path) {
        StringBuilder fullPath = new StringBuilder(trimSlashes(mountPath))
                .append('/')
                .append(segment);
        String relative = trimSlashes(path);
        if (!relative.isEmpty()) {
            fullPath.append('/').append(relative);
        }
        return fullPath.toString();
    }

    private static String trimSlashes(String value) {
        if (value == null) {
            return "";
        }
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '/') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(start, end);
    }
}
