package com.stratus.vault;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.*;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * HashiCorp Vault (KV v2) implementation of {@link VaultConnector}.
 * <p>
 * Provides:
 * <ul>
 *   <li>Multiple authentication methods (Token, AppRole, Kubernetes)</li>
 *   <li>Post-authentication health probe</li>
 *   <li>Bounded retry with linear backoff on transient failures</li>
 *   <li>Automatic renewal of the connector's own token</li>
 *   <li>Issued-token tracking through {@link VaultTokenSessionStore}</li>
 * </ul>
 * <p>
 * The session token is written only by {@link #connect()} and {@link #disconnect()}, which
 * hold the write side of a read/write lock. Every request holds the read side, so the
 * token cannot change under an in-flight call.
 */
public class HttpVaultConnector implements VaultConnector {

    private static final Logger log = LoggerFactory.getLogger(HttpVaultConnector.class);
    private static final String PROVIDER_TYPE = "vault";
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final VaultProperties properties;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final VaultRetryPolicy retryPolicy;
    private final VaultTokenSessionStore tokenStore;
    private final MeterRegistry meterRegistry;

    // Session state
    private final ReentrantReadWriteLock sessionLock = new ReentrantReadWriteLock();
    private volatile String currentToken;
    private volatile boolean connected;
    private final AtomicReference<Instant> tokenExpiry = new AtomicReference<>();
    private ScheduledExecutorService renewalScheduler;

    // Metrics
    private Counter secretReadCounter;
    private Counter secretWriteCounter;
    private Counter requestFailureCounter;
    private Counter authFailureCounter;
    private Timer requestTimer;

    public HttpVaultConnector(VaultProperties properties,
                              RestTemplate restTemplate,
                              VaultRetryPolicy retryPolicy,
                              VaultTokenSessionStore tokenStore,
                              Optional<MeterRegistry> meterRegistry) {
        this.properties = properties;
        this.restTemplate = restTemplate;
        this.retryPolicy = retryPolicy;
        this.tokenStore = tokenStore;
        this.objectMapper = new ObjectMapper();
        this.meterRegistry = meterRegistry.orElse(null);
        initializeMetrics();
    }

    // =========================================================================
    // Connection lifecycle
    // =========================================================================

    @Override
    public void connect() {
        sessionLock.writeLock().lock();
        try {
            log.info("Connecting to Vault at {} using {}", properties.getUri(), properties.getAuthentication());
            currentToken = authenticate();
            probeHealth();
            connected = true;
            startTokenRenewalScheduler();
            log.info("Connected to Vault");
        } catch (VaultConnectionException e) {
            resetSession();
            throw e;
        } catch (RuntimeException e) {
            resetSession();
            throw new VaultConnectionException("Failed to connect to Vault: " + e.getMessage(), e);
        } finally {
            sessionLock.writeLock().unlock();
        }
    }

    @Override
    public void disconnect() {
        sessionLock.writeLock().lock();
        try {
            if (connected && currentToken != null) {
                try {
                    restTemplate.exchange(url("/v1/auth/token/revoke-self"), HttpMethod.POST,
                            new HttpEntity<>(createHeaders()), JsonNode.class);
                } catch (RestClientException e) {
                    log.warn("Failed to revoke Vault token on disconnect: {}", e.getMessage());
                }
            }
            resetSession();
            log.info("Disconnected from Vault");
        } finally {
            sessionLock.writeLock().unlock();
        }
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    private void resetSession() {
        stopTokenRenewalScheduler();
        currentToken = null;
        tokenExpiry.set(null);
        connected = false;
        tokenStore.clear();
    }

    // =========================================================================
    // Secret data
    // =========================================================================

    @Override
    public int writeSecret(String path, Map<String, Object> data, Map<String, Object> metadata) {
        JsonNode response = call("write secret at " + path, () ->
                exchange(url("/v1/" + properties.buildDataPath(path)), HttpMethod.POST,
                        Map.of("data", data)));
        incrementCounter(secretWriteCounter);

        int version = response != null ? response.path("data").path("version").asInt(0) : 0;
        // The data write has already committed; metadata is best-effort from here
        if (metadata != null && !metadata.isEmpty()) {
            try {
                updateSecretMetadata(path, Map.of("custom_metadata", stringify(metadata)));
            } catch (VaultException e) {
                log.warn("Wrote secret at path: {} (version {}) but failed to attach metadata: {}",
                        path, version, e.getMessage());
            }
        }
        log.debug("Wrote secret at path: {} (version {})", path, version);
        return version;
    }

    @Override
    public Optional<VaultSecret> readSecret(String path, Integer version) {
        String url = url("/v1/" + properties.buildDataPath(path))
                + (version != null ? "?version=" + version : "");

        Optional<JsonNode> response = call("read secret at " + path, () -> getOrEmpty(url));
        incrementCounter(secretReadCounter);

        return response
                .map(body -> body.path("data"))
                .filter(node -> !node.isMissingNode() && node.hasNonNull("data"))
                .map(node -> new VaultSecret(toMap(node.get("data")), toMap(node.path("metadata"))));
    }

    @Override
    public void deleteSecret(String path) {
        call("delete secret at " + path, () ->
                exchange(url("/v1/" + properties.buildDataPath(path)), HttpMethod.DELETE, null));
        log.debug("Deleted secret at path: {}", path);
    }

    @Override
    public List<String> listSecrets(String path) {
        String url = url("/v1/" + properties.buildMetadataPath(path)) + "?list=true";
        Optional<JsonNode> response = call("list secrets at " + path, () -> getOrEmpty(url));

        List<String> keys = new ArrayList<>();
        response.ifPresent(body -> body.path("data").path("keys").forEach(key -> keys.add(key.asText())));
        return keys;
    }

    // =========================================================================
    // Versions and metadata
    // =========================================================================

    @Override
    public List<VaultSecretVersion> getSecretVersions(String path) {
        String url = url("/v1/" + properties.buildMetadataPath(path));
        Optional<JsonNode> response = call("get versions for " + path, () -> getOrEmpty(url));

        List<VaultSecretVersion> versions = new ArrayList<>();
        response.ifPresent(body -> body.path("data").path("versions").fields().forEachRemaining(entry -> {
            JsonNode info = entry.getValue();
            versions.add(new VaultSecretVersion(
                    Integer.parseInt(entry.getKey()),
                    parseInstant(info.path("created_time").asText(null)),
                    parseInstant(info.path("deletion_time").asText(null)),
                    info.path("destroyed").asBoolean(false)));
        }));
        versions.sort(Comparator.comparingInt(VaultSecretVersion::version));
        return versions;
    }

    @Override
    public void destroySecretVersion(String path, int version) {
        call("destroy version " + version + " at " + path, () ->
                exchange(url("/v1/" + properties.buildDestroyPath(path)), HttpMethod.POST,
                        Map.of("versions", List.of(version))));
        log.info("Destroyed version {} of secret at path: {}", version, path);
    }

    @Override
    public Optional<Map<String, Object>> getSecretMetadata(String path) {
        String url = url("/v1/" + properties.buildMetadataPath(path));
        Optional<JsonNode> response = call("get metadata for " + path, () -> getOrEmpty(url));
        return response.map(body -> body.path("data"))
                .filter(node -> !node.isMissingNode() && !node.isNull())
                .map(this::toMap);
    }

    @Override
    public void updateSecretMetadata(String path, Map<String, Object> metadata) {
        call("update metadata for " + path, () ->
                exchange(url("/v1/" + properties.buildMetadataPath(path)), HttpMethod.POST, metadata));
    }

    // =========================================================================
    // Policies
    // =========================================================================

    @Override
    public void createPolicy(String name, String policy) {
        call("write policy " + name, () ->
                exchange(url("/v1/sys/policies/acl/" + name), HttpMethod.PUT, Map.of("policy", policy)));
        log.info("Wrote Vault policy: {}", name);
    }

    @Override
    public void deletePolicy(String name) {
        call("delete policy " + name, () ->
                exchange(url("/v1/sys/policies/acl/" + name), HttpMethod.DELETE, null));
        log.info("Deleted Vault policy: {}", name);
    }

    @Override
    public Optional<String> getPolicy(String name) {
        String url = url("/v1/sys/policies/acl/" + name);
        Optional<JsonNode> response = call("read policy " + name, () -> getOrEmpty(url));
        return response.map(body -> body.path("data").path("policy"))
                .filter(JsonNode::isTextual)
                .map(JsonNode::asText);
    }

    // =========================================================================
    // Tokens
    // =========================================================================

    @Override
    public IssuedToken createToken(List<String> policies, Duration ttl) {
        Map<String, Object> body = new HashMap<>();
        body.put("policies", policies);
        if (ttl != null) {
            body.put("ttl", ttl.toSeconds() + "s");
        }

        JsonNode response = call("create token", () ->
                exchange(url("/v1/auth/token/create"), HttpMethod.POST, body));
        JsonNode auth = response != null ? response.path("auth") : null;
        if (auth == null || auth.isMissingNode() || !auth.hasNonNull("client_token")) {
            throw new VaultConnectionException("Vault returned no token for create-token request");
        }

        long leaseSeconds = auth.path("lease_duration").asLong(0);
        IssuedToken issued = new IssuedToken(
                auth.get("client_token").asText(),
                auth.path("accessor").asText(null),
                policies,
                leaseSeconds > 0 ? Duration.ofSeconds(leaseSeconds) : ttl,
                Instant.now());
        tokenStore.register(issued);
        log.info("Issued Vault token accessor={} policies={}", issued.accessor(), policies);
        return issued;
    }

    @Override
    public void revokeToken(String token) {
        call("revoke token", () ->
                exchange(url("/v1/auth/token/revoke"), HttpMethod.POST, Map.of("token", token)));
        tokenStore.revoke(token);
    }

    @Override
    public void renewToken(String token, Duration increment) {
        Map<String, Object> body = new HashMap<>();
        body.put("token", token);
        if (increment != null) {
            body.put("increment", increment.toSeconds() + "s");
        }

        JsonNode response = call("renew token", () ->
                exchange(url("/v1/auth/token/renew"), HttpMethod.POST, body));
        long leaseSeconds = response != null ? response.path("auth").path("lease_duration").asLong(0) : 0;
        tokenStore.renew(token, leaseSeconds > 0 ? Duration.ofSeconds(leaseSeconds) : increment);
    }

    @Override
    public String getProviderType() {
        return PROVIDER_TYPE;
    }

    public VaultTokenSessionStore getTokenStore() {
        return tokenStore;
    }

    // =========================================================================
    // Authentication
    // =========================================================================

    private String authenticate() {
        return switch (properties.getAuthentication()) {
            case TOKEN -> authenticateWithToken();
            case APPROLE -> authenticateWithAppRole();
            case KUBERNETES -> authenticateWithKubernetes();
        };
    }

    private String authenticateWithToken() {
        String token = properties.getToken();
        if (token == null || token.isBlank()) {
            throw new VaultConnectionException("No authentication method configured: Vault token is empty");
        }
        return token;
    }

    private String authenticateWithAppRole() {
        String roleId = properties.getRoleId();
        String secretId = properties.getSecretId();

        if (roleId == null || secretId == null) {
            throw new VaultConnectionException("Vault AppRole credentials not configured");
        }

        return login("/v1/auth/approle/login", Map.of(
                "role_id", roleId,
                "secret_id", secretId
        ), "AppRole");
    }

    private String authenticateWithKubernetes() {
        String role = properties.getKubernetesRole();
        if (role == null) {
            throw new VaultConnectionException("Kubernetes role not configured");
        }

        // Read JWT from service account
        String jwt;
        try {
            jwt = Files.readString(Path.of(properties.getKubernetesTokenPath()));
        } catch (IOException e) {
            throw new VaultConnectionException("Failed to read Kubernetes service account token", e);
        }

        return login("/v1/auth/" + properties.getKubernetesPath() + "/login", Map.of(
                "role", role,
                "jwt", jwt
        ), "Kubernetes");
    }

    private String login(String loginPath, Map<String, String> body, String method) {
        try {
            JsonNode response = retryPolicy.execute(() -> {
                HttpHeaders headers = new HttpHeaders();
                headers.setContentType(MediaType.APPLICATION_JSON);
                applyNamespace(headers);
                return restTemplate.exchange(url(loginPath), HttpMethod.POST,
                        new HttpEntity<>(body, headers), JsonNode.class).getBody();
            });

            JsonNode auth = response != null ? response.path("auth") : null;
            if (auth == null || !auth.hasNonNull("client_token")) {
                throw new VaultConnectionException(method + " authentication failed: no client token returned");
            }
            int leaseDuration = auth.path("lease_duration").asInt(0);
            if (leaseDuration > 0) {
                tokenExpiry.set(Instant.now().plusSeconds(leaseDuration));
            }
            return auth.get("client_token").asText();
        } catch (RestClientException e) {
            incrementCounter(authFailureCounter);
            throw new VaultConnectionException(method + " authentication failed: " + e.getMessage(), e);
        }
    }

    private void probeHealth() {
        try {
            retryPolicy.execute(() -> restTemplate.exchange(url("/v1/sys/health"), HttpMethod.GET,
                    new HttpEntity<>(createHeaders()), JsonNode.class));
        } catch (RestClientException e) {
            throw new VaultConnectionException("Vault health check failed: " + e.getMessage(), e);
        }
    }

    // =========================================================================
    // Request plumbing
    // =========================================================================

    /**
     * Run a request under the read lock and the retry policy, translating
     * Spring's client exceptions into the connector's error taxonomy.
     */
    private <T> T call(String operation, Supplier<T> request) {
        sessionLock.readLock().lock();
        Timer.Sample sample = meterRegistry != null ? Timer.start(meterRegistry) : null;
        try {
            if (!connected) {
                throw new VaultNotConnectedException();
            }
            return retryPolicy.execute(request);
        } catch (HttpClientErrorException e) {
            incrementCounter(requestFailureCounter);
            throw new VaultRequestException("Failed to " + operation + ": " + e.getStatusCode(),
                    e.getStatusCode().value(), e);
        } catch (ResourceAccessException | HttpServerErrorException e) {
            incrementCounter(requestFailureCounter);
            log.error("Failed to {} after {} attempts: {}", operation, retryPolicy.getMaxAttempts(), e.getMessage());
            throw new VaultConnectionException("Failed to " + operation + " after "
                    + retryPolicy.getMaxAttempts() + " attempts: " + e.getMessage(), e);
        } catch (RestClientException e) {
            incrementCounter(requestFailureCounter);
            throw new VaultConnectionException("Failed to " + operation + ": " + e.getMessage(), e);
        } finally {
            if (sample != null && requestTimer != null) {
                sample.stop(requestTimer);
            }
            sessionLock.readLock().unlock();
        }
    }

    private JsonNode exchange(String url, HttpMethod method, Object body) {
        HttpEntity<Object> entity = new HttpEntity<>(body, createHeaders());
        ResponseEntity<JsonNode> response = restTemplate.exchange(url, method, entity, JsonNode.class);
        return response.getBody();
    }

    /**
     * GET that maps a 404 to an empty result. 404s are never retried.
     */
    private Optional<JsonNode> getOrEmpty(String url) {
        try {
            return Optional.ofNullable(exchange(url, HttpMethod.GET, null));
        } catch (HttpClientErrorException.NotFound e) {
            return Optional.empty();
        }
    }

    private HttpHeaders createHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (currentToken != null) {
            headers.set("X-Vault-Token", currentToken);
        }
        applyNamespace(headers);
        return headers;
    }

    private void applyNamespace(HttpHeaders headers) {
        if (properties.getNamespace() != null) {
            headers.set("X-Vault-Namespace", properties.getNamespace());
        }
    }

    private String url(String path) {
        String base = properties.getUri();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) + path : base + path;
    }

    private Map<String, Object> toMap(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return Map.of();
        }
        return objectMapper.convertValue(node, MAP_TYPE);
    }

    private static Map<String, String> stringify(Map<String, Object> metadata) {
        Map<String, String> result = new LinkedHashMap<>();
        metadata.forEach((key, value) -> {
            if (value != null) {
                result.put(key, String.valueOf(value));
            }
        });
        return result;
    }

    private static Instant parseInstant(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        return Instant.parse(text);
    }

    // =========================================================================
    // Token renewal
    // =========================================================================

    private void startTokenRenewalScheduler() {
        if (properties.isTokenRenewal() &&
            properties.getAuthentication() != VaultProperties.AuthMethod.TOKEN) {

            renewalScheduler = Executors.newSingleThreadScheduledExecutor(
                    r -> new Thread(r, "vault-token-renewal"));
            renewalScheduler.scheduleAtFixedRate(this::renewTokenIfNeeded,
                    properties.getTokenRenewalInterval().toMillis(),
                    properties.getTokenRenewalInterval().toMillis(),
                    TimeUnit.MILLISECONDS);
        }
    }

    private void stopTokenRenewalScheduler() {
        if (renewalScheduler != null) {
            renewalScheduler.shutdownNow();
            renewalScheduler = null;
        }
    }

    private void renewTokenIfNeeded() {
        Instant expiry = tokenExpiry.get();
        if (expiry == null) return;

        // Renew if within 2 renewal intervals of expiry
        Duration timeToExpiry = Duration.between(Instant.now(), expiry);
        if (timeToExpiry.compareTo(properties.getTokenRenewalInterval().multipliedBy(2)) < 0) {
            try {
                renewSelf();
            } catch (RuntimeException e) {
                log.error("Failed to renew Vault token, reconnecting", e);
                try {
                    connect();
                } catch (VaultConnectionException reconnectError) {
                    log.error("Failed to re-authenticate with Vault", reconnectError);
                }
            }
        }
    }

    private void renewSelf() {
        JsonNode response = call("renew own token", () ->
                exchange(url("/v1/auth/token/renew-self"), HttpMethod.POST, null));
        if (response != null) {
            int leaseDuration = response.path("auth").path("lease_duration").asInt(0);
            if (leaseDuration > 0) {
                tokenExpiry.set(Instant.now().plusSeconds(leaseDuration));
            }
            log.debug("Renewed Vault token, new lease duration: {}s", leaseDuration);
        }
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private void initializeMetrics() {
        if (meterRegistry != null) {
            secretReadCounter = Counter.builder("stratus.vault.secret.read")
                    .description("Number of secret reads issued to Vault")
                    .register(meterRegistry);
            secretWriteCounter = Counter.builder("stratus.vault.secret.write")
                    .description("Number of secrets written to Vault")
                    .register(meterRegistry);
            requestFailureCounter = Counter.builder("stratus.vault.request.failure")
                    .description("Number of Vault requests that failed after retries")
                    .register(meterRegistry);
            authFailureCounter = Counter.builder("stratus.vault.auth.failure")
                    .description("Number of authentication failures")
                    .register(meterRegistry);
            requestTimer = Timer.builder("stratus.vault.request.time")
                    .description("Time spent in Vault requests, including retries")
                    .register(meterRegistry);
        }
    }

    private void incrementCounter(Counter counter) {
        if (counter != null) {
            counter.increment();
        }
    }
}
