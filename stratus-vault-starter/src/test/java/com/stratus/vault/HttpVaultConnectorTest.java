package com.stratus.vault;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

/**
 * Unit tests for HttpVaultConnector against a mocked Vault HTTP API.
 */
@DisplayName("HttpVaultConnector Tests")
class HttpVaultConnectorTest {

    private static final String VAULT = "http://vault.test:8200";
    private static final String TOKEN = "root-token";

    private MockRestServiceServer server;
    private HttpVaultConnector connector;
    private VaultTokenSessionStore tokenStore;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        VaultProperties properties = new VaultProperties();
        properties.setUri(VAULT);
        properties.setToken(TOKEN);

        tokenStore = new VaultTokenSessionStore(Duration.ofHours(1), 100);
        meterRegistry = new SimpleMeterRegistry();
        connector = new HttpVaultConnector(properties, restTemplate,
                new VaultRetryPolicy(3, Duration.ofMillis(1)), tokenStore, Optional.of(meterRegistry));
    }

    private void connect() {
        server.expect(requestTo(VAULT + "/v1/sys/health"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("X-Vault-Token", TOKEN))
                .andRespond(withSuccess("{\"initialized\":true,\"sealed\":false}", MediaType.APPLICATION_JSON));
        connector.connect();
    }

    @Nested
    @DisplayName("Connection lifecycle")
    class ConnectionTests {

        @Test
        @DisplayName("should connect after a healthy probe")
        void shouldConnectAfterHealthyProbe() {
            // When
            connect();

            // Then
            assertThat(connector.isConnected()).isTrue();
            server.verify();
        }

        @Test
        @DisplayName("should fail to connect when the health probe keeps failing")
        void shouldFailWhenHealthProbeFails() {
            // Given
            server.expect(ExpectedCount.times(3), requestTo(VAULT + "/v1/sys/health"))
                    .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

            // When / Then
            assertThatThrownBy(() -> connector.connect())
                    .isInstanceOf(VaultConnectionException.class)
                    .hasMessageContaining("health check failed");
            assertThat(connector.isConnected()).isFalse();
            server.verify();
        }

        @Test
        @DisplayName("should reject token authentication without a token")
        void shouldRejectMissingToken() {
            // Given
            VaultProperties properties = new VaultProperties();
            properties.setUri(VAULT);
            HttpVaultConnector unauthenticated = new HttpVaultConnector(properties, new RestTemplate(),
                    new VaultRetryPolicy(1, Duration.ZERO), tokenStore, Optional.empty());

            // When / Then
            assertThatThrownBy(unauthenticated::connect)
                    .isInstanceOf(VaultConnectionException.class)
                    .satisfies(e -> assertThat(((VaultException) e).getCode()).isEqualTo("CONNECTION_ERROR"));
        }

        @Test
        @DisplayName("should refuse operations before connect")
        void shouldRefuseOperationsBeforeConnect() {
            assertThatThrownBy(() -> connector.readSecret("app/db"))
                    .isInstanceOf(VaultNotConnectedException.class)
                    .hasMessage("Not connected to Vault. Call connect() first.");
            server.verify();
        }

        @Test
        @DisplayName("should revoke its own token on disconnect")
        void shouldRevokeOwnTokenOnDisconnect() {
            // Given
            connect();
            server.expect(requestTo(VAULT + "/v1/auth/token/revoke-self"))
                    .andExpect(method(HttpMethod.POST))
                    .andRespond(withNoContent());

            // When
            connector.disconnect();

            // Then
            assertThat(connector.isConnected()).isFalse();
            server.verify();
        }
    }

    @Nested
    @DisplayName("Secret data")
    class SecretDataTests {

        @BeforeEach
        void connectFirst() {
            connect();
        }

        @Test
        @DisplayName("should read the latest version of a secret")
        void shouldReadLatestSecret() {
            // Given
            server.expect(requestTo(VAULT + "/v1/secret/data/app/db"))
                    .andExpect(method(HttpMethod.GET))
                    .andRespond(withSuccess("""
                            {"data":{"data":{"value":"s3cret"},
                                     "metadata":{"version":2,"created_time":"2024-01-01T00:00:00Z","custom_metadata":null}}}
                            """, MediaType.APPLICATION_JSON));

            // When
            Optional<VaultSecret> secret = connector.readSecret("app/db");

            // Then
            assertThat(secret).isPresent();
            assertThat(secret.get().value()).isEqualTo("s3cret");
            assertThat(secret.get().version()).isEqualTo(2);
            server.verify();
        }

        @Test
        @DisplayName("should read a specific version")
        void shouldReadSpecificVersion() {
            // Given
            server.expect(requestTo(VAULT + "/v1/secret/data/app/db?version=1"))
                    .andRespond(withSuccess("{\"data\":{\"data\":{\"value\":\"old\"},\"metadata\":{\"version\":1}}}",
                            MediaType.APPLICATION_JSON));

            // When
            Optional<VaultSecret> secret = connector.readSecret("app/db", 1);

            // Then
            assertThat(secret).map(VaultSecret::value).contains("old");
        }

        @Test
        @DisplayName("should map a missing secret to empty without retrying")
        void shouldMapNotFoundToEmpty() {
            // Given
            server.expect(ExpectedCount.once(), requestTo(VAULT + "/v1/secret/data/missing"))
                    .andRespond(withStatus(HttpStatus.NOT_FOUND));

            // When
            Optional<VaultSecret> secret = connector.readSecret("missing");

            // Then
            assertThat(secret).isEmpty();
            server.verify();
        }

        @Test
        @DisplayName("should return the backend version assigned to a write")
        void shouldReturnWrittenVersion() {
            // Given
            server.expect(requestTo(VAULT + "/v1/secret/data/app/db"))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(content().json("{\"data\":{\"value\":\"pw\"}}"))
                    .andRespond(withSuccess("{\"data\":{\"version\":4}}", MediaType.APPLICATION_JSON));

            // When
            int version = connector.writeSecret("app/db", Map.of("value", "pw"), null);

            // Then
            assertThat(version).isEqualTo(4);
            assertThat(meterRegistry.counter("stratus.vault.secret.write").count()).isEqualTo(1.0);
            server.verify();
        }

        @Test
        @DisplayName("should attach custom metadata after writing")
        void shouldAttachCustomMetadata() {
            // Given
            server.expect(requestTo(VAULT + "/v1/secret/data/app/db"))
                    .andRespond(withSuccess("{\"data\":{\"version\":1}}", MediaType.APPLICATION_JSON));
            server.expect(requestTo(VAULT + "/v1/secret/metadata/app/db"))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(content().json("{\"custom_metadata\":{\"owner\":\"team-a\",\"rotation\":\"true\"}}"))
                    .andRespond(withNoContent());

            // When
            connector.writeSecret("app/db", Map.of("value", "pw"), Map.of("owner", "team-a", "rotation", true));

            // Then
            server.verify();
        }

        @Test
        @DisplayName("should return the committed version when the metadata write fails")
        void shouldKeepVersionWhenMetadataFails() {
            // Given
            server.expect(requestTo(VAULT + "/v1/secret/data/app/db"))
                    .andRespond(withSuccess("{\"data\":{\"version\":7}}", MediaType.APPLICATION_JSON));
            server.expect(ExpectedCount.once(), requestTo(VAULT + "/v1/secret/metadata/app/db"))
                    .andExpect(method(HttpMethod.POST))
                    .andRespond(withBadRequest());

            // When
            int version = connector.writeSecret("app/db", Map.of("value", "pw"), Map.of("owner", "team-a"));

            // Then
            assertThat(version).isEqualTo(7);
            assertThat(meterRegistry.counter("stratus.vault.secret.write").count()).isEqualTo(1.0);
            server.verify();
        }

        @Test
        @DisplayName("should list child keys")
        void shouldListKeys() {
            // Given
            server.expect(requestTo(VAULT + "/v1/secret/metadata/environments/prod/secrets?list=true"))
                    .andRespond(withSuccess("{\"data\":{\"keys\":[\"db\",\"api/\"]}}", MediaType.APPLICATION_JSON));

            // When
            List<String> keys = connector.listSecrets("environments/prod/secrets");

            // Then
            assertThat(keys).containsExactly("db", "api/");
        }

        @Test
        @DisplayName("should parse version history sorted by version")
        void shouldParseVersionHistory() {
            // Given
            server.expect(requestTo(VAULT + "/v1/secret/metadata/app/db"))
                    .andRespond(withSuccess("""
                            {"data":{"versions":{
                              "2":{"created_time":"2024-01-02T00:00:00Z","deletion_time":"","destroyed":true},
                              "1":{"created_time":"2024-01-01T00:00:00Z","deletion_time":"","destroyed":false}}}}
                            """, MediaType.APPLICATION_JSON));

            // When
            List<VaultSecretVersion> versions = connector.getSecretVersions("app/db");

            // Then
            assertThat(versions).extracting(VaultSecretVersion::version).containsExactly(1, 2);
            assertThat(versions.get(1).destroyed()).isTrue();
            assertThat(versions.get(0).deletedAt()).isNull();
        }

        @Test
        @DisplayName("should destroy a single version")
        void shouldDestroyVersion() {
            // Given
            server.expect(requestTo(VAULT + "/v1/secret/destroy/app/db"))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(content().json("{\"versions\":[2]}"))
                    .andRespond(withNoContent());

            // When
            connector.destroySecretVersion("app/db", 2);

            // Then
            server.verify();
        }
    }

    @Nested
    @DisplayName("Retry behaviour")
    class RetryTests {

        @BeforeEach
        void connectFirst() {
            connect();
        }

        @Test
        @DisplayName("should succeed when a server error clears before the last attempt")
        void shouldRecoverFromTransientServerErrors() {
            // Given
            server.expect(ExpectedCount.times(2), requestTo(VAULT + "/v1/secret/data/app/db"))
                    .andRespond(withServerError());
            server.expect(requestTo(VAULT + "/v1/secret/data/app/db"))
                    .andRespond(withSuccess("{\"data\":{\"version\":3}}", MediaType.APPLICATION_JSON));

            // When
            int version = connector.writeSecret("app/db", Map.of("value", "pw"), null);

            // Then
            assertThat(version).isEqualTo(3);
            server.verify();
        }

        @Test
        @DisplayName("should give up after the configured number of attempts")
        void shouldGiveUpAfterMaxAttempts() {
            // Given
            server.expect(ExpectedCount.times(3), requestTo(VAULT + "/v1/secret/data/app/db"))
                    .andRespond(withServerError());

            // When / Then
            assertThatThrownBy(() -> connector.writeSecret("app/db", Map.of("value", "pw"), null))
                    .isInstanceOf(VaultConnectionException.class)
                    .hasMessageContaining("after 3 attempts");
            assertThat(meterRegistry.counter("stratus.vault.request.failure").count()).isEqualTo(1.0);
            server.verify();
        }

        @Test
        @DisplayName("should not retry client errors")
        void shouldNotRetryClientErrors() {
            // Given
            server.expect(ExpectedCount.once(), requestTo(VAULT + "/v1/secret/data/app/db"))
                    .andRespond(withStatus(HttpStatus.FORBIDDEN));

            // When / Then
            assertThatThrownBy(() -> connector.writeSecret("app/db", Map.of("value", "pw"), null))
                    .isInstanceOf(VaultRequestException.class)
                    .satisfies(e -> assertThat(((VaultRequestException) e).getStatusCode()).isEqualTo(403));
            server.verify();
        }
    }

    @Nested
    @DisplayName("Policies and tokens")
    class PolicyAndTokenTests {

        @BeforeEach
        void connectFirst() {
            connect();
        }

        @Test
        @DisplayName("should write an ACL policy")
        void shouldWritePolicy() {
            // Given
            server.expect(requestTo(VAULT + "/v1/sys/policies/acl/secret-s1-user-alice"))
                    .andExpect(method(HttpMethod.PUT))
                    .andExpect(jsonPath("$.policy").value("path \"secret/data/x\" { capabilities = [\"read\"] }"))
                    .andRespond(withNoContent());

            // When
            connector.createPolicy("secret-s1-user-alice", "path \"secret/data/x\" { capabilities = [\"read\"] }");

            // Then
            server.verify();
        }

        @Test
        @DisplayName("should track issued tokens until revoked")
        void shouldTrackIssuedTokens() {
            // Given
            server.expect(requestTo(VAULT + "/v1/auth/token/create"))
                    .andExpect(jsonPath("$.ttl").value("600s"))
                    .andRespond(withSuccess(
                            "{\"auth\":{\"client_token\":\"hvs.child\",\"accessor\":\"acc-1\",\"lease_duration\":600}}",
                            MediaType.APPLICATION_JSON));
            server.expect(requestTo(VAULT + "/v1/auth/token/revoke"))
                    .andExpect(jsonPath("$.token").value("hvs.child"))
                    .andRespond(withNoContent());

            // When
            IssuedToken token = connector.createToken(List.of("reader"), Duration.ofMinutes(10));

            // Then
            assertThat(token.token()).isEqualTo("hvs.child");
            assertThat(token.ttl()).isEqualTo(Duration.ofSeconds(600));
            assertThat(tokenStore.find("hvs.child")).isPresent();

            // When
            connector.revokeToken("hvs.child");

            // Then
            assertThat(tokenStore.find("hvs.child")).isEmpty();
            server.verify();
        }
    }
}
