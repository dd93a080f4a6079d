package com.stratus.vault;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InMemoryVaultConnector Tests")
class InMemoryVaultConnectorTest {

    private InMemoryVaultConnector connector;

    @BeforeEach
    void setUp() {
        connector = new InMemoryVaultConnector();
        connector.connect();
    }

    @Nested
    @DisplayName("Versioned data")
    class VersionedDataTests {

        @Test
        @DisplayName("should assign increasing versions per path")
        void shouldAssignIncreasingVersions() {
            // When
            int first = connector.writeSecret("environments/prod/secrets/db", Map.of("value", "a"), null);
            int second = connector.writeSecret("environments/prod/secrets/db", Map.of("value", "b"), null);
            int other = connector.writeSecret("environments/prod/secrets/api", Map.of("value", "c"), null);

            // Then
            assertThat(first).isEqualTo(1);
            assertThat(second).isEqualTo(2);
            assertThat(other).isEqualTo(1);
            assertThat(connector.readSecret("environments/prod/secrets/db"))
                    .hasValueSatisfying(secret -> {
                        assertThat(secret.value()).isEqualTo("b");
                        assertThat(secret.version()).isEqualTo(2);
                    });
            assertThat(connector.readSecret("environments/prod/secrets/db", 1))
                    .map(VaultSecret::value).contains("a");
        }

        @Test
        @DisplayName("should hide a soft-deleted latest version")
        void shouldHideDeletedVersion() {
            // Given
            connector.writeSecret("app/db", Map.of("value", "a"), null);
            connector.writeSecret("app/db", Map.of("value", "b"), null);

            // When
            connector.deleteSecret("app/db");

            // Then
            assertThat(connector.readSecret("app/db")).isEmpty();
            assertThat(connector.readSecret("app/db", 1)).map(VaultSecret::value).contains("a");
            assertThat(connector.getSecretVersions("app/db").get(1).deletedAt()).isNotNull();
        }

        @Test
        @DisplayName("should destroy version data permanently")
        void shouldDestroyVersion() {
            // Given
            connector.writeSecret("app/db", Map.of("value", "a"), null);
            connector.writeSecret("app/db", Map.of("value", "b"), null);

            // When
            connector.destroySecretVersion("app/db", 1);

            // Then
            assertThat(connector.readSecret("app/db", 1)).isEmpty();
            assertThat(connector.getSecretVersions("app/db"))
                    .extracting(VaultSecretVersion::destroyed).containsExactly(true, false);
        }

        @Test
        @DisplayName("should return empty for unknown paths and versions")
        void shouldReturnEmptyForUnknown() {
            connector.writeSecret("app/db", Map.of("value", "a"), null);

            assertThat(connector.readSecret("nothing/here")).isEmpty();
            assertThat(connector.readSecret("app/db", 7)).isEmpty();
            assertThat(connector.getSecretVersions("nothing/here")).isEmpty();
        }

        @Test
        @DisplayName("should list immediate children with folder markers")
        void shouldListChildren() {
            // Given
            connector.writeSecret("environments/prod/secrets/db", Map.of("value", "a"), null);
            connector.writeSecret("environments/prod/secrets/api", Map.of("value", "b"), null);
            connector.writeSecret("environments/prod/other/x", Map.of("value", "c"), null);

            // Then
            assertThat(connector.listSecrets("environments/prod/secrets")).containsExactly("api", "db");
            assertThat(connector.listSecrets("environments/prod")).containsExactly("other/", "secrets/");
            assertThat(connector.listSecrets("environments/dev")).isEmpty();
        }

        @Test
        @DisplayName("should keep custom metadata alongside versions")
        void shouldKeepCustomMetadata() {
            // When
            connector.writeSecret("app/db", Map.of("value", "a"), Map.of("owner", "team-a"));
            connector.updateSecretMetadata("app/db", Map.of("custom_metadata", Map.of("tier", "gold")));

            // Then
            assertThat(connector.getSecretMetadata("app/db"))
                    .hasValueSatisfying(metadata ->
                            assertThat(metadata.get("custom_metadata"))
                                    .isEqualTo(Map.of("owner", "team-a", "tier", "gold")));
        }
    }

    @Nested
    @DisplayName("Policies and tokens")
    class PolicyAndTokenTests {

        @Test
        @DisplayName("should store, update and delete policies")
        void shouldManagePolicies() {
            connector.createPolicy("p1", "path \"a\" { capabilities = [\"read\"] }");
            connector.updatePolicy("p1", "path \"a\" { capabilities = [\"update\"] }");

            assertThat(connector.getPolicy("p1")).contains("path \"a\" { capabilities = [\"update\"] }");

            connector.deletePolicy("p1");

            assertThat(connector.getPolicy("p1")).isEmpty();
        }

        @Test
        @DisplayName("should issue and revoke tokens")
        void shouldIssueAndRevokeTokens() {
            // When
            IssuedToken token = connector.createToken(List.of("reader"), Duration.ofMinutes(5));

            // Then
            assertThat(token.token()).startsWith("hvs.");
            assertThat(connector.getTokenStore().find(token.token())).isPresent();

            // When
            connector.revokeToken(token.token());

            // Then
            assertThat(connector.getTokenStore().find(token.token())).isEmpty();
        }
    }

    @Test
    @DisplayName("should refuse operations after disconnect")
    void shouldRefuseAfterDisconnect() {
        // Given
        connector.disconnect();

        // When / Then
        assertThatThrownBy(() -> connector.writeSecret("app/db", Map.of("value", "a"), null))
                .isInstanceOf(VaultNotConnectedException.class);
        assertThat(connector.isConnected()).isFalse();
        assertThat(connector.getProviderType()).isEqualTo("inmemory");
    }
}
