package com.stratus.config.access;

import com.stratus.config.error.ValidationException;
import com.stratus.vault.InMemoryVaultConnector;
import com.stratus.vault.VaultProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AccessControlGate Tests")
class AccessControlGateTest {

    private static final String SECRET_ID = "secret-1";
    private static final String PATH = "environments/prod/secrets/db";

    @Mock
    private PermissionOracle oracle;

    private InMemoryVaultConnector connector;
    private AccessControlGate gate;

    @BeforeEach
    void setUp() {
        connector = new InMemoryVaultConnector();
        connector.connect();
        gate = new AccessControlGate(connector, new VaultProperties(), oracle);
    }

    private static SecretAccessGrant grant(String principalId, SecretPermission... permissions) {
        return SecretAccessGrant.builder()
                .principalId(principalId)
                .permissions(EnumSet.of(permissions[0], permissions))
                .build();
    }

    @Nested
    @DisplayName("Granting")
    class GrantTests {

        @Test
        @DisplayName("should materialize a backend policy with mapped capabilities")
        void shouldCreatePolicy() {
            // When
            SecretAccessGrant recorded = gate.grantAccess(SECRET_ID, PATH,
                    grant("svc-api", SecretPermission.READ, SecretPermission.WRITE, SecretPermission.ROTATE, SecretPermission.LIST));

            // Then
            assertThat(recorded.getPolicyName()).isEqualTo("secret-secret-1-svc-api");
            assertThat(recorded.getCreatedAt()).isNotNull();
            assertThat(connector.getPolicy(recorded.getPolicyName())).hasValueSatisfying(policy -> {
                assertThat(policy).contains("path \"secret/data/environments/prod/secrets/db\"");
                assertThat(policy).contains("capabilities = [\"read\", \"create\", \"update\"]");
                assertThat(policy).contains("path \"secret/metadata/environments/prod/secrets/db\"");
                assertThat(policy).contains("capabilities = [\"list\"]");
            });
        }

        @Test
        @DisplayName("should reject grants without principal or permissions")
        void shouldValidateGrant() {
            SecretAccessGrant empty = SecretAccessGrant.builder().principalType("robot").build();

            assertThatThrownBy(() -> gate.grantAccess(SECRET_ID, PATH, empty))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("Principal ID is required")
                    .hasMessageContaining("At least one permission is required")
                    .hasMessageContaining("Principal type");
        }

        @Test
        @DisplayName("should delete the policy on revoke")
        void shouldRevoke() {
            // Given
            SecretAccessGrant recorded = gate.grantAccess(SECRET_ID, PATH, grant("user-2", SecretPermission.READ));

            // When
            SecretAccessGrant revoked = gate.revokeAccess(SECRET_ID, "user-2");

            // Then
            assertThat(revoked.getPrincipalId()).isEqualTo("user-2");
            assertThat(connector.getPolicy(recorded.getPolicyName())).isEmpty();
            assertThat(gate.listPrincipals(SECRET_ID)).isEmpty();
            assertThat(gate.revokeAccess(SECRET_ID, "user-2")).isNull();
        }

        @Test
        @DisplayName("should list principals in order")
        void shouldListPrincipals() {
            gate.grantAccess(SECRET_ID, PATH, grant("zoe", SecretPermission.READ));
            gate.grantAccess(SECRET_ID, PATH, grant("adam", SecretPermission.DELETE));

            assertThat(gate.listPrincipals(SECRET_ID))
                    .extracting(SecretAccessGrant::getPrincipalId)
                    .containsExactly("adam", "zoe");
        }
    }

    @Nested
    @DisplayName("Permission checks")
    class CheckTests {

        @Test
        @DisplayName("should allow a covered permission without asking the oracle")
        void shouldAllowFromGrant() {
            gate.grantAccess(SECRET_ID, PATH, grant("user-2", SecretPermission.READ));

            assertThat(gate.checkPermission(SECRET_ID, "user-2", SecretPermission.READ)).isTrue();
            verifyNoInteractions(oracle);
        }

        @Test
        @DisplayName("should fall through to the oracle for uncovered permissions")
        void shouldAskOracle() {
            // Given
            gate.grantAccess(SECRET_ID, PATH, grant("user-2", SecretPermission.READ));
            when(oracle.hasPermission("user-2", "secret:" + SECRET_ID, "delete")).thenReturn(false);
            when(oracle.hasPermission("admin", "secret:" + SECRET_ID, "delete")).thenReturn(true);

            // When / Then
            assertThat(gate.checkPermission(SECRET_ID, "user-2", SecretPermission.DELETE)).isFalse();
            assertThat(gate.checkPermission(SECRET_ID, "admin", SecretPermission.DELETE)).isTrue();
            verify(oracle).hasPermission("admin", "secret:secret-1", "delete");
        }

        @Test
        @DisplayName("should deny once a grant is revoked")
        void shouldDenyAfterRevoke() {
            // Given
            gate.grantAccess(SECRET_ID, PATH, grant("user-2", SecretPermission.READ));
            gate.revokeAll(SECRET_ID);
            when(oracle.hasPermission(anyString(), anyString(), anyString())).thenReturn(false);

            // Then
            assertThat(gate.checkPermission(SECRET_ID, "user-2", SecretPermission.READ)).isFalse();
        }
    }

    @Test
    @DisplayName("rotate should map to the update capability")
    void rotateShouldMapToUpdate() {
        assertThat(SecretPermission.ROTATE.getCapability()).isEqualTo("update");
        assertThat(SecretPermission.WRITE.getCapability()).isEqualTo("create");
        assertThat(Set.of(SecretPermission.values())).hasSize(6);
    }
}
