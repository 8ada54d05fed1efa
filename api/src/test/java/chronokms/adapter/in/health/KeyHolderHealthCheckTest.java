package chronokms.adapter.in.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Instant;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import chronokms.core.model.keyholder.KeyHolderStatus;
import chronokms.core.port.out.KeyHolder;

@DisplayName("KeyHolderHealthCheck")
class KeyHolderHealthCheckTest {

    private static HealthCheckResponse check(String masterKeyStatus) {
        KeyHolder keyHolder = mock(KeyHolder.class);
        when(keyHolder.status())
                .thenReturn(new KeyHolderStatus("kms-main", masterKeyStatus, "EC P-256", Instant.EPOCH, 1000));
        return new KeyHolderHealthCheck(keyHolder).call();
    }

    @Test
    @DisplayName("should be up while the master key is active")
    void shouldBeUpWhenActive() {
        HealthCheckResponse response = check("active");

        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
        assertEquals("key-holder", response.getName());
        assertEquals("kms-main", response.getData().orElseThrow().get("keyHolderId"));
    }

    @Test
    @DisplayName("should be down for any other master key status")
    void shouldBeDownOtherwise() {
        assertEquals(HealthCheckResponse.Status.DOWN, check("rotating").getStatus());
    }
}
