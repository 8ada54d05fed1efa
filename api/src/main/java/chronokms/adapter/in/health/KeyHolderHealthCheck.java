package chronokms.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import chronokms.core.model.keyholder.KeyHolderStatus;
import chronokms.core.port.out.KeyHolder;

/**
 * Readiness check reporting the key-holder's master key status.
 */
@Readiness
@ApplicationScoped
public class KeyHolderHealthCheck implements HealthCheck {

    static final String ACTIVE = "active";

    private final KeyHolder keyHolder;

    @Inject
    public KeyHolderHealthCheck(KeyHolder keyHolder) {
        this.keyHolder = keyHolder;
    }

    @Override
    public HealthCheckResponse call() {
        KeyHolderStatus status = keyHolder.status();
        return HealthCheckResponse.builder()
                .name("key-holder")
                .status(ACTIVE.equals(status.masterKeyStatus()))
                .withData("keyHolderId", status.keyHolderId())
                .withData("masterKeyStatus", status.masterKeyStatus())
                .withData("keyAlgorithm", status.keyAlgorithm())
                .build();
    }
}
