package chronokms.adapter.in.bootstrap;

import java.time.Duration;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import chronokms.core.config.AdminConfig;
import chronokms.core.model.admin.AdminAccount;
import chronokms.core.port.in.AdminManagement;
import chronokms.core.port.in.AdminManagement.BootstrapException;
import chronokms.core.port.in.PolicyManagement;

/**
 * Seeds the default policy and, when enabled, the first admin account on startup.
 *
 * <h2>Failure Behavior</h2>
 * <ul>
 *   <li>If bootstrap is enabled but no password is provided: startup FAILS</li>
 *   <li>If the password is too short: startup FAILS</li>
 *   <li>If an admin already exists: bootstrap is skipped</li>
 * </ul>
 *
 * <p>The bootstrap password is never logged.
 */
@ApplicationScoped
public class BootstrapInitializer {

    private static final Logger LOG = Logger.getLogger(BootstrapInitializer.class);
    private static final Logger AUDIT = Logger.getLogger("chronokms.audit.bootstrap");

    private static final Duration STARTUP_TIMEOUT = Duration.ofSeconds(30);

    private final AdminManagement adminManagement;
    private final PolicyManagement policyManagement;
    private final AdminConfig config;

    @Inject
    public BootstrapInitializer(
            AdminManagement adminManagement, PolicyManagement policyManagement, AdminConfig config) {
        this.adminManagement = adminManagement;
        this.policyManagement = policyManagement;
        this.config = config;
    }

    void onStart(@Observes StartupEvent event) {
        policyManagement.seedDefaults().await().atMost(STARTUP_TIMEOUT);

        if (!config.bootstrap().enabled()) {
            LOG.debug("Admin bootstrap is disabled");
            return;
        }

        LOG.info("Admin bootstrap is enabled");
        AdminConfig.Bootstrap bootstrap = config.bootstrap();

        try {
            Optional<AdminAccount> created = adminManagement
                    .bootstrap(bootstrap.username(), bootstrap.password().orElse(null), bootstrap.email().orElse(null))
                    .await()
                    .atMost(STARTUP_TIMEOUT);

            if (created.isEmpty()) {
                LOG.info("Bootstrap skipped: an admin account already exists");
                AUDIT.info("BOOTSTRAP_SKIPPED reason=admin_exists");
                return;
            }

            AdminAccount admin = created.get();
            AUDIT.infof("BOOTSTRAP_ADMIN_CREATED username=%s setupRequired=%s", admin.username(), admin.setupRequired());
            LOG.infof("Bootstrap admin '%s' created", admin.username());
        } catch (BootstrapException e) {
            LOG.errorf("BOOTSTRAP FAILED: %s", e.getMessage());
            throw e; // Re-throw to fail startup
        }
    }
}
