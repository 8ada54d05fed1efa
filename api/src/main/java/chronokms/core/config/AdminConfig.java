package chronokms.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for admin accounts.
 *
 * <p>Configuration prefix: {@code kms.admin}
 *
 * <h2>Example</h2>
 * <pre>
 * kms.admin.bootstrap.enabled=true
 * kms.admin.bootstrap.username=ops
 * kms.admin.bootstrap.password=${KMS_ADMIN_PASSWORD}
 * </pre>
 */
@ConfigMapping(prefix = "kms.admin")
public interface AdminConfig {

    /**
     * bcrypt work factor for admin passwords.
     *
     * @return log2 rounds (default: 12)
     */
    @WithDefault("12")
    int passwordHashRounds();

    /**
     * Minimum password length accepted by setup and password change.
     *
     * @return minimum length (default: 8)
     */
    @WithDefault("8")
    int minPasswordLength();

    /**
     * Startup bootstrap of the first admin.
     */
    Bootstrap bootstrap();

    interface Bootstrap {

        /**
         * Create an admin at startup when none exists.
         *
         * @return true if enabled (default: false)
         */
        @WithDefault("false")
        boolean enabled();

        /**
         * @return bootstrap username (default: admin)
         */
        @WithDefault("admin")
        String username();

        /**
         * Bootstrap password. The literal value {@code admin} is accepted but
         * flags the account as "setup required".
         *
         * @return the password, empty if not configured
         */
        Optional<String> password();

        Optional<String> email();
    }
}
