package chronokms.core.port.in;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import chronokms.core.model.admin.AdminAccount;
import chronokms.core.model.session.AdminSession;

/**
 * Inbound port for admin accounts: initial setup, login and password changes.
 */
public interface AdminManagement {

    /**
     * Returns true while no admin account exists.
     */
    Uni<Boolean> isSetupRequired();

    /**
     * Creates the first admin account.
     *
     * @throws chronokms.core.model.common.ConflictException if an admin already exists
     * @throws chronokms.core.model.common.ValidationException if username or password is unusable
     */
    Uni<AdminAccount> setup(String username, String password, String email);

    /**
     * Checks credentials and opens a session.
     *
     * @return Uni with the login result, or empty for unknown user, disabled
     *     account or wrong password (indistinguishable to the caller)
     */
    Uni<Optional<LoginResult>> login(String username, String password);

    /**
     * Changes the password of an admin after checking the current one.
     *
     * @return Uni with true if changed, false if the current password is wrong
     */
    Uni<Boolean> changePassword(String adminId, String currentPassword, String newPassword);

    Uni<Optional<AdminAccount>> findById(String adminId);

    /**
     * Creates an admin from startup configuration if none exists.
     *
     * @param username bootstrap username
     * @param password bootstrap password
     * @param email    optional email
     * @return the created account, or empty if admins already exist
     */
    Uni<Optional<AdminAccount>> bootstrap(String username, String password, String email);

    /**
     * A successful login.
     *
     * @param admin   the authenticated account
     * @param session the new session
     */
    record LoginResult(AdminAccount admin, AdminSession session) {}

    /**
     * Exception thrown when the startup bootstrap cannot be performed.
     */
    class BootstrapException extends RuntimeException {
        public BootstrapException(String message) {
            super(message);
        }

        public BootstrapException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
