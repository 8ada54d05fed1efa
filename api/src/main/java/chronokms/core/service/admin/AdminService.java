package chronokms.core.service.admin;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import chronokms.core.config.AdminConfig;
import chronokms.core.model.admin.AdminAccount;
import chronokms.core.model.common.ConflictException;
import chronokms.core.model.common.ValidationException;
import chronokms.core.port.in.AdminManagement;
import chronokms.core.port.in.SessionManagement;
import chronokms.core.port.out.AdminRepository;
import chronokms.core.port.out.SecretHasher;

/**
 * Admin account lifecycle: first-run setup, login, password change and
 * configuration bootstrap.
 */
@ApplicationScoped
public class AdminService implements AdminManagement {

    private static final Logger LOG = Logger.getLogger(AdminService.class);
    private static final Logger AUDIT = Logger.getLogger("chronokms.audit.admin");

    /** Default bootstrap password; accounts created with it must change it. */
    public static final String DEFAULT_PASSWORD = "admin";

    /** Bcrypt only reads the first 72 bytes of its input. */
    static final int MAX_PASSWORD_BYTES = 72;

    private final AdminRepository repository;
    private final SessionManagement sessions;
    private final SecretHasher hasher;
    private final AdminConfig config;
    private final Clock clock;

    @Inject
    public AdminService(
            AdminRepository repository,
            SessionManagement sessions,
            SecretHasher hasher,
            AdminConfig config,
            Clock clock) {
        this.repository = repository;
        this.sessions = sessions;
        this.hasher = hasher;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public Uni<Boolean> isSetupRequired() {
        return repository.count().map(count -> count == 0);
    }

    @Override
    public Uni<AdminAccount> setup(String username, String password, String email) {
        requireUsername(username);
        requirePassword(password);
        return isSetupRequired().flatMap(required -> {
            if (!required) {
                return Uni.createFrom()
                        .<AdminAccount>failure(new ConflictException("Setup has already been completed"));
            }
            return createFirst(username, password, email, false).map(saved -> {
                if (saved.isEmpty()) {
                    throw new ConflictException("Setup has already been completed");
                }
                AUDIT.infof("ADMIN_SETUP username=%s", username);
                return saved.get();
            });
        });
    }

    @Override
    public Uni<Optional<LoginResult>> login(String username, String password) {
        if (username == null || username.isBlank() || password == null || password.isEmpty()) {
            return Uni.createFrom().item(Optional.empty());
        }
        return repository.findByUsername(username).flatMap(found -> {
            if (found.isEmpty() || !found.get().enabled()) {
                AUDIT.infof("ADMIN_LOGIN_FAILED username=%s", username);
                return Uni.createFrom().item(Optional.<LoginResult>empty());
            }
            AdminAccount admin = found.get();
            return verify(password, admin.passwordHash()).flatMap(matches -> {
                if (!matches) {
                    AUDIT.infof("ADMIN_LOGIN_FAILED username=%s", username);
                    return Uni.createFrom().item(Optional.<LoginResult>empty());
                }
                return sessions.createSession(admin.id(), admin.username()).map(session -> {
                    AUDIT.infof("ADMIN_LOGIN username=%s session=%s", username, session.logId());
                    return Optional.of(new LoginResult(admin, session));
                });
            });
        });
    }

    @Override
    public Uni<Boolean> changePassword(String adminId, String currentPassword, String newPassword) {
        requirePassword(newPassword);
        return repository.findById(adminId).flatMap(found -> {
            if (found.isEmpty() || currentPassword == null) {
                return Uni.createFrom().item(false);
            }
            AdminAccount admin = found.get();
            return verify(currentPassword, admin.passwordHash()).flatMap(matches -> {
                if (!matches) {
                    return Uni.createFrom().item(false);
                }
                return hash(newPassword)
                        .flatMap(hash -> repository.update(admin.withPasswordHash(hash, clock.instant())))
                        .map(v -> {
                            AUDIT.infof("ADMIN_PASSWORD_CHANGED username=%s", admin.username());
                            return true;
                        });
            });
        });
    }

    @Override
    public Uni<Optional<AdminAccount>> findById(String adminId) {
        return repository.findById(adminId);
    }

    @Override
    public Uni<Optional<AdminAccount>> bootstrap(String username, String password, String email) {
        requireUsername(username);
        if (password == null || password.isBlank()) {
            throw new BootstrapException(
                    "Bootstrap is enabled but no password provided. Set kms.admin.bootstrap.password.");
        }
        boolean defaultPassword = DEFAULT_PASSWORD.equals(password);
        if (!defaultPassword && password.length() < config.minPasswordLength()) {
            throw new BootstrapException(
                    "Bootstrap password must be at least " + config.minPasswordLength() + " characters");
        }
        return createFirst(username, password, email, defaultPassword).invoke(created -> {
            if (created.isPresent() && defaultPassword) {
                LOG.warnf("Admin '%s' uses the default password; setup is required before production use", username);
            }
        });
    }

    private Uni<Optional<AdminAccount>> createFirst(
            String username, String password, String email, boolean setupRequired) {
        return hash(password).flatMap(hash -> {
            Instant now = clock.instant();
            var account = new AdminAccount(
                    UUID.randomUUID().toString(), username, hash, email, true, setupRequired, now, now);
            return repository
                    .saveFirst(account)
                    .map(saved -> saved ? Optional.of(account) : Optional.<AdminAccount>empty());
        });
    }

    private Uni<String> hash(String password) {
        return Uni.createFrom()
                .item(() -> hasher.hash(password, config.passwordHashRounds()))
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    private Uni<Boolean> verify(String password, String hash) {
        return Uni.createFrom()
                .item(() -> hasher.matches(password, hash))
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    private static void requireUsername(String username) {
        if (username == null || username.isBlank()) {
            throw new ValidationException("username", "username is required");
        }
    }

    private void requirePassword(String password) {
        if (password == null || password.length() < config.minPasswordLength()) {
            throw new ValidationException(
                    "password", "password must be at least " + config.minPasswordLength() + " characters");
        }
        if (password.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES) {
            throw new ValidationException("password", "password must be at most " + MAX_PASSWORD_BYTES + " bytes");
        }
    }
}
