package chronokms.core.service.admin;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import chronokms.adapter.out.crypto.BcryptSecretHasher;
import chronokms.adapter.out.storage.memory.InMemoryAdminRepository;
import chronokms.adapter.out.storage.memory.InMemorySessionRepository;
import chronokms.core.model.admin.AdminAccount;
import chronokms.core.model.common.ConflictException;
import chronokms.core.model.common.ValidationException;
import chronokms.core.port.in.AdminManagement.BootstrapException;
import chronokms.core.port.in.AdminManagement.LoginResult;
import chronokms.core.service.session.SessionIdGenerator;
import chronokms.core.service.session.SessionService;
import chronokms.support.MutableClock;
import chronokms.support.TestConfigs;

@DisplayName("AdminService")
class AdminServiceTest {

    private static final String PASSWORD = "correct-horse";

    private InMemoryAdminRepository repository;
    private SessionService sessions;
    private AdminService service;

    @BeforeEach
    void setUp() {
        var clock = MutableClock.at(1_700_000_000_000L);
        repository = new InMemoryAdminRepository();
        sessions = new SessionService(
                new InMemorySessionRepository(),
                new SessionIdGenerator(),
                TestConfigs.sessions(Duration.ofHours(1), true, 3),
                clock);
        service = new AdminService(repository, sessions, new BcryptSecretHasher(), TestConfigs.admin(8), clock);
    }

    private AdminAccount setupRoot() {
        return service.setup("root", PASSWORD, "root@example.com").await().indefinitely();
    }

    @Nested
    @DisplayName("setup")
    class SetupTests {

        @Test
        @DisplayName("should require setup only while no admin exists")
        void shouldReportSetupRequired() {
            assertTrue(service.isSetupRequired().await().indefinitely());

            setupRoot();

            assertFalse(service.isSetupRequired().await().indefinitely());
        }

        @Test
        @DisplayName("should store a hash instead of the password")
        void shouldHashPassword() {
            AdminAccount admin = setupRoot();

            assertNotEquals(PASSWORD, admin.passwordHash());
            assertFalse(admin.setupRequired());
            assertEquals("root@example.com", admin.email());
        }

        @Test
        @DisplayName("should reject a second setup")
        void shouldRejectSecondSetup() {
            setupRoot();

            assertThrows(
                    ConflictException.class,
                    () -> service.setup("other", PASSWORD, null).await().indefinitely());
        }

        @Test
        @DisplayName("should validate username and password length")
        void shouldValidateInput() {
            assertThrows(ValidationException.class, () -> service.setup(" ", PASSWORD, null));
            assertThrows(ValidationException.class, () -> service.setup("root", "short", null));
            assertThrows(ValidationException.class, () -> service.setup("root", "x".repeat(73), null));
        }
    }

    @Nested
    @DisplayName("login")
    class LoginTests {

        @Test
        @DisplayName("should create a session for valid credentials")
        void shouldLogin() {
            AdminAccount admin = setupRoot();

            LoginResult result =
                    service.login("root", PASSWORD).await().indefinitely().orElseThrow();

            assertEquals(admin.id(), result.admin().id());
            assertEquals(admin.id(), result.session().adminId());
            assertTrue(sessions.validateSession(result.session().id()).await().indefinitely().isPresent());
        }

        @Test
        @DisplayName("should reject a wrong password or unknown user")
        void shouldRejectInvalidCredentials() {
            setupRoot();

            assertTrue(service.login("root", "wrong-password").await().indefinitely().isEmpty());
            assertTrue(service.login("nobody", PASSWORD).await().indefinitely().isEmpty());
            assertTrue(service.login("root", null).await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should reject a disabled admin")
        void shouldRejectDisabledAdmin() {
            AdminAccount admin = setupRoot();
            repository.update(admin.withEnabled(false, admin.updatedAt())).await().indefinitely();

            assertTrue(service.login("root", PASSWORD).await().indefinitely().isEmpty());
        }
    }

    @Nested
    @DisplayName("changePassword")
    class ChangePasswordTests {

        @Test
        @DisplayName("should replace the password when the current one matches")
        void shouldChangePassword() {
            AdminAccount admin = setupRoot();

            assertTrue(service.changePassword(admin.id(), PASSWORD, "battery-staple")
                    .await()
                    .indefinitely());

            assertTrue(service.login("root", PASSWORD).await().indefinitely().isEmpty());
            assertTrue(service.login("root", "battery-staple").await().indefinitely().isPresent());
        }

        @Test
        @DisplayName("should refuse when the current password is wrong")
        void shouldRefuseWrongCurrentPassword() {
            AdminAccount admin = setupRoot();

            assertFalse(service.changePassword(admin.id(), "not-it", "battery-staple")
                    .await()
                    .indefinitely());
        }
    }

    @Nested
    @DisplayName("bootstrap")
    class BootstrapTests {

        @Test
        @DisplayName("should fail when no password is configured")
        void shouldFailWithoutPassword() {
            assertThrows(BootstrapException.class, () -> service.bootstrap("admin", null, null));
            assertThrows(BootstrapException.class, () -> service.bootstrap("admin", "  ", null));
        }

        @Test
        @DisplayName("should fail when the password is too short")
        void shouldFailWithShortPassword() {
            assertThrows(BootstrapException.class, () -> service.bootstrap("admin", "short", null));
        }

        @Test
        @DisplayName("should flag an account created with the default password as setup required")
        void shouldFlagDefaultPassword() {
            AdminAccount admin = service.bootstrap("admin", AdminService.DEFAULT_PASSWORD, null)
                    .await()
                    .indefinitely()
                    .orElseThrow();

            assertTrue(admin.setupRequired());

            service.changePassword(admin.id(), AdminService.DEFAULT_PASSWORD, PASSWORD)
                    .await()
                    .indefinitely();
            assertFalse(repository.findById(admin.id()).await().indefinitely().orElseThrow().setupRequired());
        }

        @Test
        @DisplayName("should skip when an admin already exists")
        void shouldSkipWhenAdminExists() {
            setupRoot();

            assertTrue(service.bootstrap("admin", PASSWORD, null).await().indefinitely().isEmpty());
            assertEquals(1L, repository.count().await().indefinitely());
        }
    }
}
