package chronokms.core.service.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import chronokms.adapter.out.storage.memory.InMemorySessionRepository;
import chronokms.core.model.session.AdminSession;
import chronokms.core.port.in.SessionManagement.SessionCreationException;
import chronokms.support.MutableClock;
import chronokms.support.TestConfigs;

@DisplayName("SessionService")
class SessionServiceTest {

    private MutableClock clock;
    private InMemorySessionRepository repository;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at(1_000_000L);
        repository = new InMemorySessionRepository();
    }

    private SessionService service(Duration ttl, boolean sliding) {
        return new SessionService(
                repository, new SessionIdGenerator(), TestConfigs.sessions(ttl, sliding, 3), clock);
    }

    @Nested
    @DisplayName("createSession")
    class CreateSessionTests {

        @Test
        @DisplayName("should create a session expiring after the configured TTL")
        void shouldApplyTtl() {
            var session = service(Duration.ofMillis(1000), false)
                    .createSession("admin-1", "root")
                    .await()
                    .indefinitely();

            assertEquals("admin-1", session.adminId());
            assertEquals(clock.instant().plusMillis(1000), session.expiresAt());
            assertEquals(43, session.id().length());
        }

        @Test
        @DisplayName("should generate unique session ids")
        void shouldGenerateUniqueIds() {
            var service = service(Duration.ofHours(1), false);

            var first = service.createSession("admin-1", "root").await().indefinitely();
            var second = service.createSession("admin-1", "root").await().indefinitely();

            assertNotEquals(first.id(), second.id());
        }

        @Test
        @DisplayName("should fail after exhausting retries on id collisions")
        void shouldFailAfterCollisions() {
            var generator = mock(SessionIdGenerator.class);
            when(generator.generate()).thenReturn("fixed-session-id");
            var service = new SessionService(
                    repository, generator, TestConfigs.sessions(Duration.ofHours(1), false, 3), clock);

            service.createSession("admin-1", "root").await().indefinitely();

            assertThrows(
                    SessionCreationException.class,
                    () -> service.createSession("admin-2", "other").await().indefinitely());
        }
    }

    @Nested
    @DisplayName("validateSession")
    class ValidateSessionTests {

        @Test
        @DisplayName("should return empty for a session that was never created")
        void shouldReturnEmptyForUnknown() {
            var service = service(Duration.ofHours(1), true);

            assertTrue(service.validateSession("never-created").await().indefinitely().isEmpty());
            assertTrue(service.validateSession(null).await().indefinitely().isEmpty());
            assertTrue(service.validateSession("").await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should expire and evict a session once its TTL has elapsed")
        void shouldExpireAndEvict() {
            var service = service(Duration.ofMillis(1000), false);
            AdminSession session = service.createSession("admin-1", "root").await().indefinitely();

            assertTrue(service.validateSession(session.id()).await().indefinitely().isPresent());

            clock.advanceMillis(1001);

            assertTrue(service.validateSession(session.id()).await().indefinitely().isEmpty());
            assertTrue(repository.findById(session.id()).await().indefinitely().isEmpty());
            assertTrue(service.validateSession(session.id()).await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should still accept a session exactly at its expiry instant")
        void shouldAcceptAtExpiryInstant() {
            var service = service(Duration.ofMillis(1000), false);
            AdminSession session = service.createSession("admin-1", "root").await().indefinitely();

            clock.advanceMillis(1000);

            assertTrue(service.validateSession(session.id()).await().indefinitely().isPresent());
        }

        @Test
        @DisplayName("should refresh expiry on use when sliding expiration is enabled")
        void shouldSlideExpiry() {
            var service = service(Duration.ofMillis(1000), true);
            AdminSession session = service.createSession("admin-1", "root").await().indefinitely();

            clock.advanceMillis(800);
            var refreshed = service.validateSession(session.id()).await().indefinitely().orElseThrow();
            assertEquals(clock.instant().plusMillis(1000), refreshed.expiresAt());

            clock.advanceMillis(800);
            assertTrue(service.validateSession(session.id()).await().indefinitely().isPresent());
        }

        @Test
        @DisplayName("should keep the original expiry when sliding expiration is disabled")
        void shouldNotSlideWhenFixed() {
            var service = service(Duration.ofMillis(1000), false);
            AdminSession session = service.createSession("admin-1", "root").await().indefinitely();

            clock.advanceMillis(800);
            service.validateSession(session.id()).await().indefinitely();
            clock.advanceMillis(800);

            assertTrue(service.validateSession(session.id()).await().indefinitely().isEmpty());
        }
    }

    @Nested
    @DisplayName("deletion and sweep")
    class DeletionTests {

        @Test
        @DisplayName("should invalidate a session on logout")
        void shouldDeleteSession() {
            var service = service(Duration.ofHours(1), true);
            AdminSession session = service.createSession("admin-1", "root").await().indefinitely();

            service.deleteSession(session.id()).await().indefinitely();

            assertTrue(service.validateSession(session.id()).await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should delete every session of an admin")
        void shouldDeleteAdminSessions() {
            var service = service(Duration.ofHours(1), true);
            service.createSession("admin-1", "root").await().indefinitely();
            service.createSession("admin-1", "root").await().indefinitely();
            AdminSession other = service.createSession("admin-2", "ops").await().indefinitely();

            assertEquals(2, service.deleteAdminSessions("admin-1").await().indefinitely());
            assertTrue(service.validateSession(other.id()).await().indefinitely().isPresent());
        }

        @Test
        @DisplayName("should sweep only expired sessions")
        void shouldSweepExpired() {
            var shortLived = service(Duration.ofMillis(1000), false);
            var longLived = service(Duration.ofHours(1), false);
            shortLived.createSession("admin-1", "root").await().indefinitely();
            AdminSession kept = longLived.createSession("admin-2", "ops").await().indefinitely();

            clock.advanceMillis(1001);

            assertEquals(1, shortLived.sweepExpired().await().indefinitely());
            assertEquals(1, repository.count().await().indefinitely());
            assertTrue(repository.findById(kept.id()).await().indefinitely().isPresent());
        }
    }
}
