package chronokms.core.service.access;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

import javax.crypto.spec.SecretKeySpec;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.subscription.Cancellable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import chronokms.adapter.out.crypto.JwkKeyExporter;
import chronokms.adapter.out.keyholder.LocalKeyHolder;
import chronokms.adapter.out.storage.memory.InMemoryAccessRequestRepository;
import chronokms.adapter.out.storage.memory.InMemoryAuditLogRepository;
import chronokms.core.config.AccessConfig;
import chronokms.core.model.access.AccessRequest;
import chronokms.core.model.access.AccessRequestQuery;
import chronokms.core.model.access.AccessRequestRecord;
import chronokms.core.model.access.AccessResponse;
import chronokms.core.model.access.CorrelatedRequest;
import chronokms.core.model.access.RequestStatus;
import chronokms.core.model.access.TimeRange;
import chronokms.core.model.audit.AuditEvent;
import chronokms.core.model.audit.AuditEventType;
import chronokms.core.model.audit.AuditFilter;
import chronokms.core.model.common.ValidationException;
import chronokms.core.model.keyholder.KeyHolderDecision;
import chronokms.core.port.in.AuthorizationUseCase.KeyHolderUnavailableException;
import chronokms.core.port.out.AccessRequestRepository;
import chronokms.core.port.out.KeyExporter;
import chronokms.core.port.out.KeyHolder;
import chronokms.core.service.audit.AuditTrailService;
import chronokms.core.service.audit.RequestCorrelator;
import chronokms.core.service.common.SideEffectRunner;
import chronokms.support.MutableClock;
import chronokms.support.RecordingMetrics;
import chronokms.support.TestConfigs;

@DisplayName("AuthorizationGateway")
class AuthorizationGatewayTest {

    private static final String REQUESTER = "req-alpha";

    private MutableClock clock;
    private AuditTrailService auditTrail;
    private InMemoryAccessRequestRepository history;
    private RecordingMetrics metrics;
    private AccessConfig config;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at(50_000);
        auditTrail = new AuditTrailService(new InMemoryAuditLogRepository());
        history = new InMemoryAccessRequestRepository();
        metrics = new RecordingMetrics();
        config = TestConfigs.access(Duration.ofMillis(200), 10, Duration.ofSeconds(1));
    }

    private AuthorizationGateway gateway(KeyHolder keyHolder, KeyExporter exporter, AccessRequestRepository repo) {
        return new AuthorizationGateway(
                keyHolder, exporter, auditTrail, repo, new SideEffectRunner(metrics), metrics, config, clock);
    }

    private AuthorizationGateway localGateway() {
        return gateway(new LocalKeyHolder(config, clock), new JwkKeyExporter(), history);
    }

    private static AccessRequest request(long start, long end) {
        return new AccessRequest(REQUESTER, new TimeRange(start, end), "decrypt archive", Map.of("ticket", "OPS-1"));
    }

    private List<AuditEvent> events() {
        return auditTrail.retrieve(AuditFilter.all()).await().indefinitely();
    }

    private List<AuditEventType> eventTypes() {
        return events().stream().map(AuditEvent::eventType).toList();
    }

    private static KeyHolder stubKeyHolder(Uni<KeyHolderDecision> decision) {
        KeyHolder keyHolder = mock(KeyHolder.class);
        when(keyHolder.id()).thenReturn("kms-test");
        when(keyHolder.authorize(any())).thenReturn(decision);
        return keyHolder;
    }

    @Nested
    @DisplayName("granted requests")
    class GrantTests {

        @Test
        @DisplayName("should audit one request then one grant for a single-instant range")
        void shouldAuditSingleInstantGrant() {
            AccessResponse response = localGateway().authorize(request(1000, 1000)).await().indefinitely();

            assertTrue(response.granted());
            assertEquals(1, response.keyCount());
            assertTrue(response.keys().containsKey(1000L));

            List<AuditEvent> events = events();
            assertEquals(
                    List.of(
                            AuditEventType.ACCESS_REQUEST,
                            AuditEventType.ACCESS_GRANTED,
                            AuditEventType.KEY_GENERATION,
                            AuditEventType.KEY_DISTRIBUTION),
                    eventTypes());
            assertEquals(1, events.stream().filter(e -> e.eventType() == AuditEventType.ACCESS_REQUEST).count());
            assertEquals(1, events.stream().filter(e -> e.eventType() == AuditEventType.ACCESS_GRANTED).count());

            AuditEvent requestEvent = events.get(0);
            AuditEvent grantEvent = events.get(1);
            assertEquals(REQUESTER, requestEvent.actor());
            assertTrue(grantEvent.involves(REQUESTER));
            assertEquals(requestEvent.id(), grantEvent.requestEventId());

            List<CorrelatedRequest> correlated = RequestCorrelator.correlate(events);
            assertEquals(1, correlated.size());
            assertEquals(RequestStatus.GRANTED, correlated.get(0).status());
            assertEquals(grantEvent.id(), correlated.get(0).outcomeEventId());
        }

        @Test
        @DisplayName("should write the history row and count the decision")
        void shouldRecordHistory() {
            localGateway().authorize(request(0, 2999)).await().indefinitely();

            var page = history.find(new AccessRequestQuery(REQUESTER, null, null, 10, 0))
                    .await()
                    .indefinitely();
            assertEquals(1, page.total());
            AccessRequestRecord record = page.items().get(0);
            assertTrue(record.granted());
            assertEquals(3, record.keyCount());
            assertEquals("decrypt archive", record.purpose());
            assertEquals(List.of(true), metrics.accessDecisions);
        }

        @Test
        @DisplayName("should still grant when the history write fails")
        void shouldGrantWhenHistoryWriteFails() {
            AccessRequestRepository failing = mock(AccessRequestRepository.class);
            when(failing.save(any()))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("history store offline")));
            var gateway = gateway(new LocalKeyHolder(config, clock), new JwkKeyExporter(), failing);

            AccessResponse response = gateway.authorize(request(1000, 1000)).await().indefinitely();

            assertTrue(response.granted());
            assertFalse(response.keys().isEmpty());
            assertTrue(eventTypes().contains(AuditEventType.ACCESS_GRANTED));
            assertEquals(List.of(AuthorizationGateway.HISTORY_TASK), metrics.sideEffectFailures);
        }

        @Test
        @DisplayName("should deny and record the denial when key export fails")
        void shouldDenyWhenExportFails() {
            KeyExporter exporter = mock(KeyExporter.class);
            when(exporter.export(any())).thenThrow(new IllegalStateException("export failed"));
            var gateway = gateway(new LocalKeyHolder(config, clock), exporter, history);

            AccessResponse response = gateway.authorize(request(1000, 1000)).await().indefinitely();

            assertFalse(response.granted());
            assertTrue(response.keys().isEmpty());
            assertEquals(AuthorizationGateway.KEY_EXPORT_FAILED, response.denialReason());

            List<AuditEvent> events = events();
            assertEquals(
                    List.of(
                            AuditEventType.ACCESS_REQUEST,
                            AuditEventType.KEY_DISTRIBUTION,
                            AuditEventType.ACCESS_DENIED),
                    eventTypes());
            assertFalse(events.get(1).success());
            assertFalse(eventTypes().contains(AuditEventType.ACCESS_GRANTED));

            List<CorrelatedRequest> correlated = RequestCorrelator.correlate(events);
            assertEquals(RequestStatus.DENIED, correlated.get(0).status());

            assertEquals(List.of(false), metrics.accessDecisions);
            var page = history.find(new AccessRequestQuery(REQUESTER, null, null, 10, 0))
                    .await()
                    .indefinitely();
            assertEquals(1, page.total());
            assertFalse(page.items().get(0).granted());
            assertEquals(AuthorizationGateway.KEY_EXPORT_FAILED, page.items().get(0).denialReason());
        }

        @Test
        @DisplayName("should complete the audit chain after the caller cancels")
        void shouldCompleteAuditAfterCancellation() {
            CompletableFuture<KeyHolderDecision> pending = new CompletableFuture<>();
            var gateway = gateway(
                    stubKeyHolder(Uni.createFrom().completionStage(pending)), new JwkKeyExporter(), history);

            Cancellable subscription = gateway.authorize(request(1000, 1000))
                    .subscribe()
                    .with(response -> {}, failure -> {});
            subscription.cancel();

            pending.complete(KeyHolderDecision.grant(
                    Map.of(1000L, new SecretKeySpec(new byte[32], "AES")), 1000));

            assertTrue(eventTypes().contains(AuditEventType.ACCESS_GRANTED));
            assertTrue(eventTypes().contains(AuditEventType.KEY_DISTRIBUTION));
        }
    }

    @Nested
    @DisplayName("denied requests")
    class DenialTests {

        @Test
        @DisplayName("should return the key-holder's denial and audit it")
        void shouldAuditDenial() {
            AccessResponse response = localGateway().authorize(request(0, 60_000)).await().indefinitely();

            assertFalse(response.granted());
            assertTrue(response.keys().isEmpty());
            assertTrue(response.denialReason().contains("10 keys"));
            assertEquals(List.of(AuditEventType.ACCESS_REQUEST, AuditEventType.ACCESS_DENIED), eventTypes());
            assertEquals(List.of(false), metrics.accessDecisions);
            assertEquals(RequestStatus.DENIED, RequestCorrelator.correlate(events()).get(0).status());
        }

        @Test
        @DisplayName("should surface a key-holder timeout as unavailable and record a denial")
        void shouldTimeOut() {
            var gateway = gateway(stubKeyHolder(Uni.createFrom().nothing()), new JwkKeyExporter(), history);

            var error = assertThrows(
                    KeyHolderUnavailableException.class,
                    () -> gateway.authorize(request(1000, 1000)).await().atMost(Duration.ofSeconds(5)));

            assertInstanceOf(TimeoutException.class, error.getCause());
            assertEquals(List.of(AuditEventType.ACCESS_REQUEST, AuditEventType.ACCESS_DENIED), eventTypes());
            assertEquals(AuthorizationGateway.KEY_HOLDER_UNAVAILABLE, events().get(1).details().get("reason"));
            assertEquals(
                    1,
                    history.statistics(clock.instant()).await().indefinitely().denied());
        }

        @Test
        @DisplayName("should surface a key-holder failure as unavailable")
        void shouldWrapFailure() {
            var gateway = gateway(
                    stubKeyHolder(Uni.createFrom().failure(new IllegalStateException("hsm offline"))),
                    new JwkKeyExporter(),
                    history);

            assertThrows(
                    KeyHolderUnavailableException.class,
                    () -> gateway.authorize(request(1000, 1000)).await().indefinitely());
            assertEquals(RequestStatus.DENIED, RequestCorrelator.correlate(events()).get(0).status());
        }
    }

    @Nested
    @DisplayName("validation")
    class ValidationTests {

        @Test
        @DisplayName("should reject requests without requester or valid time range before auditing")
        void shouldRejectInvalidRequests() {
            var gateway = localGateway();

            assertThrows(ValidationException.class, () -> gateway.authorize(null));
            assertThrows(
                    ValidationException.class,
                    () -> gateway.authorize(new AccessRequest(" ", new TimeRange(1, 2), null, null)));
            assertThrows(
                    ValidationException.class,
                    () -> gateway.authorize(new AccessRequest(REQUESTER, null, null, null)));
            assertThrows(
                    ValidationException.class,
                    () -> gateway.authorize(new AccessRequest(REQUESTER, new TimeRange(5, 1), null, null)));
            assertTrue(events().isEmpty());
        }
    }
}
