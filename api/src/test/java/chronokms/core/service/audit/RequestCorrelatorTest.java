package chronokms.core.service.audit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import chronokms.adapter.out.storage.memory.InMemoryAuditLogRepository;
import chronokms.core.model.access.CorrelatedRequest;
import chronokms.core.model.access.Page;
import chronokms.core.model.access.RequestStatus;
import chronokms.core.model.access.TimeRange;
import chronokms.core.model.audit.AuditEvent;
import chronokms.core.model.audit.AuditEventType;
import chronokms.core.model.common.ValidationException;
import chronokms.support.MutableClock;
import chronokms.support.TestConfigs;

@DisplayName("RequestCorrelator")
class RequestCorrelatorTest {

    private static final String KEY_HOLDER = "kms-test";
    private static final TimeRange RANGE = new TimeRange(1000, 2000);

    private static AuditEvent request(String id, long timestamp, long sequence, String requester) {
        return new AuditEvent(
                id, sequence, timestamp, AuditEventType.ACCESS_REQUEST, requester, null, RANGE, true, Map.of());
    }

    private static AuditEvent outcome(
            String id, long timestamp, long sequence, AuditEventType type, String requester, String linkedTo) {
        Map<String, Object> details = linkedTo != null ? Map.of(AuditEvent.REQUEST_EVENT_ID, linkedTo) : Map.of();
        return new AuditEvent(
                id,
                sequence,
                timestamp,
                type,
                KEY_HOLDER,
                requester,
                RANGE,
                type == AuditEventType.ACCESS_GRANTED,
                details);
    }

    private static Map<String, CorrelatedRequest> byId(List<CorrelatedRequest> correlated) {
        Map<String, CorrelatedRequest> result = new java.util.HashMap<>();
        correlated.forEach(r -> result.put(r.id(), r));
        return result;
    }

    @Nested
    @DisplayName("correlate")
    class CorrelateTests {

        @Test
        @DisplayName("should bind outcomes to the request they reference")
        void shouldUseRequestEventId() {
            var events = List.of(
                    request("r1", 100, 0, "alice"),
                    request("r2", 100, 1, "alice"),
                    outcome("o2", 110, 2, AuditEventType.ACCESS_DENIED, "alice", "r2"),
                    outcome("o1", 120, 3, AuditEventType.ACCESS_GRANTED, "alice", "r1"));

            var result = byId(RequestCorrelator.correlate(events));

            assertEquals(RequestStatus.GRANTED, result.get("r1").status());
            assertEquals("o1", result.get("r1").outcomeEventId());
            assertEquals(RequestStatus.DENIED, result.get("r2").status());
            assertEquals("o2", result.get("r2").outcomeEventId());
        }

        @Test
        @DisplayName("should match unlinked outcomes to the earliest earlier request of the same requester")
        void shouldMatchTemporally() {
            var events = List.of(
                    request("r1", 100, 0, "alice"),
                    request("r2", 200, 1, "bob"),
                    request("r3", 300, 2, "alice"),
                    outcome("o1", 150, 3, AuditEventType.ACCESS_GRANTED, "alice", null),
                    outcome("o2", 250, 4, AuditEventType.ACCESS_DENIED, "bob", null),
                    outcome("o3", 350, 5, AuditEventType.ACCESS_DENIED, "alice", null));

            var result = byId(RequestCorrelator.correlate(events));

            assertEquals("o1", result.get("r1").outcomeEventId());
            assertEquals("o2", result.get("r2").outcomeEventId());
            assertEquals("o3", result.get("r3").outcomeEventId());
            assertEquals(RequestStatus.DENIED, result.get("r3").status());
        }

        @Test
        @DisplayName("should report a request without an outcome as pending, not denied")
        void shouldReportPending() {
            var events = List.of(
                    request("r1", 100, 0, "alice"),
                    outcome("o1", 110, 1, AuditEventType.ACCESS_GRANTED, "alice", null),
                    request("r2", 200, 2, "alice"));

            var result = byId(RequestCorrelator.correlate(events));

            assertEquals(RequestStatus.GRANTED, result.get("r1").status());
            assertEquals(RequestStatus.PENDING, result.get("r2").status());
            assertNull(result.get("r2").outcomeEventId());
        }

        @Test
        @DisplayName("should never attribute an outcome that precedes the request")
        void shouldIgnoreEarlierOutcomes() {
            var events = List.of(
                    outcome("o0", 50, 0, AuditEventType.ACCESS_GRANTED, "alice", null),
                    request("r1", 100, 1, "alice"));

            var result = byId(RequestCorrelator.correlate(events));

            assertEquals(RequestStatus.PENDING, result.get("r1").status());
        }

        @Test
        @DisplayName("should never reuse a linked outcome for another request")
        void shouldNotReuseLinkedOutcome() {
            var events = List.of(
                    request("r1", 100, 0, "alice"),
                    outcome("o-outside", 110, 1, AuditEventType.ACCESS_GRANTED, "alice", "r-out-of-window"));

            var result = byId(RequestCorrelator.correlate(events));

            assertEquals(RequestStatus.PENDING, result.get("r1").status());
        }

        @Test
        @DisplayName("should order events sharing a millisecond by insertion sequence")
        void shouldBreakTimestampTiesBySequence() {
            var events = List.of(
                    request("r1", 100, 0, "alice"),
                    outcome("o1", 100, 1, AuditEventType.ACCESS_DENIED, "alice", null),
                    request("r2", 100, 2, "alice"),
                    outcome("o2", 100, 3, AuditEventType.ACCESS_GRANTED, "alice", null));

            var result = byId(RequestCorrelator.correlate(events));

            assertEquals("o1", result.get("r1").outcomeEventId());
            assertEquals("o2", result.get("r2").outcomeEventId());
        }

        @Test
        @DisplayName("should attribute each outcome at most once and be independent of input order")
        void shouldNeverDoubleAttribute() {
            List<AuditEvent> events = new ArrayList<>();
            long sequence = 0;
            for (int i = 0; i < 20; i++) {
                String requester = i % 3 == 0 ? "alice" : "bob";
                events.add(request("r" + i, 100L * i, sequence++, requester));
                if (i % 4 != 0) {
                    events.add(outcome(
                            "o" + i, 100L * i + 10, sequence++, AuditEventType.ACCESS_GRANTED, requester, null));
                }
            }

            List<CorrelatedRequest> ordered = RequestCorrelator.correlate(events);
            Collections.shuffle(events, new java.util.Random(42));
            List<CorrelatedRequest> shuffled = RequestCorrelator.correlate(events);

            assertEquals(ordered, shuffled);
            Set<String> seen = new HashSet<>();
            for (CorrelatedRequest correlated : ordered) {
                if (correlated.outcomeEventId() != null) {
                    assertEquals(true, seen.add(correlated.outcomeEventId()));
                }
            }
            assertEquals(15, seen.size());
        }
    }

    @Nested
    @DisplayName("listRequests")
    class ListRequestsTests {

        private final MutableClock clock = MutableClock.at(10_000);

        private RequestCorrelator correlator(InMemoryAuditLogRepository repository) {
            return new RequestCorrelator(
                    new AuditTrailService(repository),
                    TestConfigs.audit(Duration.ofSeconds(5), Duration.ofSeconds(60)),
                    TestConfigs.access(),
                    clock);
        }

        @Test
        @DisplayName("should filter by status and requester and return newest first")
        void shouldFilterAndSort() {
            var repository = new InMemoryAuditLogRepository();
            List.of(
                            request("r1", 6000, 0, "alice"),
                            outcome("o1", 6001, 0, AuditEventType.ACCESS_GRANTED, "alice", "r1"),
                            request("r2", 7000, 0, "alice"),
                            request("r3", 8000, 0, "bob"),
                            outcome("o3", 8001, 0, AuditEventType.ACCESS_DENIED, "bob", "r3"),
                            request("r4", 9000, 0, "alice"),
                            outcome("o4", 9001, 0, AuditEventType.ACCESS_GRANTED, "alice", "r4"))
                    .forEach(e -> repository.append(e).await().indefinitely());

            Page<CorrelatedRequest> granted =
                    correlator(repository).listRequests("alice", null, RequestStatus.GRANTED, 10, 0)
                            .await()
                            .indefinitely();

            assertEquals(
                    List.of("r4", "r1"),
                    granted.items().stream().map(CorrelatedRequest::id).toList());
            assertEquals(2, granted.total());
        }

        @Test
        @DisplayName("should exclude requests outside the default window")
        void shouldApplyDefaultWindow() {
            var repository = new InMemoryAuditLogRepository();
            repository.append(request("old", 1000, 0, "alice")).await().indefinitely();
            repository.append(request("recent", 9000, 0, "alice")).await().indefinitely();

            Page<CorrelatedRequest> page =
                    correlator(repository).listRequests(null, null, null, 10, 0).await().indefinitely();

            assertEquals(
                    List.of("recent"),
                    page.items().stream().map(CorrelatedRequest::id).toList());
        }

        @Test
        @DisplayName("should fall back to the default page size for a non-positive limit")
        void shouldDefaultNonPositiveLimit() {
            var repository = new InMemoryAuditLogRepository();
            repository.append(request("r1", 6000, 0, "alice")).await().indefinitely();
            repository.append(request("r2", 7000, 0, "alice")).await().indefinitely();
            var correlator = correlator(repository);

            Page<CorrelatedRequest> zero = correlator.listRequests(null, null, null, 0, 0).await().indefinitely();
            Page<CorrelatedRequest> negative =
                    correlator.listRequests(null, null, null, -5, -1).await().indefinitely();

            assertEquals(2, zero.items().size());
            assertEquals(RequestCorrelator.DEFAULT_LIMIT, zero.limit());
            assertEquals(2, negative.items().size());
            assertEquals(0, negative.offset());
        }

        @Test
        @DisplayName("should page safely with the largest possible limit")
        void shouldHandleMaximumLimit() {
            var repository = new InMemoryAuditLogRepository();
            repository.append(request("r1", 6000, 0, "alice")).await().indefinitely();
            repository.append(request("r2", 7000, 0, "alice")).await().indefinitely();

            Page<CorrelatedRequest> page = correlator(repository)
                    .listRequests(null, null, null, Integer.MAX_VALUE, 1)
                    .await()
                    .indefinitely();

            assertEquals(List.of("r1"), page.items().stream().map(CorrelatedRequest::id).toList());
            assertEquals(2, page.total());
        }

        @Test
        @DisplayName("should reject an inverted or oversized window")
        void shouldRejectBadWindow() {
            var correlator = correlator(new InMemoryAuditLogRepository());

            assertThrows(
                    ValidationException.class,
                    () -> correlator.listRequests(null, new TimeRange(2000, 1000), null, 10, 0));
            assertThrows(
                    ValidationException.class,
                    () -> correlator.listRequests(null, new TimeRange(0, 120_000), null, 10, 0));
        }
    }
}
