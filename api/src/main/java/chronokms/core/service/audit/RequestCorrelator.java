package chronokms.core.service.audit;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import chronokms.core.config.AccessConfig;
import chronokms.core.config.AuditConfig;
import chronokms.core.model.access.CorrelatedRequest;
import chronokms.core.model.access.Page;
import chronokms.core.model.access.RequestStatus;
import chronokms.core.model.access.TimeRange;
import chronokms.core.model.audit.AuditEvent;
import chronokms.core.model.audit.AuditEventType;
import chronokms.core.model.audit.AuditFilter;
import chronokms.core.model.common.ValidationException;
import chronokms.core.port.in.AuditTrail;
import chronokms.core.port.in.RequestCorrelation;

/**
 * Pairs request events with outcome events to reconstruct request status.
 *
 * <p>Matching runs in two passes over a bounded window:
 * <ol>
 *   <li>an outcome carrying a {@code requestEventId} detail is bound to that request;</li>
 *   <li>every remaining request, oldest first, takes the earliest unclaimed
 *       outcome that involves its requester and comes after it in
 *       (timestamp, sequence) order.</li>
 * </ol>
 *
 * <p>Each outcome is claimed at most once. A request without an outcome is
 * {@link RequestStatus#PENDING}. Cost is O(n·m) in the window.
 */
@ApplicationScoped
public class RequestCorrelator implements RequestCorrelation {

    /** Total order over events: timestamp, then insertion sequence, then id. */
    static final Comparator<AuditEvent> EVENT_ORDER = Comparator.comparingLong(AuditEvent::timestamp)
            .thenComparingLong(AuditEvent::sequence)
            .thenComparing(AuditEvent::id);

    static final int DEFAULT_LIMIT = 50;

    private final AuditTrail auditTrail;
    private final AuditConfig auditConfig;
    private final AccessConfig accessConfig;
    private final Clock clock;

    @Inject
    public RequestCorrelator(AuditTrail auditTrail, AuditConfig auditConfig, AccessConfig accessConfig, Clock clock) {
        this.auditTrail = auditTrail;
        this.auditConfig = auditConfig;
        this.accessConfig = accessConfig;
        this.clock = clock;
    }

    @Override
    public Uni<Page<CorrelatedRequest>> listRequests(
            String requesterId, TimeRange window, RequestStatus status, int limit, int offset) {
        TimeRange effective = resolveWindow(window);

        // Outcomes may land shortly after the last request in the window.
        long grace = accessConfig.keyHolderTimeout().toMillis();
        long fetchEnd = effective.endTime() > Long.MAX_VALUE - grace ? Long.MAX_VALUE : effective.endTime() + grace;
        AuditFilter filter = AuditFilter.byTimeRange(new TimeRange(effective.startTime(), fetchEnd));

        return auditTrail.retrieve(filter).map(events -> {
            List<CorrelatedRequest> matched = correlate(events).stream()
                    .filter(r -> effective.contains(r.timestamp()))
                    .filter(r -> requesterId == null || requesterId.isBlank() || requesterId.equals(r.requesterId()))
                    .filter(r -> status == null || status == r.status())
                    .sorted(Comparator.comparingLong(CorrelatedRequest::timestamp)
                            .thenComparing(CorrelatedRequest::id)
                            .reversed())
                    .toList();
            return Page.of(matched, limit > 0 ? limit : DEFAULT_LIMIT, Math.max(offset, 0));
        });
    }

    /**
     * Correlates every request event in {@code events} with at most one outcome.
     *
     * @param events events in any order
     * @return one entry per request event, oldest first
     */
    public static List<CorrelatedRequest> correlate(List<AuditEvent> events) {
        List<AuditEvent> ordered = new ArrayList<>(events);
        ordered.sort(EVENT_ORDER);

        List<AuditEvent> requests = new ArrayList<>();
        List<AuditEvent> outcomes = new ArrayList<>();
        Set<String> requestIds = new HashSet<>();
        for (AuditEvent event : ordered) {
            if (event.eventType() == AuditEventType.ACCESS_REQUEST) {
                requests.add(event);
                requestIds.add(event.id());
            } else if (event.eventType().isOutcome()) {
                outcomes.add(event);
            }
        }

        Map<String, AuditEvent> outcomeByRequest = new HashMap<>();
        Set<String> claimed = new HashSet<>();

        for (AuditEvent outcome : outcomes) {
            String linked = outcome.requestEventId();
            if (linked == null) {
                continue;
            }
            // A linked outcome never answers a different request, even if its own request is outside the window.
            claimed.add(outcome.id());
            if (requestIds.contains(linked) && !outcomeByRequest.containsKey(linked)) {
                outcomeByRequest.put(linked, outcome);
            }
        }

        for (AuditEvent request : requests) {
            if (outcomeByRequest.containsKey(request.id())) {
                continue;
            }
            String requester = request.actor();
            for (AuditEvent outcome : outcomes) {
                if (claimed.contains(outcome.id())
                        || EVENT_ORDER.compare(outcome, request) <= 0
                        || !outcome.involves(requester)) {
                    continue;
                }
                claimed.add(outcome.id());
                outcomeByRequest.put(request.id(), outcome);
                break;
            }
        }

        List<CorrelatedRequest> result = new ArrayList<>(requests.size());
        for (AuditEvent request : requests) {
            AuditEvent outcome = outcomeByRequest.get(request.id());
            result.add(new CorrelatedRequest(
                    request.id(),
                    request.timestamp(),
                    request.actor(),
                    request.timeRange(),
                    purposeOf(request),
                    statusOf(outcome),
                    outcome != null ? outcome.id() : null));
        }
        return result;
    }

    private TimeRange resolveWindow(TimeRange window) {
        if (window == null) {
            long now = clock.millis();
            return new TimeRange(now - auditConfig.defaultCorrelationWindow().toMillis(), now);
        }
        if (!window.isValid()) {
            throw new ValidationException("startTime", "startTime must not be after endTime");
        }
        Duration max = auditConfig.maxCorrelationWindow();
        if (window.durationMillis() > max.toMillis()) {
            throw new ValidationException("endTime", "time window must not exceed " + max);
        }
        return window;
    }

    private static RequestStatus statusOf(AuditEvent outcome) {
        if (outcome == null) {
            return RequestStatus.PENDING;
        }
        return outcome.eventType() == AuditEventType.ACCESS_GRANTED ? RequestStatus.GRANTED : RequestStatus.DENIED;
    }

    private static String purposeOf(AuditEvent request) {
        Object purpose = request.details().get("purpose");
        return purpose != null ? purpose.toString() : null;
    }
}
