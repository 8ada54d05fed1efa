package chronokms.core.service.access;

import java.security.Key;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import chronokms.core.config.AccessConfig;
import chronokms.core.model.access.AccessRequest;
import chronokms.core.model.access.AccessRequestRecord;
import chronokms.core.model.access.AccessResponse;
import chronokms.core.model.audit.AuditEvent;
import chronokms.core.model.audit.AuditEventType;
import chronokms.core.model.common.ValidationException;
import chronokms.core.model.keyholder.KeyHolderDecision;
import chronokms.core.port.in.AuditTrail;
import chronokms.core.port.in.AuthorizationUseCase;
import chronokms.core.port.out.AccessRequestRepository;
import chronokms.core.port.out.KeyExporter;
import chronokms.core.port.out.KeyHolder;
import chronokms.core.port.out.Metrics;
import chronokms.core.service.common.SideEffectRunner;

/**
 * Pass-through boundary between callers and the key-holder.
 *
 * <p>For every request the gateway appends, in order: the request event, the
 * outcome event (linked to the request by {@code requestEventId}) and, on a
 * grant, the key generation and distribution events. Keys are exported
 * before the grant is recorded; a failed export is recorded as a failed
 * distribution followed by a denial. The audit chain is
 * subscribed eagerly so that it completes even if the caller cancels. The
 * history row is written as a detached side effect.
 */
@ApplicationScoped
public class AuthorizationGateway implements AuthorizationUseCase {

    private static final Logger LOG = Logger.getLogger(AuthorizationGateway.class);

    static final String HISTORY_TASK = "access-request-history";
    static final String KEY_HOLDER_UNAVAILABLE = "Key holder unavailable";
    static final String KEY_EXPORT_FAILED = "Key export failed";

    private final KeyHolder keyHolder;
    private final KeyExporter keyExporter;
    private final AuditTrail auditTrail;
    private final AccessRequestRepository history;
    private final SideEffectRunner sideEffects;
    private final Metrics metrics;
    private final AccessConfig config;
    private final Clock clock;

    @Inject
    public AuthorizationGateway(
            KeyHolder keyHolder,
            KeyExporter keyExporter,
            AuditTrail auditTrail,
            AccessRequestRepository history,
            SideEffectRunner sideEffects,
            Metrics metrics,
            AccessConfig config,
            Clock clock) {
        this.keyHolder = keyHolder;
        this.keyExporter = keyExporter;
        this.auditTrail = auditTrail;
        this.history = history;
        this.sideEffects = sideEffects;
        this.metrics = metrics;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public Uni<AccessResponse> authorize(AccessRequest request) {
        validate(request);

        CompletableFuture<AccessResponse> decision = process(request).subscribeAsCompletionStage();

        // Cancelling the returned Uni must not cancel the audit chain, so the future is never handed downstream.
        return Uni.createFrom().emitter(emitter -> decision.whenComplete((response, failure) -> {
            if (failure != null) {
                emitter.fail(failure instanceof CompletionException && failure.getCause() != null
                        ? failure.getCause()
                        : failure);
            } else {
                emitter.complete(response);
            }
        }));
    }

    private Uni<AccessResponse> process(AccessRequest request) {
        String requestEventId = newEventId();
        Map<String, Object> details = new LinkedHashMap<>();
        if (request.purpose() != null) {
            details.put("purpose", request.purpose());
        }
        if (!request.metadata().isEmpty()) {
            details.put("metadata", request.metadata());
        }
        AuditEvent requestEvent = new AuditEvent(
                requestEventId,
                AuditEvent.UNSEQUENCED,
                clock.millis(),
                AuditEventType.ACCESS_REQUEST,
                request.requesterId(),
                null,
                request.timeRange(),
                true,
                details);

        return auditTrail
                .append(requestEvent)
                .flatMap(appended -> Uni.createFrom()
                        .deferred(() -> keyHolder.authorize(request))
                        .ifNoItem()
                        .after(config.keyHolderTimeout())
                        .failWith(() -> new TimeoutException(
                                "Key holder did not answer within " + config.keyHolderTimeout()))
                        .onFailure()
                        .recoverWithUni(failure -> onKeyHolderFailure(request, requestEventId, failure))
                        .flatMap(decision -> decision.granted()
                                ? onGrant(request, requestEventId, decision)
                                : onDenial(request, requestEventId, decision.denialReason())));
    }

    private Uni<AccessResponse> onGrant(AccessRequest request, String requestEventId, KeyHolderDecision decision) {
        int keyCount = decision.derivedKeys().size();
        return Uni.createFrom()
                .item(() -> export(decision.derivedKeys()))
                .onItemOrFailure()
                .transformToUni((exported, failure) -> failure != null
                        ? onExportFailure(request, requestEventId, keyCount, failure)
                        : recordGrant(request, requestEventId, decision, exported));
    }

    private Uni<AccessResponse> recordGrant(
            AccessRequest request, String requestEventId, KeyHolderDecision decision, Map<Long, String> exported) {
        int keyCount = decision.derivedKeys().size();
        return appendOutcome(request, requestEventId, AuditEventType.ACCESS_GRANTED, true, Map.of("keyCount", keyCount))
                .flatMap(v -> appendOutcome(
                        request,
                        requestEventId,
                        AuditEventType.KEY_GENERATION,
                        true,
                        Map.of("keyCount", keyCount, "granularityMs", decision.granularityMs())))
                .flatMap(v -> appendOutcome(
                        request,
                        requestEventId,
                        AuditEventType.KEY_DISTRIBUTION,
                        true,
                        Map.of("keyCount", exported.size())))
                .map(v -> {
                    LOG.infof(
                            "Access granted to %s: %d key(s) for [%d, %d]",
                            request.requesterId(),
                            keyCount,
                            request.timeRange().startTime(),
                            request.timeRange().endTime());
                    metrics.recordAccessDecision(true);
                    recordHistory(request, requestEventId, true, null, keyCount);
                    return AccessResponse.granted(exported, decision.granularityMs());
                });
    }

    /**
     * Keys that cannot be exported are never delivered, so the request is
     * recorded and answered as denied.
     */
    private Uni<AccessResponse> onExportFailure(
            AccessRequest request, String requestEventId, int keyCount, Throwable failure) {
        LOG.warnf("Key export failed for request %s: %s", requestEventId, failure.getClass().getSimpleName());
        return appendOutcome(
                        request,
                        requestEventId,
                        AuditEventType.KEY_DISTRIBUTION,
                        false,
                        Map.of("keyCount", keyCount, "error", failure.getClass().getSimpleName()))
                .flatMap(v -> onDenial(request, requestEventId, KEY_EXPORT_FAILED));
    }

    private Uni<AccessResponse> onDenial(AccessRequest request, String requestEventId, String reason) {
        Map<String, Object> details = reason != null ? Map.of("reason", reason) : Map.of();
        return appendOutcome(request, requestEventId, AuditEventType.ACCESS_DENIED, false, details)
                .map(v -> {
                    LOG.infof("Access denied to %s: %s", request.requesterId(), reason);
                    metrics.recordAccessDecision(false);
                    recordHistory(request, requestEventId, false, reason, null);
                    return AccessResponse.denied(reason);
                });
    }

    private Uni<KeyHolderDecision> onKeyHolderFailure(AccessRequest request, String requestEventId, Throwable failure) {
        LOG.warnf("Key holder failed for request %s: %s", requestEventId, failure.getMessage());
        return appendOutcome(
                        request,
                        requestEventId,
                        AuditEventType.ACCESS_DENIED,
                        false,
                        Map.of("reason", KEY_HOLDER_UNAVAILABLE))
                .invoke(v -> {
                    metrics.recordAccessDecision(false);
                    recordHistory(request, requestEventId, false, KEY_HOLDER_UNAVAILABLE, null);
                })
                .flatMap(v -> Uni.createFrom()
                        .<KeyHolderDecision>failure(new KeyHolderUnavailableException(KEY_HOLDER_UNAVAILABLE, failure)));
    }

    private Uni<AuditEvent> appendOutcome(
            AccessRequest request,
            String requestEventId,
            AuditEventType type,
            boolean success,
            Map<String, Object> extra) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(AuditEvent.REQUEST_EVENT_ID, requestEventId);
        details.putAll(extra);
        return auditTrail.append(new AuditEvent(
                newEventId(),
                AuditEvent.UNSEQUENCED,
                clock.millis(),
                type,
                keyHolder.id(),
                request.requesterId(),
                request.timeRange(),
                success,
                details));
    }

    private Map<Long, String> export(Map<Long, Key> keys) {
        Map<Long, String> exported = new LinkedHashMap<>();
        keys.forEach((timestamp, key) -> exported.put(timestamp, keyExporter.export(key)));
        return exported;
    }

    private void recordHistory(
            AccessRequest request, String requestEventId, boolean granted, String denialReason, Integer keyCount) {
        var record = new AccessRequestRecord(
                requestEventId,
                request.requesterId(),
                request.timeRange(),
                request.purpose(),
                request.metadata(),
                granted,
                denialReason,
                keyCount,
                clock.instant());
        sideEffects.run(HISTORY_TASK, () -> history.save(record));
    }

    private static void validate(AccessRequest request) {
        if (request == null) {
            throw new ValidationException("body", "request body is required");
        }
        if (request.requesterId() == null || request.requesterId().isBlank()) {
            throw new ValidationException("requesterId", "requesterId is required");
        }
        if (request.timeRange() == null) {
            throw new ValidationException("timeRange", "timeRange is required");
        }
        if (!request.timeRange().isValid()) {
            throw new ValidationException("timeRange", "timeRange.startTime must not be after timeRange.endTime");
        }
    }

    private static String newEventId() {
        return UUID.randomUUID().toString();
    }
}
