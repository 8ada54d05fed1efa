package chronokms.adapter.in.rest;

import java.util.List;

import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;

import chronokms.adapter.in.auth.RoleNames;
import chronokms.adapter.in.dto.AuditStatisticsDto;
import chronokms.adapter.in.dto.PageDto;
import chronokms.adapter.in.problem.KmsProblem;
import chronokms.core.model.access.Page;
import chronokms.core.model.access.TimeRange;
import chronokms.core.model.audit.AuditEvent;
import chronokms.core.model.audit.AuditEventType;
import chronokms.core.model.audit.AuditFilter;
import chronokms.core.port.in.AuditTrail;

/**
 * Read-only access to the audit trail.
 */
@Path("/api/audit-logs")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@RolesAllowed(RoleNames.ADMIN)
public class AuditLogResource {

    private final AuditTrail auditTrail;

    @Inject
    public AuditLogResource(AuditTrail auditTrail) {
        this.auditTrail = auditTrail;
    }

    /**
     * List events oldest first, paginated.
     */
    @GET
    public Uni<PageDto<AuditEvent>> list(
            @QueryParam("eventType") String eventType,
            @QueryParam("actor") String actor,
            @QueryParam("startTime") Long startTime,
            @QueryParam("endTime") Long endTime,
            @QueryParam("success") Boolean success,
            @QueryParam("limit") @DefaultValue("100") int limit,
            @QueryParam("offset") @DefaultValue("0") int offset) {
        AuditFilter filter = filter(eventType, actor, startTime, endTime, success);
        int pageSize = limit > 0 ? limit : 100;
        return auditTrail.retrieve(filter).map(events -> PageDto.fromModel(
                Page.of(events, pageSize, Math.max(offset, 0)), event -> event));
    }

    @GET
    @Path("/stats")
    public Uni<AuditStatisticsDto> statistics(
            @QueryParam("eventType") String eventType,
            @QueryParam("actor") String actor,
            @QueryParam("startTime") Long startTime,
            @QueryParam("endTime") Long endTime,
            @QueryParam("success") Boolean success) {
        return auditTrail
                .statistics(filter(eventType, actor, startTime, endTime, success))
                .map(AuditStatisticsDto::fromModel);
    }

    /**
     * The event types that can be used as a filter.
     */
    @GET
    @Path("/event-types")
    public List<String> eventTypes() {
        return List.of(AuditEventType.values()).stream().map(Enum::name).toList();
    }

    private static AuditFilter filter(String eventType, String actor, Long startTime, Long endTime, Boolean success) {
        AuditEventType type = null;
        if (eventType != null && !eventType.isBlank()) {
            type = AuditEventType.fromName(eventType)
                    .orElseThrow(() -> KmsProblem.validationError("eventType", "Unknown event type: " + eventType));
        }
        TimeRange range = null;
        if (startTime != null || endTime != null) {
            range = new TimeRange(
                    startTime != null ? startTime : Long.MIN_VALUE, endTime != null ? endTime : Long.MAX_VALUE);
            if (!range.isValid()) {
                throw KmsProblem.validationError("startTime", "startTime must not be after endTime");
            }
        }
        return new AuditFilter(range, type, actor != null && !actor.isBlank() ? actor : null, success);
    }
}
