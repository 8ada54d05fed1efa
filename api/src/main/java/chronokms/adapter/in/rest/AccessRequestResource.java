package chronokms.adapter.in.rest;

import java.util.Locale;

import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import io.quarkus.security.identity.SecurityIdentity;
import io.smallrye.mutiny.Uni;

import chronokms.adapter.in.auth.RoleNames;
import chronokms.adapter.in.auth.SecurityAttributes;
import chronokms.adapter.in.dto.AccessRequestDto;
import chronokms.adapter.in.dto.AccessResponseDto;
import chronokms.adapter.in.dto.CorrelatedRequestDto;
import chronokms.adapter.in.dto.PageDto;
import chronokms.adapter.in.problem.KmsProblem;
import chronokms.core.model.access.AccessRequestQuery;
import chronokms.core.model.access.AccessRequestRecord;
import chronokms.core.model.access.AccessRequestStatistics;
import chronokms.core.model.access.RequestStatus;
import chronokms.core.model.access.TimeRange;
import chronokms.core.port.in.AccessHistory;
import chronokms.core.port.in.AuthorizationUseCase;
import chronokms.core.port.in.RequestCorrelation;

/**
 * REST resource for submitting access requests and listing their outcomes.
 *
 * <p>Requesters authenticate with their API key and may only act for
 * themselves. Admins may submit on behalf of any requester.
 */
@Path("/api/access-requests")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AccessRequestResource {

    static final int DEFAULT_LIMIT = 50;

    private final AuthorizationUseCase authorization;
    private final RequestCorrelation correlation;
    private final AccessHistory history;
    private final SecurityIdentity identity;

    @Inject
    public AccessRequestResource(
            AuthorizationUseCase authorization,
            RequestCorrelation correlation,
            AccessHistory history,
            SecurityIdentity identity) {
        this.authorization = authorization;
        this.correlation = correlation;
        this.history = history;
        this.identity = identity;
    }

    @POST
    @RolesAllowed({RoleNames.ADMIN, RoleNames.REQUESTER})
    public Uni<AccessResponseDto> submit(AccessRequestDto request) {
        if (request == null) {
            throw KmsProblem.badRequest("request body is required");
        }
        String requesterId = effectiveRequesterId(request.requesterId());
        return authorization.authorize(request.toModel(requesterId)).map(AccessResponseDto::fromModel);
    }

    /**
     * List requests reconstructed from the audit trail, newest first.
     *
     * @param status {@code all} (default), {@code granted}, {@code denied} or {@code pending}
     */
    @GET
    @RolesAllowed(RoleNames.ADMIN)
    public Uni<PageDto<CorrelatedRequestDto>> list(
            @QueryParam("requesterId") String requesterId,
            @QueryParam("startTime") Long startTime,
            @QueryParam("endTime") Long endTime,
            @QueryParam("status") @DefaultValue("all") String status,
            @QueryParam("limit") @DefaultValue("50") int limit,
            @QueryParam("offset") @DefaultValue("0") int offset) {
        return correlation
                .listRequests(requesterId, window(startTime, endTime), parseStatus(status), limit, offset)
                .map(page -> PageDto.fromModel(page, CorrelatedRequestDto::fromModel));
    }

    @GET
    @Path("/history")
    @RolesAllowed(RoleNames.ADMIN)
    public Uni<PageDto<AccessRequestRecord>> history(
            @QueryParam("requesterId") String requesterId,
            @QueryParam("startTime") Long startTime,
            @QueryParam("endTime") Long endTime,
            @QueryParam("granted") Boolean granted,
            @QueryParam("limit") @DefaultValue("50") int limit,
            @QueryParam("offset") @DefaultValue("0") int offset) {
        var query = new AccessRequestQuery(requesterId, window(startTime, endTime), granted, limit, offset);
        return history.list(query).map(page -> PageDto.fromModel(page, record -> record));
    }

    @GET
    @Path("/stats")
    @RolesAllowed(RoleNames.ADMIN)
    public Uni<AccessRequestStatistics> statistics() {
        return history.statistics();
    }

    private String effectiveRequesterId(String requested) {
        if (identity.hasRole(RoleNames.ADMIN)) {
            if (requested == null || requested.isBlank()) {
                throw KmsProblem.validationError("requesterId", "requesterId is required");
            }
            return requested;
        }
        String caller = identity.getAttribute(SecurityAttributes.REQUESTER_ID);
        if (requested != null && !requested.isBlank() && !requested.equals(caller)) {
            throw KmsProblem.forbidden("API key does not belong to requester " + requested);
        }
        return caller;
    }

    private static TimeRange window(Long startTime, Long endTime) {
        if (startTime == null && endTime == null) {
            return null;
        }
        if (startTime == null || endTime == null) {
            throw KmsProblem.validationError("startTime and endTime must be given together");
        }
        return new TimeRange(startTime, endTime);
    }

    private static RequestStatus parseStatus(String status) {
        if (status == null || status.isBlank() || "all".equalsIgnoreCase(status)) {
            return null;
        }
        try {
            return RequestStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw KmsProblem.validationError("status", "Unknown status: " + status);
        }
    }
}
