package chronokms.adapter.in.rest;

import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;

import chronokms.adapter.in.auth.RoleNames;
import chronokms.adapter.in.dto.DashboardDto;
import chronokms.core.port.in.SystemStatistics;

@Path("/api/stats")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@RolesAllowed(RoleNames.ADMIN)
public class StatsResource {

    private final SystemStatistics statistics;

    @Inject
    public StatsResource(SystemStatistics statistics) {
        this.statistics = statistics;
    }

    @GET
    public Uni<DashboardDto> summary() {
        return statistics.summary().map(DashboardDto::fromModel);
    }
}
