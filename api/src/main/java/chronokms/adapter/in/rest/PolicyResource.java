package chronokms.adapter.in.rest;

import java.util.List;

import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import chronokms.adapter.in.auth.RoleNames;
import chronokms.adapter.in.dto.PolicyRequest;
import chronokms.adapter.in.problem.KmsProblem;
import chronokms.core.model.policy.Policy;
import chronokms.core.port.in.PolicyManagement;

/**
 * REST resource for the policies served to the key-holder.
 */
@Path("/api/policies")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@RolesAllowed(RoleNames.ADMIN)
public class PolicyResource {

    private final PolicyManagement policies;

    @Inject
    public PolicyResource(PolicyManagement policies) {
        this.policies = policies;
    }

    @GET
    public Uni<List<Policy>> list() {
        return policies.list();
    }

    @GET
    @Path("/{id}")
    public Uni<Policy> get(@PathParam("id") String id) {
        return policies.get(id).map(found -> found.orElseThrow(() -> KmsProblem.resourceNotFound("Policy", id)));
    }

    @POST
    public Uni<Response> create(PolicyRequest request) {
        if (request == null) {
            throw KmsProblem.badRequest("name is required");
        }
        return policies.create(
                        request.name(), request.type(), request.priority(), request.config(), request.description())
                .map(created -> Response.status(Response.Status.CREATED).entity(created).build());
    }

    @DELETE
    @Path("/{id}")
    public Uni<Response> delete(@PathParam("id") String id) {
        return policies.delete(id).map(deleted -> {
            if (!deleted) {
                throw KmsProblem.resourceNotFound("Policy", id);
            }
            return Response.noContent().build();
        });
    }

    @PUT
    @Path("/{id}/enable")
    public Uni<Policy> enable(@PathParam("id") String id) {
        return setEnabled(id, true);
    }

    @PUT
    @Path("/{id}/disable")
    public Uni<Policy> disable(@PathParam("id") String id) {
        return setEnabled(id, false);
    }

    private Uni<Policy> setEnabled(String id, boolean enabled) {
        return policies.setEnabled(id, enabled)
                .map(found -> found.orElseThrow(() -> KmsProblem.resourceNotFound("Policy", id)));
    }
}
