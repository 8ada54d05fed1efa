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
import chronokms.adapter.in.dto.RequesterRequest;
import chronokms.adapter.in.problem.KmsProblem;
import chronokms.core.model.requester.Requester;
import chronokms.core.port.in.RequesterManagement;

/**
 * REST resource for requester management.
 */
@Path("/api/requesters")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@RolesAllowed(RoleNames.ADMIN)
public class RequesterResource {

    private final RequesterManagement requesters;

    @Inject
    public RequesterResource(RequesterManagement requesters) {
        this.requesters = requesters;
    }

    @GET
    public Uni<List<Requester>> list() {
        return requesters.list();
    }

    @GET
    @Path("/{id}")
    public Uni<Requester> get(@PathParam("id") String id) {
        return requesters.get(id).map(found -> found.orElseThrow(() -> KmsProblem.resourceNotFound("Requester", id)));
    }

    @POST
    public Uni<Response> create(RequesterRequest request) {
        if (request == null) {
            throw KmsProblem.badRequest("name is required");
        }
        return requesters
                .create(request.id(), request.name(), request.description(), request.metadata())
                .map(created -> Response.status(Response.Status.CREATED).entity(created).build());
    }

    /**
     * Update a requester. Disabling it invalidates its API keys at their next use.
     */
    @PUT
    @Path("/{id}")
    public Uni<Requester> update(@PathParam("id") String id, RequesterRequest request) {
        if (request == null) {
            throw KmsProblem.badRequest("request body is required");
        }
        return requesters
                .update(id, request.name(), request.description(), request.enabled(), request.metadata())
                .map(found -> found.orElseThrow(() -> KmsProblem.resourceNotFound("Requester", id)));
    }

    /**
     * Delete a requester together with its API keys.
     */
    @DELETE
    @Path("/{id}")
    public Uni<Response> delete(@PathParam("id") String id) {
        return requesters.delete(id).map(deleted -> {
            if (!deleted) {
                throw KmsProblem.resourceNotFound("Requester", id);
            }
            return Response.noContent().build();
        });
    }
}
