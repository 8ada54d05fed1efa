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
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.quarkus.security.identity.SecurityIdentity;
import io.smallrye.mutiny.Uni;

import chronokms.adapter.in.auth.RoleNames;
import chronokms.adapter.in.dto.ApiKeyDto;
import chronokms.adapter.in.dto.GenerateApiKeyRequest;
import chronokms.adapter.in.dto.GeneratedApiKeyDto;
import chronokms.adapter.in.dto.UpdateApiKeyRequest;
import chronokms.adapter.in.problem.KmsProblem;
import chronokms.core.port.in.ApiKeyManagement;

/**
 * REST resource for requester API keys.
 *
 * <p>The plaintext credential is only part of the response to {@code POST /generate}.
 * Hashes are never returned.
 */
@Path("/api/api-keys")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@RolesAllowed(RoleNames.ADMIN)
public class ApiKeyResource {

    private final ApiKeyManagement apiKeys;
    private final SecurityIdentity identity;

    @Inject
    public ApiKeyResource(ApiKeyManagement apiKeys, SecurityIdentity identity) {
        this.apiKeys = apiKeys;
        this.identity = identity;
    }

    @GET
    public Uni<List<ApiKeyDto>> list(@QueryParam("requesterId") String requesterId) {
        return apiKeys.list(requesterId)
                .map(keys -> keys.stream().map(ApiKeyDto::fromModel).toList());
    }

    @GET
    @Path("/{keyId}")
    public Uni<ApiKeyDto> get(@PathParam("keyId") String keyId) {
        return apiKeys.get(keyId).map(found -> found.map(ApiKeyDto::fromModel)
                .orElseThrow(() -> KmsProblem.resourceNotFound("API key", keyId)));
    }

    @POST
    @Path("/generate")
    public Uni<Response> generate(GenerateApiKeyRequest request) {
        if (request == null) {
            throw KmsProblem.badRequest("requesterId is required");
        }
        String createdBy = identity.getPrincipal().getName();
        return apiKeys.generate(request.requesterId(), request.name(), request.expiresAt(), createdBy)
                .map(result -> Response.status(Response.Status.CREATED)
                        .entity(GeneratedApiKeyDto.fromModel(result))
                        .build());
    }

    @PUT
    @Path("/{keyId}")
    public Uni<ApiKeyDto> update(@PathParam("keyId") String keyId, UpdateApiKeyRequest request) {
        if (request == null) {
            throw KmsProblem.badRequest("request body is required");
        }
        return setFields(keyId, request.name(), request.enabled());
    }

    @PUT
    @Path("/{keyId}/enable")
    public Uni<ApiKeyDto> enable(@PathParam("keyId") String keyId) {
        return setFields(keyId, null, true);
    }

    @PUT
    @Path("/{keyId}/disable")
    public Uni<ApiKeyDto> disable(@PathParam("keyId") String keyId) {
        return setFields(keyId, null, false);
    }

    /**
     * Revoke (delete) an API key. It fails validation from then on.
     */
    @DELETE
    @Path("/{keyId}")
    public Uni<Response> revoke(@PathParam("keyId") String keyId) {
        return apiKeys.revoke(keyId).map(revoked -> {
            if (!revoked) {
                throw KmsProblem.resourceNotFound("API key", keyId);
            }
            return Response.noContent().build();
        });
    }

    private Uni<ApiKeyDto> setFields(String keyId, String name, Boolean enabled) {
        return apiKeys.update(keyId, name, enabled).map(found -> found.map(ApiKeyDto::fromModel)
                .orElseThrow(() -> KmsProblem.resourceNotFound("API key", keyId)));
    }
}
