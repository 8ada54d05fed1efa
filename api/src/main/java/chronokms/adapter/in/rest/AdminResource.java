package chronokms.adapter.in.rest;

import java.util.Map;

import jakarta.annotation.security.PermitAll;
import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.quarkus.security.identity.SecurityIdentity;
import io.smallrye.mutiny.Uni;

import chronokms.adapter.in.auth.RoleNames;
import chronokms.adapter.in.auth.SecurityAttributes;
import chronokms.adapter.in.dto.AdminDto;
import chronokms.adapter.in.dto.ChangePasswordRequest;
import chronokms.adapter.in.dto.LoginRequest;
import chronokms.adapter.in.dto.LoginResponse;
import chronokms.adapter.in.dto.SetupRequest;
import chronokms.adapter.in.problem.KmsProblem;
import chronokms.core.port.in.AdminManagement;
import chronokms.core.port.in.SessionManagement;

/**
 * REST resource for admin setup, login and session handling.
 */
@Path("/api/admin")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AdminResource {

    private final AdminManagement adminManagement;
    private final SessionManagement sessionManagement;
    private final SecurityIdentity identity;

    @Inject
    public AdminResource(
            AdminManagement adminManagement, SessionManagement sessionManagement, SecurityIdentity identity) {
        this.adminManagement = adminManagement;
        this.sessionManagement = sessionManagement;
        this.identity = identity;
    }

    @GET
    @Path("/setup")
    @PermitAll
    public Uni<Map<String, Object>> setupStatus() {
        return adminManagement.isSetupRequired().map(required -> Map.<String, Object>of("setupRequired", required));
    }

    /**
     * Create the first admin account. Only allowed while no admin exists.
     */
    @POST
    @Path("/setup")
    @PermitAll
    public Uni<Response> setup(SetupRequest request) {
        if (request == null) {
            throw KmsProblem.badRequest("username and password are required");
        }
        return adminManagement
                .setup(request.username(), request.password(), request.email())
                .map(admin -> Response.status(Response.Status.CREATED)
                        .entity(AdminDto.fromModel(admin))
                        .build());
    }

    @POST
    @Path("/login")
    @PermitAll
    public Uni<LoginResponse> login(LoginRequest request) {
        if (request == null) {
            throw KmsProblem.badRequest("username and password are required");
        }
        return adminManagement.login(request.username(), request.password()).map(result -> result.map(
                        login -> new LoginResponse(
                                login.session().id(),
                                login.session().expiresAt(),
                                AdminDto.fromModel(login.admin())))
                .orElseThrow(() -> KmsProblem.unauthorized("Invalid username or password")));
    }

    @POST
    @Path("/logout")
    @RolesAllowed(RoleNames.ADMIN)
    public Uni<Response> logout() {
        String sessionId = identity.getAttribute(SecurityAttributes.SESSION_ID);
        return sessionManagement
                .deleteSession(sessionId)
                .map(v -> Response.noContent().build());
    }

    /**
     * Return the admin bound to the current session.
     */
    @GET
    @Path("/session")
    @RolesAllowed(RoleNames.ADMIN)
    public Uni<AdminDto> session() {
        String adminId = identity.getAttribute(SecurityAttributes.ADMIN_ID);
        return adminManagement.findById(adminId).map(admin -> admin.map(AdminDto::fromModel)
                .orElseThrow(() -> KmsProblem.unauthorized("Session is no longer valid")));
    }

    /**
     * Change the password of the current admin. The current session stays valid.
     */
    @PUT
    @Path("/password")
    @RolesAllowed(RoleNames.ADMIN)
    public Uni<Response> changePassword(ChangePasswordRequest request) {
        if (request == null) {
            throw KmsProblem.badRequest("currentPassword and newPassword are required");
        }
        String adminId = identity.getAttribute(SecurityAttributes.ADMIN_ID);
        return adminManagement
                .changePassword(adminId, request.currentPassword(), request.newPassword())
                .map(changed -> {
                    if (!changed) {
                        throw KmsProblem.unauthorized("Current password is incorrect");
                    }
                    return Response.noContent().build();
                });
    }
}
