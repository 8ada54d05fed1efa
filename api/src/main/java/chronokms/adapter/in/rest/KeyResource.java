package chronokms.adapter.in.rest;

import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;

import chronokms.adapter.in.auth.RoleNames;
import chronokms.core.model.keyholder.KeyHolderStatus;
import chronokms.core.port.out.KeyHolder;

/**
 * Key-holder information: the master public key and its status.
 */
@Path("/api/keys")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class KeyResource {

    private final KeyHolder keyHolder;

    @Inject
    public KeyResource(KeyHolder keyHolder) {
        this.keyHolder = keyHolder;
    }

    /**
     * The master public key as a JWK, for distribution to data sources.
     */
    @GET
    @Path("/master-public")
    @RolesAllowed({RoleNames.ADMIN, RoleNames.REQUESTER})
    public Uni<Map<String, Object>> masterPublicKey() {
        return keyHolder.masterPublicKey().map(jwk -> {
            KeyHolderStatus status = keyHolder.status();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("publicKey", jwk);
            body.put("algorithm", status.keyAlgorithm());
            body.put("createdAt", status.keyCreatedAt());
            return body;
        });
    }

    @GET
    @Path("/status")
    @RolesAllowed(RoleNames.ADMIN)
    public KeyHolderStatus status() {
        return keyHolder.status();
    }
}
