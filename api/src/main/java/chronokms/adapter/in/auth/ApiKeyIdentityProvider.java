package chronokms.adapter.in.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.security.AuthenticationFailedException;
import io.quarkus.security.identity.AuthenticationRequestContext;
import io.quarkus.security.identity.IdentityProvider;
import io.quarkus.security.identity.SecurityIdentity;
import io.quarkus.security.runtime.QuarkusSecurityIdentity;
import io.smallrye.mutiny.Uni;

import chronokms.core.model.auth.RequesterIdentity;
import chronokms.core.port.in.ApiKeyManagement;
import chronokms.core.port.out.Metrics;

/**
 * Validates API keys and builds the requester's SecurityIdentity.
 *
 * <p>The resulting {@link SecurityIdentity} contains:
 * <ul>
 *   <li>Principal name: the requester id</li>
 *   <li>Role: {@link RoleNames#REQUESTER}</li>
 *   <li>Attributes: requesterId, keyId</li>
 * </ul>
 */
@ApplicationScoped
public class ApiKeyIdentityProvider implements IdentityProvider<ApiKeyAuthenticationRequest> {

    static final String MECHANISM = "api_key";
    static final String FAILURE_MESSAGE = "Invalid or expired credentials";

    private final ApiKeyManagement apiKeyManagement;
    private final Metrics metrics;

    @Inject
    public ApiKeyIdentityProvider(ApiKeyManagement apiKeyManagement, Metrics metrics) {
        this.apiKeyManagement = apiKeyManagement;
        this.metrics = metrics;
    }

    @Override
    public Class<ApiKeyAuthenticationRequest> getRequestType() {
        return ApiKeyAuthenticationRequest.class;
    }

    @Override
    public Uni<SecurityIdentity> authenticate(
            ApiKeyAuthenticationRequest request, AuthenticationRequestContext context) {
        return apiKeyManagement.validate(request.getCredential()).map(identity -> {
            if (identity.isEmpty()) {
                metrics.recordAuthFailure(MECHANISM);
                throw new AuthenticationFailedException(FAILURE_MESSAGE);
            }
            return buildIdentity(identity.get());
        });
    }

    private SecurityIdentity buildIdentity(RequesterIdentity identity) {
        return QuarkusSecurityIdentity.builder()
                .setPrincipal(identity::requesterId)
                .addRole(RoleNames.REQUESTER)
                .addAttribute(SecurityAttributes.REQUESTER_ID, identity.requesterId())
                .addAttribute(SecurityAttributes.KEY_ID, identity.keyId())
                .build();
    }
}
