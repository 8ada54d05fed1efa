package chronokms.adapter.in.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.security.AuthenticationFailedException;
import io.quarkus.security.identity.AuthenticationRequestContext;
import io.quarkus.security.identity.IdentityProvider;
import io.quarkus.security.identity.SecurityIdentity;
import io.quarkus.security.runtime.QuarkusSecurityIdentity;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import chronokms.core.model.admin.AdminAccount;
import chronokms.core.model.session.AdminSession;
import chronokms.core.port.in.AdminManagement;
import chronokms.core.port.in.SessionManagement;
import chronokms.core.port.out.Metrics;

/**
 * Validates admin sessions and builds the admin's SecurityIdentity.
 *
 * <p>A session whose admin account was removed or disabled is deleted and rejected.
 */
@ApplicationScoped
public class SessionIdentityProvider implements IdentityProvider<SessionAuthenticationRequest> {

    private static final Logger LOG = Logger.getLogger(SessionIdentityProvider.class);

    static final String MECHANISM = "session";

    private final SessionManagement sessionManagement;
    private final AdminManagement adminManagement;
    private final Metrics metrics;

    @Inject
    public SessionIdentityProvider(
            SessionManagement sessionManagement, AdminManagement adminManagement, Metrics metrics) {
        this.sessionManagement = sessionManagement;
        this.adminManagement = adminManagement;
        this.metrics = metrics;
    }

    @Override
    public Class<SessionAuthenticationRequest> getRequestType() {
        return SessionAuthenticationRequest.class;
    }

    @Override
    public Uni<SecurityIdentity> authenticate(
            SessionAuthenticationRequest request, AuthenticationRequestContext context) {
        return sessionManagement.validateSession(request.getSessionId()).flatMap(session -> {
            if (session.isEmpty()) {
                return reject();
            }
            AdminSession active = session.get();
            return adminManagement.findById(active.adminId()).flatMap(admin -> {
                if (admin.isEmpty() || !admin.get().enabled()) {
                    LOG.infof("Session %s belongs to a missing or disabled admin, deleting", active.logId());
                    return sessionManagement.deleteSession(active.id()).flatMap(v -> reject());
                }
                return Uni.createFrom().item(buildIdentity(active, admin.get()));
            });
        });
    }

    private Uni<SecurityIdentity> reject() {
        metrics.recordAuthFailure(MECHANISM);
        return Uni.createFrom().failure(new AuthenticationFailedException(ApiKeyIdentityProvider.FAILURE_MESSAGE));
    }

    private static SecurityIdentity buildIdentity(AdminSession session, AdminAccount admin) {
        return QuarkusSecurityIdentity.builder()
                .setPrincipal(admin::username)
                .addRole(RoleNames.ADMIN)
                .addAttribute(SecurityAttributes.SESSION_ID, session.id())
                .addAttribute(SecurityAttributes.ADMIN_ID, admin.id())
                .build();
    }
}
