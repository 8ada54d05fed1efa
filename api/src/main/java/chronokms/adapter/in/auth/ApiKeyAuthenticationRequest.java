package chronokms.adapter.in.auth;

import io.quarkus.security.identity.request.BaseAuthenticationRequest;

/**
 * Authentication request carrying the raw {@code <keyId>.<secret>} credential.
 *
 * <p>Passed from {@link ApiKeyAuthenticationMechanism} to {@link ApiKeyIdentityProvider}.
 */
public class ApiKeyAuthenticationRequest extends BaseAuthenticationRequest {

    private final String credential;

    public ApiKeyAuthenticationRequest(String credential) {
        this.credential = credential;
    }

    public String getCredential() {
        return credential;
    }
}
