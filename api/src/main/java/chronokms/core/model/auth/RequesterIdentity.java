package chronokms.core.model.auth;

/**
 * The identity established by a successfully validated API key.
 *
 * @param keyId         the credential that authenticated
 * @param requesterId   the owning requester
 * @param requesterName display name of the owning requester
 */
public record RequesterIdentity(String keyId, String requesterId, String requesterName) {}
