package chronokms.adapter.in.auth;

/**
 * Attribute names set on authenticated identities.
 */
public final class SecurityAttributes {

    public static final String REQUESTER_ID = "requesterId";
    public static final String KEY_ID = "keyId";
    public static final String SESSION_ID = "sessionId";
    public static final String ADMIN_ID = "adminId";

    private SecurityAttributes() {}
}
