package chronokms.adapter.in.auth;

/**
 * Security roles used with {@code @RolesAllowed}.
 */
public final class RoleNames {

    /** Held by identities built from an admin session. */
    public static final String ADMIN = "admin";

    /** Held by identities built from a requester API key. */
    public static final String REQUESTER = "requester";

    private RoleNames() {}
}
