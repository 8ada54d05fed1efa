package chronokms.core.model.session;

import java.time.Instant;

/**
 * Ephemeral proof of a successful admin login.
 *
 * <p>Lifecycle: created on login, optionally refreshed on each successful
 * validation, destroyed on logout or expiry.
 *
 * @param id        high-entropy session token
 * @param adminId   bound admin account
 * @param username  admin username at login time
 * @param createdAt creation instant
 * @param expiresAt expiry instant
 */
public record AdminSession(String id, String adminId, String username, Instant createdAt, Instant expiresAt) {

    public AdminSession {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Session ID cannot be null or blank");
        }
        if (adminId == null || adminId.isBlank()) {
            throw new IllegalArgumentException("Admin ID cannot be null or blank");
        }
    }

    /**
     * A session is expired once {@code now} is strictly after its expiry instant.
     */
    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    public AdminSession withExpiresAt(Instant expiresAt) {
        return new AdminSession(id, adminId, username, createdAt, expiresAt);
    }

    /**
     * Short, log-safe prefix of the session token.
     */
    public String logId() {
        return logId(id);
    }

    public static String logId(String sessionId) {
        if (sessionId == null) {
            return "null";
        }
        return sessionId.length() <= 8 ? sessionId : sessionId.substring(0, 8) + "...";
    }

    @Override
    public String toString() {
        return "AdminSession[id=" + logId() + ", adminId=" + adminId + ", expiresAt=" + expiresAt + "]";
    }
}
