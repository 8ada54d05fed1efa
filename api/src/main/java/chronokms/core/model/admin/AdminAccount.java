package chronokms.core.model.admin;

import java.time.Instant;

/**
 * A human operator allowed to log in to the console.
 *
 * @param id            unique identifier
 * @param username      unique login name
 * @param passwordHash  bcrypt hash of the password
 * @param email         optional contact address
 * @param enabled       whether the account may log in
 * @param setupRequired true while the account still uses a default bootstrap password
 * @param createdAt     creation instant
 * @param updatedAt     last modification instant
 */
public record AdminAccount(
        String id,
        String username,
        String passwordHash,
        String email,
        boolean enabled,
        boolean setupRequired,
        Instant createdAt,
        Instant updatedAt) {

    public AdminAccount {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Admin ID cannot be null or blank");
        }
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Admin username cannot be null or blank");
        }
        if (passwordHash == null || passwordHash.isBlank()) {
            throw new IllegalArgumentException("Admin password hash cannot be null or blank");
        }
    }

    public AdminAccount withPasswordHash(String passwordHash, Instant now) {
        return new AdminAccount(id, username, passwordHash, email, enabled, false, createdAt, now);
    }

    public AdminAccount withEnabled(boolean enabled, Instant now) {
        return new AdminAccount(id, username, passwordHash, email, enabled, setupRequired, createdAt, now);
    }

    @Override
    public String toString() {
        return "AdminAccount[id=" + id + ", username=" + username + ", enabled=" + enabled + "]";
    }
}
