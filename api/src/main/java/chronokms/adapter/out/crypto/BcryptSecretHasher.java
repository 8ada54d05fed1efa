package chronokms.adapter.out.crypto;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;
import org.springframework.security.crypto.bcrypt.BCrypt;

import chronokms.core.port.out.SecretHasher;

/**
 * Bcrypt hashing for API-key secrets and admin passwords.
 *
 * <p>Each hash carries its own salt and cost, so secrets hashed with an older
 * work factor keep verifying after the configured rounds change.
 */
@ApplicationScoped
public class BcryptSecretHasher implements SecretHasher {

    private static final Logger LOG = Logger.getLogger(BcryptSecretHasher.class);

    static final int MIN_ROUNDS = 4;
    static final int MAX_ROUNDS = 31;

    @Override
    public String hash(String secret, int workFactor) {
        if (workFactor < MIN_ROUNDS || workFactor > MAX_ROUNDS) {
            throw new IllegalArgumentException(
                    "Bcrypt work factor must be between " + MIN_ROUNDS + " and " + MAX_ROUNDS + ": " + workFactor);
        }
        return BCrypt.hashpw(secret, BCrypt.gensalt(workFactor));
    }

    @Override
    public boolean matches(String secret, String hash) {
        if (secret == null || hash == null || hash.isEmpty()) {
            return false;
        }
        try {
            return BCrypt.checkpw(secret, hash);
        } catch (IllegalArgumentException e) {
            LOG.debugf("Stored hash is not a valid bcrypt hash: %s", e.getMessage());
            return false;
        }
    }
}
