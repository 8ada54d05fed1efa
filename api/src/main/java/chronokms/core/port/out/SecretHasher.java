package chronokms.core.port.out;

/**
 * Adaptive, salted one-way hashing for secrets and passwords.
 *
 * <p>Hashes are never inverted; {@link #matches(String, String)} is the only check.
 */
public interface SecretHasher {

    /**
     * Hash a secret with the given work factor.
     */
    String hash(String secret, int workFactor);

    /**
     * Check a plaintext secret against a stored hash. Malformed hashes never match.
     */
    boolean matches(String secret, String hash);
}
