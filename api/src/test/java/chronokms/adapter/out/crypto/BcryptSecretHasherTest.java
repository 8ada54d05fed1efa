package chronokms.adapter.out.crypto;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("BcryptSecretHasher")
class BcryptSecretHasherTest {

    private final BcryptSecretHasher hasher = new BcryptSecretHasher();

    @Test
    @DisplayName("should verify only the hashed secret")
    void shouldVerify() {
        String hash = hasher.hash("sk_secret", BcryptSecretHasher.MIN_ROUNDS);

        assertNotEquals("sk_secret", hash);
        assertTrue(hash.startsWith("$2a$04$"));
        assertTrue(hasher.matches("sk_secret", hash));
        assertFalse(hasher.matches("sk_secreT", hash));
    }

    @Test
    @DisplayName("should treat missing or corrupt hashes as a mismatch")
    void shouldRejectCorruptHash() {
        assertFalse(hasher.matches("sk_secret", null));
        assertFalse(hasher.matches(null, "$2a$04$abc"));
        assertFalse(hasher.matches("sk_secret", "not-a-bcrypt-hash"));
    }

    @Test
    @DisplayName("should reject work factors bcrypt cannot use")
    void shouldRejectInvalidWorkFactor() {
        assertThrows(IllegalArgumentException.class, () -> hasher.hash("sk_secret", 3));
        assertThrows(IllegalArgumentException.class, () -> hasher.hash("sk_secret", 32));
    }
}
