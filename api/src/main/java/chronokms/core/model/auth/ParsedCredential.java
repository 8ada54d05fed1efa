package chronokms.core.model.auth;

/**
 * Typed outcome of parsing a composite {@code <keyId>.<secret>} credential string.
 */
public sealed interface ParsedCredential {

    /**
     * A syntactically well-formed credential.
     */
    record WellFormed(String keyId, String secret) implements ParsedCredential {
        @Override
        public String toString() {
            return "WellFormed[keyId=" + keyId + "]";
        }
    }

    /**
     * A credential that could not be parsed.
     */
    record Malformed(Reason reason) implements ParsedCredential {}

    enum Reason {
        MISSING,
        WRONG_PART_COUNT,
        EMPTY_PART,
        BAD_KEY_ID_PREFIX,
        BAD_SECRET_PREFIX
    }
}
