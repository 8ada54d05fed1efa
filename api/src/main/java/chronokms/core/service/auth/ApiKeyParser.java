package chronokms.core.service.auth;

import chronokms.core.model.auth.ApiKeyPair;
import chronokms.core.model.auth.ParsedCredential;
import chronokms.core.model.auth.ParsedCredential.Malformed;
import chronokms.core.model.auth.ParsedCredential.Reason;
import chronokms.core.model.auth.ParsedCredential.WellFormed;

/**
 * Strict parser for {@code <keyId>.<secret>} credentials.
 */
public final class ApiKeyParser {

    public static final String KEY_ID_PREFIX = "ck_";
    public static final String SECRET_PREFIX = "sk_";

    private ApiKeyParser() {}

    public static ParsedCredential parse(String credential) {
        if (credential == null || credential.isBlank()) {
            return new Malformed(Reason.MISSING);
        }
        int separator = credential.indexOf(ApiKeyPair.SEPARATOR);
        if (separator < 0 || credential.indexOf(ApiKeyPair.SEPARATOR, separator + 1) >= 0) {
            return new Malformed(Reason.WRONG_PART_COUNT);
        }
        String keyId = credential.substring(0, separator);
        String secret = credential.substring(separator + 1);
        if (keyId.isEmpty() || secret.isEmpty()) {
            return new Malformed(Reason.EMPTY_PART);
        }
        if (!keyId.startsWith(KEY_ID_PREFIX) || keyId.length() == KEY_ID_PREFIX.length()) {
            return new Malformed(Reason.BAD_KEY_ID_PREFIX);
        }
        if (!secret.startsWith(SECRET_PREFIX) || secret.length() == SECRET_PREFIX.length()) {
            return new Malformed(Reason.BAD_SECRET_PREFIX);
        }
        return new WellFormed(keyId, secret);
    }
}
