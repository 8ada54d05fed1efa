package chronokms.core.model.auth;

/**
 * A freshly generated key pair.
 *
 * <p>{@code toString()} is overridden so the secret never ends up in a log line.
 *
 * @param keyId  public identifier ({@code ck_} + 32 hex characters)
 * @param secret plaintext secret ({@code sk_} + base64url of 32 random bytes)
 */
public record ApiKeyPair(String keyId, String secret) {

    public static final char SEPARATOR = '.';

    /**
     * Returns the composite credential presented in the {@code Authorization: ApiKey} header.
     */
    public String credential() {
        return keyId + SEPARATOR + secret;
    }

    @Override
    public String toString() {
        return "ApiKeyPair[keyId=" + keyId + ", secret=" + ApiKeyCredential.REDACTED + "]";
    }
}
