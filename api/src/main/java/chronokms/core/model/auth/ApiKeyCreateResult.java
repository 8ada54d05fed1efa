package chronokms.core.model.auth;

/**
 * Result of generating an API key. The plaintext credential is only available here.
 *
 * @param pair     the generated key pair, including the plaintext secret
 * @param metadata the stored credential (hash redacted)
 */
public record ApiKeyCreateResult(ApiKeyPair pair, ApiKeyCredential metadata) {

    public String keyId() {
        return pair.keyId();
    }

    public String plaintextCredential() {
        return pair.credential();
    }
}
