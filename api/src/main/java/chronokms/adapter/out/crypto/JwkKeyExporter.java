package chronokms.adapter.out.crypto;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.Base64;

import jakarta.enterprise.context.ApplicationScoped;

import org.jose4j.jwk.JsonWebKey;
import org.jose4j.lang.JoseException;

import chronokms.core.port.out.KeyExporter;

/**
 * Exports keys as base64-encoded JWK JSON.
 *
 * <p>Private and symmetric material is included: the output is meant for the
 * requester that was granted access.
 */
@ApplicationScoped
public class JwkKeyExporter implements KeyExporter {

    @Override
    public String export(Key key) {
        try {
            String json = JsonWebKey.Factory.newJwk(key)
                    .toJson(JsonWebKey.OutputControlLevel.INCLUDE_PRIVATE);
            return Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8));
        } catch (JoseException e) {
            throw new IllegalStateException("Unable to export " + key.getAlgorithm() + " key as JWK", e);
        }
    }
}
