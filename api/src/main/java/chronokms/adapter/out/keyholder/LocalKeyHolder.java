package chronokms.adapter.out.keyholder;

import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.security.spec.ECGenParameterSpec;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.PublicJsonWebKey;
import org.jose4j.lang.JoseException;

import chronokms.core.config.AccessConfig;
import chronokms.core.model.access.AccessRequest;
import chronokms.core.model.keyholder.KeyHolderDecision;
import chronokms.core.model.keyholder.KeyHolderStatus;
import chronokms.core.port.out.KeyHolder;

/**
 * In-process key-holder backed by an EC P-256 master key pair generated at startup.
 *
 * <p>One AES-256 key is derived per time step with HMAC-SHA256 over the step
 * timestamp, keyed by the master private scalar. Requests needing more than
 * {@code kms.access.max-keys-per-request} keys are denied. The master key lives
 * only in memory and changes on every restart.
 */
@ApplicationScoped
public class LocalKeyHolder implements KeyHolder {

    private static final Logger LOG = Logger.getLogger(LocalKeyHolder.class);

    static final String CURVE = "secp256r1";
    static final String KEY_ALGORITHM = "EC P-256";
    private static final String DERIVATION_ALGORITHM = "HmacSHA256";

    private final AccessConfig config;
    private final KeyPair masterKeyPair;
    private final Instant keyCreatedAt;

    @Inject
    public LocalKeyHolder(AccessConfig config, Clock clock) {
        this.config = config;
        this.masterKeyPair = generateMasterKeyPair();
        this.keyCreatedAt = clock.instant();
        LOG.infof("Key holder %s initialized with a fresh %s master key", config.keyHolderId(), KEY_ALGORITHM);
    }

    @Override
    public String id() {
        return config.keyHolderId();
    }

    @Override
    public Uni<KeyHolderDecision> authorize(AccessRequest request) {
        return Uni.createFrom()
                .item(() -> decide(request))
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    KeyHolderDecision decide(AccessRequest request) {
        long step = granularityMs();
        long start = request.timeRange().startTime();
        long end = request.timeRange().endTime();
        long first;
        long steps;
        try {
            first = Math.multiplyExact(Math.floorDiv(start, step), step);
            steps = Math.floorDiv(Math.subtractExact(end, first), step) + 1;
        } catch (ArithmeticException e) {
            return tooManyKeys();
        }

        if (steps > config.maxKeysPerRequest()) {
            return tooManyKeys();
        }

        Map<Long, Key> keys = new TreeMap<>();
        Mac mac = newMac();
        for (long i = 0; i < steps; i++) {
            long timestamp = first + i * step;
            keys.put(timestamp, deriveKey(mac, timestamp));
        }
        return KeyHolderDecision.grant(keys, step);
    }

    private KeyHolderDecision tooManyKeys() {
        return KeyHolderDecision.deny(
                "Requested range exceeds the limit of " + config.maxKeysPerRequest() + " keys per request");
    }

    @Override
    public Uni<Map<String, Object>> masterPublicKey() {
        return Uni.createFrom().item(() -> {
            try {
                PublicJsonWebKey jwk = PublicJsonWebKey.Factory.newPublicJwk(masterKeyPair.getPublic());
                return jwk.toParams(JsonWebKey.OutputControlLevel.PUBLIC_ONLY);
            } catch (JoseException e) {
                throw new IllegalStateException("Unable to export master public key", e);
            }
        });
    }

    @Override
    public KeyHolderStatus status() {
        return new KeyHolderStatus(config.keyHolderId(), "active", KEY_ALGORITHM, keyCreatedAt, granularityMs());
    }

    private long granularityMs() {
        return Math.max(1, config.granularity().toMillis());
    }

    private Mac newMac() {
        try {
            Mac mac = Mac.getInstance(DERIVATION_ALGORITHM);
            byte[] scalar = ((ECPrivateKey) masterKeyPair.getPrivate()).getS().toByteArray();
            mac.init(new SecretKeySpec(scalar, DERIVATION_ALGORITHM));
            return mac;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Key derivation unavailable", e);
        }
    }

    private static Key deriveKey(Mac mac, long timestamp) {
        byte[] material = mac.doFinal(ByteBuffer.allocate(Long.BYTES).putLong(timestamp).array());
        return new SecretKeySpec(material, "AES");
    }

    private static KeyPair generateMasterKeyPair() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
            generator.initialize(new ECGenParameterSpec(CURVE));
            KeyPair pair = generator.generateKeyPair();
            if (!(pair.getPublic() instanceof ECPublicKey)) {
                throw new IllegalStateException("EC key pair generator returned " + pair.getPublic().getAlgorithm());
            }
            return pair;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to generate master key pair", e);
        }
    }
}
