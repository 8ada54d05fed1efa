package chronokms.core.service.auth;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import chronokms.core.config.ApiKeyConfig;
import chronokms.core.model.auth.ApiKeyCreateResult;
import chronokms.core.model.auth.ApiKeyCredential;
import chronokms.core.model.auth.ApiKeyPair;
import chronokms.core.model.auth.ParsedCredential;
import chronokms.core.model.auth.RequesterIdentity;
import chronokms.core.model.common.ValidationException;
import chronokms.core.model.requester.Requester;
import chronokms.core.port.in.ApiKeyManagement;
import chronokms.core.port.out.ApiKeyRepository;
import chronokms.core.port.out.RequesterRepository;
import chronokms.core.port.out.SecretHasher;
import chronokms.core.service.common.SideEffectRunner;

/**
 * Service for issuing and validating requester API keys.
 *
 * <p>Secrets are stored as bcrypt hashes; the plaintext is only returned once
 * at creation. Hashing runs on the worker pool.
 */
@ApplicationScoped
public class ApiKeyService implements ApiKeyManagement {

    private static final Logger LOG = Logger.getLogger(ApiKeyService.class);

    static final String LAST_USED_TASK = "api-key-last-used";

    private static final int KEY_ID_BYTES = 16;
    private static final int SECRET_BYTES = 32;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final ApiKeyRepository repository;
    private final RequesterRepository requesterRepository;
    private final SecretHasher hasher;
    private final SideEffectRunner sideEffects;
    private final ApiKeyConfig config;
    private final Clock clock;

    @Inject
    public ApiKeyService(
            ApiKeyRepository repository,
            RequesterRepository requesterRepository,
            SecretHasher hasher,
            SideEffectRunner sideEffects,
            ApiKeyConfig config,
            Clock clock) {
        this.repository = repository;
        this.requesterRepository = requesterRepository;
        this.hasher = hasher;
        this.sideEffects = sideEffects;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public ApiKeyPair generateKeyPair() {
        byte[] idBytes = new byte[KEY_ID_BYTES];
        SECURE_RANDOM.nextBytes(idBytes);
        byte[] secretBytes = new byte[SECRET_BYTES];
        SECURE_RANDOM.nextBytes(secretBytes);
        return new ApiKeyPair(
                ApiKeyParser.KEY_ID_PREFIX + HexFormat.of().formatHex(idBytes),
                ApiKeyParser.SECRET_PREFIX + Base64.getUrlEncoder().withoutPadding().encodeToString(secretBytes));
    }

    @Override
    public Uni<String> hashSecret(String secret) {
        return Uni.createFrom()
                .item(() -> hasher.hash(secret, config.hashRounds()))
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    @Override
    public Uni<ApiKeyCreateResult> generate(String requesterId, String name, Instant expiresAt, String createdBy) {
        if (requesterId == null || requesterId.isBlank()) {
            throw new ValidationException("requesterId", "requesterId is required");
        }
        Instant now = clock.instant();
        validateExpiry(expiresAt, now);

        return requesterRepository.findById(requesterId).flatMap(requester -> {
            if (requester.isEmpty()) {
                return Uni.createFrom()
                        .<ApiKeyCreateResult>failure(
                                new ValidationException("requesterId", "Unknown requester: " + requesterId));
            }
            ApiKeyPair pair = generateKeyPair();
            return hashSecret(pair.secret()).flatMap(hash -> {
                var credential =
                        new ApiKeyCredential(pair.keyId(), hash, name, requesterId, true, expiresAt, null, now, createdBy);
                return repository.save(credential).map(v -> {
                    LOG.infof("API key %s generated for requester %s by %s", pair.keyId(), requesterId, createdBy);
                    return new ApiKeyCreateResult(pair, credential.redacted());
                });
            });
        });
    }

    @Override
    public Uni<Optional<RequesterIdentity>> validate(String credential) {
        ParsedCredential parsed = ApiKeyParser.parse(credential);
        if (parsed instanceof ParsedCredential.Malformed malformed) {
            LOG.debugf("Rejected API key: malformed (%s)", malformed.reason());
            return Uni.createFrom().item(Optional.empty());
        }
        var wellFormed = (ParsedCredential.WellFormed) parsed;
        String keyId = wellFormed.keyId();

        return repository.findById(keyId).flatMap(found -> {
            if (found.isEmpty()) {
                return reject(keyId, "unknown key");
            }
            ApiKeyCredential stored = found.get();
            if (!stored.enabled()) {
                return reject(keyId, "disabled");
            }
            Instant now = clock.instant();
            if (stored.isExpired(now)) {
                return reject(keyId, "expired");
            }
            return requesterRepository.findById(stored.requesterId()).flatMap(requester -> {
                if (requester.isEmpty() || !requester.get().enabled()) {
                    return reject(keyId, "requester disabled or missing");
                }
                return verifySecret(wellFormed.secret(), stored.secretHash()).map(matches -> {
                    if (!matches) {
                        LOG.debugf("Rejected API key %s: secret mismatch", keyId);
                        return Optional.<RequesterIdentity>empty();
                    }
                    sideEffects.run(LAST_USED_TASK, () -> repository.updateLastUsed(keyId, clock.instant()));
                    return Optional.of(identityOf(stored, requester.get()));
                });
            });
        });
    }

    @Override
    public Uni<List<ApiKeyCredential>> list(String requesterId) {
        Uni<List<ApiKeyCredential>> source = requesterId == null || requesterId.isBlank()
                ? repository.findAll()
                : repository.findByRequesterId(requesterId);
        return source.map(keys -> keys.stream().map(ApiKeyCredential::redacted).toList());
    }

    @Override
    public Uni<Optional<ApiKeyCredential>> get(String keyId) {
        return repository.findById(keyId).map(opt -> opt.map(ApiKeyCredential::redacted));
    }

    @Override
    public Uni<Optional<ApiKeyCredential>> update(String keyId, String name, Boolean enabled) {
        return repository.findById(keyId).flatMap(existing -> {
            if (existing.isEmpty()) {
                return Uni.createFrom().item(Optional.<ApiKeyCredential>empty());
            }
            ApiKeyCredential updated = existing.get();
            if (name != null && !name.isBlank()) {
                updated = updated.withName(name);
            }
            if (enabled != null) {
                updated = updated.withEnabled(enabled);
            }
            ApiKeyCredential result = updated;
            return repository.save(result).map(v -> {
                LOG.infof("API key %s updated (enabled=%s)", keyId, result.enabled());
                return Optional.of(result.redacted());
            });
        });
    }

    @Override
    public Uni<Boolean> revoke(String keyId) {
        return repository.delete(keyId).invoke(deleted -> {
            if (deleted) {
                LOG.infof("API key %s revoked", keyId);
            }
        });
    }

    private Uni<Boolean> verifySecret(String secret, String hash) {
        return Uni.createFrom()
                .item(() -> hasher.matches(secret, hash))
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    private static Uni<Optional<RequesterIdentity>> reject(String keyId, String reason) {
        LOG.debugf("Rejected API key %s: %s", keyId, reason);
        return Uni.createFrom().item(Optional.empty());
    }

    private static RequesterIdentity identityOf(ApiKeyCredential credential, Requester requester) {
        return new RequesterIdentity(credential.keyId(), requester.id(), requester.name());
    }

    /**
     * Validates the requested expiry against the clock and the configured maximum.
     */
    private void validateExpiry(Instant expiresAt, Instant now) {
        if (expiresAt != null && !expiresAt.isAfter(now)) {
            throw new ValidationException("expiresAt", "expiresAt must be in the future");
        }
        Optional<Duration> maxTtl = config.maxTtl();
        if (maxTtl.isEmpty()) {
            return;
        }
        if (expiresAt == null) {
            throw new ValidationException(
                    "expiresAt", "expiresAt is required. Maximum lifetime: " + maxTtl.get());
        }
        if (Duration.between(now, expiresAt).compareTo(maxTtl.get()) > 0) {
            throw new ValidationException(
                    "expiresAt", "expiresAt exceeds maximum lifetime of " + maxTtl.get());
        }
    }
}
