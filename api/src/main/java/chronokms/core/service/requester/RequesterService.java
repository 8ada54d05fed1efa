package chronokms.core.service.requester;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import chronokms.core.model.common.ConflictException;
import chronokms.core.model.common.ValidationException;
import chronokms.core.model.requester.Requester;
import chronokms.core.port.in.RequesterManagement;
import chronokms.core.port.out.ApiKeyRepository;
import chronokms.core.port.out.RequesterRepository;

/**
 * Requester CRUD. Deleting a requester also deletes its credentials.
 */
@ApplicationScoped
public class RequesterService implements RequesterManagement {

    private static final Logger LOG = Logger.getLogger(RequesterService.class);

    static final String ID_PREFIX = "req-";

    private final RequesterRepository repository;
    private final ApiKeyRepository apiKeyRepository;
    private final Clock clock;

    @Inject
    public RequesterService(RequesterRepository repository, ApiKeyRepository apiKeyRepository, Clock clock) {
        this.repository = repository;
        this.apiKeyRepository = apiKeyRepository;
        this.clock = clock;
    }

    @Override
    public Uni<List<Requester>> list() {
        return repository.findAll();
    }

    @Override
    public Uni<Optional<Requester>> get(String id) {
        if (id == null || id.isBlank()) {
            return Uni.createFrom().item(Optional.empty());
        }
        return repository.findById(id);
    }

    @Override
    public Uni<Requester> create(String id, String name, String description, Map<String, Object> metadata) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("name", "name is required");
        }
        String requesterId = id == null || id.isBlank() ? ID_PREFIX + UUID.randomUUID() : id.trim();
        Instant now = clock.instant();
        Requester requester = new Requester(requesterId, name, description, true, metadata, now, now);

        return repository.findById(requesterId).flatMap(existing -> {
            if (existing.isPresent()) {
                return Uni.createFrom()
                        .<Requester>failure(new ConflictException("Requester already exists: " + requesterId));
            }
            return repository.save(requester).invoke(() -> LOG.infof("Created requester %s", requesterId))
                    .replaceWith(requester);
        });
    }

    @Override
    public Uni<Optional<Requester>> update(
            String id, String name, String description, Boolean enabled, Map<String, Object> metadata) {
        if (name != null && name.isBlank()) {
            throw new ValidationException("name", "name must not be blank");
        }
        return get(id).flatMap(existing -> {
            if (existing.isEmpty()) {
                return Uni.createFrom().item(Optional.<Requester>empty());
            }
            Instant now = clock.instant();
            Requester updated = existing.get().withDetails(name, description, metadata, now);
            if (enabled != null) {
                updated = updated.withEnabled(enabled, now);
            }
            Requester result = updated;
            return repository.save(result).replaceWith(Optional.of(result));
        });
    }

    @Override
    public Uni<Boolean> delete(String id) {
        if (id == null || id.isBlank()) {
            return Uni.createFrom().item(false);
        }
        return repository.delete(id).flatMap(deleted -> {
            if (!deleted) {
                return Uni.createFrom().item(false);
            }
            return apiKeyRepository.deleteByRequesterId(id).map(keys -> {
                LOG.infof("Deleted requester %s and %d credential(s)", id, keys);
                return true;
            });
        });
    }
}
