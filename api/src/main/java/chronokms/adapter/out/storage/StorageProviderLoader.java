package chronokms.adapter.out.storage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import chronokms.core.port.out.AccessRequestRepository;
import chronokms.core.port.out.AdminRepository;
import chronokms.core.port.out.ApiKeyRepository;
import chronokms.core.port.out.AuditLogRepository;
import chronokms.core.port.out.PolicyRepository;
import chronokms.core.port.out.RequesterRepository;
import chronokms.core.port.out.SessionRepository;
import chronokms.spi.KmsStorageProvider;
import chronokms.spi.StorageAdapterConfig;
import chronokms.spi.StorageProviderException;

/**
 * Discovers storage providers via ServiceLoader and produces the repositories.
 *
 * <p>Provider selection:
 * <ol>
 *   <li>If kms.storage.provider is set, use that provider</li>
 *   <li>Otherwise, select the highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class StorageProviderLoader {

    private static final Logger LOG = Logger.getLogger(StorageProviderLoader.class);

    private final Optional<String> configuredProvider;
    private final StorageAdapterConfig config;

    private KmsStorageProvider provider;

    @Inject
    public StorageProviderLoader(
            @ConfigProperty(name = "kms.storage.provider") Optional<String> configuredProvider,
            StorageAdapterConfig config) {
        this.configuredProvider = configuredProvider;
        this.config = config;
    }

    @Produces
    @ApplicationScoped
    public ApiKeyRepository apiKeyRepository() {
        return getProvider().createApiKeyRepository(config);
    }

    @Produces
    @ApplicationScoped
    public RequesterRepository requesterRepository() {
        return getProvider().createRequesterRepository(config);
    }

    @Produces
    @ApplicationScoped
    public AdminRepository adminRepository() {
        return getProvider().createAdminRepository(config);
    }

    @Produces
    @ApplicationScoped
    public SessionRepository sessionRepository() {
        return getProvider().createSessionRepository(config);
    }

    @Produces
    @ApplicationScoped
    public AuditLogRepository auditLogRepository() {
        return getProvider().createAuditLogRepository(config);
    }

    @Produces
    @ApplicationScoped
    public AccessRequestRepository accessRequestRepository() {
        return getProvider().createAccessRequestRepository(config);
    }

    @Produces
    @ApplicationScoped
    public PolicyRepository policyRepository() {
        return getProvider().createPolicyRepository(config);
    }

    synchronized KmsStorageProvider getProvider() {
        if (provider != null) {
            return provider;
        }

        List<KmsStorageProvider> providers = new ArrayList<>();
        ServiceLoader.load(KmsStorageProvider.class).forEach(providers::add);

        if (providers.isEmpty()) {
            throw new StorageProviderException(
                    "No storage providers found. Ensure a provider JAR is on the classpath.");
        }

        LOG.infof(
                "Found %d storage provider(s): %s",
                providers.size(),
                providers.stream().map(KmsStorageProvider::name).toList());

        provider = selectProvider(providers, configuredProvider.orElse(null));
        LOG.infof("Using storage provider: %s (%s)", provider.name(), provider.description());
        return provider;
    }

    static KmsStorageProvider selectProvider(List<KmsStorageProvider> providers, String configured) {
        // Explicit configuration takes precedence
        if (configured != null && !configured.isBlank()) {
            return providers.stream()
                    .filter(p -> p.name().equals(configured))
                    .findFirst()
                    .orElseThrow(() -> new StorageProviderException("Configured storage provider not found: "
                            + configured + ". Available: "
                            + providers.stream().map(KmsStorageProvider::name).toList()));
        }

        return providers.stream()
                .filter(KmsStorageProvider::isAvailable)
                .max(Comparator.comparingInt(KmsStorageProvider::priority))
                .orElseThrow(() -> new StorageProviderException("No available storage providers"));
    }
}
