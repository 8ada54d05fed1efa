package chronokms.adapter.out.storage.memory;

import chronokms.core.port.out.AccessRequestRepository;
import chronokms.core.port.out.AdminRepository;
import chronokms.core.port.out.ApiKeyRepository;
import chronokms.core.port.out.AuditLogRepository;
import chronokms.core.port.out.PolicyRepository;
import chronokms.core.port.out.RequesterRepository;
import chronokms.core.port.out.SessionRepository;
import chronokms.spi.KmsStorageProvider;
import chronokms.spi.StorageAdapterConfig;

/**
 * Default in-memory storage provider.
 *
 * <p>Data is NOT persisted across restarts. This provider is the fallback for
 * development, testing and single-instance deployments.
 */
public class InMemoryStorageProvider implements KmsStorageProvider {

    public static final String NAME = "memory";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "In-memory storage (non-persistent)";
    }

    @Override
    public int priority() {
        return 0; // Lowest priority - only used if nothing else available
    }

    @Override
    public ApiKeyRepository createApiKeyRepository(StorageAdapterConfig config) {
        return new InMemoryApiKeyRepository();
    }

    @Override
    public RequesterRepository createRequesterRepository(StorageAdapterConfig config) {
        return new InMemoryRequesterRepository();
    }

    @Override
    public AdminRepository createAdminRepository(StorageAdapterConfig config) {
        return new InMemoryAdminRepository();
    }

    @Override
    public SessionRepository createSessionRepository(StorageAdapterConfig config) {
        return new InMemorySessionRepository();
    }

    @Override
    public AuditLogRepository createAuditLogRepository(StorageAdapterConfig config) {
        return new InMemoryAuditLogRepository();
    }

    @Override
    public AccessRequestRepository createAccessRequestRepository(StorageAdapterConfig config) {
        return new InMemoryAccessRequestRepository();
    }

    @Override
    public PolicyRepository createPolicyRepository(StorageAdapterConfig config) {
        return new InMemoryPolicyRepository();
    }
}
