package chronokms.spi;

import chronokms.core.port.out.AccessRequestRepository;
import chronokms.core.port.out.AdminRepository;
import chronokms.core.port.out.ApiKeyRepository;
import chronokms.core.port.out.AuditLogRepository;
import chronokms.core.port.out.PolicyRepository;
import chronokms.core.port.out.RequesterRepository;
import chronokms.core.port.out.SessionRepository;

/**
 * Service Provider Interface for storage backends.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} at startup.
 *
 * <h2>How to Create a Custom Provider</h2>
 * <ol>
 *   <li>Implement this interface</li>
 *   <li>Create META-INF/services/chronokms.spi.KmsStorageProvider</li>
 *   <li>Add your fully qualified class name to the file</li>
 *   <li>Put the JAR on the classpath</li>
 *   <li>Configure: kms.storage.provider=your-provider-name</li>
 * </ol>
 *
 * <p>Each create method is called once at startup. Returned repositories must be
 * thread-safe.
 */
public interface KmsStorageProvider {

    /**
     * Unique name used in {@code kms.storage.provider}.
     */
    String name();

    default String description() {
        return name() + " storage provider";
    }

    /**
     * Priority for auto-selection when no provider is configured. Higher wins;
     * the built-in memory provider uses 0.
     */
    default int priority() {
        return 0;
    }

    /**
     * Check if this provider can be used (dependencies present, etc.)
     */
    default boolean isAvailable() {
        return true;
    }

    ApiKeyRepository createApiKeyRepository(StorageAdapterConfig config);

    RequesterRepository createRequesterRepository(StorageAdapterConfig config);

    AdminRepository createAdminRepository(StorageAdapterConfig config);

    SessionRepository createSessionRepository(StorageAdapterConfig config);

    AuditLogRepository createAuditLogRepository(StorageAdapterConfig config);

    AccessRequestRepository createAccessRequestRepository(StorageAdapterConfig config);

    PolicyRepository createPolicyRepository(StorageAdapterConfig config);
}
