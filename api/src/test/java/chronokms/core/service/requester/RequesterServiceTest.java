package chronokms.core.service.requester;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import chronokms.adapter.out.storage.memory.InMemoryApiKeyRepository;
import chronokms.adapter.out.storage.memory.InMemoryRequesterRepository;
import chronokms.core.model.auth.ApiKeyCredential;
import chronokms.core.model.common.ConflictException;
import chronokms.core.model.common.ValidationException;
import chronokms.core.model.requester.Requester;
import chronokms.support.MutableClock;

@DisplayName("RequesterService")
class RequesterServiceTest {

    private InMemoryApiKeyRepository apiKeys;
    private RequesterService service;

    @BeforeEach
    void setUp() {
        apiKeys = new InMemoryApiKeyRepository();
        service = new RequesterService(new InMemoryRequesterRepository(), apiKeys, MutableClock.at(0));
    }

    private void storeKey(String keyId, String requesterId) {
        apiKeys.save(new ApiKeyCredential(
                        keyId, "$2a$04$hash", null, requesterId, true, null, null, Instant.EPOCH, "root"))
                .await()
                .indefinitely();
    }

    @Test
    @DisplayName("should create a requester with a generated id when none is given")
    void shouldGenerateId() {
        Requester requester = service.create(null, "Batch jobs", "nightly", Map.of("team", "data"))
                .await()
                .indefinitely();

        assertTrue(requester.id().startsWith(RequesterService.ID_PREFIX));
        assertTrue(requester.enabled());
        assertEquals("data", requester.metadata().get("team"));
    }

    @Test
    @DisplayName("should reject a duplicate id")
    void shouldRejectDuplicate() {
        service.create("req-1", "One", null, null).await().indefinitely();

        assertThrows(
                ConflictException.class,
                () -> service.create("req-1", "Again", null, null).await().indefinitely());
    }

    @Test
    @DisplayName("should require a name")
    void shouldRequireName() {
        assertThrows(ValidationException.class, () -> service.create("req-1", null, null, null));
    }

    @Test
    @DisplayName("should update only the given fields")
    void shouldPartiallyUpdate() {
        service.create("req-1", "One", "first", null).await().indefinitely();

        Requester updated = service.update("req-1", null, null, false, null)
                .await()
                .indefinitely()
                .orElseThrow();

        assertEquals("One", updated.name());
        assertEquals("first", updated.description());
        assertFalse(updated.enabled());
        assertTrue(service.update("req-missing", "x", null, null, null).await().indefinitely().isEmpty());
    }

    @Test
    @DisplayName("should delete the requester's credentials with it")
    void shouldCascadeDelete() {
        service.create("req-1", "One", null, null).await().indefinitely();
        service.create("req-2", "Two", null, null).await().indefinitely();
        storeKey("ck_a", "req-1");
        storeKey("ck_b", "req-1");
        storeKey("ck_c", "req-2");

        assertTrue(service.delete("req-1").await().indefinitely());

        assertTrue(apiKeys.findByRequesterId("req-1").await().indefinitely().isEmpty());
        assertEquals(1, apiKeys.findAll().await().indefinitely().size());
        assertFalse(service.delete("req-1").await().indefinitely());
    }
}
