package chronokms.adapter.out.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import chronokms.adapter.out.storage.memory.InMemoryStorageProvider;
import chronokms.spi.KmsStorageProvider;
import chronokms.spi.StorageProviderException;

@DisplayName("StorageProviderLoader")
class StorageProviderLoaderTest {

    private static KmsStorageProvider provider(String name, int priority, boolean available) {
        return new InMemoryStorageProvider() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public int priority() {
                return priority;
            }

            @Override
            public boolean isAvailable() {
                return available;
            }
        };
    }

    @Test
    @DisplayName("should honour the configured provider name")
    void shouldUseConfiguredProvider() {
        var memory = provider("memory", 0, true);
        var remote = provider("remote", 100, true);

        assertEquals(memory, StorageProviderLoader.selectProvider(List.of(memory, remote), "memory"));
    }

    @Test
    @DisplayName("should fail when the configured provider is missing")
    void shouldFailForUnknownProvider() {
        var providers = List.of(provider("memory", 0, true));

        assertThrows(StorageProviderException.class, () -> StorageProviderLoader.selectProvider(providers, "jdbc"));
    }

    @Test
    @DisplayName("should pick the highest-priority available provider otherwise")
    void shouldPickByPriority() {
        var memory = provider("memory", 0, true);
        var offline = provider("offline", 200, false);
        var remote = provider("remote", 100, true);

        assertEquals(remote, StorageProviderLoader.selectProvider(List.of(memory, offline, remote), null));
        assertEquals(remote, StorageProviderLoader.selectProvider(List.of(memory, offline, remote), " "));
    }

    @Test
    @DisplayName("should fail when no provider is available")
    void shouldFailWhenNoneAvailable() {
        var providers = List.of(provider("offline", 0, false));

        assertThrows(StorageProviderException.class, () -> StorageProviderLoader.selectProvider(providers, null));
    }

    @Test
    @DisplayName("should expose the built-in memory provider through ServiceLoader")
    void shouldDiscoverMemoryProvider() {
        var names = java.util.ServiceLoader.load(KmsStorageProvider.class).stream()
                .map(p -> p.get().name())
                .toList();

        assertEquals(List.of(InMemoryStorageProvider.NAME), names);
    }
}
