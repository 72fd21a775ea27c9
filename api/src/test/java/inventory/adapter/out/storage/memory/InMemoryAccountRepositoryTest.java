package inventory.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import inventory.core.model.auth.Account;

@DisplayName("InMemoryAccountRepository")
class InMemoryAccountRepositoryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private InMemoryAccountRepository repository;
    private Account alice;

    @BeforeEach
    void setUp() {
        repository = new InMemoryAccountRepository();
        alice = Account.builder("a-1", "Alice").apiKey("key-a").build();
        repository.save(alice).await().atMost(TIMEOUT);
    }

    @Test
    @DisplayName("should find accounts by id, api key and username")
    void shouldFind() {
        assertEquals(alice, repository.findById("a-1").await().atMost(TIMEOUT).orElseThrow());
        assertEquals(alice, repository.findByApiKey("key-a").await().atMost(TIMEOUT).orElseThrow());
        assertEquals(alice, repository.findByUsername("alice").await().atMost(TIMEOUT).orElseThrow());
        assertTrue(repository.findByApiKey("KEY-A").await().atMost(TIMEOUT).isEmpty());
    }

    @Test
    @DisplayName("should reject a duplicate username")
    void shouldRejectDuplicateUsername() {
        final var other = Account.builder("a-2", "ALICE").apiKey("key-b").build();

        assertThrows(IllegalArgumentException.class, () -> repository.save(other).await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("should reject a duplicate api key")
    void shouldRejectDuplicateApiKey() {
        final var other = Account.builder("a-2", "bob").apiKey("key-a").build();

        assertThrows(IllegalArgumentException.class, () -> repository.save(other).await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("should allow re-saving the same account")
    void shouldAllowUpdate() {
        final var updated = Account.builder("a-1", "Alice").apiKey("key-a").role("admin").build();

        repository.save(updated).await().atMost(TIMEOUT);

        assertEquals(1, repository.findAll().await().atMost(TIMEOUT).size());
        assertTrue(repository.delete("a-1").await().atMost(TIMEOUT));
    }
}
