package inventory.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;

import inventory.core.model.auth.Account;
import inventory.core.port.out.AccountRepository;

/**
 * In-memory implementation of AccountRepository.
 *
 * <p>Username and API key uniqueness is enforced under a lock so concurrent
 * provisioning cannot create duplicates.
 */
public class InMemoryAccountRepository implements AccountRepository {

    private final Map<String, Account> storage = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> save(Account account) {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                for (Account other : storage.values()) {
                    if (other.id().equals(account.id())) {
                        continue;
                    }
                    if (other.username().equalsIgnoreCase(account.username())) {
                        throw new IllegalArgumentException("Username already exists: " + account.username());
                    }
                    if (other.apiKey() != null && other.apiKey().equals(account.apiKey())) {
                        throw new IllegalArgumentException("API key already exists");
                    }
                }
                storage.put(account.id(), account);
            }
            return null;
        });
    }

    @Override
    public Uni<Optional<Account>> findById(String id) {
        return Uni.createFrom().item(() -> id == null ? Optional.empty() : Optional.ofNullable(storage.get(id)));
    }

    @Override
    public Uni<Optional<Account>> findByApiKey(String apiKey) {
        return Uni.createFrom().item(() -> storage.values().stream()
                .filter(a -> a.apiKey() != null && a.apiKey().equals(apiKey))
                .findFirst());
    }

    @Override
    public Uni<Optional<Account>> findByUsername(String username) {
        if (username == null) {
            return Uni.createFrom().item(Optional.empty());
        }
        final var wanted = username.toLowerCase(Locale.ROOT);
        return Uni.createFrom().item(() -> storage.values().stream()
                .filter(a -> a.username().toLowerCase(Locale.ROOT).equals(wanted))
                .findFirst());
    }

    @Override
    public Uni<List<Account>> findAll() {
        return Uni.createFrom().item(() -> new ArrayList<>(storage.values()));
    }

    @Override
    public Uni<Boolean> delete(String id) {
        return Uni.createFrom().item(() -> id != null && storage.remove(id) != null);
    }
}
