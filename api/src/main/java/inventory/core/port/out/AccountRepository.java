package inventory.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import inventory.core.model.auth.Account;

/**
 * Port interface for persistent storage of accounts.
 */
public interface AccountRepository {

    /**
     * Save or replace an account.
     *
     * @throws IllegalArgumentException via the Uni if another account owns the username or API key
     */
    Uni<Void> save(Account account);

    Uni<Optional<Account>> findById(String id);

    /**
     * Find an account by its exact API key.
     */
    Uni<Optional<Account>> findByApiKey(String apiKey);

    /**
     * Find an account by username, ignoring case.
     */
    Uni<Optional<Account>> findByUsername(String username);

    Uni<List<Account>> findAll();

    Uni<Boolean> delete(String id);
}
