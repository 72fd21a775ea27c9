package inventory.core.model.auth;

import java.security.Principal;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Authenticated caller established from a validated Bearer token.
 *
 * @param accountId account identifier ({@code sub})
 * @param username  login name, may be null for tokens minted elsewhere
 * @param roles     role names in claim order without duplicates
 * @param claims    canonical claims with case-insensitive keys; multi-valued claims are lists
 */
public record InventoryPrincipal(String accountId, String username, List<String> roles, Map<String, Object> claims)
        implements Principal {

    public InventoryPrincipal {
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalArgumentException("Account ID cannot be null or blank");
        }
        roles = roles == null ? List.of() : List.copyOf(new LinkedHashSet<>(roles));
        final var copy = new TreeMap<String, Object>(String.CASE_INSENSITIVE_ORDER);
        if (claims != null) {
            claims.forEach((key, value) -> copy.put(key, value instanceof List<?> list ? List.copyOf(list) : value));
        }
        claims = Collections.unmodifiableMap(copy);
    }

    @Override
    public String getName() {
        return username != null ? username : accountId;
    }

    public Optional<Object> claim(String name) {
        return Optional.ofNullable(claims.get(name));
    }
}
