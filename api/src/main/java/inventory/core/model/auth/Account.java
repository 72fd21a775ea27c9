package inventory.core.model.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * An account that can authenticate against the API.
 *
 * @param id                 unique account identifier
 * @param username           unique login name
 * @param email              contact address
 * @param name               display name
 * @param passwordHash       BCrypt hash in Modular Crypt Format
 * @param apiKey             opaque API key, unique across accounts
 * @param allowedIpAddresses comma separated addresses or ranges, null when unrestricted
 * @param createdAt          creation instant
 * @param expiresAt          instant after which the account no longer resolves
 * @param roles              ordered role names
 */
public record Account(
        String id,
        String username,
        String email,
        String name,
        String passwordHash,
        String apiKey,
        String allowedIpAddresses,
        Instant createdAt,
        Instant expiresAt,
        List<String> roles) {

    /**
     * Lifetime applied when no expiry is given.
     */
    public static final Duration DEFAULT_LIFETIME = Duration.ofDays(365);

    public Account {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Account ID cannot be null or blank");
        }
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username cannot be null or blank");
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (expiresAt == null) {
            expiresAt = createdAt.plus(DEFAULT_LIFETIME);
        }
        if (allowedIpAddresses != null && allowedIpAddresses.isBlank()) {
            allowedIpAddresses = null;
        }
        roles = roles == null ? List.of() : List.copyOf(new LinkedHashSet<>(roles));
    }

    public static Builder builder(String id, String username) {
        return new Builder(id, username);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * Check whether a request from {@code remoteIp} is allowed for this account.
     */
    public boolean permitsAddress(String remoteIp) {
        return IpRestriction.parse(allowedIpAddresses).permits(remoteIp);
    }

    public static final class Builder {
        private final String id;
        private final String username;
        private String email;
        private String name;
        private String passwordHash;
        private String apiKey;
        private String allowedIpAddresses;
        private Instant createdAt;
        private Instant expiresAt;
        private final List<String> roles = new ArrayList<>();

        private Builder(String id, String username) {
            this.id = id;
            this.username = username;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder passwordHash(String passwordHash) {
            this.passwordHash = passwordHash;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder allowedIpAddresses(String allowedIpAddresses) {
            this.allowedIpAddresses = allowedIpAddresses;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder role(String role) {
            this.roles.add(role);
            return this;
        }

        public Builder roles(List<String> roles) {
            this.roles.addAll(roles);
            return this;
        }

        public Account build() {
            return new Account(id, username, email, name, passwordHash, apiKey, allowedIpAddresses, createdAt,
                    expiresAt, roles);
        }
    }
}
