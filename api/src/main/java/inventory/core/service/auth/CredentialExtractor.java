package inventory.core.service.auth;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import inventory.core.model.auth.Credential;
import inventory.core.model.auth.CredentialParseException;

/**
 * Parses credentials from raw header values. Performs no I/O.
 */
@ApplicationScoped
public class CredentialExtractor {

    private static final String BASIC_PREFIX = "Basic ";
    private static final String BEARER_PREFIX = "Bearer ";

    /**
     * Parse the {@code ApiKey} header.
     *
     * @throws CredentialParseException if the header is missing or blank
     */
    public Credential.ApiKey extractApiKey(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            throw new CredentialParseException("API Key was not provided.");
        }
        return new Credential.ApiKey(headerValue.trim());
    }

    /**
     * Parse an {@code Authorization: Basic} header.
     *
     * @throws CredentialParseException if the header is missing, uses another scheme,
     *                                  is not base64, or has no {@code :} separator
     */
    public Credential.Basic extractBasic(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            throw new CredentialParseException("Missing Authorization Header");
        }
        if (!hasPrefix(authorizationHeader, BASIC_PREFIX)) {
            throw new CredentialParseException("Invalid Authorization Header");
        }

        final var encoded = authorizationHeader.substring(BASIC_PREFIX.length()).trim();
        final String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new CredentialParseException("Invalid Basic Authentication Credentials. " + e.getMessage(), e);
        }

        final var separator = decoded.indexOf(':');
        if (separator < 0) {
            throw new CredentialParseException(
                    "Invalid Basic Authentication Credentials. The string does not resolve to username:password format");
        }
        return new Credential.Basic(decoded.substring(0, separator), decoded.substring(separator + 1));
    }

    /**
     * Parse an {@code Authorization: Bearer} header.
     *
     * @return the token, or empty when the header is absent, uses another scheme, or has no token
     */
    public Optional<Credential.Bearer> extractBearer(String authorizationHeader) {
        if (authorizationHeader == null || !hasPrefix(authorizationHeader, BEARER_PREFIX)) {
            return Optional.empty();
        }
        final var token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(new Credential.Bearer(token));
    }

    /**
     * Check whether an Authorization header uses the Basic scheme.
     */
    public boolean isBasic(String authorizationHeader) {
        return authorizationHeader != null && hasPrefix(authorizationHeader, BASIC_PREFIX);
    }

    private static boolean hasPrefix(String value, String prefix) {
        return value.regionMatches(true, 0, prefix, 0, prefix.length());
    }
}
