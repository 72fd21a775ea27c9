package inventory.core.service.auth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.InvalidKeyException;
import org.jose4j.lang.JoseException;

import inventory.core.config.ConfigurationException;
import inventory.core.config.JwtConfig;
import inventory.core.config.JwtSettings;
import inventory.core.model.auth.Account;
import inventory.core.model.auth.ClaimCompletenessException;
import inventory.core.model.auth.ClaimNameMapping;
import inventory.core.model.auth.ClaimNames;
import inventory.core.model.auth.InventoryPrincipal;
import inventory.core.model.auth.IssuedToken;
import inventory.core.model.auth.TokenFailure;
import inventory.core.model.auth.TokenValidationException;
import inventory.core.model.auth.TokenValidationResult;

/**
 * Issues and validates the API's HS256 Bearer tokens.
 *
 * <p>Validation applies no clock skew: a token is expired from the instant of its
 * {@code exp} claim onwards.
 */
@ApplicationScoped
public class TokenService {

    private static final Logger LOG = Logger.getLogger(TokenService.class);

    private static final String INVALID_SECRET_MESSAGE = "The JWT Secret key is not a valid Base64 string";

    private final JwtConfig config;
    private final ClaimNameMapping claimNames;
    private final Clock clock;

    private volatile JwtSettings settings;

    @Inject
    public TokenService(JwtConfig config) {
        this(config, ClaimNameMapping.defaults(), Clock.systemUTC());
    }

    public TokenService(JwtConfig config, ClaimNameMapping claimNames, Clock clock) {
        this.config = config;
        this.claimNames = claimNames;
        this.clock = clock;
    }

    /**
     * Configured settings, resolved once.
     *
     * @throws ConfigurationException if the configuration is incomplete or unusable
     */
    public JwtSettings settings() {
        var current = settings;
        if (current == null) {
            current = JwtSettings.from(config);
            settings = current;
        }
        return current;
    }

    /**
     * Issue a token for the account with the configured settings.
     */
    public IssuedToken issue(Account account, List<String> roles) {
        final var resolved = settings();
        return issue(account, roles, resolved.secretKey(), resolved.issuer(), resolved.audience(),
                resolved.lifetime());
    }

    /**
     * Issue a token with explicit settings.
     *
     * @throws ConfigurationException if the secret is not base64 or too short for HS256
     */
    public IssuedToken issue(
            Account account, List<String> roles, String secretKey, String issuer, String audience,
            Duration lifetime) {
        final var key = new HmacKey(JwtSettings.decodeSecret(secretKey));
        final var expiresAt = Instant.ofEpochSecond(clock.instant().plus(lifetime).getEpochSecond());

        final var claims = new JwtClaims();
        claims.setIssuer(issuer);
        claims.setAudience(audience);
        claims.setSubject(account.id());
        claims.setClaim(claimNames.toWire(ClaimNames.USERNAME), account.username());
        if (account.email() != null) {
            claims.setClaim(claimNames.toWire(ClaimNames.EMAIL), account.email());
        }
        if (account.name() != null) {
            claims.setClaim(claimNames.toWire(ClaimNames.NAME), account.name());
        }
        claims.setJwtId(UUID.randomUUID().toString());
        claims.setIssuedAt(NumericDate.fromMilliseconds(clock.millis()));
        claims.setExpirationTime(NumericDate.fromSeconds(expiresAt.getEpochSecond()));

        final var roleClaim = claimNames.toWire(ClaimNames.ROLE);
        if (roles.size() == 1) {
            claims.setClaim(roleClaim, roles.get(0));
        } else if (!roles.isEmpty()) {
            claims.setStringListClaim(roleClaim, roles);
        }

        final var jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setKey(key);
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.HMAC_SHA256);
        jws.setHeader("typ", "JWT");

        try {
            final var token = jws.getCompactSerialization();
            LOG.debugv("Issued token for account {0} with roles {1}, expires {2}", account.id(), roles, expiresAt);
            return new IssuedToken(token, expiresAt);
        } catch (JoseException e) {
            throw new ConfigurationException("Unable to sign token: " + e.getMessage(), e);
        }
    }

    /**
     * Validate a token with the configured settings.
     */
    public TokenValidationResult validate(String token) {
        final var resolved = settings();
        return validate(token, resolved.secretKey(), resolved.issuer(), resolved.audience());
    }

    /**
     * Validate a token against an explicit secret, issuer and audience.
     */
    public TokenValidationResult validate(String token, String secretKey, String issuer, String audience) {
        if (token == null || token.isBlank()) {
            return new TokenValidationResult.NoToken();
        }
        try {
            return verify(token, secretKey, issuer, audience);
        } catch (TokenValidationException e) {
            LOG.debugv("Token rejected ({0}): {1}", e.failure(), e.getMessage());
            return new TokenValidationResult.Invalid(e.failure(), e.getMessage());
        }
    }

    /**
     * Validate a token with the configured settings, throwing on rejection.
     *
     * @throws TokenValidationException with the failure category, or
     *                                  {@link ClaimCompletenessException} when a required claim is absent
     */
    public InventoryPrincipal validateOrThrow(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenValidationException(TokenFailure.MALFORMED, "No token provided");
        }
        final var resolved = settings();
        return verify(token, resolved.secretKey(), resolved.issuer(), resolved.audience()).principal();
    }

    private TokenValidationResult.Valid verify(String token, String secretKey, String issuer, String audience) {
        final byte[] secret;
        try {
            secret = JwtSettings.decodeSecret(secretKey == null ? "" : secretKey);
        } catch (ConfigurationException e) {
            throw new TokenValidationException(TokenFailure.INVALID_SECRET, INVALID_SECRET_MESSAGE);
        }
        if (secret.length == 0) {
            throw new TokenValidationException(TokenFailure.INVALID_SECRET, INVALID_SECRET_MESSAGE);
        }

        final var consumer = new JwtConsumerBuilder()
                .setRequireExpirationTime()
                .setAllowedClockSkewInSeconds(0)
                .setEvaluationTime(NumericDate.fromMilliseconds(clock.millis()))
                .setExpectedIssuer(issuer)
                .setExpectedAudience(audience)
                .setVerificationKey(new HmacKey(secret))
                .setJwsAlgorithmConstraints(
                        AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.HMAC_SHA256)
                .build();

        final JwtClaims claims;
        try {
            claims = consumer.processToClaims(token);
        } catch (InvalidJwtException e) {
            throw classify(e);
        }

        try {
            return new TokenValidationResult.Valid(
                    toPrincipal(claims), Instant.ofEpochSecond(claims.getExpirationTime().getValue()));
        } catch (MalformedClaimException e) {
            throw new TokenValidationException(TokenFailure.MALFORMED, "Token has a malformed claim");
        }
    }

    /**
     * Flatten a principal's claims for display: canonical names, numeric dates,
     * and a list for a multi-valued role.
     */
    public Map<String, Object> flattenClaims(InventoryPrincipal principal) {
        final var flattened = new LinkedHashMap<String, Object>();
        principal.claims().forEach((name, value) -> {
            if (ClaimNames.ROLE.equalsIgnoreCase(name)) {
                flattened.put(name, principal.roles().size() == 1 ? principal.roles().get(0) : principal.roles());
            } else {
                flattened.put(name, value);
            }
        });
        return flattened;
    }

    private InventoryPrincipal toPrincipal(JwtClaims claims) throws MalformedClaimException {
        final var canonical = new TreeMap<String, Object>(String.CASE_INSENSITIVE_ORDER);
        final var roles = new ArrayList<String>();
        for (Map.Entry<String, Object> entry : claims.getClaimsMap().entrySet()) {
            final var name = claimNames.toCanonical(entry.getKey());
            final var value = entry.getValue();
            if (ClaimNames.ROLE.equalsIgnoreCase(name)) {
                collectRoles(value, roles);
                continue;
            }
            if (value instanceof List<?> list) {
                canonical.put(name, list.stream().map(String::valueOf).toList());
            } else {
                canonical.put(name, value);
            }
        }

        requireText(canonical.get(ClaimNames.SUBJECT), ClaimNames.SUBJECT);
        requireText(canonical.get(ClaimNames.JWT_ID), ClaimNames.JWT_ID);
        if (roles.isEmpty()) {
            throw new ClaimCompletenessException(ClaimNames.ROLE);
        }
        canonical.put(ClaimNames.ROLE, List.copyOf(roles));

        final var username = canonical.get(ClaimNames.USERNAME);
        return new InventoryPrincipal(
                String.valueOf(canonical.get(ClaimNames.SUBJECT)),
                username == null ? null : String.valueOf(username),
                roles,
                canonical);
    }

    private static void collectRoles(Object value, List<String> roles) {
        if (value instanceof List<?> list) {
            for (Object item : list) {
                collectRoles(item, roles);
            }
        } else if (value != null) {
            final var role = String.valueOf(value).trim();
            if (!role.isEmpty() && !roles.contains(role)) {
                roles.add(role);
            }
        }
    }

    private static void requireText(Object value, String claim) {
        if (value == null || String.valueOf(value).isBlank()) {
            throw new ClaimCompletenessException(claim);
        }
    }

    private static TokenValidationException classify(InvalidJwtException e) {
        if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID) || e.hasErrorCode(ErrorCodes.SIGNATURE_MISSING)) {
            return new TokenValidationException(TokenFailure.BAD_SIGNATURE, "Invalid token signature");
        }
        if (e.hasExpired()) {
            return new TokenValidationException(TokenFailure.EXPIRED, "Token has expired");
        }
        if (e.hasErrorCode(ErrorCodes.ISSUER_INVALID) || e.hasErrorCode(ErrorCodes.ISSUER_MISSING)) {
            return new TokenValidationException(TokenFailure.WRONG_ISSUER, "Invalid token issuer");
        }
        if (e.hasErrorCode(ErrorCodes.AUDIENCE_INVALID) || e.hasErrorCode(ErrorCodes.AUDIENCE_MISSING)) {
            return new TokenValidationException(TokenFailure.WRONG_AUDIENCE, "Invalid token audience");
        }
        if (e.getCause() instanceof InvalidKeyException) {
            return new TokenValidationException(TokenFailure.INVALID_SECRET, "Token signing key is too short");
        }
        return new TokenValidationException(TokenFailure.MALFORMED, "Token is malformed");
    }
}
