package inventory.core.service.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import inventory.core.model.auth.AuthenticationOutcome;
import inventory.core.model.auth.Credential;
import inventory.core.model.auth.RequestHeaders;
import inventory.core.port.in.AccountResolver;

/**
 * Picks the authentication scheme for a credential-exchange request and runs it.
 *
 * <p>Precedence: an {@code ApiKey} header selects the API key scheme, otherwise an
 * {@code Authorization: Basic} header selects Basic, otherwise the request fails
 * with an invalid-scheme message. Failures never propagate as exceptions.
 */
@ApplicationScoped
public class SchemeDispatcher {

    private static final Logger LOG = Logger.getLogger(SchemeDispatcher.class);

    public static final String API_KEY_HEADER = "ApiKey";
    public static final String AUTHORIZATION_HEADER = "Authorization";

    static final String INVALID_SCHEME_MESSAGE =
            "Invalid authentication scheme. Valid options are ApiKey, Basic or OpenIdConnect/Bearer.";
    static final String NO_REMOTE_IP_MESSAGE = "Remote IP address is not available";

    private final CredentialExtractor extractor;
    private final AccountResolver accountResolver;

    @Inject
    public SchemeDispatcher(CredentialExtractor extractor, AccountResolver accountResolver) {
        this.extractor = extractor;
        this.accountResolver = accountResolver;
    }

    /**
     * Name of the scheme the headers select.
     */
    public String selectScheme(RequestHeaders headers) {
        if (headers.contains(API_KEY_HEADER)) {
            return AuthenticationOutcome.API_KEY_SCHEME;
        }
        if (extractor.isBasic(headers.first(AUTHORIZATION_HEADER))) {
            return AuthenticationOutcome.BASIC_SCHEME;
        }
        return AuthenticationOutcome.DEFAULT_SCHEME;
    }

    /**
     * Authenticate the request.
     *
     * @param headers  request headers
     * @param remoteIp client address, or null when unavailable
     * @return Uni with the outcome; never fails
     */
    public Uni<AuthenticationOutcome> authenticate(RequestHeaders headers, String remoteIp) {
        final var scheme = selectScheme(headers);
        if (AuthenticationOutcome.DEFAULT_SCHEME.equals(scheme)) {
            if (!headers.contains(AUTHORIZATION_HEADER)) {
                return Uni.createFrom().item(new AuthenticationOutcome.Challenge(scheme, INVALID_SCHEME_MESSAGE));
            }
            return Uni.createFrom().item(new AuthenticationOutcome.Fail(scheme, INVALID_SCHEME_MESSAGE));
        }

        final Credential credential;
        try {
            credential = AuthenticationOutcome.API_KEY_SCHEME.equals(scheme)
                    ? extractor.extractApiKey(headers.first(API_KEY_HEADER))
                    : extractor.extractBasic(headers.first(AUTHORIZATION_HEADER));
        } catch (RuntimeException e) {
            return Uni.createFrom().item(new AuthenticationOutcome.Fail(scheme, e.getMessage()));
        }

        if (remoteIp == null || remoteIp.isBlank()) {
            return Uni.createFrom().item(new AuthenticationOutcome.Fail(scheme, NO_REMOTE_IP_MESSAGE));
        }

        return accountResolver
                .resolve(credential, remoteIp)
                .map(account -> {
                    LOG.debugv("Authenticated account {0} with scheme {1}", account.id(), scheme);
                    return (AuthenticationOutcome) new AuthenticationOutcome.Success(account, scheme);
                })
                .onFailure()
                .recoverWithItem(e -> {
                    LOG.debugv("{0} authentication failed: {1}", scheme, e.getMessage());
                    return new AuthenticationOutcome.Fail(scheme, e.getMessage());
                });
    }
}
