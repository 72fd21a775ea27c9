package inventory.adapter.in.auth;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import org.jboss.logging.Logger;

import inventory.core.model.auth.AuthenticationOutcome;
import inventory.core.model.auth.RequestHeaders;

/**
 * Renders authentication (401) and authorization (403) failures as JSON.
 *
 * <p>401 message priority: the context error, then a missing-header hint for the
 * scheme, then a generic message. Credential-bearing header values are masked in
 * the echoed headers.
 */
@ApplicationScoped
public class AuthorizationFailureResponder {

    private static final Logger LOG = Logger.getLogger(AuthorizationFailureResponder.class);

    static final String GENERIC_MESSAGE = "Please provide valid credentials.";
    static final String FORBIDDEN_FALLBACK = "Unauthorized request";
    static final String MASK = "***";

    private static final Set<String> MASKED_HEADERS = caseInsensitive("Authorization", "ApiKey", "secret", "token");

    /**
     * 401 response for a failed or challenged authentication.
     */
    public Response unauthorized(AuthenticationOutcome outcome, RequestHeaders headers) {
        final var contextError = outcome instanceof AuthenticationOutcome.Fail fail
                ? fail.reason()
                : ((AuthenticationOutcome.Challenge) outcome).reason();
        return unauthorized(outcome.scheme(), contextError, headers);
    }

    /**
     * 401 response for the given scheme.
     *
     * @param scheme       scheme name, e.g. {@code Bearer}
     * @param contextError explicit failure message, may be null
     * @param headers      request headers to echo
     */
    public Response unauthorized(String scheme, String contextError, RequestHeaders headers) {
        final var message = message(scheme, contextError, headers);
        LOG.debugv("Unauthorized ({0}): {1}", scheme, message);

        final var body = new LinkedHashMap<String, Object>();
        if (!AuthenticationOutcome.DEFAULT_SCHEME.equals(scheme)) {
            body.put("scheme", scheme);
        }
        body.put("statuscode", Response.Status.UNAUTHORIZED.getStatusCode());
        body.put("error", "Unauthorized");
        body.put("message", message);
        body.put("headers", maskedHeaders(headers));

        final var response = Response.status(Response.Status.UNAUTHORIZED)
                .type(MediaType.APPLICATION_JSON)
                .entity(body);
        if (AuthenticationOutcome.BEARER_SCHEME.equals(scheme)) {
            response.header("WWW-Authenticate", "Bearer realm=\"inventory\"");
        }
        return response.build();
    }

    /**
     * 403 response carrying the denial message.
     */
    public Response forbidden(String message) {
        final var text = message == null || message.isBlank() ? FORBIDDEN_FALLBACK : message;
        LOG.debugv("Forbidden: {0}", text);
        return Response.status(Response.Status.FORBIDDEN)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", text))
                .build();
    }

    static String message(String scheme, String contextError, RequestHeaders headers) {
        if (contextError != null && !contextError.isBlank()) {
            return contextError;
        }
        final var expectedHeader = AuthenticationOutcome.API_KEY_SCHEME.equals(scheme) ? "ApiKey" : "Authorization";
        if (!AuthenticationOutcome.DEFAULT_SCHEME.equals(scheme) && !headers.contains(expectedHeader)) {
            return "Include an " + expectedHeader + " header in your request";
        }
        return switch (scheme) {
            case AuthenticationOutcome.API_KEY_SCHEME -> "Please provide a valid Apikey.";
            case AuthenticationOutcome.BASIC_SCHEME -> "Please provide a valid Base64 credentials string.";
            case AuthenticationOutcome.BEARER_SCHEME -> "Please provide a valid bearer token.";
            default -> GENERIC_MESSAGE;
        };
    }

    static Map<String, String> maskedHeaders(RequestHeaders headers) {
        final var masked = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
        headers.joined().forEach((name, value) -> masked.put(name, MASKED_HEADERS.contains(name) ? MASK : value));
        return masked;
    }

    private static Set<String> caseInsensitive(String... names) {
        final var set = new TreeSet<String>(String.CASE_INSENSITIVE_ORDER);
        set.addAll(List.of(names));
        return set;
    }
}
