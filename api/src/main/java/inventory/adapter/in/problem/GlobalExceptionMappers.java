package inventory.adapter.in.problem;

import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import inventory.adapter.in.auth.AuthorizationFailureResponder;
import inventory.core.config.ConfigurationException;
import inventory.core.model.auth.AccountLookupException;
import inventory.core.model.auth.AuthenticationOutcome;
import inventory.core.model.auth.CredentialParseException;
import inventory.core.model.auth.RequestHeaders;
import inventory.core.model.auth.TokenValidationException;
import inventory.core.model.server.ServerNotFoundException;

/**
 * Global exception mappers converting domain exceptions to JSON error bodies.
 *
 * <p>Clients see the exception message for request errors and a fixed message for
 * server errors.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);

    static final String INTERNAL_ERROR = "Internal server error";

    private final AuthorizationFailureResponder responder;

    public GlobalExceptionMappers(AuthorizationFailureResponder responder) {
        this.responder = responder;
    }

    @ServerExceptionMapper
    public Response mapCredentialParseException(CredentialParseException e) {
        return responder.unauthorized(AuthenticationOutcome.DEFAULT_SCHEME, e.getMessage(), RequestHeaders.empty());
    }

    @ServerExceptionMapper
    public Response mapAccountLookupException(AccountLookupException e) {
        return responder.unauthorized(AuthenticationOutcome.DEFAULT_SCHEME, e.getMessage(), RequestHeaders.empty());
    }

    @ServerExceptionMapper
    public Response mapTokenValidationException(TokenValidationException e) {
        LOG.debugv("Token rejected ({0}): {1}", e.failure(), e.getMessage());
        return responder.unauthorized(AuthenticationOutcome.BEARER_SCHEME, e.getMessage(), RequestHeaders.empty());
    }

    @ServerExceptionMapper
    public Response mapServerNotFoundException(ServerNotFoundException e) {
        return error(Response.Status.NOT_FOUND, e.getMessage());
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return error(Response.Status.BAD_REQUEST, e.getMessage());
    }

    @ServerExceptionMapper
    public Response mapConfigurationException(ConfigurationException e) {
        LOG.errorv(e, "Configuration error: {0}", e.getMessage());
        return error(Response.Status.INTERNAL_SERVER_ERROR, INTERNAL_ERROR);
    }

    @ServerExceptionMapper
    public Response mapWebApplicationException(WebApplicationException e) {
        return e.getResponse();
    }

    @ServerExceptionMapper
    public Response mapUnexpectedException(RuntimeException e) {
        LOG.errorv(e, "Unhandled error: {0}", e.getMessage());
        return error(Response.Status.INTERNAL_SERVER_ERROR, INTERNAL_ERROR);
    }

    private static Response error(Response.Status status, String message) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", message == null ? status.getReasonPhrase() : message))
                .build();
    }
}
