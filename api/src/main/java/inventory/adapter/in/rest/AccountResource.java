package inventory.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import org.jboss.logging.Logger;

import inventory.adapter.in.auth.AuthorizationFailureResponder;
import inventory.adapter.in.dto.ProvisionedAccountResponse;
import inventory.adapter.in.dto.TokenResponse;
import inventory.adapter.in.dto.TokenVerificationResponse;
import inventory.core.model.auth.AuthenticationOutcome;
import inventory.core.model.auth.RequestHeaders;
import inventory.core.model.auth.RoleType;
import inventory.core.model.auth.TokenValidationResult;
import inventory.core.port.in.AccountManagement;
import inventory.core.service.auth.SchemeDispatcher;
import inventory.core.service.auth.TokenService;

/**
 * Account provisioning and credential exchange.
 *
 * <p>Every endpoint here is anonymous: callers use it to obtain credentials and
 * exchange them for a Bearer token.
 */
@Path("/account")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class AccountResource {

    private static final Logger LOG = Logger.getLogger(AccountResource.class);

    static final String VERIFY_HEADERS_REQUIRED = "token and secret headers are required";

    private final AccountManagement accountManagement;
    private final SchemeDispatcher dispatcher;
    private final TokenService tokenService;
    private final AuthorizationFailureResponder responder;

    @Inject
    public AccountResource(
            AccountManagement accountManagement,
            SchemeDispatcher dispatcher,
            TokenService tokenService,
            AuthorizationFailureResponder responder) {
        this.accountManagement = accountManagement;
        this.dispatcher = dispatcher;
        this.tokenService = tokenService;
        this.responder = responder;
    }

    /**
     * Provision an account with generated credentials.
     *
     * @param roleType      role to assign, defaults to {@code user}
     * @param restrictIp    restrict the account to the caller's address
     * @param restrictRange restrict the account to the caller's /24 range
     * @return 201 with the account and its one-time credentials
     */
    @GET
    public Uni<Response> provision(
            @QueryParam("roleType") String roleType,
            @QueryParam("restrictIp") @DefaultValue("false") boolean restrictIp,
            @QueryParam("restrictRange") @DefaultValue("false") boolean restrictRange,
            @Context HttpServerRequest request) {
        final var type = RoleType.fromName(roleType);
        return accountManagement
                .provision(type, remoteIp(request), restrictIp, restrictRange)
                .map(provisioned -> Response.status(Response.Status.CREATED)
                        .entity(ProvisionedAccountResponse.from(provisioned))
                        .build());
    }

    /**
     * Exchange ApiKey or Basic credentials for a Bearer token.
     *
     * @return 200 with the token, or 401 with the failure details
     */
    @POST
    @Path("/token")
    public Uni<Response> token(@Context HttpHeaders httpHeaders, @Context HttpServerRequest request) {
        final var headers = RequestHeaders.of(httpHeaders.getRequestHeaders());
        return dispatcher.authenticate(headers, remoteIp(request)).flatMap(outcome -> {
            if (outcome instanceof AuthenticationOutcome.Success success) {
                return accountManagement.effectiveRoles(success.account()).map(roles -> {
                    final var issued = tokenService.issue(success.account(), roles);
                    LOG.infov("Issued token for {0} via {1}", success.account().username(), success.scheme());
                    return Response.ok(new TokenResponse(issued.token())).build();
                });
            }
            return Uni.createFrom().item(responder.unauthorized(outcome, headers));
        });
    }

    /**
     * Validate a token against a caller-supplied secret and report its claims.
     *
     * @param token  the token to check
     * @param secret base64 signing key
     * @return 200 with the claims, or 400 with the reason
     */
    @POST
    @Path("/token/verify")
    public Response verify(@HeaderParam("token") String token, @HeaderParam("secret") String secret) {
        if (token == null || token.isBlank() || secret == null || secret.isBlank()) {
            return badRequest(VERIFY_HEADERS_REQUIRED);
        }
        final var settings = tokenService.settings();
        final var result = tokenService.validate(token, secret, settings.issuer(), settings.audience());
        if (result instanceof TokenValidationResult.Valid valid) {
            return Response.ok(TokenVerificationResponse.valid(tokenService.flattenClaims(valid.principal())))
                    .build();
        }
        if (result instanceof TokenValidationResult.Invalid invalid) {
            return badRequest(invalid.reason());
        }
        return badRequest(VERIFY_HEADERS_REQUIRED);
    }

    private static Response badRequest(String error) {
        return Response.status(Response.Status.BAD_REQUEST)
                .entity(TokenVerificationResponse.invalid(error))
                .build();
    }

    private static String remoteIp(HttpServerRequest request) {
        if (request == null || request.remoteAddress() == null) {
            return null;
        }
        return request.remoteAddress().host();
    }
}
