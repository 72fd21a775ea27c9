package inventory.adapter.in.rest;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.OPTIONS;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import inventory.adapter.in.dto.ServerDto;
import inventory.core.model.server.ServerFilter;
import inventory.core.port.in.ServerManagement;

/**
 * REST resource for the server inventory.
 *
 * <p>Every method requires a Bearer token whose roles grant the method's
 * endpoint; see {@link EndpointRoutes}.
 */
@Path("/server")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ServerResource {

    static final String ALLOWED_METHODS = "GET, POST, PUT, PATCH, DELETE, OPTIONS";

    private final ServerManagement servers;

    @Inject
    public ServerResource(ServerManagement servers) {
        this.servers = servers;
    }

    @GET
    @Path("/{id}")
    public Uni<ServerDto> getById(@PathParam("id") long id) {
        return servers.get(id).map(ServerDto::from);
    }

    @GET
    public Uni<List<ServerDto>> getByFilter(@QueryParam("name") String name, @QueryParam("ipAddress") String ipAddress) {
        return servers.list(new ServerFilter(name, ipAddress))
                .map(list -> list.stream().map(ServerDto::from).toList());
    }

    @POST
    public Uni<Response> post(ServerDto request) {
        return servers.create(request == null ? null : request.toModel())
                .map(created -> Response.status(Response.Status.CREATED)
                        .entity(ServerDto.from(created))
                        .build());
    }

    @PATCH
    @Path("/{id}")
    public Uni<ServerDto> patch(@PathParam("id") long id, ServerDto request) {
        return servers.patch(id, request == null ? null : request.toModel()).map(ServerDto::from);
    }

    @PUT
    @Path("/{id}")
    public Uni<ServerDto> put(@PathParam("id") long id, ServerDto request) {
        return servers.replace(id, request == null ? null : request.toModel()).map(ServerDto::from);
    }

    @DELETE
    @Path("/{id}")
    public Uni<Response> delete(@PathParam("id") long id) {
        return servers.delete(id).map(ignored -> Response.noContent().build());
    }

    @OPTIONS
    public Response options() {
        return Response.ok().header("Allow", ALLOWED_METHODS).build();
    }
}
