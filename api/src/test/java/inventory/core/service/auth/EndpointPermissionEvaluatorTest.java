package inventory.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import inventory.adapter.out.storage.memory.InMemoryRoleRepository;
import inventory.core.model.auth.AuthorizationDecision;
import inventory.core.model.auth.EndpointPermission;
import inventory.core.model.auth.EndpointPermissionAction;
import inventory.core.model.auth.Role;
import inventory.core.model.auth.RoleType;
import inventory.core.model.routing.EndpointRoute;
import inventory.core.model.routing.HttpVerb;
import inventory.core.port.out.RoleRepository;

@DisplayName("EndpointPermissionEvaluator")
class EndpointPermissionEvaluatorTest {

    private static final EndpointRoute GET_BY_ID = EndpointRoute.of("Server", "GetById", HttpVerb.GET, "{Id}");
    private static final EndpointRoute DELETE = EndpointRoute.of("Server", "Delete", HttpVerb.DELETE, "{Id}");
    private static final EndpointRoute POST = EndpointRoute.of("Server", "Post", HttpVerb.POST);

    private InMemoryRoleRepository repository;
    private EndpointPermissionEvaluator evaluator;

    @BeforeEach
    void setUp() {
        repository = new InMemoryRoleRepository();
        for (RoleType type : RoleType.values()) {
            repository.save(type.defaultRole()).await().atMost(Duration.ofSeconds(1));
        }
        evaluator = new EndpointPermissionEvaluator(repository);
    }

    private AuthorizationDecision authorize(List<String> roles, EndpointRoute route) {
        return evaluator.authorize(roles, route).await().atMost(Duration.ofSeconds(1));
    }

    private static String deniedMessage(AuthorizationDecision decision) {
        return assertInstanceOf(AuthorizationDecision.Denied.class, decision).message();
    }

    @Nested
    @DisplayName("bootstrap roles")
    class BootstrapRoleTests {

        @Test
        @DisplayName("user may read but not delete servers")
        void userMayReadNotDelete() {
            assertTrue(authorize(List.of("user"), GET_BY_ID).isAllowed());
            assertEquals(
                    "Role 'user' does not have access to endpoint 'Server/Delete/Id' with action 'Delete'.",
                    deniedMessage(authorize(List.of("user"), DELETE)));
        }

        @Test
        @DisplayName("admin may do anything")
        void adminMayDoAnything() {
            assertTrue(authorize(List.of("admin"), DELETE).isAllowed());
            assertTrue(authorize(List.of("Admin"), POST).isAllowed());
        }

        @Test
        @DisplayName("guest is denied everything")
        void guestIsDenied() {
            assertEquals(
                    "Role 'guest' does not have access to endpoint 'Server/GetById/Id' with action 'Read'.",
                    deniedMessage(authorize(List.of("guest"), GET_BY_ID)));
        }

        @Test
        @DisplayName("singleendpoint may only read one endpoint")
        void singleEndpointMayReadOne() {
            assertTrue(authorize(List.of("singleendpoint"), GET_BY_ID).isAllowed());
            assertTrue(authorize(List.of("singleendpoint"),
                    EndpointRoute.of("Server", "GetByFilter", HttpVerb.GET)) instanceof AuthorizationDecision.Denied);
        }
    }

    @Nested
    @DisplayName("role walk")
    class RoleWalkTests {

        @Test
        @DisplayName("should allow when any role authorizes")
        void shouldAllowWhenAnyRoleAuthorizes() {
            assertTrue(authorize(List.of("guest", "priviledged"), POST).isAllowed());
        }

        @Test
        @DisplayName("should name the last role checked when denying")
        void shouldNameLastRole() {
            assertEquals(
                    "Role 'user' does not have access to endpoint 'Server/Post' with action 'Create'.",
                    deniedMessage(authorize(List.of("guest", "user"), POST)));
        }

        @Test
        @DisplayName("should treat unknown roles as granting nothing")
        void shouldTreatUnknownRoleAsEmpty() {
            assertEquals(
                    "Role 'ghost' does not have access to endpoint 'Server/GetById/Id' with action 'Read'.",
                    deniedMessage(authorize(List.of("ghost"), GET_BY_ID)));
        }

        @Test
        @DisplayName("should deny with a hint when there are no roles")
        void shouldDenyWithoutRoles() {
            assertEquals(
                    "No claims found for the current user. Are you missing an Authorization header?",
                    deniedMessage(authorize(List.of(), GET_BY_ID)));
        }

        @Test
        @DisplayName("should allow anonymous routes without roles")
        void shouldAllowAnonymous() {
            assertTrue(authorize(List.of(), EndpointRoute.anonymous("Account", "Token", HttpVerb.POST)).isAllowed());
        }

        @Test
        @DisplayName("should honour a None grant as deny override")
        void shouldHonourNone() {
            repository.save(new Role("auditor", null, List.of(
                            EndpointPermission.of("All", EndpointPermissionAction.WRITE),
                            EndpointPermission.of("Server/Delete", EndpointPermissionAction.NONE))))
                    .await()
                    .atMost(Duration.ofSeconds(1));

            assertTrue(authorize(List.of("auditor"), DELETE) instanceof AuthorizationDecision.Denied);
            assertTrue(authorize(List.of("auditor"), POST).isAllowed());
        }
    }

    @Nested
    @DisplayName("lookup failures")
    class LookupFailureTests {

        @Test
        @DisplayName("should skip a role whose lookup fails and keep checking")
        void shouldSkipFailedLookup() {
            final var failing = mock(RoleRepository.class);
            when(failing.findByName("broken"))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("storage down")));
            when(failing.findByName("admin"))
                    .thenReturn(Uni.createFrom().item(Optional.of(RoleType.ADMIN.defaultRole())));
            final var resilient = new EndpointPermissionEvaluator(failing);

            final var decision = resilient.authorize(List.of("broken", "admin"), DELETE)
                    .await()
                    .atMost(Duration.ofSeconds(1));

            assertTrue(decision.isAllowed());
        }

        @Test
        @DisplayName("should stop at the first authorizing role")
        void shouldShortCircuit() {
            final var counting = mock(RoleRepository.class);
            when(counting.findByName("admin"))
                    .thenReturn(Uni.createFrom().item(Optional.of(RoleType.ADMIN.defaultRole())));
            final var shortCircuit = new EndpointPermissionEvaluator(counting);

            shortCircuit.authorize(List.of("admin", "user"), GET_BY_ID).await().atMost(Duration.ofSeconds(1));

            verify(counting, never()).findByName("user");
            verify(counting).findByName(anyString());
        }
    }
}
