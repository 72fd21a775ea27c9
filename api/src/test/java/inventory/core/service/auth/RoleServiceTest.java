package inventory.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import inventory.adapter.out.storage.memory.InMemoryRoleRepository;
import inventory.core.model.auth.EndpointPermission;
import inventory.core.model.auth.EndpointPermissionAction;
import inventory.core.model.auth.Role;
import inventory.core.model.auth.RoleType;

@DisplayName("RoleService")
class RoleServiceTest {

    private InMemoryRoleRepository repository;
    private RoleService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryRoleRepository();
        service = new RoleService(repository);
    }

    @Nested
    @DisplayName("ensureRole()")
    class EnsureRoleTests {

        @Test
        @DisplayName("should seed the default grants on first use")
        void shouldSeedDefaults() {
            final var role = service.ensureRole(RoleType.USER).await().atMost(Duration.ofSeconds(1));

            assertEquals("user", role.name());
            assertEquals(List.of(EndpointPermission.of("Server", EndpointPermissionAction.READ)), role.permissions());
            assertTrue(repository.findByName("USER").await().atMost(Duration.ofSeconds(1)).isPresent());
        }

        @Test
        @DisplayName("should keep a stored role")
        void shouldKeepStoredRole() {
            final var redefined = new Role("user", "Read one endpoint",
                    List.of(EndpointPermission.of("Server/GetById", EndpointPermissionAction.READ)));
            repository.save(redefined).await().atMost(Duration.ofSeconds(1));

            final var role = service.ensureRole(RoleType.USER).await().atMost(Duration.ofSeconds(1));

            assertEquals(redefined, role);
        }
    }
}
