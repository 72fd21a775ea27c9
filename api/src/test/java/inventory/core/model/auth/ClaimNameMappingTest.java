package inventory.core.model.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ClaimNameMapping")
class ClaimNameMappingTest {

    private final ClaimNameMapping mapping = ClaimNameMapping.defaults();

    @Test
    @DisplayName("should map unique_name both ways")
    void shouldMapUniqueName() {
        assertEquals(ClaimNames.USERNAME, mapping.toCanonical("unique_name"));
        assertEquals("unique_name", mapping.toWire(ClaimNames.USERNAME));
    }

    @Test
    @DisplayName("should match claim names regardless of case")
    void shouldIgnoreCase() {
        assertEquals(ClaimNames.USERNAME, mapping.toCanonical("Unique_Name"));
        assertEquals("unique_name", mapping.toWire("USERNAME"));
        assertEquals(ClaimNames.ROLE, mapping.toCanonical("Roles"));
    }

    @Test
    @DisplayName("built mappings should stay case-insensitive")
    void builtMappingShouldIgnoreCase() {
        final var custom = ClaimNameMapping.builder().map("preferred_username", ClaimNames.USERNAME).build();

        assertEquals(ClaimNames.USERNAME, custom.toCanonical("PREFERRED_USERNAME"));
        assertEquals("preferred_username", custom.toWire("UserName"));
    }

    @Test
    @DisplayName("should normalize long-form claim URIs")
    void shouldNormalizeClaimUris() {
        assertEquals(ClaimNames.ROLE,
                mapping.toCanonical("http://schemas.microsoft.com/ws/2008/06/identity/claims/role"));
        assertEquals(ClaimNames.SUBJECT,
                mapping.toCanonical("http://schemas.xmlsoap.org/ws/2005/05/identity/claims/nameidentifier"));
        assertEquals(ClaimNames.EMAIL,
                mapping.toCanonical("http://schemas.xmlsoap.org/ws/2005/05/identity/claims/emailaddress"));
    }

    @Test
    @DisplayName("should pass unmapped names through")
    void shouldPassThroughUnmapped() {
        assertEquals("sub", mapping.toCanonical("sub"));
        assertEquals("role", mapping.toWire("role"));
        assertEquals("custom", mapping.toCanonical("custom"));
    }

    @Test
    @DisplayName("should reject two primary wire names for one claim")
    void shouldRejectDuplicatePrimary() {
        assertThrows(IllegalArgumentException.class, () -> ClaimNameMapping.builder()
                .map("unique_name", ClaimNames.USERNAME)
                .map("preferred_username", ClaimNames.USERNAME));
    }
}
