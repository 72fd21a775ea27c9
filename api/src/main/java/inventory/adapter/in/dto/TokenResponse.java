package inventory.adapter.in.dto;

/**
 * DTO for an issued Bearer token.
 *
 * @param token compact JWS serialization
 */
public record TokenResponse(String token) {}
