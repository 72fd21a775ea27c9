package inventory.adapter.in.dto;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of the token verification utility.
 *
 * @param valid  whether the token validated
 * @param claims flattened claims, present when valid
 * @param error  failure reason, present when invalid
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenVerificationResponse(boolean valid, Map<String, Object> claims, String error) {

    public static TokenVerificationResponse valid(Map<String, Object> claims) {
        return new TokenVerificationResponse(true, claims, null);
    }

    public static TokenVerificationResponse invalid(String error) {
        return new TokenVerificationResponse(false, null, error);
    }
}
