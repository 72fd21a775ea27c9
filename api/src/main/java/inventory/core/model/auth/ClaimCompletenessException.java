package inventory.core.model.auth;

/**
 * A validly signed token lacks a claim required to build a principal.
 */
public class ClaimCompletenessException extends TokenValidationException {

    private final String claim;

    public ClaimCompletenessException(String claim) {
        super(TokenFailure.MISSING_CLAIM, "Token is missing required claim: " + claim);
        this.claim = claim;
    }

    public String claim() {
        return claim;
    }
}
