package inventory.core.model.auth;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Bidirectional table between claim names on the wire and canonical claim names.
 *
 * <p>Each canonical name has one primary wire name used when issuing tokens.
 * Additional inbound aliases (such as the long XML-soap claim URIs) normalize to
 * the same canonical name. Names without an entry pass through unchanged.
 */
public final class ClaimNameMapping {

    private static final String SOAP_CLAIMS = "http://schemas.xmlsoap.org/ws/2005/05/identity/claims/";
    private static final String MS_CLAIMS = "http://schemas.microsoft.com/ws/2008/06/identity/claims/";

    private static final ClaimNameMapping DEFAULTS = builder()
            .map("unique_name", ClaimNames.USERNAME)
            .alias(SOAP_CLAIMS + "nameidentifier", ClaimNames.SUBJECT)
            .alias(SOAP_CLAIMS + "name", ClaimNames.USERNAME)
            .alias(SOAP_CLAIMS + "emailaddress", ClaimNames.EMAIL)
            .alias(MS_CLAIMS + "role", ClaimNames.ROLE)
            .alias("roles", ClaimNames.ROLE)
            .build();

    private final Map<String, String> toCanonical;
    private final Map<String, String> toWire;

    private ClaimNameMapping(Map<String, String> toCanonical, Map<String, String> toWire) {
        this.toCanonical = Collections.unmodifiableMap(toCanonical);
        this.toWire = Collections.unmodifiableMap(toWire);
    }

    public static ClaimNameMapping defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String toCanonical(String wireName) {
        return toCanonical.getOrDefault(wireName, wireName);
    }

    public String toWire(String canonicalName) {
        return toWire.getOrDefault(canonicalName, canonicalName);
    }

    public static final class Builder {
        private final Map<String, String> toCanonical = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private final Map<String, String> toWire = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

        private Builder() {}

        /**
         * Register the primary wire name for a canonical claim.
         */
        public Builder map(String wireName, String canonicalName) {
            if (toWire.containsKey(canonicalName)) {
                throw new IllegalArgumentException("Canonical claim already mapped: " + canonicalName);
            }
            toCanonical.put(wireName, canonicalName);
            toWire.put(canonicalName, wireName);
            return this;
        }

        /**
         * Register an inbound-only alias.
         */
        public Builder alias(String wireName, String canonicalName) {
            toCanonical.put(wireName, canonicalName);
            return this;
        }

        public ClaimNameMapping build() {
            return new ClaimNameMapping(caseInsensitiveCopy(toCanonical), caseInsensitiveCopy(toWire));
        }
    }

    private static Map<String, String> caseInsensitiveCopy(Map<String, String> source) {
        final var copy = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(source);
        return copy;
    }
}
