package inventory.core.service.account;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Generates identities and secrets for provisioned accounts.
 */
@ApplicationScoped
public class CredentialGenerator {

    static final String LOWER = "abcdefghijklmnopqrstuvwxyz";
    static final String UPPER = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    static final String SPECIAL = "!@#$%^&*()_+";
    static final String DIGITS = "0123456789";
    static final int CHARS_PER_CLASS = 6;

    private static final List<String> TITLES = List.of("mr.", "mrs.", "ms.", "miss", "dr.", "prof.");

    private static final List<String> NAMES = List.of(
            "Dr. Ada Lovelace",
            "Grace Hopper",
            "Mr. Alan Turing",
            "Ms. Margaret Hamilton",
            "Prof. Edsger Dijkstra",
            "Barbara Liskov",
            "Mrs. Frances Allen",
            "Ken Thompson",
            "Dr. Radia Perlman",
            "Dennis Ritchie");

    private final SecureRandom random = new SecureRandom();

    /**
     * Pick a display name.
     */
    public String randomName() {
        return NAMES.get(random.nextInt(NAMES.size()));
    }

    /**
     * Username from a display name: name parts without title, joined by dots, plus a
     * five character random suffix.
     */
    public String usernameFor(String displayName, UUID seed) {
        final var parts = new ArrayList<String>();
        for (String part : displayName.trim().split("\\s+")) {
            if (!TITLES.contains(part.toLowerCase(Locale.ROOT))) {
                parts.add(part.toLowerCase(Locale.ROOT));
            }
        }
        return String.join(".", parts) + "." + seed.toString().substring(0, 5);
    }

    /**
     * Password of six characters from each class (lower, upper, special, digits), shuffled.
     */
    public String password() {
        final var chars = new ArrayList<Character>();
        for (String pool : List.of(LOWER, UPPER, SPECIAL, DIGITS)) {
            for (int i = 0; i < CHARS_PER_CLASS; i++) {
                chars.add(pool.charAt(random.nextInt(pool.length())));
            }
        }
        Collections.shuffle(chars, random);
        final var password = new StringBuilder(chars.size());
        chars.forEach(password::append);
        return password.toString();
    }

    /**
     * Opaque API key: base64 of a random UUID.
     */
    public String apiKey(UUID seed) {
        return Base64.getEncoder().encodeToString(seed.toString().getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Base64 of {@code username:password}, as sent in a Basic header.
     */
    public static String basicCredentials(String username, String password) {
        return Base64.getEncoder().encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
    }
}
