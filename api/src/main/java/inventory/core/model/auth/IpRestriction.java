package inventory.core.model.auth;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parsed form of an account's allowed-address list.
 *
 * <p>Entries are comma separated. Each entry is a single address or an inclusive
 * IPv4 range written {@code start-end}. IPv4-mapped IPv6 addresses are compared
 * as IPv4; any other IPv6 address only matches an identical single entry.
 */
public final class IpRestriction {

    private static final IpRestriction UNRESTRICTED = new IpRestriction(List.of());
    private static final String MAPPED_PREFIX = "::ffff:";

    private final List<Entry> entries;

    private IpRestriction(List<Entry> entries) {
        this.entries = entries;
    }

    /**
     * Parse an allowed-address string. Null or blank means unrestricted.
     *
     * @throws IllegalArgumentException if a range bound is not an IPv4 address
     */
    public static IpRestriction parse(String allowed) {
        if (allowed == null || allowed.isBlank()) {
            return UNRESTRICTED;
        }
        final var entries = new ArrayList<Entry>();
        for (String raw : allowed.split(",")) {
            final var value = raw.trim();
            if (value.isEmpty()) {
                continue;
            }
            final var dash = value.indexOf('-');
            if (dash > 0) {
                final var start = ipv4ToLong(normalize(value.substring(0, dash).trim()));
                final var end = ipv4ToLong(normalize(value.substring(dash + 1).trim()));
                if (start < 0 || end < 0) {
                    throw new IllegalArgumentException("IP range must use IPv4 bounds: " + value);
                }
                entries.add(new Range(Math.min(start, end), Math.max(start, end)));
            } else {
                entries.add(new Single(normalize(value)));
            }
        }
        return entries.isEmpty() ? UNRESTRICTED : new IpRestriction(List.copyOf(entries));
    }

    /**
     * Restriction string allowing exactly one address.
     */
    public static String single(String ip) {
        return normalize(ip);
    }

    /**
     * Restriction string allowing hosts .1 through .254 of the address's /24 network.
     *
     * @throws IllegalArgumentException if the address is not IPv4
     */
    public static String subnetRange(String ip) {
        final var normalized = normalize(ip);
        if (ipv4ToLong(normalized) < 0) {
            throw new IllegalArgumentException("IP range restriction requires an IPv4 address: " + ip);
        }
        final var prefix = normalized.substring(0, normalized.lastIndexOf('.') + 1);
        return prefix + "1-" + prefix + "254";
    }

    /**
     * Normalize an address for comparison: trims, lower-cases and unwraps IPv4-mapped IPv6.
     */
    public static String normalize(String ip) {
        if (ip == null) {
            return null;
        }
        var value = ip.trim().toLowerCase(Locale.ROOT);
        if (value.startsWith("[") && value.endsWith("]")) {
            value = value.substring(1, value.length() - 1);
        }
        if (value.startsWith(MAPPED_PREFIX) && ipv4ToLong(value.substring(MAPPED_PREFIX.length())) >= 0) {
            return value.substring(MAPPED_PREFIX.length());
        }
        return value;
    }

    public boolean isUnrestricted() {
        return entries.isEmpty();
    }

    public boolean permits(String remoteIp) {
        if (entries.isEmpty()) {
            return true;
        }
        if (remoteIp == null || remoteIp.isBlank()) {
            return false;
        }
        final var normalized = normalize(remoteIp);
        final var numeric = ipv4ToLong(normalized);
        for (Entry entry : entries) {
            if (entry.permits(normalized, numeric)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Convert a dotted-quad IPv4 address to its unsigned value, or -1 if it is not one.
     */
    static long ipv4ToLong(String ip) {
        if (ip == null) {
            return -1;
        }
        final var parts = ip.split("\\.", -1);
        if (parts.length != 4) {
            return -1;
        }
        long value = 0;
        for (String part : parts) {
            if (part.isEmpty() || part.length() > 3 || !part.chars().allMatch(Character::isDigit)) {
                return -1;
            }
            final var octet = Integer.parseInt(part);
            if (octet > 255) {
                return -1;
            }
            value = (value << 8) | octet;
        }
        return value;
    }

    private sealed interface Entry permits Single, Range {
        boolean permits(String normalized, long numeric);
    }

    private record Single(String address) implements Entry {
        @Override
        public boolean permits(String normalized, long numeric) {
            return address.equals(normalized);
        }
    }

    private record Range(long start, long end) implements Entry {
        @Override
        public boolean permits(String normalized, long numeric) {
            return numeric >= 0 && numeric >= start && numeric <= end;
        }
    }
}
