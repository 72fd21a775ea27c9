package inventory.core.model.auth;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Case-insensitive, read-only view of request headers.
 */
public final class RequestHeaders {

    private static final RequestHeaders EMPTY = new RequestHeaders(new TreeMap<>(String.CASE_INSENSITIVE_ORDER));

    private final Map<String, List<String>> values;

    private RequestHeaders(TreeMap<String, List<String>> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static RequestHeaders empty() {
        return EMPTY;
    }

    public static RequestHeaders of(Map<String, List<String>> headers) {
        final var copy = new TreeMap<String, List<String>>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, list) -> {
                if (name != null && list != null) {
                    copy.merge(name, List.copyOf(list), (a, b) -> {
                        final var merged = new ArrayList<>(a);
                        merged.addAll(b);
                        return List.copyOf(merged);
                    });
                }
            });
        }
        return new RequestHeaders(copy);
    }

    public static RequestHeaders single(Map<String, String> headers) {
        final var copy = new TreeMap<String, List<String>>(String.CASE_INSENSITIVE_ORDER);
        headers.forEach((name, value) -> copy.put(name, List.of(value)));
        return new RequestHeaders(copy);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /**
     * First value of the header, or null when absent.
     */
    public String first(String name) {
        final var list = values.get(name);
        return list == null || list.isEmpty() ? null : list.get(0);
    }

    /**
     * All headers with multiple values joined by commas.
     */
    public Map<String, String> joined() {
        final var result = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
        values.forEach((name, list) -> result.put(name, String.join(",", list)));
        return result;
    }
}
