package de.bsommerfeld.panelvault.scraper.http;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Case-insensitive, immutable view of response headers.
 */
public final class HttpHeaders {

    private static final HttpHeaders EMPTY = new HttpHeaders(Map.of());

    private final Map<String, List<String>> values;

    private HttpHeaders(Map<String, List<String>> values) {
        this.values = values;
    }

    public static HttpHeaders of(Map<String, List<String>> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, List<String>> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        raw.forEach((name, list) -> {
            if (name != null) {
                map.put(name, List.copyOf(list));
            }
        });
        return new HttpHeaders(map);
    }

    /** Convenience for single-valued headers, mostly in tests. */
    public static HttpHeaders of(String name, String value) {
        return of(Map.of(name, List.of(value)));
    }

    public static HttpHeaders empty() {
        return EMPTY;
    }

    /** First value of the header, or null. */
    public String first(String name) {
        List<String> list = values.get(name);
        return list == null || list.isEmpty() ? null : list.get(0);
    }

    public String contentType() {
        return first("Content-Type");
    }

    /** The {@code charset} parameter of the Content-Type, or null. */
    public String charset() {
        String contentType = contentType();
        if (contentType == null) {
            return null;
        }
        for (String param : contentType.split(";")) {
            String trimmed = param.trim();
            if (trimmed.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String value = trimmed.substring("charset=".length()).trim();
                if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
                    value = value.substring(1, value.length() - 1);
                }
                return value.isEmpty() ? null : value;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
