package com.rivet.core.config;

import java.util.List;
import java.util.Locale;

/**
 * Recognises configuration keys whose values must not be printed.
 */
public final class SensitiveKeys {

    public static final String MASK = "********";

    private static final List<String> MARKERS = List.of(
        "password", "secret", "token", "private_key", "api_key", "dsn"
    );

    private SensitiveKeys() {
        // Utility class
    }

    public static boolean isSensitive(String key) {
        String lower = key.toLowerCase(Locale.ROOT);
        if (lower.equals("app.key")) {
            return true;
        }
        return MARKERS.stream().anyMatch(marker -> lower.contains(marker) || lower.contains(marker.replace('_', '.')));
    }

    /**
     * Returns the text to display for a value.
     *
     * @param key dotted key
     * @param value formatted value
     * @return the value, the mask, or empty for an empty sensitive value
     */
    public static String display(String key, String value) {
        if (!isSensitive(key)) {
            return value;
        }
        return value == null || value.isEmpty() ? "" : MASK;
    }
}
