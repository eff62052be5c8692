package com.rivet.core.config;

import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Turns command-line text into a typed configuration value.
 *
 * <p>Tried in order: boolean ({@code true}/{@code false}, any case), integer, decimal,
 * then plain string.
 */
public final class ConfigValueParser {

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.\\d*|\\.\\d+)([eE][-+]?\\d+)?|[-+]?\\d+[eE][-+]?\\d+");

    private ConfigValueParser() {
        // Utility class
    }

    /**
     * Parses a raw value.
     *
     * @param raw value as typed
     * @return {@link Boolean}, {@link Long}, {@link Double} or {@link String}
     */
    public static Object parse(String raw) {
        if (raw == null) {
            return "";
        }
        if ("true".equalsIgnoreCase(raw)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(raw)) {
            return Boolean.FALSE;
        }
        if (INTEGER.matcher(raw).matches()) {
            BigInteger value = new BigInteger(raw.startsWith("+") ? raw.substring(1) : raw);
            return value.bitLength() < Long.SIZE ? (Object) value.longValue() : (Object) value.doubleValue();
        }
        if (DECIMAL.matcher(raw).matches()) {
            return Double.parseDouble(raw);
        }
        return raw;
    }
}
