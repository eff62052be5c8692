package com.rivet.core.util;

import java.util.Locale;

/**
 * English plural and singular forms using simple suffix rules.
 *
 * <p>Only the last word of a compound name is inflected ({@code blog_post} becomes
 * {@code blog_posts}).
 */
public final class Inflector {

    private Inflector() {
        // Utility class
    }

    public static String pluralize(String word) {
        if (word == null || word.isEmpty()) {
            return word;
        }
        String lower = word.toLowerCase(Locale.ROOT);
        if (lower.endsWith("s") || lower.endsWith("sh") || lower.endsWith("ch")
            || lower.endsWith("x") || lower.endsWith("z")) {
            return word + "es";
        }
        if (lower.endsWith("y") && lower.length() > 1 && !isVowel(lower.charAt(lower.length() - 2))) {
            return word.substring(0, word.length() - 1) + "ies";
        }
        if (lower.endsWith("fe")) {
            return word.substring(0, word.length() - 2) + "ves";
        }
        if (lower.endsWith("f")) {
            return word.substring(0, word.length() - 1) + "ves";
        }
        return word + "s";
    }

    public static String singularize(String word) {
        if (word == null || word.isEmpty()) {
            return word;
        }
        String lower = word.toLowerCase(Locale.ROOT);
        if (lower.endsWith("ies") && word.length() > 3) {
            return word.substring(0, word.length() - 3) + "y";
        }
        if (lower.endsWith("ves") && word.length() > 3) {
            return word.substring(0, word.length() - 3) + "f";
        }
        if (lower.endsWith("ses") || lower.endsWith("shes") || lower.endsWith("ches")
            || lower.endsWith("xes") || lower.endsWith("zes")) {
            return word.substring(0, word.length() - 2);
        }
        if (lower.endsWith("s") && !lower.endsWith("ss") && word.length() > 1) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }

    private static boolean isVowel(char c) {
        return "aeiou".indexOf(c) >= 0;
    }
}
