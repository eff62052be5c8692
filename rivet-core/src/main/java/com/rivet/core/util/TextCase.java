package com.rivet.core.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Case conversions for component names.
 *
 * <p>Input may be in any common casing ({@code UserProfile}, {@code user_profile},
 * {@code user-profile}, {@code HTTPClient}); it is split into words first, treating runs of
 * capitals as acronyms:
 * <pre>{@code
 * TextCase.snake("HTTPClientFactory")  // "http_client_factory"
 * TextCase.pascal("blog_post")         // "BlogPost"
 * TextCase.camel("BlogPost")           // "blogPost"
 * }</pre>
 */
public final class TextCase {

    private TextCase() {
        // Utility class
    }

    /**
     * Splits a name into words at separators and case boundaries.
     *
     * @param input name in any casing
     * @return words in order, original casing kept
     */
    public static List<String> words(String input) {
        List<String> words = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (c == '_' || c == '-' || c == ' ' || c == '.') {
                flush(current, words);
                continue;
            }
            if (current.length() > 0 && Character.isUpperCase(c)) {
                char previous = input.charAt(i - 1);
                boolean nextIsLower = i + 1 < input.length() && Character.isLowerCase(input.charAt(i + 1));
                if (!Character.isUpperCase(previous) || nextIsLower) {
                    flush(current, words);
                }
            }
            current.append(c);
        }
        flush(current, words);
        return words;
    }

    public static String snake(String input) {
        return String.join("_", lowerWords(input));
    }

    public static String kebab(String input) {
        return String.join("-", lowerWords(input));
    }

    public static String pascal(String input) {
        StringBuilder out = new StringBuilder();
        for (String word : words(input)) {
            out.append(capitalize(word));
        }
        return out.toString();
    }

    public static String camel(String input) {
        List<String> words = words(input);
        if (words.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(words.get(0).toLowerCase(Locale.ROOT));
        for (String word : words.subList(1, words.size())) {
            out.append(capitalize(word));
        }
        return out.toString();
    }

    public static String title(String input) {
        List<String> titled = new ArrayList<>();
        for (String word : words(input)) {
            titled.add(capitalize(word));
        }
        return String.join(" ", titled);
    }

    public static String capitalize(String word) {
        if (word.isEmpty()) {
            return word;
        }
        return Character.toUpperCase(word.charAt(0)) + word.substring(1);
    }

    /**
     * Checks that a name starts with a letter or underscore and contains only letters,
     * digits and underscores.
     *
     * @param name candidate name
     * @return true if valid
     */
    public static boolean isValidIdentifier(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        char first = name.charAt(0);
        if (!Character.isLetter(first) && first != '_') {
            return false;
        }
        return name.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '_');
    }

    private static List<String> lowerWords(String input) {
        return words(input).stream().map(word -> word.toLowerCase(Locale.ROOT)).toList();
    }

    private static void flush(StringBuilder current, List<String> words) {
        if (current.length() > 0) {
            words.add(current.toString());
            current.setLength(0);
        }
    }
}
