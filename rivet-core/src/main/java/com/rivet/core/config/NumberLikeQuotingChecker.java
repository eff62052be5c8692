package com.rivet.core.config;

import com.fasterxml.jackson.dataformat.yaml.util.StringQuotingChecker;

import java.util.regex.Pattern;

/**
 * Quotes string values that a YAML reader could take for a number.
 *
 * <p>Jackson's default checker only quotes plain decimals, so {@code 0x10}, {@code 1_000},
 * {@code 0o17}, {@code 1:20} and {@code .inf} would be written bare and come back as numbers.
 * Any value that starts like a YAML 1.1 number is quoted here.
 */
final class NumberLikeQuotingChecker extends StringQuotingChecker.Default {

    private static final long serialVersionUID = 1L;

    private static final Pattern NUMBER_LIKE = Pattern.compile(
        "[-+]?(\\.?[0-9].*|\\.(inf|Inf|INF))|\\.(nan|NaN|NAN)");

    @Override
    public boolean needToQuoteValue(String value) {
        return super.needToQuoteValue(value) || NUMBER_LIKE.matcher(value).matches();
    }
}
