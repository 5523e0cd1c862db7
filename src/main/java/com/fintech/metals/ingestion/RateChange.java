package com.fintech.metals.ingestion;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Signed change pair parsed from the feed's "rate of change" text, e.g. {@code "-5.45 (-0.23%)"}.
 *
 * @param delta Signed absolute change
 * @param deltaPercent Signed change in percent
 */
public record RateChange(BigDecimal delta, BigDecimal deltaPercent) {

    public static final RateChange ZERO = new RateChange(BigDecimal.ZERO, BigDecimal.ZERO);

    private static final Pattern PATTERN =
        Pattern.compile("^([-+]?\\d+\\.?\\d*)\\s*\\(\\s*([-+]?\\d+\\.?\\d*)\\s*%\\s*\\)$");

    /**
     * Parses the change text. Anything that does not match yields {@link #ZERO}.
     */
    public static RateChange parse(String text) {
        if (text == null) {
            return ZERO;
        }
        // the feed sometimes doubles the parentheses: "-5.45 ((-0.23%))"
        String cleaned = text.trim().replace(",", "").replace("((", "(").replace("))", ")");
        Matcher matcher = PATTERN.matcher(cleaned);
        if (!matcher.matches()) {
            return ZERO;
        }
        return new RateChange(new BigDecimal(matcher.group(1)), new BigDecimal(matcher.group(2)));
    }
}
