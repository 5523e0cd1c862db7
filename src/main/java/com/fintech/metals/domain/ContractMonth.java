package com.fintech.metals.domain;

import java.time.Month;
import java.time.YearMonth;
import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A contract-month label together with the calendar month it denotes, when it can be
 * worked out. Upstream labels come as "JAN25", "MAR 2025", "MARCH 2025" or "2025-03".
 *
 * @param label Label exactly as published upstream (trimmed)
 * @param month Parsed calendar month, {@code null} if the label is not recognised
 */
public record ContractMonth(String label, YearMonth month) {

    private static final Pattern NAMED = Pattern.compile("^([A-Z]{3,9})[\\s'-]*(\\d{2}|\\d{4})$");
    private static final Pattern NUMERIC = Pattern.compile("^(\\d{4})-(\\d{1,2})$");

    /**
     * Chronological order; labels that could not be parsed go last.
     */
    public static final Comparator<ContractMonth> CHRONOLOGICAL =
        Comparator.comparing(ContractMonth::month, Comparator.nullsLast(Comparator.naturalOrder()));

    /** Parses a label. Never fails: unknown formats yield a {@code null} month. */
    public static ContractMonth parse(String label) {
        String trimmed = label == null ? "" : label.trim();
        return new ContractMonth(trimmed, toYearMonth(trimmed.toUpperCase(Locale.ROOT)).orElse(null));
    }

    /** Returns true for the placeholder labels the feed sends when a slot is empty. */
    public static boolean isPlaceholder(String label) {
        return label == null || label.isBlank() || "0".equals(label.trim());
    }

    private static Optional<YearMonth> toYearMonth(String label) {
        Matcher numeric = NUMERIC.matcher(label);
        if (numeric.matches()) {
            int month = Integer.parseInt(numeric.group(2));
            if (month < 1 || month > 12) {
                return Optional.empty();
            }
            return Optional.of(YearMonth.of(Integer.parseInt(numeric.group(1)), month));
        }

        Matcher named = NAMED.matcher(label);
        if (!named.matches()) {
            return Optional.empty();
        }
        Optional<Month> month = monthFromName(named.group(1));
        if (month.isEmpty()) {
            return Optional.empty();
        }
        int year = Integer.parseInt(named.group(2));
        if (year < 100) {
            year += 2000;
        }
        return Optional.of(YearMonth.of(year, month.get()));
    }

    private static Optional<Month> monthFromName(String token) {
        for (Month month : Month.values()) {
            String full = month.name();
            if (full.startsWith(token) && token.length() >= 3) {
                return Optional.of(month);
            }
        }
        return Optional.empty();
    }
}
