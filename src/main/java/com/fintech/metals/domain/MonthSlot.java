package com.fintech.metals.domain;

import java.util.Locale;

/**
 * Numeric price slot of a contract-month series. The label bound to a slot rolls
 * over time, the slot itself does not.
 */
public enum MonthSlot {

    CURRENT(1),
    NEXT(2),
    THIRD(3);

    private final int position;

    MonthSlot(int position) {
        this.position = position;
    }

    /** Returns the 1-based position (month1, month2, month3). */
    public int position() {
        return position;
    }

    /**
     * Parses request parameters such as "current", "next", "third", "month2" or "3".
     *
     * @throws IllegalArgumentException for anything else
     */
    public static MonthSlot fromParam(String value) {
        if (value == null || value.isBlank()) {
            return CURRENT;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "current", "month1", "1" -> CURRENT;
            case "next", "month2", "2" -> NEXT;
            case "third", "month3", "3" -> THIRD;
            default -> throw new IllegalArgumentException(
                "Unsupported month '" + value + "'. Allowed: current, next, third");
        };
    }
}
