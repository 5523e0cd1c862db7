package com.fintech.metals;

import com.fintech.metals.calendar.TradingCalendar;
import com.fintech.metals.domain.QuoteSnapshot;
import com.fintech.metals.domain.SeriesFamily;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.Set;

/**
 * Shared calendar and snapshot builders. 2025-01-10 is a Friday, 2025-01-13 a Monday.
 */
public final class TestFixtures {

    public static final ZoneId IST = ZoneId.of("Asia/Kolkata");
    public static final LocalDate FRIDAY = LocalDate.of(2025, 1, 10);
    public static final LocalDate SATURDAY = LocalDate.of(2025, 1, 11);
    public static final LocalDate MONDAY = LocalDate.of(2025, 1, 13);
    public static final String SOURCE = "scheduled-poll";

    private TestFixtures() {
    }

    public static TradingCalendar calendar() {
        return calendar(Set.of());
    }

    public static TradingCalendar calendar(Set<LocalDate> holidays) {
        return new TradingCalendar(
            IST,
            EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY),
            LocalTime.of(9, 0),
            LocalTime.of(23, 30),
            holidays
        );
    }

    /** Instant of a wall-clock time in IST. */
    public static Instant ist(LocalDate date, int hour, int minute, int second) {
        return LocalDateTime.of(date, LocalTime.of(hour, minute, second)).atZone(IST).toInstant();
    }

    public static Instant ist(LocalDate date, int hour, int minute) {
        return ist(date, hour, minute, 0);
    }

    public static QuoteSnapshot spot(String instrument, Instant at, String price) {
        return new QuoteSnapshot(SeriesFamily.SPOT, instrument, null, at,
            new BigDecimal(price), BigDecimal.ZERO, BigDecimal.ZERO, SOURCE);
    }

    public static QuoteSnapshot contract(String instrument, String month, Instant at, String price) {
        return new QuoteSnapshot(SeriesFamily.CONTRACT_MONTH, instrument, month, at,
            new BigDecimal(price), BigDecimal.ZERO, BigDecimal.ZERO, SOURCE);
    }
}
