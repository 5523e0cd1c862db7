package com.fintech.metals.calendar;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Trading calendar for one market: trading weekdays, a daily session and a single IANA
 * timezone. All session-boundary logic lives here so ingestion gating and aggregation
 * clipping can never disagree.
 *
 * <p>The configured end time names the last minute of the session: an end of 23:30
 * keeps 23:30:59.999 inside and closes at 23:31:00.
 *
 * <p>Thread-safe and stateless - all methods are pure functions of their arguments.
 */
public class TradingCalendar {

    // Longest run of non-trading days we expect (long weekend plus holidays)
    private static final int MAX_LOOKBACK_DAYS = 14;

    private final ZoneId zone;
    private final Set<DayOfWeek> tradingDays;
    private final LocalTime sessionStart;
    private final LocalTime sessionEnd;
    private final Set<LocalDate> holidays;

    public TradingCalendar(
            ZoneId zone,
            Set<DayOfWeek> tradingDays,
            LocalTime sessionStart,
            LocalTime sessionEnd,
            Set<LocalDate> holidays) {
        this.zone = Objects.requireNonNull(zone, "Zone cannot be null");
        this.sessionStart = Objects.requireNonNull(sessionStart, "Session start cannot be null");
        this.sessionEnd = Objects.requireNonNull(sessionEnd, "Session end cannot be null");
        if (tradingDays == null || tradingDays.isEmpty()) {
            throw new IllegalArgumentException("At least one trading day must be configured");
        }
        if (!sessionEnd.isAfter(sessionStart)) {
            throw new IllegalArgumentException(
                "Session end (" + sessionEnd + ") must be after session start (" + sessionStart + ")");
        }
        this.tradingDays = EnumSet.copyOf(tradingDays);
        this.holidays = holidays == null ? Set.of() : Set.copyOf(holidays);
    }

    /**
     * Decides whether ingestion is permitted at {@code now}.
     *
     * @return allowed=false with reason "weekend", "holiday" or "outside-hours" when closed
     */
    public TradingStatus isOpen(Instant now) {
        LocalDate date = now.atZone(zone).toLocalDate();

        if (!tradingDays.contains(date.getDayOfWeek())) {
            return TradingStatus.closed(TradingStatus.WEEKEND, now);
        }
        if (holidays.contains(date)) {
            return TradingStatus.closed(TradingStatus.HOLIDAY, now);
        }
        if (!sessionWindow(date).contains(now)) {
            return TradingStatus.closed(TradingStatus.OUTSIDE_HOURS, now);
        }
        return TradingStatus.open(now);
    }

    /**
     * Returns the session window of {@code date}, whether or not it is a trading day.
     */
    public TradingSession sessionWindow(LocalDate date) {
        ZonedDateTime start = date.atTime(sessionStart).atZone(zone);
        ZonedDateTime end = date.atTime(sessionEnd).plusMinutes(1).atZone(zone);
        return new TradingSession(date, start.toInstant(), end.toInstant());
    }

    /** Returns true if {@code date} is a configured weekday and not a holiday. */
    public boolean isTradingDay(LocalDate date) {
        return tradingDays.contains(date.getDayOfWeek()) && !holidays.contains(date);
    }

    /**
     * Returns the session dashboards should show at {@code now}: today's session once it
     * has started, otherwise the most recent earlier trading session. Before Monday's open
     * this is Friday's session when weekends are closed.
     */
    public TradingSession effectiveSession(Instant now) {
        LocalDate today = now.atZone(zone).toLocalDate();
        if (isTradingDay(today)) {
            TradingSession todays = sessionWindow(today);
            if (!now.isBefore(todays.start())) {
                return todays;
            }
        }
        return previousSession(today);
    }

    /**
     * Returns the session of the last trading day strictly before {@code date}.
     *
     * @throws IllegalStateException if no trading day exists within the lookback limit
     */
    public TradingSession previousSession(LocalDate date) {
        LocalDate candidate = date.minusDays(1);
        for (int i = 0; i < MAX_LOOKBACK_DAYS; i++) {
            if (isTradingDay(candidate)) {
                return sessionWindow(candidate);
            }
            candidate = candidate.minusDays(1);
        }
        throw new IllegalStateException("No trading day found within " + MAX_LOOKBACK_DAYS + " days before " + date);
    }

    /** Returns the trading date {@code instant} falls on in the calendar timezone. */
    public LocalDate dateOf(Instant instant) {
        return instant.atZone(zone).toLocalDate();
    }

    public ZoneId zone() {
        return zone;
    }

    /** Human-readable session hours, e.g. "09:00 - 23:30 Asia/Kolkata". */
    public String describeHours() {
        return sessionStart + " - " + sessionEnd + " " + zone.getId();
    }
}
