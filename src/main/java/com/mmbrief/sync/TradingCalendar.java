package com.mmbrief.sync;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Mon-Fri approximation of the exchange calendar. Holidays are not modelled.
 */
public final class TradingCalendar {
    public static final ZoneId DEFAULT_ZONE = ZoneId.of("America/New_York");

    private final ZoneId zone;

    public TradingCalendar() {
        this(DEFAULT_ZONE);
    }

    public TradingCalendar(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public ZoneId zone() {
        return zone;
    }

    public LocalDate latestTradingDay(Clock clock) {
        return latestTradingDay(clock.instant());
    }

    public LocalDate latestTradingDay(Instant now) {
        return latestTradingDay(ZonedDateTime.ofInstant(now, zone).toLocalDate());
    }

    public static LocalDate latestTradingDay(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY) {
            return date.minusDays(1);
        }
        if (dow == DayOfWeek.SUNDAY) {
            return date.minusDays(2);
        }
        return date;
    }

    public static boolean isTradingDay(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return dow != DayOfWeek.SATURDAY && dow != DayOfWeek.SUNDAY;
    }
}
