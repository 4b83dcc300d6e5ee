package com.basketbot.service;

import com.basketbot.config.MarketConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.HashSet;
import java.util.Set;

/**
 * Exchange calendar: weekdays minus configured holidays, regular session
 * [open, close) in the exchange's zone.
 */
@Slf4j
public class MarketHours {

    private final ZoneId zone;
    private final LocalTime openTime;
    private final LocalTime closeTime;
    private final Set<LocalDate> holidays = new HashSet<>();

    public MarketHours(MarketConfig config) {
        this(ZoneId.of(config.getZone()), LocalTime.parse(config.getOpenTime()),
                LocalTime.parse(config.getCloseTime()), parseHolidays(config));
    }

    public MarketHours(ZoneId zone, LocalTime openTime, LocalTime closeTime, Set<LocalDate> holidays) {
        if (!openTime.isBefore(closeTime)) {
            throw new IllegalArgumentException("Market open " + openTime + " must be before close " + closeTime);
        }
        this.zone = zone;
        this.openTime = openTime;
        this.closeTime = closeTime;
        this.holidays.addAll(holidays);
    }

    public ZoneId getZone() {
        return zone;
    }

    public LocalTime getOpenTime() {
        return openTime;
    }

    public LocalTime getCloseTime() {
        return closeTime;
    }

    public ZonedDateTime now(Clock clock) {
        return ZonedDateTime.now(clock).withZoneSameInstant(zone);
    }

    public boolean isTradingDay(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
            return false;
        }
        return !holidays.contains(date);
    }

    /**
     * True on a trading day with local time in [open, close).
     */
    public boolean isOpen(ZonedDateTime time) {
        ZonedDateTime local = time.withZoneSameInstant(zone);
        if (!isTradingDay(local.toLocalDate())) {
            return false;
        }
        LocalTime t = local.toLocalTime();
        return !t.isBefore(openTime) && t.isBefore(closeTime);
    }

    private static Set<LocalDate> parseHolidays(MarketConfig config) {
        Set<LocalDate> dates = new HashSet<>();
        for (String holiday : config.getHolidays()) {
            dates.add(LocalDate.parse(holiday.trim()));
        }
        if (!dates.isEmpty()) {
            log.info("Loaded {} market holidays", dates.size());
        }
        return dates;
    }
}
