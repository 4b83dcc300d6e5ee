package com.basketbot.service.strategy;

import com.basketbot.config.StrategyConfig;
import com.basketbot.service.MarketHours;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Enters on a configured weekday at or after the entry time while the market is open.
 * No side effects; safe to call on every tick.
 */
public class ScheduledEntryPolicy implements EntryPolicy {

    private final Set<DayOfWeek> entryDays;
    private final LocalTime entryTime;
    private final MarketHours marketHours;

    public ScheduledEntryPolicy(StrategyConfig config, MarketHours marketHours) {
        this.entryDays = EnumSet.copyOf(config.getEntryDays());
        this.entryTime = config.entryLocalTime();
        this.marketHours = marketHours;
    }

    @Override
    public boolean shouldEnter(ZonedDateTime now) {
        ZonedDateTime local = now.withZoneSameInstant(marketHours.getZone());
        return entryDays.contains(local.getDayOfWeek())
                && !local.toLocalTime().isBefore(entryTime)
                && marketHours.isOpen(local);
    }
}
