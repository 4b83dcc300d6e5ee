package com.basketbot.model;

import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.Set;

/**
 * State of an open basket while it is monitored. Created on complete entry and replaced
 * with {@link #inactive()} once the exit finishes.
 */
@Value
@With
public class MonitoringState {
    boolean active;
    double deployedCapital;
    Instant entryTimestamp;
    ExitReason exitReason;
    Set<String> symbols;

    public static MonitoringState opened(double deployedCapital, Instant entryTimestamp, Set<String> symbols) {
        return new MonitoringState(true, deployedCapital, entryTimestamp, ExitReason.NONE, Set.copyOf(symbols));
    }

    public static MonitoringState inactive() {
        return new MonitoringState(false, 0.0, null, ExitReason.NONE, Set.of());
    }

    public boolean hasCapital() {
        return deployedCapital > 0;
    }
}
