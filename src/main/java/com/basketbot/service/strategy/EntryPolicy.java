package com.basketbot.service.strategy;

import java.time.ZonedDateTime;

/**
 * Decides whether a basket may be entered at {@code now}.
 */
@FunctionalInterface
public interface EntryPolicy {

    boolean shouldEnter(ZonedDateTime now);
}
