package com.basketbot.service.strategy;

import com.basketbot.model.Leg;

import java.util.List;

/**
 * Turns the current spot into the basket's legs, in placement order.
 * Implementations are pure: the same spot always yields the same legs.
 * Broker symbols are attached later, once the expiry is known.
 */
public interface StrikeSelector {

    List<Leg> select(double spot);
}
