package com.basketbot.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered legs placed together for one entry cycle.
 * <p>
 * Entry order is the configured order. Closing order puts short legs first so the
 * buy-backs go out before the protective longs are sold; each group keeps entry order.
 */
@Value
public class Basket {

    List<Leg> legs;

    public Basket(List<Leg> legs) {
        this.legs = List.copyOf(legs);
    }

    public int size() {
        return legs.size();
    }

    public boolean isEmpty() {
        return legs.isEmpty();
    }

    public Set<String> symbols() {
        Set<String> symbols = new LinkedHashSet<>();
        for (Leg leg : legs) {
            symbols.add(leg.getBrokerSymbol());
        }
        return symbols;
    }

    public Basket exitOrder() {
        List<Leg> ordered = new ArrayList<>(legs.size());
        for (Leg leg : legs) {
            if (leg.isShort()) {
                ordered.add(leg);
            }
        }
        for (Leg leg : legs) {
            if (!leg.isShort()) {
                ordered.add(leg);
            }
        }
        return new Basket(ordered);
    }
}
