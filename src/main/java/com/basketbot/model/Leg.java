package com.basketbot.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * One option order within a basket. Immutable once computed for an entry; the broker
 * symbol is attached after the selector has produced the strike.
 */
@Value
@Builder
public class Leg {
    String label;
    OptionType optionType;
    double strike;
    Side side;
    int quantity;
    @With
    String brokerSymbol;

    public boolean isShort() {
        return side == Side.SELL;
    }
}
