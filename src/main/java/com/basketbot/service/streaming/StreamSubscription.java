package com.basketbot.service.streaming;

import lombok.Value;

/**
 * One entry of the logical subscription set.
 */
@Value
public class StreamSubscription {
    String symbol;
    DataType dataType;

    @Override
    public String toString() {
        return symbol + "/" + dataType;
    }
}
