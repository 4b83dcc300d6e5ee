package com.basketbot.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-leg outcome of a basket execution.
 */
@Value
@Builder
public class LegExecution {
    Leg leg;
    Side sentSide;
    String orderId;
    OrderStatus status;
    String errorDetail;

    public boolean isAccepted() {
        return status == OrderStatus.ACCEPTED;
    }
}
