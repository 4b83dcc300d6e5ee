package com.basketbot.dto;

import com.basketbot.model.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Broker response to a placement. Rejections are values, not exceptions.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OrderAck {
    private String orderId;
    private OrderStatus status;
    private String errorDetail;

    public static OrderAck accepted(String orderId) {
        return new OrderAck(orderId, OrderStatus.ACCEPTED, null);
    }

    public static OrderAck rejected(String errorDetail) {
        return new OrderAck(null, OrderStatus.REJECTED, errorDetail);
    }

    public static OrderAck unknown(String errorDetail) {
        return new OrderAck(null, OrderStatus.UNKNOWN, errorDetail);
    }

    public boolean isAccepted() {
        return status == OrderStatus.ACCEPTED;
    }
}
