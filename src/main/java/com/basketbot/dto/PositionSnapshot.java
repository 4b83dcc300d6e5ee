package com.basketbot.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PositionSnapshot {
    private String symbol;
    private String exchange;
    private int netQuantity;
    private double pnl;

    public boolean isFlat() {
        return netQuantity == 0;
    }
}
