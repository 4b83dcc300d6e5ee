package com.basketbot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * OHLCV row. {@code timestamp} is seconds since the epoch, candle open time.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Candle {
    private long timestamp;
    private double open;
    private double high;
    private double low;
    private double close;
    private long volume;
}
