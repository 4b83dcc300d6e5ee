package com.basketbot.service.streaming;

/**
 * Feed content requested for a subscribed symbol.
 */
public enum DataType {
    /** Last price, volume, change and the day's OHLC */
    SYMBOL_UPDATE,
    /** Symbol update plus the bid/ask ladder */
    DEPTH_UPDATE
}
