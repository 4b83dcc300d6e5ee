package com.basketbot.service.streaming;

/**
 * Kinds of inbound feed messages, listed in classification priority order.
 */
public enum MessageType {
    QUOTE,
    DEPTH,
    TRADE_PRINT,
    GENERAL,
    ORDER_UPDATE,
    TRADE_UPDATE,
    POSITION_UPDATE,
    /** Nothing matched; routed to the default handler */
    UNKNOWN
}
