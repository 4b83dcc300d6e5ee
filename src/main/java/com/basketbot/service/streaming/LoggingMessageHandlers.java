package com.basketbot.service.streaming;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

import static com.basketbot.service.streaming.KiteTickerTransport.*;
import static com.basketbot.service.streaming.MessageClassifier.*;

/**
 * Handlers that write feed messages to the log. Quotes and depth go to DEBUG since they
 * arrive continuously; account updates go to INFO.
 */
@Slf4j
public final class LoggingMessageHandlers {

    private LoggingMessageHandlers() {
    }

    public static void install(StreamingClient client) {
        client.registerHandler(MessageType.QUOTE, LoggingMessageHandlers::quote);
        client.registerHandler(MessageType.DEPTH, LoggingMessageHandlers::depth);
        client.registerHandler(MessageType.TRADE_PRINT, m -> log.debug("Trade print {} @ {}", m.get(SYMBOL), m.get(TRADE_PRICE)));
        client.registerHandler(MessageType.GENERAL, m -> log.info("Account notice [{}] {}", m.get(CODE), m.get(MESSAGE)));
        client.registerHandler(MessageType.ORDER_UPDATE, LoggingMessageHandlers::orderUpdate);
        client.registerHandler(MessageType.TRADE_UPDATE, m -> log.info("Trade update: {}", m.getFields()));
        client.registerHandler(MessageType.POSITION_UPDATE, m -> log.info("Position update: {}", m.getFields()));
        client.setDefaultHandler(m -> log.info("Message: {}", m));
    }

    static void quote(StreamMessage m) {
        log.debug("{} LTP={} Vol={} Chg%={} H={} L={} O={} PC={}", m.get(SYMBOL), m.get(LTP), m.get(VOLUME),
                m.get(CHANGE_PERCENT), m.get(HIGH), m.get(LOW), m.get(OPEN_PRICE), m.get(PREV_CLOSE_PRICE));
    }

    static void depth(StreamMessage m) {
        log.debug("{} LTP={} bestBid={} bestAsk={}", m.get(SYMBOL), m.get(LTP), best(m.get(BID)), best(m.get(ASK)));
    }

    static void orderUpdate(StreamMessage m) {
        log.info("Order update: id={} status={} {} {} qty={} filled={} avg={} tag={} {}",
                m.get(ID), m.get(STATUS), m.get(SIDE), m.get(SYMBOL), m.get(QTY), m.get(FILLED_QTY),
                m.get(AVG_PRICE), m.get(TAG), m.get(MESSAGE) != null ? m.get(MESSAGE) : "");
    }

    private static Object best(Object levels) {
        if (levels instanceof List<?> list && !list.isEmpty() && list.get(0) instanceof Map<?, ?> top) {
            return top.get("price");
        }
        return null;
    }
}
