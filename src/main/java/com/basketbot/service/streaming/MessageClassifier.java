package com.basketbot.service.streaming;

/**
 * Decides the {@link MessageType} of an inbound message.
 * <p>
 * A type declared by the transport always wins. Otherwise the first matching predicate in
 * this order decides, so messages carrying several marker fields route the same way every
 * time:
 * <ol>
 *   <li>{@code ltp}: QUOTE</li>
 *   <li>{@code bid} or {@code ask}: DEPTH</li>
 *   <li>{@code trade_price}: TRADE_PRINT</li>
 *   <li>{@code code} and {@code message}: GENERAL</li>
 *   <li>{@code orderNumber} or {@code id}: ORDER_UPDATE</li>
 *   <li>{@code tradeNumber}: TRADE_UPDATE</li>
 *   <li>{@code netQty} or {@code qty}: POSITION_UPDATE</li>
 * </ol>
 */
public class MessageClassifier {

    public static final String LTP = "ltp";
    public static final String BID = "bid";
    public static final String ASK = "ask";
    public static final String TRADE_PRICE = "trade_price";
    public static final String CODE = "code";
    public static final String MESSAGE = "message";
    public static final String ORDER_NUMBER = "orderNumber";
    public static final String ID = "id";
    public static final String TRADE_NUMBER = "tradeNumber";
    public static final String NET_QTY = "netQty";
    public static final String QTY = "qty";

    public MessageType classify(StreamMessage message) {
        if (message.getDeclaredType().isPresent()) {
            return message.getDeclaredType().get();
        }
        if (message.has(LTP)) {
            return MessageType.QUOTE;
        }
        if (message.has(BID) || message.has(ASK)) {
            return MessageType.DEPTH;
        }
        if (message.has(TRADE_PRICE)) {
            return MessageType.TRADE_PRINT;
        }
        if (message.has(CODE) && message.has(MESSAGE)) {
            return MessageType.GENERAL;
        }
        if (message.has(ORDER_NUMBER) || message.has(ID)) {
            return MessageType.ORDER_UPDATE;
        }
        if (message.has(TRADE_NUMBER)) {
            return MessageType.TRADE_UPDATE;
        }
        if (message.has(NET_QTY) || message.has(QTY)) {
            return MessageType.POSITION_UPDATE;
        }
        return MessageType.UNKNOWN;
    }
}
