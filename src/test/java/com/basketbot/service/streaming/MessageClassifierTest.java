package com.basketbot.service.streaming;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MessageClassifier")
class MessageClassifierTest {

    private final MessageClassifier classifier = new MessageClassifier();

    private MessageType classify(Object... keyValues) {
        Map<String, Object> fields = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            fields.put((String) keyValues[i], keyValues[i + 1]);
        }
        return classifier.classify(StreamMessage.of(fields));
    }

    @Test
    @DisplayName("Each marker field maps to its type")
    void singleMarkers() {
        assertEquals(MessageType.QUOTE, classify("ltp", 1.0));
        assertEquals(MessageType.DEPTH, classify("bid", 1.0));
        assertEquals(MessageType.DEPTH, classify("ask", 1.0));
        assertEquals(MessageType.TRADE_PRINT, classify("trade_price", 1.0));
        assertEquals(MessageType.GENERAL, classify("code", 200, "message", "ok"));
        assertEquals(MessageType.ORDER_UPDATE, classify("orderNumber", "A1"));
        assertEquals(MessageType.ORDER_UPDATE, classify("id", "A1"));
        assertEquals(MessageType.TRADE_UPDATE, classify("tradeNumber", "T1"));
        assertEquals(MessageType.POSITION_UPDATE, classify("netQty", -50));
        assertEquals(MessageType.POSITION_UPDATE, classify("qty", 50));
        assertEquals(MessageType.UNKNOWN, classify("foo", "bar"));
    }

    @Test
    @DisplayName("Several markers resolve by fixed priority")
    void priority() {
        assertEquals(MessageType.QUOTE, classify("ltp", 1.0, "bid", 1.0, "id", "x"));
        assertEquals(MessageType.DEPTH, classify("ask", 1.0, "trade_price", 1.0));
        assertEquals(MessageType.TRADE_PRINT, classify("trade_price", 1.0, "code", 1, "message", "m"));
        assertEquals(MessageType.GENERAL, classify("code", 1, "message", "m", "id", "x"));
        assertEquals(MessageType.ORDER_UPDATE, classify("id", "x", "tradeNumber", "t", "qty", 1));
        assertEquals(MessageType.TRADE_UPDATE, classify("tradeNumber", "t", "netQty", 1));
    }

    @Test
    @DisplayName("code without message is not GENERAL")
    void generalNeedsBothFields() {
        assertEquals(MessageType.ORDER_UPDATE, classify("code", 1, "id", "x"));
        assertEquals(MessageType.UNKNOWN, classify("code", 1));
    }

    @Test
    @DisplayName("A declared type wins over field markers")
    void declaredTypeWins() {
        StreamMessage message = StreamMessage.typed(MessageType.POSITION_UPDATE, Map.of("ltp", 1.0));
        assertEquals(MessageType.POSITION_UPDATE, classifier.classify(message));
    }

    @Test
    @DisplayName("Null-valued fields do not count as present")
    void nullFieldsIgnored() {
        assertEquals(MessageType.ORDER_UPDATE, classify("ltp", null, "id", "x"));
    }
}
