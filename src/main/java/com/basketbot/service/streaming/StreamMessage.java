package com.basketbot.service.streaming;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Inbound feed message: named fields plus an optional type declared by the transport.
 * When the type is declared it is used as-is; otherwise the message is classified by
 * the fields it carries.
 */
public final class StreamMessage {

    private final Map<String, Object> fields;
    private final MessageType declaredType;
    private final Instant receivedAt;

    private StreamMessage(Map<String, Object> fields, MessageType declaredType, Instant receivedAt) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.declaredType = declaredType;
        this.receivedAt = receivedAt;
    }

    public static StreamMessage of(Map<String, Object> fields) {
        return new StreamMessage(fields, null, Instant.now());
    }

    public static StreamMessage typed(MessageType type, Map<String, Object> fields) {
        return new StreamMessage(fields, type, Instant.now());
    }

    public Map<String, Object> getFields() {
        return fields;
    }

    public Optional<MessageType> getDeclaredType() {
        return Optional.ofNullable(declaredType);
    }

    public Instant getReceivedAt() {
        return receivedAt;
    }

    public boolean has(String field) {
        return fields.get(field) != null;
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public String getString(String field) {
        Object value = fields.get(field);
        return value != null ? value.toString() : null;
    }

    public double getDouble(String field) {
        Object value = fields.get(field);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return value != null ? Double.parseDouble(value.toString()) : Double.NaN;
    }

    @Override
    public String toString() {
        return (declaredType != null ? declaredType + " " : "") + fields;
    }
}
