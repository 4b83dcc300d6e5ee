package com.basketbot.service.streaming;

@FunctionalInterface
public interface StreamMessageHandler {

    void handle(StreamMessage message);
}
