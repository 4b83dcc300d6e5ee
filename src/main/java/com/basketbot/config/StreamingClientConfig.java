package com.basketbot.config;

import com.basketbot.service.broker.KiteBrokerClient;
import com.basketbot.service.streaming.KiteTickerTransport;
import com.basketbot.service.streaming.LoggingMessageHandlers;
import com.basketbot.service.streaming.MessageClassifier;
import com.basketbot.service.streaming.StreamCredentials;
import com.basketbot.service.streaming.StreamTransport;
import com.basketbot.service.streaming.StreamingClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StreamingClientConfig {

    @Bean
    public StreamTransport streamTransport(StreamCredentials streamCredentials, KiteBrokerClient brokerClient) {
        return new KiteTickerTransport(streamCredentials, brokerClient);
    }

    @Bean
    public StreamingClient streamingClient(StreamTransport streamTransport, StreamingConfig streamingConfig) {
        StreamingClient client = new StreamingClient(streamTransport, new MessageClassifier(), streamingConfig);
        LoggingMessageHandlers.install(client);
        return client;
    }
}
