package com.basketbot.service;

import com.basketbot.config.StreamingConfig;
import com.basketbot.exception.BrokerAuthenticationException;
import com.basketbot.exception.BrokerException;
import com.basketbot.exception.ConfigurationException;
import com.basketbot.model.EngineState;
import com.basketbot.service.broker.BrokerClient;
import com.basketbot.service.strategy.StrategyEngine;
import com.basketbot.service.streaming.StreamingClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Service;

/**
 * Startup sequence: verify the broker session, open the realtime feed, start the engine.
 * When the engine finishes its trading cycle the application exits with 0 for DONE and 1
 * for FAILED.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StrategyRunner implements ApplicationRunner {

    private final BrokerClient brokerClient;
    private final StrategyEngine strategyEngine;
    private final StreamingClient streamingClient;
    private final StreamingConfig streamingConfig;
    private final ConfigurableApplicationContext context;

    @Override
    public void run(ApplicationArguments args) {
        verifySession();

        if (streamingConfig.isEnabled()) {
            streamingClient.subscribe(streamingConfig.getSymbols(), streamingConfig.getDataType());
            streamingClient.connect();
        } else {
            log.info("Realtime streaming disabled");
        }

        strategyEngine.setCompletionListener(this::onCompletion);
        strategyEngine.start();
    }

    private void verifySession() {
        try {
            brokerClient.verifySession();
        } catch (BrokerAuthenticationException e) {
            throw new ConfigurationException("Broker session rejected, refresh the access token: " + e.getMessage(), e);
        } catch (BrokerException e) {
            throw new IllegalStateException("Broker unreachable at startup: " + e.getMessage(), e);
        }
    }

    static int exitCode(EngineState state) {
        return state == EngineState.DONE ? 0 : 1;
    }

    private void onCompletion(EngineState state) {
        int code = exitCode(state);
        log.info("Trading cycle complete ({}), shutting down with exit code {}", state, code);
        // exit off the engine thread so the shutdown hook can join it
        Thread exit = new Thread(() -> System.exit(SpringApplication.exit(context, () -> code)), "app-exit");
        exit.start();
    }
}
