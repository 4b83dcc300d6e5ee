package com.basketbot.service;

import com.basketbot.dto.PositionSnapshot;
import com.basketbot.exception.BrokerQueryException;
import com.basketbot.model.Basket;
import com.basketbot.service.broker.BrokerClient;
import com.basketbot.service.strategy.StrategyEngine;
import com.basketbot.service.streaming.StreamingClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Orderly teardown when the context closes (SIGINT/SIGTERM through Spring's shutdown hook).
 *
 * <p>Runs with a high phase so it stops before the web server and other beans:
 * <ol>
 *   <li>Stop the engine loop</li>
 *   <li>Disconnect the realtime feed</li>
 *   <li>Wait up to the grace period for an in-flight basket placement to finish</li>
 *   <li>Log basket positions that are still open</li>
 * </ol>
 *
 * <p>Positions are left open. No exit orders are placed during shutdown.
 */
@Service
@Slf4j
public class ShutdownCoordinator implements SmartLifecycle {

    private final StrategyEngine strategyEngine;
    private final StreamingClient streamingClient;
    private final BrokerClient brokerClient;
    private final Duration gracePeriod;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public ShutdownCoordinator(StrategyEngine strategyEngine,
                               StreamingClient streamingClient,
                               BrokerClient brokerClient,
                               @Value("${shutdown.grace-period:10s}") Duration gracePeriod) {
        this.strategyEngine = strategyEngine;
        this.streamingClient = streamingClient;
        this.brokerClient = brokerClient;
        this.gracePeriod = gracePeriod;
    }

    @Override
    public void start() {
        running.set(true);
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Shutdown initiated (engine state {})", strategyEngine.getState());
        try {
            strategyEngine.stop();
            disconnectStreaming();

            if (!strategyEngine.awaitTermination(gracePeriod)) {
                log.warn("Strategy engine still running after {}s grace period", gracePeriod.toSeconds());
            }
            logOpenPositions();
            log.info("Shutdown complete");
        } catch (RuntimeException e) {
            log.error("Error during shutdown", e);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // higher phase stops first
        return Integer.MAX_VALUE - 1;
    }

    void disconnectStreaming() {
        try {
            streamingClient.disconnect();
        } catch (RuntimeException e) {
            log.warn("Failed to disconnect streaming client cleanly", e);
        }
    }

    void logOpenPositions() {
        Basket basket = strategyEngine.getBasket();
        if (basket == null || basket.isEmpty()) {
            return;
        }
        Set<String> symbols = basket.symbols();
        List<PositionSnapshot> open;
        try {
            open = brokerClient.getPositions().stream()
                    .filter(p -> symbols.contains(p.getSymbol()) && !p.isFlat())
                    .toList();
        } catch (BrokerQueryException e) {
            log.warn("Could not read positions at shutdown, verify manually: {}", e.getMessage());
            return;
        }
        if (open.isEmpty()) {
            log.info("No open basket positions left behind");
            return;
        }
        log.warn("{} basket position(s) left OPEN at shutdown:", open.size());
        for (PositionSnapshot position : open) {
            log.warn("  {} qty={} pnl={}", position.getSymbol(), position.getNetQuantity(), position.getPnl());
        }
    }
}
