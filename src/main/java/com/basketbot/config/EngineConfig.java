package com.basketbot.config;

import com.basketbot.service.MarketHours;
import com.basketbot.service.broker.BrokerClient;
import com.basketbot.service.broker.KiteBrokerClient;
import com.basketbot.service.broker.RateLimiterService;
import com.basketbot.service.scheduling.LatchTicker;
import com.basketbot.service.scheduling.Sleeper;
import com.basketbot.service.scheduling.Ticker;
import com.basketbot.service.strategy.BasketExecutor;
import com.basketbot.service.strategy.EntryPolicy;
import com.basketbot.service.strategy.OffsetStrikeSelector;
import com.basketbot.service.strategy.RsiEntryPolicy;
import com.basketbot.service.strategy.ScheduledEntryPolicy;
import com.basketbot.service.strategy.StrangleStrikeSelector;
import com.basketbot.service.strategy.StrategyEngine;
import com.basketbot.service.strategy.StrikeSelector;
import com.basketbot.service.strategy.monitoring.PositionMonitor;
import com.zerodhatech.kiteconnect.KiteConnect;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the strategy engine from the loaded configuration. Every component receives the
 * same immutable {@link StrategyConfig}.
 */
@Configuration
@Slf4j
public class EngineConfig {

    @Bean
    public MarketHours marketHours(MarketConfig marketConfig) {
        return new MarketHours(marketConfig);
    }

    @Bean
    public Clock clock(MarketHours marketHours) {
        return Clock.system(marketHours.getZone());
    }

    @Bean
    public RateLimiterService rateLimiterService() {
        return new RateLimiterService();
    }

    @Bean
    public KiteBrokerClient brokerClient(KiteConnect kiteConnect, RateLimiterService rateLimiterService,
                                         Clock clock, MarketHours marketHours) {
        return new KiteBrokerClient(kiteConnect, rateLimiterService, clock, marketHours.getZone());
    }

    @Bean
    public Ticker engineTicker() {
        return new LatchTicker();
    }

    @Bean
    public StrikeSelector strikeSelector(StrategyConfig config) {
        return switch (config.getVariant()) {
            case OFFSET_BASKET -> new OffsetStrikeSelector(config);
            case STRANGLE -> new StrangleStrikeSelector(config);
        };
    }

    @Bean
    public EntryPolicy entryPolicy(StrategyConfig config, MarketHours marketHours, BrokerClient brokerClient) {
        EntryPolicy scheduled = new ScheduledEntryPolicy(config, marketHours);
        if (!config.getRsiFilter().isEnabled()) {
            return scheduled;
        }
        log.info("RSI entry filter enabled: RSI({}) on {} {} candles, {} {}",
                config.getRsiFilter().getPeriod(), config.getUnderlyingQuoteSymbol(),
                config.getRsiFilter().getResolution(), config.getRsiFilter().getDirection(),
                config.getRsiFilter().getEntryLevel());
        return new RsiEntryPolicy(scheduled, brokerClient, config.getUnderlyingQuoteSymbol(),
                config.getRsiFilter(), marketHours.getOpenTime());
    }

    @Bean
    public BasketExecutor basketExecutor(BrokerClient brokerClient, StrategyConfig config) {
        return new BasketExecutor(brokerClient, config.getOptionExchange(), config.getProductType(),
                config.getOrderType(), config.getOrderPacing(), Sleeper.threadSleep());
    }

    @Bean
    public PositionMonitor positionMonitor(BrokerClient brokerClient, MarketHours marketHours, Clock clock,
                                           Ticker engineTicker, StrategyConfig config) {
        return new PositionMonitor(brokerClient, marketHours, clock, engineTicker,
                config.exitLocalTime(), config.getTargetPercent(), config.getStopLossPercent());
    }

    @Bean
    public StrategyEngine strategyEngine(StrategyConfig config, BrokerClient brokerClient,
                                         StrikeSelector strikeSelector, EntryPolicy entryPolicy,
                                         BasketExecutor basketExecutor, PositionMonitor positionMonitor,
                                         MarketHours marketHours, Clock clock, Ticker engineTicker) {
        return new StrategyEngine(config, brokerClient, strikeSelector, entryPolicy, basketExecutor,
                positionMonitor, marketHours, clock, engineTicker);
    }
}
