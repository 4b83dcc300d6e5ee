package com.basketbot.service.strategy;

import com.basketbot.config.StrategyConfig.RsiFilterConfig;
import com.basketbot.config.StrategyConfig.RsiFilterConfig.Direction;
import com.basketbot.dto.Candle;
import com.basketbot.exception.BrokerQueryException;
import com.basketbot.service.broker.BrokerClient;
import com.basketbot.util.CandleUtils;
import com.basketbot.util.RsiCalculator;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Adds an RSI condition on index candles to another entry policy.
 * <p>
 * RSI is recomputed only when a new candle has closed; between closes the previous
 * decision is reused so the broker is not queried on every tick. A failed candle fetch
 * blocks entry for that tick and is retried on the next one. Not thread-safe: called from
 * the engine thread only.
 */
@Slf4j
public class RsiEntryPolicy implements EntryPolicy {

    private final EntryPolicy schedule;
    private final BrokerClient brokerClient;
    private final String symbol;
    private final RsiFilterConfig filter;
    private final LocalTime sessionOpen;

    private ZonedDateTime lastEvaluatedCandle;
    private boolean lastDecision;
    private double lastRsi = Double.NaN;

    public RsiEntryPolicy(EntryPolicy schedule, BrokerClient brokerClient, String symbol,
                          RsiFilterConfig filter, LocalTime sessionOpen) {
        this.schedule = schedule;
        this.brokerClient = brokerClient;
        this.symbol = symbol;
        this.filter = filter;
        this.sessionOpen = sessionOpen;
    }

    @Override
    public boolean shouldEnter(ZonedDateTime now) {
        if (!schedule.shouldEnter(now)) {
            return false;
        }

        ZonedDateTime candleOpen = CandleUtils.currentCandleOpen(now, sessionOpen, filter.getResolution());
        if (candleOpen.equals(lastEvaluatedCandle)) {
            return lastDecision;
        }

        List<Candle> candles;
        try {
            LocalDate to = now.toLocalDate();
            candles = brokerClient.getCandles(symbol, filter.getResolution(),
                    to.minusDays(filter.getHistoryDays()), to);
        } catch (BrokerQueryException e) {
            log.warn("RSI filter: candle fetch for {} failed, entry deferred: {}", symbol, e.getMessage());
            return false;
        }

        List<Double> closes = new ArrayList<>(candles.size());
        for (Candle candle : candles) {
            if (CandleUtils.isClosed(candle.getTimestamp(), filter.getResolution(), now)) {
                closes.add(candle.getClose());
            }
        }

        double rsi = RsiCalculator.wilderRsi(closes, filter.getPeriod());
        boolean decision;
        if (Double.isNaN(rsi)) {
            log.warn("RSI filter: only {} closed candles for {}, need {}", closes.size(), symbol, filter.getPeriod() + 1);
            decision = false;
        } else {
            decision = filter.getDirection() == Direction.ABOVE
                    ? rsi >= filter.getEntryLevel()
                    : rsi <= filter.getEntryLevel();
            log.info("Market Data | RSI({})={} | Spot={} | level {} {} -> {}",
                    filter.getPeriod(), String.format("%.2f", rsi), closes.get(closes.size() - 1),
                    filter.getDirection(), filter.getEntryLevel(), decision ? "ENTER" : "WAIT");
        }

        lastEvaluatedCandle = candleOpen;
        lastDecision = decision;
        lastRsi = rsi;
        return decision;
    }

    public double getLastRsi() {
        return lastRsi;
    }
}
