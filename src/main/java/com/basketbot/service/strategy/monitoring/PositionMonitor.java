package com.basketbot.service.strategy.monitoring;

import com.basketbot.dto.PositionSnapshot;
import com.basketbot.exception.BrokerQueryException;
import com.basketbot.model.ExitDecision;
import com.basketbot.model.ExitReason;
import com.basketbot.model.MonitoringState;
import com.basketbot.service.MarketHours;
import com.basketbot.service.broker.BrokerClient;
import com.basketbot.service.scheduling.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polls the broker for the open basket's P&L until an exit condition holds.
 *
 * <h2>Checks per tick, in order</h2>
 * <ol>
 *   <li>Manual exit requested: MANUAL</li>
 *   <li>Local time at or after min(exit time, market close), or not a trading day: MARKET_CLOSE</li>
 *   <li>P&L &gt;= capital x target%: TARGET</li>
 *   <li>P&L &lt;= -(capital x stop-loss%): STOP_LOSS</li>
 * </ol>
 * Target is checked before stop-loss, so a tick satisfying both reports TARGET.
 * <p>
 * Positions are re-read every tick. If that read fails the tick is skipped entirely and the
 * loop carries on. When deployed capital was not known at entry, it is read from funds on
 * later ticks; until then only the manual and close checks can fire.
 */
@Slf4j
public class PositionMonitor {

    private final BrokerClient brokerClient;
    private final MarketHours marketHours;
    private final Clock clock;
    private final Ticker ticker;
    private final LocalTime exitTime;
    private final double targetPercent;
    private final double stopLossPercent;

    private final AtomicBoolean manualExitRequested = new AtomicBoolean(false);

    public PositionMonitor(BrokerClient brokerClient, MarketHours marketHours, Clock clock, Ticker ticker,
                           LocalTime exitTime, double targetPercent, double stopLossPercent) {
        this.brokerClient = brokerClient;
        this.marketHours = marketHours;
        this.clock = clock;
        this.ticker = ticker;
        LocalTime close = marketHours.getCloseTime();
        this.exitTime = exitTime.isBefore(close) ? exitTime : close;
        this.targetPercent = targetPercent;
        this.stopLossPercent = stopLossPercent;
    }

    /**
     * Blocks until an exit condition holds or the ticker is cancelled.
     *
     * @return the exit decision, or {@link ExitDecision#none()} if cancelled
     */
    public ExitDecision poll(MonitoringState state, Duration interval) {
        double capital = state.getDeployedCapital();
        log.info("Monitoring {} | capital={} | target={}% | stopLoss={}% | forced exit at {}",
                state.getSymbols(), capital, targetPercent, stopLossPercent, exitTime);

        while (!ticker.isCancelled()) {
            if (capital <= 0) {
                capital = resolveCapital();
            }
            ExitDecision decision = check(state, capital);
            if (decision.isExit()) {
                log.info("Exit decision: {}", decision);
                return decision;
            }
            if (!ticker.await(interval)) {
                break;
            }
        }
        log.info("Monitoring cancelled");
        return ExitDecision.none();
    }

    /**
     * One tick. Returns {@link ExitDecision#none()} when no condition holds or the tick
     * was skipped.
     */
    ExitDecision check(MonitoringState state, double capital) {
        List<PositionSnapshot> positions;
        try {
            positions = brokerClient.getPositions();
        } catch (BrokerQueryException e) {
            log.warn("Position fetch failed, tick skipped: {}", e.getMessage());
            return ExitDecision.none();
        }

        double pnl = 0.0;
        for (PositionSnapshot position : positions) {
            if (state.getSymbols().contains(position.getSymbol())) {
                pnl += position.getPnl();
            }
        }
        double targetAmount = capital * targetPercent / 100.0;
        double stopLossAmount = capital * stopLossPercent / 100.0;

        log.info("P&L: {} | Target: {} | SL: -{}", round2(pnl), round2(targetAmount), round2(stopLossAmount));

        if (manualExitRequested.get()) {
            return new ExitDecision(ExitReason.MANUAL, pnl, targetAmount, stopLossAmount, capital);
        }
        if (isPastExitTime()) {
            return new ExitDecision(ExitReason.MARKET_CLOSE, pnl, targetAmount, stopLossAmount, capital);
        }
        if (capital <= 0) {
            log.warn("Deployed capital unknown, P&L thresholds not evaluated this tick");
            return ExitDecision.none();
        }
        if (pnl >= targetAmount) {
            return new ExitDecision(ExitReason.TARGET, pnl, targetAmount, stopLossAmount, capital);
        }
        if (pnl <= -stopLossAmount) {
            return new ExitDecision(ExitReason.STOP_LOSS, pnl, targetAmount, stopLossAmount, capital);
        }
        return ExitDecision.none();
    }

    public void requestManualExit() {
        if (manualExitRequested.compareAndSet(false, true)) {
            log.info("Manual exit requested");
        }
    }

    public boolean isManualExitRequested() {
        return manualExitRequested.get();
    }

    public void clearManualExit() {
        manualExitRequested.set(false);
    }

    private boolean isPastExitTime() {
        ZonedDateTime now = marketHours.now(clock);
        return !marketHours.isTradingDay(now.toLocalDate()) || !now.toLocalTime().isBefore(exitTime);
    }

    private double resolveCapital() {
        try {
            double utilised = brokerClient.getFunds().getUtilizedMargin();
            if (utilised > 0) {
                log.info("Deployed capital resolved: {}", utilised);
            }
            return utilised;
        } catch (BrokerQueryException e) {
            log.warn("Funds fetch failed, deployed capital still unknown: {}", e.getMessage());
            return 0.0;
        }
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
