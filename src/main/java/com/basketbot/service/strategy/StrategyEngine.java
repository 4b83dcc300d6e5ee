package com.basketbot.service.strategy;

import com.basketbot.config.StrategyConfig;
import com.basketbot.dto.PositionSnapshot;
import com.basketbot.exception.BrokerQueryException;
import com.basketbot.model.Basket;
import com.basketbot.model.EngineState;
import com.basketbot.model.ExecutionResult;
import com.basketbot.model.ExitDecision;
import com.basketbot.model.Leg;
import com.basketbot.model.LegExecution;
import com.basketbot.model.MonitoringState;
import com.basketbot.model.SideTransform;
import com.basketbot.service.MarketHours;
import com.basketbot.service.broker.BrokerClient;
import com.basketbot.service.scheduling.Ticker;
import com.basketbot.service.strategy.monitoring.PositionMonitor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * One trading day of the basket strategy as a state machine:
 * WAITING_ENTRY, ENTERING, MONITORING, EXITING, then DONE; or FAILED when entry is partial.
 * <p>
 * Runs on a single dedicated thread. Each iteration is one tick of the poll interval; the
 * monitoring phase blocks inside {@link PositionMonitor#poll} on the same ticker, so
 * {@link #stop()} ends either phase before its next sleep returns. At most one entry cycle
 * runs per trading day: DONE and FAILED are left only when the local date changes.
 */
@Slf4j
public class StrategyEngine implements Runnable {

    private final StrategyConfig config;
    private final BrokerClient brokerClient;
    private final StrikeSelector strikeSelector;
    private final EntryPolicy entryPolicy;
    private final BasketExecutor basketExecutor;
    private final PositionMonitor positionMonitor;
    private final MarketHours marketHours;
    private final Clock clock;
    private final Ticker ticker;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile Thread thread;
    private volatile Consumer<EngineState> completionListener = state -> { };

    private volatile EngineState state = EngineState.WAITING_ENTRY;
    private volatile LocalDate tradingDay;
    private volatile MonitoringState monitoringState = MonitoringState.inactive();
    private volatile Basket basket;
    private volatile ExitDecision lastDecision;

    public StrategyEngine(StrategyConfig config, BrokerClient brokerClient, StrikeSelector strikeSelector,
                          EntryPolicy entryPolicy, BasketExecutor basketExecutor, PositionMonitor positionMonitor,
                          MarketHours marketHours, Clock clock, Ticker ticker) {
        this.config = config;
        this.brokerClient = brokerClient;
        this.strikeSelector = strikeSelector;
        this.entryPolicy = entryPolicy;
        this.basketExecutor = basketExecutor;
        this.positionMonitor = positionMonitor;
        this.marketHours = marketHours;
        this.clock = clock;
        this.ticker = ticker;
    }

    /**
     * Starts the engine thread. Subsequent calls are ignored.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            log.warn("Strategy engine already started");
            return;
        }
        Thread t = new Thread(this, "strategy-engine");
        t.setDaemon(true);
        thread = t;
        t.start();
    }

    @Override
    public void run() {
        log.info("Strategy engine started | underlying={} | variant={} | entry {} {} | exit {}",
                config.getUnderlying(), config.getVariant(), config.getEntryDays(),
                config.getEntryTime(), config.getExitTime());
        while (!ticker.isCancelled()) {
            try {
                step();
            } catch (RuntimeException e) {
                log.error("Unexpected error in state {}: {}", state, e.getMessage(), e);
            }

            if (state.isTerminal() && config.isShutdownOnCompletion()) {
                log.info("Trading cycle finished in state {}", state);
                completionListener.accept(state);
                return;
            }
            if (!ticker.await(config.getPollInterval())) {
                break;
            }
        }
        log.info("Strategy engine stopped in state {}", state);
    }

    /**
     * Advances the state machine by one tick.
     */
    void step() {
        ZonedDateTime now = marketHours.now(clock);
        rollOver(now.toLocalDate());

        switch (state) {
            case WAITING_ENTRY -> {
                if (entryPolicy.shouldEnter(now)) {
                    if (pastEntryCutoff(now)) {
                        log.debug("Entry window closed at {}, no basket today", entryCutoff());
                    } else {
                        enter();
                    }
                }
                if (state == EngineState.MONITORING) {
                    monitor();
                }
            }
            case MONITORING -> monitor();
            case EXITING -> exit();
            case ENTERING, DONE, FAILED -> {
                // ENTERING never spans a tick; DONE and FAILED wait for the next trading day
            }
        }
    }

    private void enter() {
        transition(EngineState.ENTERING);

        Basket entry;
        try {
            entry = buildBasket();
        } catch (BrokerQueryException e) {
            log.warn("Entry lookup failed, nothing placed, retrying next tick: {}", e.getMessage());
            if (positionMonitor.isManualExitRequested()) {
                log.info("Discarding manual exit request, no basket was opened");
                positionMonitor.clearManualExit();
            }
            transition(EngineState.WAITING_ENTRY);
            return;
        }

        ExecutionResult result = basketExecutor.execute(entry, SideTransform.AS_IS);
        basket = entry;
        if (result.isPartial()) {
            logPartialEntry(result);
            transition(EngineState.FAILED);
            return;
        }

        double capital = 0.0;
        try {
            capital = brokerClient.getFunds().getUtilizedMargin();
        } catch (BrokerQueryException e) {
            log.warn("Funds fetch after entry failed, capital will be resolved while monitoring: {}", e.getMessage());
        }
        monitoringState = MonitoringState.opened(capital, clock.instant(), entry.symbols());
        log.info("Basket entered | deployed capital={} | legs={}", capital, entry.symbols());
        transition(EngineState.MONITORING);
    }

    /**
     * Latest entry instant of the day: the earlier of the exit time and market close. A basket
     * opened at or after it would be closed by the monitor on its first tick.
     */
    LocalTime entryCutoff() {
        LocalTime exit = config.exitLocalTime();
        LocalTime close = marketHours.getCloseTime();
        return exit.isBefore(close) ? exit : close;
    }

    private boolean pastEntryCutoff(ZonedDateTime now) {
        return !now.toLocalTime().isBefore(entryCutoff());
    }

    private Basket buildBasket() throws BrokerQueryException {
        double spot = brokerClient.getQuote(config.getUnderlyingQuoteSymbol()).getLastPrice();
        LocalDate expiry = brokerClient.getNearestExpiry(config.getUnderlying());
        List<Leg> selected = strikeSelector.select(spot);

        List<Leg> resolved = new ArrayList<>(selected.size());
        for (Leg leg : selected) {
            String symbol = brokerClient.resolveOptionSymbol(config.getUnderlying(), expiry,
                    leg.getStrike(), leg.getOptionType());
            resolved.add(leg.withBrokerSymbol(symbol));
        }
        log.info("Spot {} | expiry {} | basket {}", spot, expiry,
                resolved.stream().map(l -> l.getSide() + " " + l.getQuantity() + " " + l.getBrokerSymbol()).toList());
        return new Basket(resolved);
    }

    private void monitor() {
        ExitDecision decision = positionMonitor.poll(monitoringState, config.getPollInterval());
        if (!decision.isExit()) {
            return;
        }
        lastDecision = decision;
        monitoringState = monitoringState
                .withExitReason(decision.getReason())
                .withDeployedCapital(decision.getDeployedCapital());
        log.info("Exit triggered: {}", decision);
        transition(EngineState.EXITING);
        exit();
    }

    private void exit() {
        ExecutionResult result;
        try {
            result = basketExecutor.exit(basket, monitoringState.getExitReason());
        } catch (BrokerQueryException e) {
            log.warn("Position fetch for exit failed, retrying next tick: {}", e.getMessage());
            return;
        }
        if (result.isPartial()) {
            log.error("Closing basket incomplete, retrying from fresh positions next tick");
            return;
        }
        logFinalPnl();
        monitoringState = MonitoringState.inactive();
        positionMonitor.clearManualExit();
        transition(EngineState.DONE);
    }

    private void rollOver(LocalDate today) {
        if (tradingDay == null) {
            tradingDay = today;
            return;
        }
        if (today.equals(tradingDay)) {
            return;
        }
        log.info("New trading day {} (was {})", today, tradingDay);
        tradingDay = today;
        if (state.isTerminal()) {
            basket = null;
            lastDecision = null;
            positionMonitor.clearManualExit();
            transition(EngineState.WAITING_ENTRY);
        }
    }

    private void logFinalPnl() {
        double pnl = 0.0;
        try {
            Set<String> symbols = basket.symbols();
            for (PositionSnapshot position : brokerClient.getPositions()) {
                if (symbols.contains(position.getSymbol())) {
                    pnl += position.getPnl();
                }
            }
        } catch (BrokerQueryException e) {
            log.warn("Final P&L fetch failed, reporting last observed value: {}", e.getMessage());
            pnl = lastDecision != null ? lastDecision.getPnl() : 0.0;
        }
        log.info("Basket closed | reason={} | realized P&L={}",
                monitoringState.getExitReason(), String.format("%.2f", pnl));
    }

    private void logPartialEntry(ExecutionResult result) {
        log.error("Entry PARTIAL, engine FAILED. Manual intervention required. No automatic unwind.");
        for (LegExecution execution : result.getAttempted()) {
            log.error("  {} {} {} -> {} order={} {}", execution.getLeg().getLabel(), execution.getSentSide(),
                    execution.getLeg().getBrokerSymbol(), execution.getStatus(), execution.getOrderId(),
                    execution.getErrorDetail() != null ? execution.getErrorDetail() : "");
        }
        for (Leg leg : result.getNotSent()) {
            log.error("  {} {} {} -> NOT SENT", leg.getLabel(), leg.getSide(), leg.getBrokerSymbol());
        }
    }

    private void transition(EngineState next) {
        if (state != next) {
            log.info("Engine state {} -> {}", state, next);
            state = next;
        }
    }

    /**
     * Asks the monitor to exit on its next tick.
     *
     * @return false if no basket is being entered or monitored
     */
    public boolean requestManualExit() {
        EngineState current = state;
        if (current != EngineState.MONITORING && current != EngineState.ENTERING) {
            log.warn("Manual exit ignored in state {}", current);
            return false;
        }
        positionMonitor.requestManualExit();
        return true;
    }

    /**
     * Cancels the ticker; the loop ends before its next sleep returns.
     */
    public void stop() {
        log.info("Stopping strategy engine (state {})", state);
        ticker.cancel();
    }

    /**
     * Waits for the engine thread to finish.
     *
     * @return true if the thread is not running when this returns
     */
    public boolean awaitTermination(Duration timeout) {
        Thread t = thread;
        if (t == null) {
            return true;
        }
        try {
            t.join(Math.max(1, timeout.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !t.isAlive();
    }

    public void setCompletionListener(Consumer<EngineState> completionListener) {
        this.completionListener = completionListener;
    }

    public EngineState getState() {
        return state;
    }

    public LocalDate getTradingDay() {
        return tradingDay;
    }

    public MonitoringState getMonitoringState() {
        return monitoringState;
    }

    public Basket getBasket() {
        return basket;
    }

    public ExitDecision getLastDecision() {
        return lastDecision;
    }

    public boolean isManualExitRequested() {
        return positionMonitor.isManualExitRequested();
    }
}
