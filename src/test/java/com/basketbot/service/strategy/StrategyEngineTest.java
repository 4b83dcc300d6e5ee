package com.basketbot.service.strategy;

import com.basketbot.config.StrategyConfig;
import com.basketbot.dto.Funds;
import com.basketbot.dto.Quote;
import com.basketbot.exception.BrokerQueryException;
import com.basketbot.model.Basket;
import com.basketbot.model.EngineState;
import com.basketbot.model.ExecutionResult;
import com.basketbot.model.ExitDecision;
import com.basketbot.model.ExitReason;
import com.basketbot.model.Leg;
import com.basketbot.model.LegExecution;
import com.basketbot.model.OptionType;
import com.basketbot.model.OrderStatus;
import com.basketbot.model.Side;
import com.basketbot.model.SideTransform;
import com.basketbot.model.StrategyVariant;
import com.basketbot.service.MarketHours;
import com.basketbot.service.broker.BrokerClient;
import com.basketbot.service.scheduling.FakeTicker;
import com.basketbot.service.scheduling.MutableClock;
import com.basketbot.service.strategy.monitoring.PositionMonitor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("StrategyEngine")
class StrategyEngineTest {

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");
    private static final LocalDate EXPIRY = LocalDate.of(2024, 6, 6);

    @Mock
    private BrokerClient brokerClient;
    @Mock
    private StrikeSelector strikeSelector;
    @Mock
    private EntryPolicy entryPolicy;
    @Mock
    private BasketExecutor basketExecutor;
    @Mock
    private PositionMonitor positionMonitor;

    private MutableClock clock;
    private FakeTicker ticker;
    private StrategyEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(ZonedDateTime.of(2024, 6, 3, 9, 45, 0, 0, IST));
        ticker = new FakeTicker(clock, 10);
        StrategyConfig config = StrategyConfig.builder()
                .underlying("NIFTY")
                .underlyingQuoteSymbol("NSE:NIFTY 50")
                .variant(StrategyVariant.OFFSET_BASKET)
                .entryTime("09:45")
                .exitTime("15:15")
                .pollInterval(Duration.ofSeconds(10))
                .shutdownOnCompletion(true)
                .build();
        MarketHours marketHours = new MarketHours(IST, LocalTime.of(9, 15), LocalTime.of(15, 30), Set.of());
        engine = new StrategyEngine(config, brokerClient, strikeSelector, entryPolicy, basketExecutor,
                positionMonitor, marketHours, clock, ticker);
    }

    private static Leg leg(String label, Side side, double strike, int quantity) {
        return Leg.builder().label(label).optionType(OptionType.CE).strike(strike).side(side).quantity(quantity).build();
    }

    private static ExecutionResult accepted(List<Leg> legs) {
        List<LegExecution> executions = new ArrayList<>();
        for (Leg leg : legs) {
            executions.add(LegExecution.builder().leg(leg).sentSide(leg.getSide())
                    .orderId("o-" + leg.getLabel()).status(OrderStatus.ACCEPTED).build());
        }
        return new ExecutionResult(executions, List.of());
    }

    private void stubLookups() throws BrokerQueryException {
        when(entryPolicy.shouldEnter(any())).thenReturn(true);
        when(brokerClient.getQuote("NSE:NIFTY 50")).thenReturn(new Quote("NSE:NIFTY 50", 22050.0));
        when(brokerClient.getNearestExpiry("NIFTY")).thenReturn(EXPIRY);
        when(strikeSelector.select(22050.0)).thenReturn(List.of(
                leg("BUY_ATM_CE", Side.BUY, 22250, 50),
                leg("SELL_CE", Side.SELL, 22450, 150)));
        when(brokerClient.resolveOptionSymbol(eq("NIFTY"), eq(EXPIRY), anyDouble(), eq(OptionType.CE)))
                .thenAnswer(inv -> "NIFTY24JUN" + (long) inv.<Double>getArgument(2).doubleValue() + "CE");
    }

    private void enterAndMonitor(ExitDecision firstDecision) throws BrokerQueryException {
        stubLookups();
        when(basketExecutor.execute(any(Basket.class), eq(SideTransform.AS_IS)))
                .thenAnswer(inv -> accepted(((Basket) inv.getArgument(0)).getLegs()));
        when(brokerClient.getFunds()).thenReturn(new Funds(120_000.0, 30_000.0));
        when(positionMonitor.poll(any(), any())).thenReturn(firstDecision);
    }

    @Nested
    @DisplayName("Entry")
    class Entry {

        @Test
        @DisplayName("Waits while the entry policy says no")
        void waitsForEntry() throws Exception {
            when(entryPolicy.shouldEnter(any())).thenReturn(false);

            engine.step();

            assertEquals(EngineState.WAITING_ENTRY, engine.getState());
            verify(brokerClient, never()).getQuote(any());
            verifyNoInteractions(basketExecutor);
        }

        @Test
        @DisplayName("Lookup failure returns to WAITING_ENTRY without placing anything")
        void lookupFailure() throws Exception {
            when(entryPolicy.shouldEnter(any())).thenReturn(true);
            when(brokerClient.getQuote("NSE:NIFTY 50")).thenThrow(new BrokerQueryException("quote timeout"));

            engine.step();

            assertEquals(EngineState.WAITING_ENTRY, engine.getState());
            verifyNoInteractions(basketExecutor);
            assertNull(engine.getBasket());
        }

        @Test
        @DisplayName("No basket is opened at or after the exit time")
        void noEntryAtExitTime() throws Exception {
            clock.set(ZonedDateTime.of(2024, 6, 3, 15, 15, 0, 0, IST));
            when(entryPolicy.shouldEnter(any())).thenReturn(true);

            engine.step();
            clock.set(ZonedDateTime.of(2024, 6, 3, 15, 20, 0, 0, IST));
            engine.step();

            assertEquals(EngineState.WAITING_ENTRY, engine.getState());
            verify(brokerClient, never()).getQuote(any());
            verifyNoInteractions(basketExecutor, positionMonitor);
            assertEquals(LocalTime.of(15, 15), engine.entryCutoff());
        }

        @Test
        @DisplayName("Entry one second before the exit time still opens the basket")
        void entryJustBeforeExitTime() throws Exception {
            clock.set(ZonedDateTime.of(2024, 6, 3, 15, 14, 59, 0, IST));
            enterAndMonitor(ExitDecision.none());

            engine.step();

            assertEquals(EngineState.MONITORING, engine.getState());
        }

        @Test
        @DisplayName("Manual exit accepted during a failed entry does not carry over to the next basket")
        void manualExitDiscardedOnFailedLookup() throws Exception {
            AtomicReference<Boolean> accepted = new AtomicReference<>();
            when(entryPolicy.shouldEnter(any())).thenReturn(true);
            when(brokerClient.getQuote("NSE:NIFTY 50")).thenAnswer(inv -> {
                accepted.set(engine.requestManualExit());
                throw new BrokerQueryException("quote timeout");
            });
            when(positionMonitor.isManualExitRequested()).thenReturn(true);

            engine.step();

            assertTrue(accepted.get());
            assertEquals(EngineState.WAITING_ENTRY, engine.getState());
            verify(positionMonitor).requestManualExit();
            verify(positionMonitor).clearManualExit();
            verifyNoInteractions(basketExecutor);
        }

        @Test
        @DisplayName("Complete basket moves to MONITORING with broker symbols and capital")
        void completeEntry() throws Exception {
            enterAndMonitor(ExitDecision.none());

            engine.step();

            assertEquals(EngineState.MONITORING, engine.getState());
            assertEquals(List.of("NIFTY24JUN22250CE", "NIFTY24JUN22450CE"),
                    List.copyOf(engine.getBasket().symbols()));
            assertTrue(engine.getMonitoringState().isActive());
            assertEquals(120_000.0, engine.getMonitoringState().getDeployedCapital(), 1e-9);
            assertEquals(Set.of("NIFTY24JUN22250CE", "NIFTY24JUN22450CE"), engine.getMonitoringState().getSymbols());
            verify(positionMonitor).poll(engine.getMonitoringState(), Duration.ofSeconds(10));
        }

        @Test
        @DisplayName("Funds failure after entry still monitors with unknown capital")
        void fundsFailureAfterEntry() throws Exception {
            stubLookups();
            when(basketExecutor.execute(any(Basket.class), eq(SideTransform.AS_IS)))
                    .thenAnswer(inv -> accepted(((Basket) inv.getArgument(0)).getLegs()));
            when(brokerClient.getFunds()).thenThrow(new BrokerQueryException("margins down"));
            when(positionMonitor.poll(any(), any())).thenReturn(ExitDecision.none());

            engine.step();

            assertEquals(EngineState.MONITORING, engine.getState());
            assertEquals(0.0, engine.getMonitoringState().getDeployedCapital(), 1e-9);
        }

        @Test
        @DisplayName("Partial basket moves to FAILED with no retry and no unwind")
        void partialEntry() throws Exception {
            stubLookups();
            when(basketExecutor.execute(any(Basket.class), eq(SideTransform.AS_IS))).thenAnswer(inv -> {
                List<Leg> legs = ((Basket) inv.getArgument(0)).getLegs();
                LegExecution first = LegExecution.builder().leg(legs.get(0)).sentSide(Side.BUY)
                        .orderId("o1").status(OrderStatus.ACCEPTED).build();
                LegExecution second = LegExecution.builder().leg(legs.get(1)).sentSide(Side.SELL)
                        .status(OrderStatus.REJECTED).errorDetail("[400] margin").build();
                return new ExecutionResult(List.of(first, second), List.of());
            });

            engine.step();
            assertEquals(EngineState.FAILED, engine.getState());

            engine.step();
            assertEquals(EngineState.FAILED, engine.getState());
            verify(basketExecutor, times(1)).execute(any(Basket.class), any(SideTransform.class));
            verify(basketExecutor, never()).exit(any(), any());
            verifyNoInteractions(positionMonitor);
        }
    }

    @Nested
    @DisplayName("Exit")
    class Exit {

        @Test
        @DisplayName("Exit decision closes the basket and finishes DONE")
        void exitToDone() throws Exception {
            enterAndMonitor(new ExitDecision(ExitReason.TARGET, 1300.0, 1200.0, 1200.0, 120_000.0));
            when(basketExecutor.exit(any(Basket.class), eq(ExitReason.TARGET))).thenReturn(ExecutionResult.empty());

            engine.step();

            assertEquals(EngineState.DONE, engine.getState());
            assertEquals(ExitReason.TARGET, engine.getLastDecision().getReason());
            assertFalse(engine.getMonitoringState().isActive());
            verify(positionMonitor).clearManualExit();
        }

        @Test
        @DisplayName("Partial close stays EXITING and retries on the next tick")
        void partialCloseRetries() throws Exception {
            enterAndMonitor(new ExitDecision(ExitReason.STOP_LOSS, -1300.0, 1200.0, 1200.0, 120_000.0));
            Leg held = leg("SELL_CE", Side.SELL, 22450, 150).withBrokerSymbol("NIFTY24JUN22450CE");
            ExecutionResult partial = new ExecutionResult(List.of(LegExecution.builder().leg(held)
                    .sentSide(Side.BUY).status(OrderStatus.REJECTED).errorDetail("[429] too many").build()), List.of());
            when(basketExecutor.exit(any(Basket.class), eq(ExitReason.STOP_LOSS)))
                    .thenReturn(partial)
                    .thenThrow(new BrokerQueryException("positions down"))
                    .thenReturn(ExecutionResult.empty());

            engine.step();
            assertEquals(EngineState.EXITING, engine.getState());

            engine.step();
            assertEquals(EngineState.EXITING, engine.getState());

            engine.step();
            assertEquals(EngineState.DONE, engine.getState());
            verify(basketExecutor, times(3)).exit(any(Basket.class), eq(ExitReason.STOP_LOSS));
        }
    }

    @Nested
    @DisplayName("Trading day")
    class TradingDay {

        @Test
        @DisplayName("At most one cycle per day; a new date re-arms the engine")
        void rollOver() throws Exception {
            enterAndMonitor(new ExitDecision(ExitReason.MARKET_CLOSE, 10.0, 1200.0, 1200.0, 120_000.0));
            when(basketExecutor.exit(any(Basket.class), any())).thenReturn(ExecutionResult.empty());

            engine.step();
            assertEquals(EngineState.DONE, engine.getState());

            clock.advance(Duration.ofHours(1));
            engine.step();
            assertEquals(EngineState.DONE, engine.getState());
            verify(entryPolicy, times(1)).shouldEnter(any());

            clock.set(ZonedDateTime.of(2024, 6, 4, 9, 0, 0, 0, IST));
            when(entryPolicy.shouldEnter(any())).thenReturn(false);
            engine.step();

            assertEquals(EngineState.WAITING_ENTRY, engine.getState());
            assertEquals(LocalDate.of(2024, 6, 4), engine.getTradingDay());
            assertNull(engine.getBasket());
        }
    }

    @Nested
    @DisplayName("Control")
    class Control {

        @Test
        @DisplayName("Manual exit is refused while waiting for entry")
        void manualExitRefusedWhenIdle() {
            assertFalse(engine.requestManualExit());
            verify(positionMonitor, never()).requestManualExit();
        }

        @Test
        @DisplayName("Manual exit is forwarded while monitoring")
        void manualExitWhileMonitoring() throws Exception {
            enterAndMonitor(ExitDecision.none());
            engine.step();

            assertTrue(engine.requestManualExit());
            verify(positionMonitor).requestManualExit();
        }

        @Test
        @DisplayName("Run loop reports completion once the cycle is DONE")
        void runReportsCompletion() throws Exception {
            enterAndMonitor(new ExitDecision(ExitReason.MANUAL, 0.0, 1200.0, 1200.0, 120_000.0));
            when(basketExecutor.exit(any(Basket.class), any())).thenReturn(ExecutionResult.empty());
            AtomicReference<EngineState> completed = new AtomicReference<>();
            engine.setCompletionListener(completed::set);

            engine.run();

            assertEquals(EngineState.DONE, completed.get());
        }

        @Test
        @DisplayName("Stop ends the run loop")
        void stopEndsLoop() {
            engine.stop();

            engine.run();

            assertTrue(ticker.isCancelled());
            verifyNoInteractions(entryPolicy);
        }
    }
}
