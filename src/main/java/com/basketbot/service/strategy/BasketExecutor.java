package com.basketbot.service.strategy;

import com.basketbot.dto.OrderAck;
import com.basketbot.dto.OrderRequest;
import com.basketbot.dto.PositionSnapshot;
import com.basketbot.exception.BrokerQueryException;
import com.basketbot.model.Basket;
import com.basketbot.model.ExecutionResult;
import com.basketbot.model.ExitReason;
import com.basketbot.model.Leg;
import com.basketbot.model.LegExecution;
import com.basketbot.model.OrderStatus;
import com.basketbot.model.Side;
import com.basketbot.model.SideTransform;
import com.basketbot.service.broker.BrokerClient;
import com.basketbot.service.scheduling.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.basketbot.service.TradingConstants.MSG_VERIFY_MANUALLY;
import static com.basketbot.service.TradingConstants.TAG_ENTRY_PREFIX;
import static com.basketbot.service.TradingConstants.TAG_EXIT_PREFIX;

/**
 * Places a basket leg by leg.
 * <p>
 * Legs go out strictly in basket order with a fixed pause between placements. The first
 * leg that is not accepted stops the basket: later legs are never sent and legs already
 * filled are left open for the operator. Holds no state between calls.
 */
@Slf4j
public class BasketExecutor {

    private final BrokerClient brokerClient;
    private final String exchange;
    private final String product;
    private final String orderType;
    private final Duration pacing;
    private final Sleeper sleeper;

    public BasketExecutor(BrokerClient brokerClient, String exchange, String product, String orderType,
                          Duration pacing, Sleeper sleeper) {
        this.brokerClient = brokerClient;
        this.exchange = exchange;
        this.product = product;
        this.orderType = orderType;
        this.pacing = pacing;
        this.sleeper = sleeper;
    }

    public ExecutionResult execute(Basket basket, SideTransform transform) {
        return execute(basket, transform, TAG_ENTRY_PREFIX);
    }

    /**
     * @param tagPrefix prefix of each order's tag; the leg label is appended
     */
    public ExecutionResult execute(Basket basket, SideTransform transform, String tagPrefix) {
        List<Leg> legs = basket.getLegs();
        List<LegExecution> attempted = new ArrayList<>(legs.size());

        for (int i = 0; i < legs.size(); i++) {
            if (i > 0 && !pause()) {
                List<Leg> notSent = legs.subList(i, legs.size());
                log.error("Basket interrupted before leg {}/{}; {} legs not sent", i + 1, legs.size(), notSent.size());
                return finish(attempted, notSent);
            }

            Leg leg = legs.get(i);
            Side side = transform.apply(leg.getSide());
            OrderAck ack = brokerClient.placeOrder(OrderRequest.builder()
                    .tradingSymbol(leg.getBrokerSymbol())
                    .exchange(exchange)
                    .side(side)
                    .quantity(leg.getQuantity())
                    .product(product)
                    .orderType(orderType)
                    .tag(tagPrefix + leg.getLabel())
                    .build());

            LegExecution execution = LegExecution.builder()
                    .leg(leg)
                    .sentSide(side)
                    .orderId(ack.getOrderId())
                    .status(ack.getStatus())
                    .errorDetail(ack.getErrorDetail())
                    .build();
            attempted.add(execution);
            logLeg(i + 1, legs.size(), execution);

            if (!execution.isAccepted()) {
                return finish(attempted, legs.subList(i + 1, legs.size()));
            }
        }
        return finish(attempted, List.of());
    }

    /**
     * Closes whatever is still held of {@code entryBasket}.
     * <p>
     * Held legs come from current net positions: the sign of the net quantity gives the
     * side and its magnitude the quantity. They are closed short legs first, then longs,
     * each group in entry order. A basket that is already flat sends nothing and is complete.
     *
     * @throws BrokerQueryException if positions could not be read; nothing was sent
     */
    public ExecutionResult exit(Basket entryBasket, ExitReason reason) throws BrokerQueryException {
        Map<String, PositionSnapshot> bySymbol = new HashMap<>();
        for (PositionSnapshot position : brokerClient.getPositions()) {
            bySymbol.put(position.getSymbol(), position);
        }

        List<Leg> held = new ArrayList<>();
        for (Leg leg : entryBasket.getLegs()) {
            PositionSnapshot position = bySymbol.get(leg.getBrokerSymbol());
            if (position == null || position.isFlat()) {
                continue;
            }
            held.add(Leg.builder()
                    .label(leg.getLabel())
                    .optionType(leg.getOptionType())
                    .strike(leg.getStrike())
                    .side(Side.fromNetQuantity(position.getNetQuantity()))
                    .quantity(Math.abs(position.getNetQuantity()))
                    .brokerSymbol(leg.getBrokerSymbol())
                    .build());
        }

        if (held.isEmpty()) {
            log.info("Exit ({}): basket already flat, no orders sent", reason);
            return ExecutionResult.empty();
        }

        Basket closing = new Basket(held).exitOrder();
        log.info("Exit ({}): closing {} held legs {}", reason, closing.size(), closing.symbols());
        return execute(closing, SideTransform.INVERT, TAG_EXIT_PREFIX + reason.name() + "_");
    }

    private boolean pause() {
        if (pacing.isZero() || pacing.isNegative()) {
            return true;
        }
        try {
            sleeper.sleep(pacing);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private ExecutionResult finish(List<LegExecution> attempted, List<Leg> notSent) {
        ExecutionResult result = new ExecutionResult(attempted, notSent);
        if (result.isComplete()) {
            log.info("Basket complete: {} legs accepted", attempted.size());
        } else {
            log.error("Basket PARTIAL: {} attempted, {} accepted, {} never sent {}. Placed legs are left open.",
                    attempted.size(),
                    attempted.stream().filter(LegExecution::isAccepted).count(),
                    notSent.size(),
                    notSent.stream().map(Leg::getBrokerSymbol).toList());
        }
        return result;
    }

    private void logLeg(int position, int total, LegExecution execution) {
        Leg leg = execution.getLeg();
        if (execution.isAccepted()) {
            log.info("Leg {}/{} {} {} {} x{} accepted, order {}", position, total, leg.getLabel(),
                    execution.getSentSide(), leg.getBrokerSymbol(), leg.getQuantity(), execution.getOrderId());
        } else if (execution.getStatus() == OrderStatus.UNKNOWN) {
            log.error("Leg {}/{} {} {} {} x{} UNKNOWN ({}): {}", position, total, leg.getLabel(),
                    execution.getSentSide(), leg.getBrokerSymbol(), leg.getQuantity(),
                    execution.getErrorDetail(), MSG_VERIFY_MANUALLY);
        } else {
            log.error("Leg {}/{} {} {} {} x{} REJECTED: {}", position, total, leg.getLabel(),
                    execution.getSentSide(), leg.getBrokerSymbol(), leg.getQuantity(), execution.getErrorDetail());
        }
    }
}
