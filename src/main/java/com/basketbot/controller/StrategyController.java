package com.basketbot.controller;

import com.basketbot.dto.ApiResponse;
import com.basketbot.dto.EngineStatusResponse;
import com.basketbot.model.Basket;
import com.basketbot.model.EngineState;
import com.basketbot.model.ExitDecision;
import com.basketbot.model.MonitoringState;
import com.basketbot.service.strategy.StrategyEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * Controller for the running basket strategy
 */
@RestController
@RequestMapping("/api/strategy")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Strategy", description = "Basket strategy engine state and manual exit")
public class StrategyController {

    private final StrategyEngine strategyEngine;

    @GetMapping("/status")
    @Operation(summary = "Get engine status",
               description = "Current state, today's basket, deployed capital and the last exit decision")
    public ResponseEntity<ApiResponse<EngineStatusResponse>> getStatus() {
        MonitoringState monitoring = strategyEngine.getMonitoringState();
        Basket basket = strategyEngine.getBasket();
        ExitDecision decision = strategyEngine.getLastDecision();

        List<String> legs = basket == null ? List.of() : basket.getLegs().stream()
                .map(leg -> leg.getLabel() + " " + leg.getSide() + " " + leg.getQuantity() + " " + leg.getBrokerSymbol())
                .toList();

        EngineStatusResponse status = EngineStatusResponse.builder()
                .state(strategyEngine.getState().name())
                .tradingDay(strategyEngine.getTradingDay())
                .monitoring(monitoring.isActive())
                .deployedCapital(monitoring.isActive() ? monitoring.getDeployedCapital() : null)
                .entryTimestamp(monitoring.getEntryTimestamp())
                .lastExitDecision(decision != null ? decision.toString() : null)
                .legs(legs)
                .manualExitRequested(strategyEngine.isManualExitRequested())
                .lastUpdated(Instant.now())
                .build();
        return ResponseEntity.ok(ApiResponse.success(status));
    }

    @PostMapping("/exit")
    @Operation(summary = "Request manual exit",
               description = "The monitor reports MANUAL on its next tick and the basket is closed")
    public ResponseEntity<ApiResponse<String>> requestExit() {
        EngineState state = strategyEngine.getState();
        if (!strategyEngine.requestManualExit()) {
            throw new IllegalStateException("No open basket to exit (engine state " + state + ")");
        }
        log.info("Manual exit requested via API");
        return ResponseEntity.ok(ApiResponse.success("Manual exit requested", state.name()));
    }
}
