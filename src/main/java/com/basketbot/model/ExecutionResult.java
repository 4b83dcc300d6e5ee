package com.basketbot.model;

import lombok.Value;

import java.util.List;

/**
 * Result of executing a basket: the legs that were attempted, in order, and the legs that
 * were never sent because an earlier leg was not accepted.
 */
@Value
public class ExecutionResult {

    List<LegExecution> attempted;
    List<Leg> notSent;

    public ExecutionResult(List<LegExecution> attempted, List<Leg> notSent) {
        this.attempted = List.copyOf(attempted);
        this.notSent = List.copyOf(notSent);
    }

    public static ExecutionResult empty() {
        return new ExecutionResult(List.of(), List.of());
    }

    /**
     * True only if every leg was sent and accepted. An empty basket is complete.
     */
    public boolean isComplete() {
        if (!notSent.isEmpty()) {
            return false;
        }
        for (LegExecution execution : attempted) {
            if (!execution.isAccepted()) {
                return false;
            }
        }
        return true;
    }

    public boolean isPartial() {
        return !isComplete();
    }

    public boolean hasUnknownOrders() {
        return attempted.stream().anyMatch(e -> e.getStatus() == OrderStatus.UNKNOWN);
    }
}
