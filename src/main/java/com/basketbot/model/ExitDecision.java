package com.basketbot.model;

import lombok.Value;

/**
 * Exit reason together with the figures that triggered it, kept for the audit log.
 */
@Value
public class ExitDecision {

    private static final ExitDecision NONE = new ExitDecision(ExitReason.NONE, 0.0, 0.0, 0.0, 0.0);

    ExitReason reason;
    double pnl;
    double targetAmount;
    double stopLossAmount;
    double deployedCapital;

    public static ExitDecision none() {
        return NONE;
    }

    public boolean isExit() {
        return reason != ExitReason.NONE;
    }

    @Override
    public String toString() {
        return String.format("%s (pnl=%.2f, target=%.2f, stopLoss=-%.2f, capital=%.2f)",
                reason, pnl, targetAmount, stopLossAmount, deployedCapital);
    }
}
