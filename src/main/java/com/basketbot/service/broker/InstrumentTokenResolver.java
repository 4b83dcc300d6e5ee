package com.basketbot.service.broker;

import com.basketbot.exception.BrokerQueryException;

/**
 * Maps an exchange-qualified symbol such as {@code NSE:NIFTY 50} to the numeric token the
 * Kite feed subscribes by.
 */
@FunctionalInterface
public interface InstrumentTokenResolver {

    long instrumentToken(String symbol) throws BrokerQueryException;
}
