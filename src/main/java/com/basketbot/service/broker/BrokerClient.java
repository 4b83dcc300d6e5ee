package com.basketbot.service.broker;

import com.basketbot.dto.Candle;
import com.basketbot.dto.Funds;
import com.basketbot.dto.OrderAck;
import com.basketbot.dto.OrderRequest;
import com.basketbot.dto.PositionSnapshot;
import com.basketbot.dto.Quote;
import com.basketbot.exception.BrokerAuthenticationException;
import com.basketbot.exception.BrokerException;
import com.basketbot.exception.BrokerQueryException;
import com.basketbot.model.OptionType;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Synchronous gateway to the brokerage. Lookups fail with {@link BrokerQueryException};
 * order placement never throws and reports rejection in the returned {@link OrderAck}.
 */
public interface BrokerClient {

    /**
     * Last traded price per symbol. Symbols the broker did not return are absent.
     */
    Map<String, Quote> getQuotes(List<String> symbols) throws BrokerQueryException;

    default Quote getQuote(String symbol) throws BrokerQueryException {
        Quote quote = getQuotes(List.of(symbol)).get(symbol);
        if (quote == null || quote.getLastPrice() <= 0) {
            throw new BrokerQueryException("No quote returned for " + symbol);
        }
        return quote;
    }

    /**
     * OHLCV rows for {@code symbol}, oldest first, timestamps in epoch seconds.
     *
     * @param resolution 1, 3, 5, 10, 15, 30, 60 (minutes) or D
     */
    List<Candle> getCandles(String symbol, String resolution, LocalDate from, LocalDate to)
            throws BrokerQueryException;

    OrderAck placeOrder(OrderRequest request);

    /**
     * Net positions for the day, including flat ones.
     */
    List<PositionSnapshot> getPositions() throws BrokerQueryException;

    Funds getFunds() throws BrokerQueryException;

    /**
     * Earliest option expiry on or after today for the underlying.
     */
    LocalDate getNearestExpiry(String underlying) throws BrokerQueryException;

    /**
     * Exchange trading symbol of one option contract.
     */
    String resolveOptionSymbol(String underlying, LocalDate expiry, double strike, OptionType optionType)
            throws BrokerQueryException;

    /**
     * Checks that the configured credentials are accepted.
     *
     * @throws BrokerAuthenticationException if the broker rejects the session
     */
    void verifySession() throws BrokerException;
}
