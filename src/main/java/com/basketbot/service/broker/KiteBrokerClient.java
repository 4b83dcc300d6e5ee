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
import com.basketbot.service.broker.RateLimiterService.ApiType;
import com.basketbot.service.broker.RateLimiterService.KiteCall;
import com.basketbot.service.broker.RateLimiterService.RateLimitExceededException;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.NetworkException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.TokenException;
import com.zerodhatech.models.HistoricalData;
import com.zerodhatech.models.Instrument;
import com.zerodhatech.models.LTPQuote;
import com.zerodhatech.models.Margin;
import com.zerodhatech.models.Order;
import com.zerodhatech.models.OrderParams;
import com.zerodhatech.models.Position;
import com.zerodhatech.models.Profile;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static com.basketbot.service.TradingConstants.*;

/**
 * {@link BrokerClient} over Kite Connect.
 * <p>
 * Every call goes through {@link RateLimiterService}. The instrument dump is large and
 * static for the day, so it is fetched once per exchange per trading day.
 */
@Slf4j
public class KiteBrokerClient implements BrokerClient, InstrumentTokenResolver {

    private static final DateTimeFormatter KITE_CANDLE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssZ");

    private static final Map<String, String> INTERVALS = Map.of(
            "1", "minute",
            "3", "3minute",
            "5", "5minute",
            "10", "10minute",
            "15", "15minute",
            "30", "30minute",
            "60", "60minute",
            "D", "day");

    private final KiteConnect kiteConnect;
    private final RateLimiterService rateLimiter;
    private final Clock clock;
    private final ZoneId zone;

    private final Map<String, InstrumentDump> instrumentCache = new ConcurrentHashMap<>();
    private final Map<String, Long> tokenCache = new ConcurrentHashMap<>();

    public KiteBrokerClient(KiteConnect kiteConnect, RateLimiterService rateLimiter, Clock clock, ZoneId zone) {
        this.kiteConnect = kiteConnect;
        this.rateLimiter = rateLimiter;
        this.clock = clock;
        this.zone = zone;
    }

    @Override
    public Map<String, Quote> getQuotes(List<String> symbols) throws BrokerQueryException {
        Map<String, LTPQuote> ltp = query(ApiType.QUOTE, "LTP " + symbols,
                () -> kiteConnect.getLTP(symbols.toArray(new String[0])));
        Map<String, Quote> quotes = new LinkedHashMap<>();
        if (ltp != null) {
            for (String symbol : symbols) {
                LTPQuote q = ltp.get(symbol);
                if (q != null) {
                    quotes.put(symbol, new Quote(symbol, q.lastPrice));
                    tokenCache.putIfAbsent(symbol, q.instrumentToken);
                }
            }
        }
        log.debug("Fetched LTP for {}/{} symbols", quotes.size(), symbols.size());
        return quotes;
    }

    @Override
    public List<Candle> getCandles(String symbol, String resolution, LocalDate from, LocalDate to)
            throws BrokerQueryException {
        String interval = INTERVALS.get(resolution);
        if (interval == null) {
            throw new BrokerQueryException("Unsupported candle resolution: " + resolution);
        }
        String token = String.valueOf(instrumentToken(symbol));
        Date fromDate = Date.from(from.atStartOfDay(zone).toInstant());
        Date toDate = Date.from(to.plusDays(1).atStartOfDay(zone).toInstant());

        HistoricalData data = query(ApiType.HISTORICAL, "historical data for " + symbol,
                () -> kiteConnect.getHistoricalData(fromDate, toDate, token, interval, false, false));

        if (data == null || data.dataArrayList == null) {
            return List.of();
        }
        List<Candle> candles = new ArrayList<>(data.dataArrayList.size());
        for (HistoricalData row : data.dataArrayList) {
            candles.add(Candle.builder()
                    .timestamp(parseCandleTime(row.timeStamp))
                    .open(row.open)
                    .high(row.high)
                    .low(row.low)
                    .close(row.close)
                    .volume(row.volume)
                    .build());
        }
        log.debug("Fetched {} {} candles for {}", candles.size(), interval, symbol);
        return candles;
    }

    @Override
    public OrderAck placeOrder(OrderRequest request) {
        OrderParams params = new OrderParams();
        params.tradingsymbol = request.getTradingSymbol();
        params.exchange = request.getExchange();
        params.transactionType = request.getSide().name();
        params.quantity = request.getQuantity();
        params.product = request.getProduct();
        params.orderType = request.getOrderType();
        params.validity = VALIDITY_DAY;
        params.tag = sanitizeTag(request.getTag());

        log.info("Placing order - Symbol: {}, Side: {}, Qty: {}, Tag: {}",
                params.tradingsymbol, params.transactionType, params.quantity, params.tag);
        try {
            Order order = rateLimiter.call(ApiType.ORDER, () -> kiteConnect.placeOrder(params, VARIETY_REGULAR));
            if (order == null || order.orderId == null || order.orderId.isEmpty()) {
                log.error("{} for {} - {}", ERR_ORDER_PLACEMENT_FAILED_NO_ID, params.tradingsymbol, MSG_VERIFY_MANUALLY);
                return OrderAck.unknown(ERR_ORDER_PLACEMENT_FAILED_NO_ID);
            }
            log.info("Order placed successfully: {} - {} {} {}",
                    order.orderId, params.transactionType, params.quantity, params.tradingsymbol);
            return OrderAck.accepted(order.orderId);
        } catch (RateLimitExceededException e) {
            log.warn("Order for {} not sent: {}", params.tradingsymbol, e.getMessage());
            return OrderAck.rejected(ERR_NOT_SENT_RATE_LIMITED);
        } catch (KiteException e) {
            if (isOutcomeUnknown(e)) {
                log.error("Kite server error placing order for {} - {}: [{}] {}",
                        params.tradingsymbol, MSG_VERIFY_MANUALLY, e.code, e.message);
                return OrderAck.unknown("[" + e.code + "] " + e.message);
            }
            log.error("Kite rejected order for {}: [{}] {}", params.tradingsymbol, e.code, e.message);
            return OrderAck.rejected("[" + e.code + "] " + e.message);
        } catch (IOException e) {
            log.error("Network error placing order for {} - {}: {}",
                    params.tradingsymbol, MSG_VERIFY_MANUALLY, e.getMessage());
            return OrderAck.unknown(ERR_NETWORK + e.getMessage());
        }
    }

    /**
     * A gateway or network failure says nothing about whether the order reached the exchange.
     */
    static boolean isOutcomeUnknown(KiteException e) {
        return e instanceof NetworkException || e.code >= 500;
    }

    @Override
    public List<PositionSnapshot> getPositions() throws BrokerQueryException {
        Map<String, List<Position>> positions = query(ApiType.POSITIONS, "positions", kiteConnect::getPositions);
        List<Position> net = positions != null ? positions.get(POSITION_NET) : null;
        if (net == null) {
            return List.of();
        }
        List<PositionSnapshot> snapshots = new ArrayList<>(net.size());
        for (Position p : net) {
            snapshots.add(new PositionSnapshot(p.tradingSymbol, p.exchange, p.netQuantity,
                    p.pnl != null ? p.pnl : 0.0));
        }
        return snapshots;
    }

    @Override
    public Funds getFunds() throws BrokerQueryException {
        Margin margin = query(ApiType.MARGINS, "margins", () -> kiteConnect.getMargins(SEGMENT_EQUITY));
        if (margin == null || margin.utilised == null) {
            throw new BrokerQueryException("Margin response has no utilised section");
        }
        double utilised = parseAmount(margin.utilised.debits, "utilised.debits");
        double cash = margin.available != null ? parseAmount(margin.available.cash, "available.cash") : 0.0;
        log.debug("Margins fetched - Utilised: {}, Available cash: {}", utilised, cash);
        return new Funds(utilised, cash);
    }

    @Override
    public LocalDate getNearestExpiry(String underlying) throws BrokerQueryException {
        LocalDate today = LocalDate.now(clock.withZone(zone));
        LocalDate nearest = null;
        for (Instrument instrument : instruments(EXCHANGE_NFO)) {
            if (!isOptionOf(instrument, underlying) || instrument.expiry == null) {
                continue;
            }
            LocalDate expiry = toLocalDate(instrument.expiry);
            if (!expiry.isBefore(today) && (nearest == null || expiry.isBefore(nearest))) {
                nearest = expiry;
            }
        }
        if (nearest == null) {
            throw new BrokerQueryException("No live option expiry found for " + underlying);
        }
        return nearest;
    }

    @Override
    public String resolveOptionSymbol(String underlying, LocalDate expiry, double strike, OptionType optionType)
            throws BrokerQueryException {
        for (Instrument instrument : instruments(EXCHANGE_NFO)) {
            if (isOptionOf(instrument, underlying)
                    && optionType.name().equals(instrument.instrument_type)
                    && instrument.expiry != null
                    && expiry.equals(toLocalDate(instrument.expiry))
                    && Double.compare(parseStrike(instrument.strike), strike) == 0) {
                return instrument.tradingsymbol;
            }
        }
        throw new BrokerQueryException(String.format("No %s %s contract at strike %.0f expiring %s",
                underlying, optionType, strike, expiry));
    }

    @Override
    public void verifySession() throws BrokerException {
        try {
            Profile profile = rateLimiter.call(ApiType.PROFILE, kiteConnect::getProfile);
            log.info("Kite session verified for user: {}", profile != null ? profile.userName : "unknown");
        } catch (TokenException e) {
            throw new BrokerAuthenticationException("Access token rejected: " + e.message, e.code, e);
        } catch (KiteException e) {
            if (e.code == 403) {
                throw new BrokerAuthenticationException("Session rejected: " + e.message, e.code, e);
            }
            throw new BrokerQueryException("Profile check failed: " + e.message, e.code, e);
        } catch (IOException | RateLimitExceededException e) {
            throw new BrokerQueryException("Profile check failed: " + e.getMessage(), e);
        }
    }

    private <T> T query(ApiType apiType, String what, KiteCall<T> call) throws BrokerQueryException {
        try {
            return rateLimiter.call(apiType, call);
        } catch (KiteException e) {
            throw new BrokerQueryException("Kite error fetching " + what + ": " + e.message, e.code, e);
        } catch (IOException e) {
            throw new BrokerQueryException("Network error fetching " + what + ": " + e.getMessage(), e);
        } catch (RateLimitExceededException e) {
            throw new BrokerQueryException(e.getMessage(), e);
        }
    }

    @Override
    public long instrumentToken(String symbol) throws BrokerQueryException {
        Long token = tokenCache.get(symbol);
        if (token == null) {
            getQuotes(List.of(symbol));
            token = tokenCache.get(symbol);
        }
        if (token == null) {
            throw new BrokerQueryException("Unknown instrument: " + symbol);
        }
        return token;
    }

    private List<Instrument> instruments(String exchange) throws BrokerQueryException {
        LocalDate today = LocalDate.now(clock.withZone(zone));
        InstrumentDump cached = instrumentCache.get(exchange);
        if (cached != null && cached.day.equals(today)) {
            return cached.instruments;
        }
        synchronized (instrumentCache) {
            cached = instrumentCache.get(exchange);
            if (cached != null && cached.day.equals(today)) {
                return cached.instruments;
            }
            log.info("Fetching instruments from Kite API for exchange: {}", exchange);
            List<Instrument> fetched = query(ApiType.INSTRUMENTS, "instruments for " + exchange,
                    () -> kiteConnect.getInstruments(exchange));
            List<Instrument> instruments = fetched != null ? fetched : Collections.emptyList();
            instrumentCache.put(exchange, new InstrumentDump(today, instruments));
            log.info("Cached {} instruments for exchange: {}", instruments.size(), exchange);
            return instruments;
        }
    }

    private boolean isOptionOf(Instrument instrument, String underlying) {
        return underlying.equals(instrument.name)
                && (OptionType.CE.name().equals(instrument.instrument_type)
                || OptionType.PE.name().equals(instrument.instrument_type));
    }

    private LocalDate toLocalDate(Date date) {
        return date.toInstant().atZone(zone).toLocalDate();
    }

    static String sanitizeTag(String tag) {
        if (tag == null) {
            return null;
        }
        String cleaned = tag.replaceAll("[^A-Za-z0-9]", "");
        return cleaned.length() > MAX_TAG_LENGTH ? cleaned.substring(0, MAX_TAG_LENGTH) : cleaned;
    }

    static long parseCandleTime(String timeStamp) {
        return OffsetDateTime.parse(timeStamp, KITE_CANDLE_TIME).toEpochSecond();
    }

    private static double parseStrike(String strike) {
        try {
            return strike != null ? Double.parseDouble(strike) : Double.NaN;
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    private static double parseAmount(String value, String field) throws BrokerQueryException {
        if (value == null || value.isBlank()) {
            return 0.0;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new BrokerQueryException("Unparseable margin field " + field + ": " + value, e);
        }
    }

    private static final class InstrumentDump {
        final LocalDate day;
        final List<Instrument> instruments;

        InstrumentDump(LocalDate day, List<Instrument> instruments) {
            this.day = day;
            this.instruments = instruments;
        }
    }
}
