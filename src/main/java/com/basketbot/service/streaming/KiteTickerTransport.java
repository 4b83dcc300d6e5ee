package com.basketbot.service.streaming;

import com.basketbot.exception.BrokerQueryException;
import com.basketbot.exception.StreamingException;
import com.basketbot.service.broker.InstrumentTokenResolver;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.models.Depth;
import com.zerodhatech.models.Order;
import com.zerodhatech.models.Tick;
import com.zerodhatech.ticker.KiteTicker;
import com.zerodhatech.ticker.OnError;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static com.basketbot.service.streaming.MessageClassifier.*;

/**
 * {@link StreamTransport} over Kite's websocket ticker. The same connection carries
 * market ticks and the account's order updates.
 * <p>
 * A fresh {@link KiteTicker} is created on every {@link #open}; the ticker's own
 * reconnection is switched off so reconnects are driven by {@link StreamingClient}.
 * Ticks are published with a declared type taken from the subscription's data type.
 */
@Slf4j
public class KiteTickerTransport implements StreamTransport {

    public static final String SYMBOL = "symbol";
    public static final String TOKEN = "token";
    public static final String VOLUME = "volume";
    public static final String CHANGE_PERCENT = "chp";
    public static final String HIGH = "high";
    public static final String LOW = "low";
    public static final String OPEN_PRICE = "open_price";
    public static final String PREV_CLOSE_PRICE = "prev_close_price";
    public static final String STATUS = "status";
    public static final String SIDE = "side";
    public static final String FILLED_QTY = "filledQty";
    public static final String AVG_PRICE = "avgPrice";
    public static final String TAG = "tag";

    private final StreamCredentials credentials;
    private final InstrumentTokenResolver tokenResolver;

    private final Map<Long, StreamSubscription> byToken = new ConcurrentHashMap<>();
    private volatile KiteTicker ticker;

    public KiteTickerTransport(StreamCredentials credentials, InstrumentTokenResolver tokenResolver) {
        this.credentials = credentials;
        this.tokenResolver = tokenResolver;
    }

    @Override
    public synchronized void open(Listener listener) throws StreamingException {
        releaseTicker();
        KiteTicker t = createTicker();
        t.setTryReconnection(false);

        t.setOnConnectedListener(listener::onOpen);
        t.setOnDisconnectedListener(() -> listener.onClosed("ticker disconnected"));
        t.setOnErrorListener(new OnError() {
            @Override
            public void onError(Exception e) {
                listener.onError(e);
            }

            @Override
            public void onError(KiteException e) {
                listener.onError(new StreamingException("[" + e.code + "] " + e.message));
            }

            @Override
            public void onError(String message) {
                listener.onError(new StreamingException(message));
            }
        });
        t.setOnTickerArrivalListener(ticks -> {
            if (ticks == null) {
                return;
            }
            for (Tick tick : ticks) {
                listener.onMessage(toMessage(tick));
            }
        });
        t.setOnOrderUpdateListener(order -> {
            if (order != null) {
                listener.onMessage(toMessage(order));
            }
        });

        ticker = t;
        log.info("Opening Kite ticker connection for {}", credentials);
        try {
            t.connect();
        } catch (RuntimeException e) {
            throw new StreamingException("Kite ticker connect failed: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void subscribe(Set<StreamSubscription> subscriptions) throws StreamingException {
        KiteTicker t = requireTicker();
        ArrayList<Long> quoteTokens = new ArrayList<>();
        ArrayList<Long> fullTokens = new ArrayList<>();
        for (StreamSubscription subscription : subscriptions) {
            long token = resolve(subscription.getSymbol());
            byToken.put(token, subscription);
            if (subscription.getDataType() == DataType.DEPTH_UPDATE) {
                fullTokens.add(token);
            } else {
                quoteTokens.add(token);
            }
        }
        ArrayList<Long> all = new ArrayList<>(quoteTokens);
        all.addAll(fullTokens);
        t.subscribe(all);
        if (!quoteTokens.isEmpty()) {
            t.setMode(quoteTokens, KiteTicker.modeQuote);
        }
        if (!fullTokens.isEmpty()) {
            t.setMode(fullTokens, KiteTicker.modeFull);
        }
        log.info("Subscribed {} instruments ({} quote, {} full)", all.size(), quoteTokens.size(), fullTokens.size());
    }

    @Override
    public synchronized void unsubscribe(Set<StreamSubscription> subscriptions) throws StreamingException {
        KiteTicker t = requireTicker();
        ArrayList<Long> tokens = new ArrayList<>();
        for (StreamSubscription subscription : subscriptions) {
            long token = resolve(subscription.getSymbol());
            byToken.remove(token);
            tokens.add(token);
        }
        t.unsubscribe(tokens);
        log.info("Unsubscribed {} instruments", tokens.size());
    }

    @Override
    public synchronized void close() {
        releaseTicker();
    }

    KiteTicker createTicker() {
        // KiteTicker constructor order: (accessToken, apiKey)
        return new KiteTicker(credentials.getAccessToken(), credentials.getClientId());
    }

    private void releaseTicker() {
        KiteTicker t = ticker;
        ticker = null;
        if (t == null) {
            return;
        }
        try {
            t.disconnect();
        } catch (RuntimeException e) {
            log.warn("Error disconnecting previous Kite ticker: {}", e.getMessage());
        }
    }

    private KiteTicker requireTicker() throws StreamingException {
        KiteTicker t = ticker;
        if (t == null) {
            throw new StreamingException("Kite ticker not open");
        }
        return t;
    }

    private long resolve(String symbol) throws StreamingException {
        try {
            return tokenResolver.instrumentToken(symbol);
        } catch (BrokerQueryException e) {
            throw new StreamingException("Cannot resolve instrument token for " + symbol, e);
        }
    }

    StreamMessage toMessage(Tick tick) {
        StreamSubscription subscription = byToken.get(tick.getInstrumentToken());
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(SYMBOL, subscription != null ? subscription.getSymbol() : null);
        fields.put(TOKEN, tick.getInstrumentToken());
        fields.put(LTP, tick.getLastTradedPrice());
        fields.put(VOLUME, tick.getVolumeTradedToday());
        fields.put(CHANGE_PERCENT, tick.getChange());
        fields.put(HIGH, tick.getHighPrice());
        fields.put(LOW, tick.getLowPrice());
        fields.put(OPEN_PRICE, tick.getOpenPrice());
        fields.put(PREV_CLOSE_PRICE, tick.getClosePrice());

        boolean depth = subscription != null && subscription.getDataType() == DataType.DEPTH_UPDATE;
        if (depth && tick.getMarketDepth() != null) {
            fields.put(BID, depthLevels(tick.getMarketDepth().get("buy")));
            fields.put(ASK, depthLevels(tick.getMarketDepth().get("sell")));
        }
        return StreamMessage.typed(depth ? MessageType.DEPTH : MessageType.QUOTE, fields);
    }

    StreamMessage toMessage(Order order) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(ID, order.orderId);
        fields.put(STATUS, order.status);
        fields.put(SYMBOL, order.tradingSymbol);
        fields.put(SIDE, order.transactionType);
        fields.put(QTY, order.quantity);
        fields.put(FILLED_QTY, order.filledQuantity);
        fields.put(AVG_PRICE, order.averagePrice);
        fields.put(MESSAGE, order.statusMessage);
        fields.put(TAG, order.tag);
        return StreamMessage.typed(MessageType.ORDER_UPDATE, fields);
    }

    private static List<Map<String, Object>> depthLevels(List<Depth> levels) {
        List<Map<String, Object>> mapped = new ArrayList<>();
        if (levels == null) {
            return mapped;
        }
        for (Depth level : levels) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("price", level.getPrice());
            entry.put("qty", level.getQuantity());
            entry.put("orders", level.getOrders());
            mapped.add(entry);
        }
        return mapped;
    }
}
