package com.basketbot.service.streaming;

import com.basketbot.config.StreamingConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StreamingClient")
class StreamingClientTest {

    private FakeStreamTransport transport;
    private StreamingClient client;

    @BeforeEach
    void setUp() {
        transport = new FakeStreamTransport();
        client = new StreamingClient(transport, new MessageClassifier(), config(100));
    }

    @AfterEach
    void tearDown() {
        client.disconnect();
    }

    private static StreamingConfig config(int queueCapacity) {
        StreamingConfig config = new StreamingConfig();
        config.setQueueCapacity(queueCapacity);
        config.setReconnectInitialDelay(Duration.ofMillis(10));
        config.setReconnectMaxDelay(Duration.ofMillis(40));
        config.setCloseGracePeriod(Duration.ofMillis(300));
        return config;
    }

    private static void waitUntil(BooleanSupplier condition, String description) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Timed out waiting for " + description);
            }
            Thread.sleep(5);
        }
    }

    private static Set<StreamSubscription> subs(DataType type, String... symbols) {
        Set<StreamSubscription> set = new LinkedHashSet<>();
        for (String symbol : symbols) {
            set.add(new StreamSubscription(symbol, type));
        }
        return set;
    }

    @Nested
    @DisplayName("Subscriptions")
    class Subscriptions {

        @Test
        @DisplayName("Subscriptions made before connect are sent once connected")
        void subscribeBeforeConnect() {
            client.subscribe(List.of("NSE:NIFTY 50", "NSE:NIFTY BANK"), DataType.SYMBOL_UPDATE);
            assertTrue(transport.subscribeCalls.isEmpty());

            client.connect();

            assertEquals(ConnectionStatus.CONNECTED, client.getStatus());
            assertEquals(1, transport.subscribeCalls.size());
            assertEquals(subs(DataType.SYMBOL_UPDATE, "NSE:NIFTY 50", "NSE:NIFTY BANK"), transport.lastSubscribe());
        }

        @Test
        @DisplayName("While connected only new entries are sent")
        void deltaWhileConnected() {
            client.subscribe(List.of("NSE:NIFTY 50"), DataType.SYMBOL_UPDATE);
            client.connect();

            client.subscribe(List.of("NSE:NIFTY 50", "NFO:NIFTY24JUN22450CE"), DataType.SYMBOL_UPDATE);
            client.subscribe(List.of("NSE:NIFTY 50"), DataType.SYMBOL_UPDATE);

            assertEquals(2, transport.subscribeCalls.size());
            assertEquals(subs(DataType.SYMBOL_UPDATE, "NFO:NIFTY24JUN22450CE"), transport.lastSubscribe());
            assertEquals(2, client.getSubscriptions().size());
        }

        @Test
        @DisplayName("Same symbol with another data type is a separate entry")
        void dataTypeIsPartOfKey() {
            client.subscribe(List.of("NSE:NIFTY 50"), DataType.SYMBOL_UPDATE);
            client.subscribe(List.of("NSE:NIFTY 50"), DataType.DEPTH_UPDATE);

            assertEquals(2, client.getSubscriptions().size());
            assertEquals(List.of("NSE:NIFTY 50/SYMBOL_UPDATE", "NSE:NIFTY 50/DEPTH_UPDATE"),
                    client.describeSubscriptions());
        }

        @Test
        @DisplayName("Unsubscribed entries are not re-sent after a reconnect")
        void unsubscribeSurvivesReconnect() throws Exception {
            client.subscribe(List.of("NSE:NIFTY 50", "NSE:NIFTY BANK"), DataType.SYMBOL_UPDATE);
            client.connect();
            client.unsubscribe(List.of("NSE:NIFTY BANK"), DataType.SYMBOL_UPDATE);

            assertEquals(subs(DataType.SYMBOL_UPDATE, "NSE:NIFTY BANK"), transport.unsubscribeCalls.get(0));

            transport.listener.onClosed("reset by peer");
            waitUntil(() -> transport.subscribeCalls.size() == 2, "resubscribe");

            assertEquals(subs(DataType.SYMBOL_UPDATE, "NSE:NIFTY 50"), transport.lastSubscribe());
        }
    }

    @Nested
    @DisplayName("Reconnect")
    class Reconnect {

        @Test
        @DisplayName("After a forced drop the identical subscription set is re-sent")
        void resubscribesVerbatim() throws Exception {
            client.subscribe(List.of("NSE:NIFTY 50", "NFO:NIFTY24JUN22250CE"), DataType.SYMBOL_UPDATE);
            client.subscribe(List.of("NFO:NIFTY24JUN22450CE"), DataType.DEPTH_UPDATE);
            client.connect();
            Set<StreamSubscription> before = transport.lastSubscribe();

            transport.listener.onClosed("network reset");

            waitUntil(() -> transport.subscribeCalls.size() == 2, "resubscribe after reconnect");
            assertEquals(2, transport.opens.get());
            assertEquals(ConnectionStatus.CONNECTED, client.getStatus());
            assertEquals(before, transport.lastSubscribe());
            assertEquals(client.getSubscriptions(), transport.lastSubscribe());
            assertEquals(0, client.getReconnectAttempts());
        }

        @Test
        @DisplayName("Failed opens are retried until one succeeds")
        void retriesFailedOpens() throws Exception {
            transport.failNextOpens = 3;
            client.subscribe(List.of("NSE:NIFTY 50"), DataType.SYMBOL_UPDATE);

            client.connect();

            waitUntil(() -> transport.subscribeCalls.size() == 1, "subscribe after connect");
            assertEquals(4, transport.opens.get());
            assertEquals(subs(DataType.SYMBOL_UPDATE, "NSE:NIFTY 50"), transport.lastSubscribe());
        }

        @Test
        @DisplayName("Error and close for the same drop schedule one reconnect")
        void oneReconnectPerDrop() throws Exception {
            client.connect();
            transport.openImmediately = false;

            transport.listener.onError(new RuntimeException("broken pipe"));
            transport.listener.onClosed("closed");

            waitUntil(() -> transport.opens.get() >= 2, "reconnect");
            Thread.sleep(100);
            assertEquals(2, transport.opens.get());
            assertEquals(ConnectionStatus.CONNECTING, client.getStatus());
        }

        @Test
        @DisplayName("Backoff doubles from the initial delay up to the maximum")
        void exponentialBackoff() {
            assertEquals(Duration.ofMillis(10), client.backoff(1));
            assertEquals(Duration.ofMillis(20), client.backoff(2));
            assertEquals(Duration.ofMillis(40), client.backoff(3));
            assertEquals(Duration.ofMillis(40), client.backoff(4));
            assertEquals(Duration.ofMillis(40), client.backoff(500));
        }
    }

    @Nested
    @DisplayName("Disconnect")
    class Disconnect {

        @Test
        @DisplayName("Disconnect twice closes the transport exactly once")
        void idempotent() {
            client.connect();

            client.disconnect();
            client.disconnect();

            assertEquals(1, transport.closes.get());
            assertEquals(ConnectionStatus.DISCONNECTED, client.getStatus());
        }

        @Test
        @DisplayName("Disconnect before connect does not touch the transport")
        void neverConnected() {
            client.disconnect();

            assertEquals(0, transport.closes.get());
            assertEquals(0, transport.opens.get());
        }

        @Test
        @DisplayName("No reconnect after disconnect, and connect is refused")
        void noReconnectAfterDisconnect() throws Exception {
            client.connect();
            StreamTransport.Listener listener = transport.listener;
            client.disconnect();

            listener.onClosed("closed by client");
            client.connect();
            Thread.sleep(100);

            assertEquals(1, transport.opens.get());
            assertEquals(ConnectionStatus.DISCONNECTED, client.getStatus());
        }

        @Test
        @DisplayName("A hanging close is abandoned after the grace period")
        void boundedClose() {
            client.connect();
            transport.closeBlocker = new CountDownLatch(1);

            long start = System.nanoTime();
            client.disconnect();
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            transport.closeBlocker.countDown();
            assertTrue(elapsedMs < 3000, "disconnect took " + elapsedMs + "ms");
            assertEquals(ConnectionStatus.DISCONNECTED, client.getStatus());
        }
    }

    @Nested
    @DisplayName("Dispatch")
    class Dispatch {

        @Test
        @DisplayName("Messages reach the handler for their type, others the default handler")
        void routesByType() {
            List<String> seen = new CopyOnWriteArrayList<>();
            client.registerHandler(MessageType.QUOTE, m -> seen.add("quote:" + m.getString("symbol")));
            client.registerHandler(MessageType.ORDER_UPDATE, m -> seen.add("order:" + m.getString("id")));
            client.setDefaultHandler(m -> seen.add("default"));

            client.enqueue(StreamMessage.of(Map.of("symbol", "NIFTY", "ltp", 22050.0)));
            client.enqueue(StreamMessage.of(Map.of("id", "240603000001", "status", "COMPLETE")));
            client.enqueue(StreamMessage.of(Map.of("tradeNumber", "T1")));
            client.enqueue(StreamMessage.of(Map.of("foo", "bar")));

            assertEquals(4, client.dispatchPending());
            assertEquals(List.of("quote:NIFTY", "order:240603000001", "default", "default"), seen);
            assertEquals(1L, client.getDispatchedCounts().get("TRADE_UPDATE"));
            assertEquals(1L, client.getDispatchedCounts().get("UNKNOWN"));
        }

        @Test
        @DisplayName("A failing handler does not stop dispatch")
        void handlerFailureIsolated() {
            List<String> seen = new CopyOnWriteArrayList<>();
            client.registerHandler(MessageType.QUOTE, m -> {
                throw new IllegalStateException("boom");
            });
            client.registerHandler(MessageType.GENERAL, m -> seen.add(m.getString("message")));

            client.enqueue(StreamMessage.of(Map.of("ltp", 1.0)));
            client.enqueue(StreamMessage.of(Map.of("code", 200, "message", "ok")));

            assertEquals(2, client.dispatchPending());
            assertEquals(List.of("ok"), seen);
        }

        @Test
        @DisplayName("Full queue drops the oldest messages")
        void dropOldest() {
            StreamingClient small = new StreamingClient(transport, new MessageClassifier(), config(3));
            List<Object> seen = new CopyOnWriteArrayList<>();
            small.setDefaultHandler(m -> seen.add(m.get("seq")));

            for (int i = 1; i <= 5; i++) {
                small.enqueue(StreamMessage.of(Map.of("seq", i)));
            }

            assertEquals(3, small.getQueuedMessages());
            assertEquals(2, small.getDroppedMessages());
            small.dispatchPending();
            assertEquals(List.of(3, 4, 5), seen);
            small.disconnect();
        }

        @Test
        @DisplayName("Connected client delivers transport messages on the dispatcher thread")
        void dispatcherThread() throws Exception {
            CountDownLatch delivered = new CountDownLatch(1);
            List<String> threads = new CopyOnWriteArrayList<>();
            client.registerHandler(MessageType.QUOTE, m -> {
                threads.add(Thread.currentThread().getName());
                delivered.countDown();
            });
            client.connect();

            transport.listener.onMessage(StreamMessage.typed(MessageType.QUOTE, Map.of("symbol", "NIFTY")));

            assertTrue(delivered.await(5, TimeUnit.SECONDS));
            assertEquals(List.of("stream-dispatcher"), threads);
        }
    }
}
