package com.basketbot.service.streaming;

import com.basketbot.config.StreamingConfig;
import com.basketbot.exception.StreamingException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps one logical subscription set alive across physical reconnects of a
 * {@link StreamTransport}.
 * <p>
 * Every time the transport reports the connection open, the whole current subscription
 * set is sent again. A drop moves the client to RECONNECTING and a new connection is tried
 * with exponential backoff until {@link #disconnect()} is called. Transport callbacks only
 * enqueue messages into a bounded queue (oldest dropped when full); a single dispatcher
 * thread classifies them and runs the registered handlers.
 * <p>
 * The client is single-use: once disconnected it does not connect again.
 */
@Slf4j
public class StreamingClient {

    private static final long DROP_WARN_EVERY = 1000;

    private final StreamTransport transport;
    private final MessageClassifier classifier;
    private final Duration reconnectInitialDelay;
    private final Duration reconnectMaxDelay;
    private final Duration closeGracePeriod;

    private final Object lock = new Object();
    private final Set<StreamSubscription> subscriptions = new LinkedHashSet<>(); // guarded by lock
    private volatile ConnectionStatus status = ConnectionStatus.DISCONNECTED;

    private final BlockingQueue<StreamMessage> queue;
    private final Map<MessageType, StreamMessageHandler> handlers = new ConcurrentHashMap<>();
    private volatile StreamMessageHandler defaultHandler = message -> log.debug("Unhandled message: {}", message);
    private final Map<MessageType, AtomicLong> dispatched = new EnumMap<>(MessageType.class);
    private final AtomicLong droppedMessages = new AtomicLong();

    private final AtomicBoolean connectRequested = new AtomicBoolean(false);
    private final AtomicBoolean disconnectRequested = new AtomicBoolean(false);
    private final AtomicBoolean reconnectScheduled = new AtomicBoolean(false);
    private final AtomicInteger reconnectAttempts = new AtomicInteger();

    private final ScheduledExecutorService reconnectScheduler;
    private volatile Thread dispatcher;

    private final StreamTransport.Listener listener = new TransportListener();

    public StreamingClient(StreamTransport transport, MessageClassifier classifier, StreamingConfig config) {
        this.transport = transport;
        this.classifier = classifier;
        this.reconnectInitialDelay = config.getReconnectInitialDelay();
        this.reconnectMaxDelay = config.getReconnectMaxDelay();
        this.closeGracePeriod = config.getCloseGracePeriod();
        this.queue = new ArrayBlockingQueue<>(config.getQueueCapacity());
        for (MessageType type : MessageType.values()) {
            dispatched.put(type, new AtomicLong());
        }
        this.reconnectScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "stream-reconnect");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Opens the connection and starts the dispatcher. Later calls are ignored.
     */
    public void connect() {
        if (disconnectRequested.get()) {
            log.warn("Connect ignored: streaming client already disconnected");
            return;
        }
        if (!connectRequested.compareAndSet(false, true)) {
            log.debug("Connect ignored: already connected or connecting");
            return;
        }
        startDispatcher();
        status = ConnectionStatus.CONNECTING;
        log.info("Establishing streaming connection...");
        openTransport();
    }

    public void subscribe(Collection<String> symbols, DataType dataType) {
        synchronized (lock) {
            Set<StreamSubscription> added = new LinkedHashSet<>();
            for (String symbol : symbols) {
                StreamSubscription subscription = new StreamSubscription(symbol, dataType);
                if (subscriptions.add(subscription)) {
                    added.add(subscription);
                }
            }
            if (added.isEmpty()) {
                return;
            }
            log.info("Subscription set +{} -> {} entries", added.size(), subscriptions.size());
            if (status == ConnectionStatus.CONNECTED) {
                try {
                    transport.subscribe(added);
                } catch (StreamingException e) {
                    // kept in the set, re-sent on the next (re)connect
                    log.error("Error subscribing {}: {}", added, e.getMessage());
                }
            }
        }
    }

    public void unsubscribe(Collection<String> symbols, DataType dataType) {
        synchronized (lock) {
            Set<StreamSubscription> removed = new LinkedHashSet<>();
            for (String symbol : symbols) {
                StreamSubscription subscription = new StreamSubscription(symbol, dataType);
                if (subscriptions.remove(subscription)) {
                    removed.add(subscription);
                }
            }
            if (removed.isEmpty()) {
                return;
            }
            log.info("Subscription set -{} -> {} entries", removed.size(), subscriptions.size());
            if (status == ConnectionStatus.CONNECTED) {
                try {
                    transport.unsubscribe(removed);
                } catch (StreamingException e) {
                    log.error("Error unsubscribing {}: {}", removed, e.getMessage());
                }
            }
        }
    }

    /**
     * Closes the connection once. Further calls, and calls before {@link #connect()}, are
     * no-ops. Waits at most the close grace period for the transport to close.
     */
    public void disconnect() {
        if (!disconnectRequested.compareAndSet(false, true)) {
            log.debug("Disconnect ignored: already disconnected");
            return;
        }
        reconnectScheduler.shutdownNow();

        if (connectRequested.get()) {
            log.info("Disconnecting streaming client (status {})", status);
            closeTransportBounded();
        }
        status = ConnectionStatus.DISCONNECTED;

        Thread t = dispatcher;
        if (t != null) {
            t.interrupt();
        }
        int pending = queue.size();
        if (pending > 0) {
            log.info("Discarding {} undelivered messages", pending);
            queue.clear();
        }
    }

    public void registerHandler(MessageType type, StreamMessageHandler handler) {
        handlers.put(type, handler);
    }

    public void setDefaultHandler(StreamMessageHandler handler) {
        this.defaultHandler = handler;
    }

    public ConnectionStatus getStatus() {
        return status;
    }

    public Set<StreamSubscription> getSubscriptions() {
        synchronized (lock) {
            return Set.copyOf(subscriptions);
        }
    }

    public List<String> describeSubscriptions() {
        synchronized (lock) {
            List<String> described = new ArrayList<>(subscriptions.size());
            for (StreamSubscription subscription : subscriptions) {
                described.add(subscription.toString());
            }
            return described;
        }
    }

    public int getQueuedMessages() {
        return queue.size();
    }

    public long getDroppedMessages() {
        return droppedMessages.get();
    }

    public int getReconnectAttempts() {
        return reconnectAttempts.get();
    }

    public Map<String, Long> getDispatchedCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        dispatched.forEach((type, count) -> counts.put(type.name(), count.get()));
        return counts;
    }

    /**
     * Drains queued messages on the calling thread.
     *
     * @return number of messages dispatched
     */
    int dispatchPending() {
        int count = 0;
        StreamMessage message;
        while ((message = queue.poll()) != null) {
            dispatch(message);
            count++;
        }
        return count;
    }

    void dispatch(StreamMessage message) {
        MessageType type = classifier.classify(message);
        dispatched.get(type).incrementAndGet();
        StreamMessageHandler handler = handlers.get(type);
        if (handler == null) {
            handler = defaultHandler;
        }
        try {
            handler.handle(message);
        } catch (RuntimeException e) {
            log.error("Handler for {} failed on {}: {}", type, message, e.getMessage(), e);
        }
    }

    void enqueue(StreamMessage message) {
        while (!queue.offer(message)) {
            StreamMessage oldest = queue.poll();
            if (oldest != null) {
                long dropped = droppedMessages.incrementAndGet();
                if (dropped == 1 || dropped % DROP_WARN_EVERY == 0) {
                    log.warn("Inbound queue full, dropped oldest message ({} dropped so far)", dropped);
                }
            }
        }
    }

    private void openTransport() {
        try {
            transport.open(listener);
        } catch (StreamingException e) {
            log.error("Streaming connection failed: {}", e.getMessage());
            handleDrop("open failed");
        }
    }

    private void handleDrop(String reason) {
        if (disconnectRequested.get()) {
            return;
        }
        status = ConnectionStatus.RECONNECTING;
        scheduleReconnect(reason);
    }

    private void scheduleReconnect(String reason) {
        if (!reconnectScheduled.compareAndSet(false, true)) {
            return;
        }
        int attempt = reconnectAttempts.incrementAndGet();
        Duration delay = backoff(attempt);
        log.info("Connection lost ({}). Scheduling reconnection attempt {} in {}ms", reason, attempt, delay.toMillis());
        try {
            reconnectScheduler.schedule(() -> {
                reconnectScheduled.set(false);
                if (disconnectRequested.get()) {
                    return;
                }
                log.info("Executing reconnection attempt #{}", attempt);
                status = ConnectionStatus.CONNECTING;
                openTransport();
            }, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            reconnectScheduled.set(false);
            log.debug("Reconnect not scheduled, client shutting down");
        }
    }

    Duration backoff(int attempt) {
        long initial = Math.max(1, reconnectInitialDelay.toMillis());
        long max = Math.max(initial, reconnectMaxDelay.toMillis());
        int shift = Math.min(attempt - 1, 30);
        long delay = initial << shift;
        return Duration.ofMillis(delay <= 0 || delay > max ? max : delay);
    }

    private void closeTransportBounded() {
        CompletableFuture<Void> closing = CompletableFuture.runAsync(transport::close, runnable -> {
            Thread t = new Thread(runnable, "stream-close");
            t.setDaemon(true);
            t.start();
        });
        try {
            closing.get(closeGracePeriod.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Streaming connection closed");
        } catch (TimeoutException e) {
            log.warn("Transport did not close within {}ms, abandoning it", closeGracePeriod.toMillis());
        } catch (ExecutionException e) {
            log.warn("Error while closing transport: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while closing transport");
        }
    }

    private void startDispatcher() {
        Thread t = new Thread(() -> {
            while (!disconnectRequested.get()) {
                try {
                    dispatch(queue.take());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            log.debug("Dispatcher stopped");
        }, "stream-dispatcher");
        t.setDaemon(true);
        dispatcher = t;
        t.start();
    }

    private class TransportListener implements StreamTransport.Listener {

        @Override
        public void onOpen() {
            synchronized (lock) {
                if (disconnectRequested.get()) {
                    return;
                }
                status = ConnectionStatus.CONNECTED;
                reconnectAttempts.set(0);
                log.info("Streaming connected");
                if (subscriptions.isEmpty()) {
                    return;
                }
                Set<StreamSubscription> snapshot = new LinkedHashSet<>(subscriptions);
                log.info("Resubscribing to {} entries", snapshot.size());
                try {
                    transport.subscribe(snapshot);
                } catch (StreamingException e) {
                    log.error("Resubscribe failed: {}", e.getMessage());
                    handleDrop("resubscribe failed");
                }
            }
        }

        @Override
        public void onMessage(StreamMessage message) {
            enqueue(message);
        }

        @Override
        public void onClosed(String reason) {
            if (disconnectRequested.get()) {
                return;
            }
            log.warn("Streaming disconnected: {}", reason);
            handleDrop(reason);
        }

        @Override
        public void onError(Throwable error) {
            if (disconnectRequested.get()) {
                return;
            }
            log.error("Streaming error: {}", error.getMessage());
            handleDrop("error: " + error.getMessage());
        }
    }
}
