package com.basketbot.service.streaming;

import com.basketbot.exception.StreamingException;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory transport: records every call and lets tests drive the listener.
 */
class FakeStreamTransport implements StreamTransport {

    final AtomicInteger opens = new AtomicInteger();
    final AtomicInteger closes = new AtomicInteger();
    final List<Set<StreamSubscription>> subscribeCalls = new CopyOnWriteArrayList<>();
    final List<Set<StreamSubscription>> unsubscribeCalls = new CopyOnWriteArrayList<>();

    volatile Listener listener;
    volatile boolean openImmediately = true;
    volatile int failNextOpens;
    volatile CountDownLatch closeBlocker;

    @Override
    public void open(Listener listener) throws StreamingException {
        this.listener = listener;
        opens.incrementAndGet();
        if (failNextOpens > 0) {
            failNextOpens--;
            throw new StreamingException("connection refused");
        }
        if (openImmediately) {
            listener.onOpen();
        }
    }

    @Override
    public void subscribe(Set<StreamSubscription> subscriptions) {
        subscribeCalls.add(Set.copyOf(subscriptions));
    }

    @Override
    public void unsubscribe(Set<StreamSubscription> subscriptions) {
        unsubscribeCalls.add(Set.copyOf(subscriptions));
    }

    @Override
    public void close() {
        closes.incrementAndGet();
        CountDownLatch blocker = closeBlocker;
        if (blocker != null) {
            try {
                blocker.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    Set<StreamSubscription> lastSubscribe() {
        return subscribeCalls.get(subscribeCalls.size() - 1);
    }
}
