package com.basketbot.service.streaming;

import com.basketbot.exception.StreamingException;

import java.util.Set;

/**
 * One physical feed connection. Callbacks arrive on a thread owned by the transport.
 */
public interface StreamTransport {

    /**
     * Opens a new connection, replacing any previous one. {@link Listener#onOpen()} fires
     * once the connection is usable.
     */
    void open(Listener listener) throws StreamingException;

    void subscribe(Set<StreamSubscription> subscriptions) throws StreamingException;

    void unsubscribe(Set<StreamSubscription> subscriptions) throws StreamingException;

    /**
     * Releases the connection. May block while the socket closes.
     */
    void close();

    interface Listener {

        void onOpen();

        void onMessage(StreamMessage message);

        void onClosed(String reason);

        void onError(Throwable error);
    }
}
