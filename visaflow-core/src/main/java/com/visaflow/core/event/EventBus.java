package com.visaflow.core.event;

import java.util.function.Consumer;

/**
 * Publish-subscribe channel decoupling event producers (engine, folder watcher)
 * from their consumers (logging, notifications, UI refresh).
 *
 * @param <E> event type
 */
public interface EventBus<E> {

    /**
     * Register a listener. Events published after this call are delivered to it
     * in publish order until the returned subscription is closed.
     */
    Subscription subscribe(Consumer<? super E> listener);

    /**
     * Publish an event to every current subscriber. Never blocks on listeners
     * and never throws because of them.
     */
    void publish(E event);

    /**
     * Handle to a registered listener.
     */
    interface Subscription extends AutoCloseable {

        /**
         * Stop delivering events to the listener. Idempotent.
         */
        @Override
        void close();
    }
}
