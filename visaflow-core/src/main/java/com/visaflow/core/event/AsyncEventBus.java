package com.visaflow.core.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Event bus delivering events on an executor.
 * <p>
 * Each subscriber owns a queue drained by at most one task at a time, so a
 * subscriber sees events in publish order and a slow subscriber delays only itself.
 * Listener exceptions are logged; the subscriber keeps receiving events.
 *
 * @param <E> event type
 */
public class AsyncEventBus<E> implements EventBus<E> {

    private static final Logger log = LoggerFactory.getLogger(AsyncEventBus.class);

    private final String name;
    private final Executor executor;
    private final Set<SerialSubscriber> subscribers = new CopyOnWriteArraySet<>();

    public AsyncEventBus(String name, Executor executor) {
        this.name = name;
        this.executor = executor;
    }

    /**
     * Create a bus that delivers on the publishing thread. Used in tests.
     */
    public static <E> AsyncEventBus<E> direct(String name) {
        return new AsyncEventBus<>(name, Runnable::run);
    }

    @Override
    public Subscription subscribe(Consumer<? super E> listener) {
        SerialSubscriber subscriber = new SerialSubscriber(listener);
        subscribers.add(subscriber);
        log.debug("Subscribed listener to {} bus ({} total)", name, subscribers.size());
        return subscriber;
    }

    @Override
    public void publish(E event) {
        for (SerialSubscriber subscriber : subscribers) {
            subscriber.enqueue(event);
        }
    }

    /**
     * Number of active subscriptions.
     */
    public int subscriberCount() {
        return subscribers.size();
    }

    private final class SerialSubscriber implements Subscription {

        private final Consumer<? super E> listener;
        private final Queue<E> pending = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean draining = new AtomicBoolean(false);
        private volatile boolean closed = false;

        private SerialSubscriber(Consumer<? super E> listener) {
            this.listener = listener;
        }

        private void enqueue(E event) {
            if (closed) {
                return;
            }
            pending.add(event);
            scheduleDrain();
        }

        private void scheduleDrain() {
            if (draining.compareAndSet(false, true)) {
                try {
                    executor.execute(this::drain);
                } catch (RuntimeException e) {
                    draining.set(false);
                    log.error("Event executor of {} bus rejected delivery", name, e);
                }
            }
        }

        private void drain() {
            try {
                E event;
                while (!closed && (event = pending.poll()) != null) {
                    try {
                        listener.accept(event);
                    } catch (RuntimeException e) {
                        log.error("Listener on {} bus failed for event {}", name, event, e);
                    }
                }
            } finally {
                draining.set(false);
            }
            // Events enqueued between the last poll and the flag reset
            if (!closed && !pending.isEmpty()) {
                scheduleDrain();
            }
        }

        @Override
        public void close() {
            closed = true;
            pending.clear();
            subscribers.remove(this);
        }
    }
}
