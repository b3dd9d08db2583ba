package com.visaflow.core.event;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class AsyncEventBusTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Each subscriber sees events in publish order")
    void shouldDeliverInPublishOrder() throws Exception {
        AsyncEventBus<Integer> bus = new AsyncEventBus<>("test", executor);
        List<Integer> received = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(100);
        bus.subscribe(event -> {
            received.add(event);
            done.countDown();
        });

        for (int i = 0; i < 100; i++) {
            bus.publish(i);
        }

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertThat(received).isSorted().hasSize(100);
    }

    @Test
    @DisplayName("A blocked subscriber does not block the publisher or other subscribers")
    void slowSubscriberShouldNotBlockOthers() throws Exception {
        AsyncEventBus<String> bus = new AsyncEventBus<>("test", executor);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch fastReceived = new CountDownLatch(1);
        bus.subscribe(event -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        bus.subscribe(event -> fastReceived.countDown());

        bus.publish("advanced");

        assertTrue(fastReceived.await(5, TimeUnit.SECONDS));
        release.countDown();
    }

    @Test
    @DisplayName("A failing listener keeps receiving later events")
    void failingListenerShouldKeepReceiving() {
        AsyncEventBus<String> bus = AsyncEventBus.direct("test");
        List<String> received = new CopyOnWriteArrayList<>();
        bus.subscribe(event -> {
            received.add(event);
            if (event.equals("boom")) {
                throw new IllegalStateException("listener failure");
            }
        });

        bus.publish("boom");
        bus.publish("after");

        assertThat(received).containsExactly("boom", "after");
    }

    @Test
    void closedSubscription_shouldStopDelivery() {
        AsyncEventBus<String> bus = AsyncEventBus.direct("test");
        List<String> received = new CopyOnWriteArrayList<>();
        EventBus.Subscription subscription = bus.subscribe(received::add);

        bus.publish("first");
        subscription.close();
        subscription.close();
        bus.publish("second");

        assertThat(received).containsExactly("first");
        assertEquals(0, bus.subscriberCount());
    }
}
