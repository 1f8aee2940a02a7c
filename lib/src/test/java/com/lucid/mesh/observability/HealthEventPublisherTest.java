package com.lucid.mesh.observability;

import com.lucid.mesh.MutableClock;
import com.lucid.mesh.model.HealthState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HealthEventPublisherTest {

    private MutableClock clock;
    private HealthEventPublisher publisher;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        publisher = new HealthEventPublisher(clock);
    }

    @Test
    void testEventsAreStreamed() {
        StepVerifier.create(publisher.events().take(2))
            .then(() -> {
                publisher.publish(HealthChangeEvent.Source.CIRCUIT_BREAKER, "payments",
                    HealthState.HEALTHY, HealthState.UNHEALTHY);
                publisher.publish(HealthChangeEvent.Source.CIRCUIT_BREAKER, "payments",
                    HealthState.UNHEALTHY, HealthState.DEGRADED);
            })
            .assertNext(event -> {
                assertEquals("payments", event.getName());
                assertEquals(HealthState.HEALTHY, event.getPreviousState());
                assertEquals(HealthState.UNHEALTHY, event.getCurrentState());
                assertEquals(clock.instant(), event.getTimestamp());
            })
            .assertNext(event -> assertEquals(HealthState.DEGRADED, event.getCurrentState()))
            .verifyComplete();
    }

    @Test
    void testUnchangedStateIsNotPublished() {
        List<HealthChangeEvent> received = new ArrayList<>();
        Disposable subscription = publisher.subscribe(received::add);

        publisher.publish(HealthChangeEvent.Source.SERVER, "echo", HealthState.HEALTHY, HealthState.HEALTHY);

        assertTrue(received.isEmpty());
        subscription.dispose();
    }

    @Test
    void testListenerSubscription() throws Exception {
        List<HealthChangeEvent> received = new CopyOnWriteArrayList<>();
        CountDownLatch delivered = new CountDownLatch(1);
        Disposable subscription = publisher.subscribe(event -> {
            received.add(event);
            delivered.countDown();
        });
        assertEquals(1, publisher.getSubscriberCount());

        publisher.publish(HealthChangeEvent.Source.SERVER, "echo", HealthState.UNKNOWN, HealthState.HEALTHY);
        assertTrue(delivered.await(5, TimeUnit.SECONDS));
        subscription.dispose();
        publisher.publish(HealthChangeEvent.Source.SERVER, "echo", HealthState.HEALTHY, HealthState.UNKNOWN);

        assertEquals(1, received.size());
        assertEquals(HealthChangeEvent.Source.SERVER, received.get(0).getSource());
        assertEquals(0, publisher.getSubscriberCount());
    }

    @Test
    void testSlowListenerDoesNotBlockPublisher() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch delivered = new CountDownLatch(2);
        Disposable subscription = publisher.subscribe(event -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            delivered.countDown();
        });
        try {
            assertTimeoutPreemptively(Duration.ofSeconds(1), () -> {
                publisher.publish(HealthChangeEvent.Source.CIRCUIT_BREAKER, "payments",
                    HealthState.HEALTHY, HealthState.UNHEALTHY);
                publisher.publish(HealthChangeEvent.Source.CIRCUIT_BREAKER, "payments",
                    HealthState.UNHEALTHY, HealthState.DEGRADED);
            });

            release.countDown();
            assertTrue(delivered.await(5, TimeUnit.SECONDS));
        } finally {
            subscription.dispose();
        }
    }

    @Test
    void testConcurrentPublishersDeliverEveryEvent() throws Exception {
        List<HealthChangeEvent> received = new CopyOnWriteArrayList<>();
        CountDownLatch delivered = new CountDownLatch(200);
        Disposable subscription = publisher.subscribe(event -> {
            received.add(event);
            delivered.countDown();
        });
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            for (int i = 0; i < 200; i++) {
                String name = "dep-" + i;
                executor.execute(() -> publisher.publish(HealthChangeEvent.Source.CIRCUIT_BREAKER, name,
                    HealthState.HEALTHY, HealthState.UNHEALTHY));
            }
            assertTrue(delivered.await(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
            subscription.dispose();
        }

        assertEquals(200, received.size());
    }

    @Test
    void testPublishWithoutSubscribersIsDropped() {
        assertDoesNotThrow(() -> publisher.publish(HealthChangeEvent.Source.SERVER, "echo",
            HealthState.UNKNOWN, HealthState.HEALTHY));
    }

    @Test
    void testCloseCompletesStream() {
        StepVerifier.create(publisher.events())
            .then(publisher::close)
            .verifyComplete();
    }
}
