package com.lucid.mesh.observability;

import com.lucid.mesh.model.HealthState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Publishes health change events from breakers and the local server so that
 * dashboards see both directions of the mesh in the same vocabulary.
 * Events emitted while nobody is subscribed are dropped. Listeners are
 * called on a separate scheduler, never on the thread that publishes.
 */
public class HealthEventPublisher implements AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(HealthEventPublisher.class);
    
    private final Sinks.Many<HealthChangeEvent> healthEventSink;
    private final Clock clock;
    private final AtomicInteger subscriberCount;
    private final Scheduler listenerScheduler;
    
    public HealthEventPublisher() {
        this(Clock.systemUTC());
    }
    
    public HealthEventPublisher(Clock clock) {
        this(clock, Schedulers.boundedElastic());
    }
    
    /**
     * @param listenerScheduler runs {@link HealthListener} callbacks
     */
    public HealthEventPublisher(Clock clock, Scheduler listenerScheduler) {
        this.healthEventSink = Sinks.many().multicast().directBestEffort();
        this.clock = clock;
        this.subscriberCount = new AtomicInteger();
        this.listenerScheduler = listenerScheduler;
    }
    
    /**
     * Publishes a health change. Does nothing if the state did not change.
     *
     * @param source the reporting side
     * @param name the dependency or service name
     * @param previous the state before the change
     * @param current the state after the change
     */
    public void publish(HealthChangeEvent.Source source, String name,
                        HealthState previous, HealthState current) {
        if (previous == current) {
            return;
        }
        HealthChangeEvent event = new HealthChangeEvent(source, name, previous, current, clock.instant());
        
        Sinks.EmitResult result = healthEventSink.tryEmitNext(event);
        while (result == Sinks.EmitResult.FAIL_NON_SERIALIZED) {
            // another thread is emitting
            Thread.onSpinWait();
            result = healthEventSink.tryEmitNext(event);
        }
        if (result == Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            logger.trace("No subscribers for health change: {}", event);
        } else if (result.isFailure()) {
            logger.warn("Failed to publish health change for {}: {}", name, result);
        } else {
            logger.debug("Published health change: {}", event);
        }
    }
    
    /**
     * Returns the stream of health change events.
     */
    public Flux<HealthChangeEvent> events() {
        return healthEventSink.asFlux();
    }
    
    /**
     * Subscribes a listener to health change events.
     *
     * @param listener the callback for health change events
     * @return Disposable to unsubscribe
     */
    public Disposable subscribe(HealthListener listener) {
        int count = subscriberCount.incrementAndGet();
        logger.info("New health change subscriber (total subscribers: {})", count);
        
        return healthEventSink.asFlux()
            .publishOn(listenerScheduler)
            .doOnCancel(() -> logger.info("Health change subscription cancelled (remaining: {})",
                subscriberCount.decrementAndGet()))
            .subscribe(
                listener::onHealthChange,
                error -> logger.error("Health change subscriber error", error)
            );
    }
    
    public int getSubscriberCount() {
        return subscriberCount.get();
    }
    
    @Override
    public void close() {
        healthEventSink.tryEmitComplete();
        logger.info("HealthEventPublisher closed");
    }
}
