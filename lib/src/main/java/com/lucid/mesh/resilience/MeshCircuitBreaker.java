package com.lucid.mesh.resilience;

import com.lucid.mesh.config.BreakerConfig;
import com.lucid.mesh.exception.MeshException;
import com.lucid.mesh.exception.MeshException.CircuitOpenException;
import com.lucid.mesh.model.BreakerStats;
import com.lucid.mesh.model.CircuitBreakerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Consecutive-failure circuit breaker guarding calls to one downstream dependency.
 * <p>
 * CLOSED opens after {@code failureThreshold} consecutive failures. OPEN rejects
 * calls until {@code recoveryTimeout} has passed since the last failure, then the
 * next call is let through in HALF_OPEN. HALF_OPEN admits at most
 * {@code successThreshold} concurrent trial calls, closes after
 * {@code successThreshold} consecutive successes and reopens on any failure.
 * Outcomes of calls admitted before the latest transition only update the totals.
 * <p>
 * State bookkeeping is guarded by a short internal lock, so {@link #getStats()}
 * never waits for an in-flight call. With {@link BreakerConfig#isSerializeCalls()}
 * the whole invocation is additionally serialized.
 */
public class MeshCircuitBreaker {
    
    private static final Logger logger = LoggerFactory.getLogger(MeshCircuitBreaker.class);
    
    /**
     * Receives breaker events. Invoked outside the breaker's lock.
     */
    public interface Listener {
        default void onStateTransition(String breakerName, CircuitBreakerState from, CircuitBreakerState to) {
        }
        
        default void onCallRejected(String breakerName, Duration remainingOpenTime) {
        }
    }
    
    private final String name;
    private final BreakerConfig config;
    private final Clock clock;
    private final Object stateLock = new Object();
    private final ReentrantLock callLock = new ReentrantLock();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();
    
    // guarded by stateLock
    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant lastFailureTime;
    private Instant lastSuccessTime;
    private long totalRequests;
    private long totalFailures;
    private long rejectedCalls;
    private long generation;
    private int trialsInFlight;
    
    public MeshCircuitBreaker(String name, BreakerConfig config) {
        this(name, config, Clock.systemUTC());
    }
    
    public MeshCircuitBreaker(String name, BreakerConfig config, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Breaker name must not be blank");
        }
        this.name = name;
        this.config = config != null ? config : BreakerConfig.defaultConfig();
        this.clock = clock;
    }
    
    public String getName() {
        return name;
    }
    
    public BreakerConfig getConfig() {
        return config;
    }
    
    public void addListener(Listener listener) {
        listeners.add(listener);
    }
    
    /**
     * Runs the callable through the breaker.
     *
     * @throws CircuitOpenException if the breaker is open and the recovery timeout has not passed
     * @throws Exception whatever the callable throws, after it is recorded as a failure
     */
    public <T> T executeCallable(Callable<T> callable) throws Exception {
        if (!config.isSerializeCalls()) {
            return doExecute(callable);
        }
        callLock.lock();
        try {
            return doExecute(callable);
        } finally {
            callLock.unlock();
        }
    }
    
    /**
     * Runs the supplier through the breaker.
     *
     * @throws CircuitOpenException if the breaker is open and the recovery timeout has not passed
     */
    public <T> T executeSupplier(Supplier<T> supplier) {
        try {
            return executeCallable(supplier::get);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            // suppliers cannot throw checked exceptions
            throw new MeshException("Unexpected checked exception in breaker " + name, e);
        }
    }
    
    public void executeRunnable(Runnable runnable) {
        executeSupplier(() -> {
            runnable.run();
            return null;
        });
    }
    
    /**
     * Returns the breaker to CLOSED with all counters zeroed.
     */
    public void reset() {
        CircuitBreakerState previous;
        synchronized (stateLock) {
            previous = state;
            state = CircuitBreakerState.CLOSED;
            failureCount = 0;
            successCount = 0;
            lastFailureTime = null;
            lastSuccessTime = null;
            totalRequests = 0;
            totalFailures = 0;
            rejectedCalls = 0;
            generation++;
            trialsInFlight = 0;
        }
        logger.info("Circuit breaker {} has been reset", name);
        fireTransition(previous, CircuitBreakerState.CLOSED);
    }
    
    public CircuitBreakerState getState() {
        synchronized (stateLock) {
            return state;
        }
    }
    
    public BreakerStats getStats() {
        synchronized (stateLock) {
            return BreakerStats.builder()
                .name(name)
                .state(state)
                .failureCount(failureCount)
                .successCount(successCount)
                .lastFailureTime(lastFailureTime)
                .lastSuccessTime(lastSuccessTime)
                .totalRequests(totalRequests)
                .totalFailures(totalFailures)
                .rejectedCalls(rejectedCalls)
                .config(config)
                .build();
        }
    }
    
    private <T> T doExecute(Callable<T> callable) throws Exception {
        long admittedIn = acquirePermission();
        T result;
        try {
            result = callable.call();
        } catch (Exception e) {
            onFailure(admittedIn, e);
            throw e;
        }
        onSuccess(admittedIn);
        return result;
    }
    
    /**
     * Returns the generation the call was admitted in.
     */
    private long acquirePermission() {
        CircuitBreakerState previous;
        CircuitBreakerState current;
        Duration remaining = null;
        long admittedIn;
        synchronized (stateLock) {
            previous = state;
            totalRequests++;
            if (state == CircuitBreakerState.OPEN) {
                Duration sinceFailure = Duration.between(lastFailureTime, clock.instant());
                if (sinceFailure.compareTo(config.getRecoveryTimeout()) > 0) {
                    transitionTo(CircuitBreakerState.HALF_OPEN);
                    successCount = 0;
                } else {
                    remaining = config.getRecoveryTimeout().minus(sinceFailure);
                }
            } else if (state == CircuitBreakerState.HALF_OPEN
                    && trialsInFlight >= config.getSuccessThreshold()) {
                remaining = Duration.ZERO;
            }
            if (remaining != null) {
                // a rejected call counts as a failure without touching failureCount
                totalFailures++;
                rejectedCalls++;
            } else if (state == CircuitBreakerState.HALF_OPEN) {
                trialsInFlight++;
            }
            current = state;
            admittedIn = generation;
        }
        
        if (remaining != null) {
            if (remaining.isZero()) {
                logger.debug("Circuit breaker {} rejected call, half-open trial limit reached", name);
            } else {
                logger.debug("Circuit breaker {} rejected call, {}ms until half-open", name, remaining.toMillis());
            }
            for (Listener listener : listeners) {
                listener.onCallRejected(name, remaining);
            }
            throw new CircuitOpenException(name, remaining);
        }
        fireTransition(previous, current);
        return admittedIn;
    }
    
    private void onSuccess(long admittedIn) {
        CircuitBreakerState previous;
        CircuitBreakerState current;
        synchronized (stateLock) {
            previous = state;
            lastSuccessTime = clock.instant();
            if (admittedIn == generation) {
                if (state == CircuitBreakerState.HALF_OPEN) {
                    trialsInFlight--;
                    successCount++;
                    if (successCount >= config.getSuccessThreshold()) {
                        transitionTo(CircuitBreakerState.CLOSED);
                        failureCount = 0;
                        successCount = 0;
                    }
                } else if (state == CircuitBreakerState.CLOSED) {
                    failureCount = 0;
                }
            }
            current = state;
        }
        fireTransition(previous, current);
    }
    
    private void onFailure(long admittedIn, Exception error) {
        CircuitBreakerState previous;
        CircuitBreakerState current;
        int failures;
        synchronized (stateLock) {
            previous = state;
            totalFailures++;
            if (admittedIn == generation) {
                failureCount++;
                lastFailureTime = clock.instant();
                if (state == CircuitBreakerState.HALF_OPEN) {
                    transitionTo(CircuitBreakerState.OPEN);
                    successCount = 0;
                } else if (state == CircuitBreakerState.CLOSED && failureCount >= config.getFailureThreshold()) {
                    transitionTo(CircuitBreakerState.OPEN);
                }
            }
            current = state;
            failures = failureCount;
        }
        logger.debug("Circuit breaker {} recorded failure {} ({})", name, failures, error.toString());
        fireTransition(previous, current);
    }
    
    // caller holds stateLock
    private void transitionTo(CircuitBreakerState target) {
        state = target;
        generation++;
        trialsInFlight = 0;
    }
    
    private void fireTransition(CircuitBreakerState from, CircuitBreakerState to) {
        if (from == to) {
            return;
        }
        if (to == CircuitBreakerState.OPEN) {
            logger.warn("Circuit breaker {} state transition: {} -> {}", name, from, to);
        } else {
            logger.info("Circuit breaker {} state transition: {} -> {}", name, from, to);
        }
        for (Listener listener : listeners) {
            try {
                listener.onStateTransition(name, from, to);
            } catch (RuntimeException e) {
                logger.warn("Circuit breaker {} listener failed on transition {} -> {}", name, from, to, e);
            }
        }
    }
}
