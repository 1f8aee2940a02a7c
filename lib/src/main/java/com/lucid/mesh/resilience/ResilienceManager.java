package com.lucid.mesh.resilience;

import com.lucid.mesh.config.BreakerConfig;
import com.lucid.mesh.config.ResilienceConfig;
import com.lucid.mesh.model.BreakerStats;
import com.lucid.mesh.model.CircuitBreakerState;
import com.lucid.mesh.observability.HealthChangeEvent;
import com.lucid.mesh.observability.HealthEventPublisher;
import com.lucid.mesh.observability.MetricsCollector;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.grpc.Context;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Registry of named circuit breakers plus the retry policy applied to outbound calls.
 * A breaker is created with its configured (or the default) settings the first
 * time its name is requested and lives for the lifetime of the manager.
 */
public class ResilienceManager {
    
    private static final Logger logger = LoggerFactory.getLogger(ResilienceManager.class);
    
    private static final String SERVICE_TAG = "service";
    
    private final ResilienceConfig config;
    private final Clock clock;
    private final MetricsCollector metricsCollector;
    private final HealthEventPublisher eventPublisher;
    private final ConcurrentHashMap<String, BreakerConfig> breakerOverrides;
    private final ConcurrentHashMap<String, MeshCircuitBreaker> breakers;
    private final RetryRegistry retryRegistry;
    
    public ResilienceManager(ResilienceConfig config) {
        this(config, Map.of(), new MetricsCollector(), null, Clock.systemUTC());
    }
    
    public ResilienceManager(ResilienceConfig config, Map<String, BreakerConfig> breakerOverrides,
                             MetricsCollector metricsCollector, HealthEventPublisher eventPublisher, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.metricsCollector = metricsCollector;
        this.eventPublisher = eventPublisher;
        this.breakerOverrides = new ConcurrentHashMap<>(breakerOverrides);
        this.breakers = new ConcurrentHashMap<>();
        this.retryRegistry = RetryRegistry.ofDefaults();
        
        setupEventHandlers();
    }
    
    /**
     * Get or create the circuit breaker for a dependency.
     */
    public MeshCircuitBreaker getCircuitBreaker(String name) {
        return breakers.computeIfAbsent(name, this::createCircuitBreaker);
    }
    
    /**
     * Returns the breaker for a dependency without creating it.
     */
    public Optional<MeshCircuitBreaker> findCircuitBreaker(String name) {
        return Optional.ofNullable(breakers.get(name));
    }
    
    /**
     * Registers settings for a breaker that has not been created yet.
     *
     * @return false if the breaker already exists and keeps its original settings
     */
    public boolean configureBreaker(String name, BreakerConfig breakerConfig) {
        if (breakers.containsKey(name)) {
            logger.warn("Circuit breaker {} already exists; keeping its original settings", name);
            return false;
        }
        breakerOverrides.put(name, breakerConfig);
        return true;
    }
    
    /**
     * Settings the named breaker has, or would be created with.
     */
    public BreakerConfig getBreakerConfig(String name) {
        MeshCircuitBreaker existing = breakers.get(name);
        if (existing != null) {
            return existing.getConfig();
        }
        return breakerOverrides.getOrDefault(name, config.getBreakerConfig());
    }
    
    public <T> T executeSupplier(String name, Supplier<T> supplier) {
        if (!config.isCircuitBreakerEnabled()) {
            return supplier.get();
        }
        return getCircuitBreaker(name).executeSupplier(supplier);
    }
    
    public <T> T executeCallable(String name, Callable<T> callable) throws Exception {
        if (!config.isCircuitBreakerEnabled()) {
            return callable.call();
        }
        return getCircuitBreaker(name).executeCallable(callable);
    }
    
    public BreakerStats getStats(String name) {
        return getCircuitBreaker(name).getStats();
    }
    
    public List<BreakerStats> getAllStats() {
        List<BreakerStats> stats = new ArrayList<>();
        for (MeshCircuitBreaker breaker : breakers.values()) {
            stats.add(breaker.getStats());
        }
        stats.sort(Comparator.comparing(BreakerStats::getName));
        return stats;
    }
    
    public CircuitBreakerState getState(String name) {
        return getCircuitBreaker(name).getState();
    }
    
    public boolean isCircuitBreakerOpen(String name) {
        return getState(name) == CircuitBreakerState.OPEN;
    }
    
    /**
     * Reset a single breaker to CLOSED with zeroed counters.
     */
    public void reset(String name) {
        getCircuitBreaker(name).reset();
    }
    
    public void resetAll() {
        breakers.values().forEach(MeshCircuitBreaker::reset);
        logger.info("Reset {} circuit breakers", breakers.size());
    }
    
    public Set<String> getBreakerNames() {
        return Set.copyOf(breakers.keySet());
    }
    
    /**
     * Retry policy for calls to a service: {@code retries} additional attempts after the
     * first, waiting {@code baseDelay * multiplier^(attempt-1)} between them. Only
     * transport failures are retried, and never once the caller has been cancelled.
     */
    public Retry retryFor(String serviceName, int retries, Duration baseDelay) {
        String retryName = String.format("%s[retries=%d,delay=%dms]", serviceName, retries, baseDelay.toMillis());
        RetryConfig retryConfig = RetryConfig.custom()
            .maxAttempts(retries + 1)
            .intervalFunction(IntervalFunction.ofExponentialBackoff(baseDelay, config.getBackoffMultiplier()))
            .retryOnException(this::isRetryable)
            .build();
        return retryRegistry.retry(retryName, retryConfig, Map.of(SERVICE_TAG, serviceName));
    }
    
    /**
     * Whether the error is a transport-level RPC failure (unavailable, deadline, exhausted).
     */
    public boolean isTransportFailure(Throwable error) {
        Status status = statusOf(error);
        return status != null && config.getTransportStatusCodes().contains(status.getCode());
    }
    
    public ResilienceConfig getConfig() {
        return config;
    }
    
    private boolean isRetryable(Throwable error) {
        if (Thread.currentThread().isInterrupted() || Context.current().isCancelled()) {
            logger.debug("Caller cancelled, not retrying: {}", error.toString());
            return false;
        }
        return isTransportFailure(error);
    }
    
    private static Status statusOf(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof StatusRuntimeException) {
                return ((StatusRuntimeException) t).getStatus();
            }
            if (t instanceof StatusException) {
                return ((StatusException) t).getStatus();
            }
        }
        return null;
    }
    
    private MeshCircuitBreaker createCircuitBreaker(String name) {
        BreakerConfig breakerConfig = breakerOverrides.getOrDefault(name, config.getBreakerConfig());
        MeshCircuitBreaker breaker = new MeshCircuitBreaker(name, breakerConfig, clock);
        breaker.addListener(new MeshCircuitBreaker.Listener() {
            @Override
            public void onStateTransition(String breakerName, CircuitBreakerState from, CircuitBreakerState to) {
                metricsCollector.recordCircuitBreakerTransition(breakerName, from, to);
                if (eventPublisher != null) {
                    eventPublisher.publish(HealthChangeEvent.Source.CIRCUIT_BREAKER, breakerName,
                        from.toHealthState(), to.toHealthState());
                }
            }
            
            @Override
            public void onCallRejected(String breakerName, Duration remainingOpenTime) {
                metricsCollector.recordCircuitBreakerRejection(breakerName);
            }
        });
        logger.debug("Created circuit breaker {} with {}", name, breakerConfig);
        return breaker;
    }
    
    private void setupEventHandlers() {
        retryRegistry.getEventPublisher().onEntryAdded(event -> {
            Retry retry = event.getAddedEntry();
            String serviceName = retry.getTags().getOrDefault(SERVICE_TAG, retry.getName());
            
            retry.getEventPublisher()
                    .onRetry(e -> {
                        logger.warn("Call to {} failed (attempt {}), retrying in {}ms: {}",
                                serviceName, e.getNumberOfRetryAttempts(), e.getWaitInterval().toMillis(),
                                e.getLastThrowable().getMessage());
                        metricsCollector.recordRetry(serviceName, e.getNumberOfRetryAttempts(), e.getWaitInterval());
                    })
                    .onSuccess(e -> logger.debug("Call to {} succeeded after {} retries",
                            serviceName, e.getNumberOfRetryAttempts()))
                    .onError(e -> logger.debug("Retries for {} exhausted after {} attempts: {}",
                            serviceName, e.getNumberOfRetryAttempts(), e.getLastThrowable().getMessage()));
        });
    }
}
