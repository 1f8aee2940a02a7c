package com.lucid.mesh.observability;

import com.lucid.mesh.model.CircuitBreakerState;
import com.lucid.mesh.model.RecordType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Collects metrics for the mesh communication layer.
 * Provides observability into outbound calls, breakers, the resolver cache
 * and the local server.
 */
public class MetricsCollector {
    
    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);
    
    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, ServiceMetrics> serviceMetrics;
    
    // Global metrics
    private final Counter totalRequests;
    private final Counter failedRequests;
    private final Timer requestLatency;
    private final AtomicLong activeChannels;
    private final AtomicLong registeredServices;
    
    public MetricsCollector() {
        this(new SimpleMeterRegistry());
    }
    
    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.serviceMetrics = new ConcurrentHashMap<>();
        this.activeChannels = new AtomicLong(0);
        this.registeredServices = new AtomicLong(0);
        
        this.totalRequests = Counter.builder("mesh.rpc.requests.total")
            .description("Total number of outbound RPC attempts")
            .register(meterRegistry);
            
        this.failedRequests = Counter.builder("mesh.rpc.requests.failed")
            .description("Total number of failed outbound RPC attempts")
            .register(meterRegistry);
            
        this.requestLatency = Timer.builder("mesh.rpc.request.latency")
            .description("Outbound RPC latency")
            .register(meterRegistry);
            
        Gauge.builder("mesh.channels.active", activeChannels, AtomicLong::doubleValue)
            .description("Number of open outbound channels")
            .register(meterRegistry);
            
        Gauge.builder("mesh.server.services", registeredServices, AtomicLong::doubleValue)
            .description("Number of services registered on the local server")
            .register(meterRegistry);
        
        logger.debug("Metrics collector initialized with {}", meterRegistry.getClass().getSimpleName());
    }
    
    public void recordRequest(String serviceName, Duration latency, boolean success) {
        totalRequests.increment();
        if (!success) {
            failedRequests.increment();
        }
        requestLatency.record(latency);
        
        if (serviceName != null) {
            metricsFor(serviceName).recordRequest(latency, success);
        }
    }
    
    public void recordRetry(String serviceName, int attempt, Duration waitInterval) {
        Counter.builder("mesh.rpc.retries")
            .tag("service", serviceName)
            .description("Retried outbound RPC attempts")
            .register(meterRegistry)
            .increment();
        logger.trace("Recorded retry {} for {} (wait {})", attempt, serviceName, waitInterval);
    }
    
    public void recordChannelEvent(String serviceName, boolean opened) {
        if (opened) {
            activeChannels.incrementAndGet();
        } else {
            activeChannels.decrementAndGet();
        }
        
        if (serviceName != null) {
            metricsFor(serviceName).recordChannelEvent(opened);
        }
    }
    
    public void recordCircuitBreakerTransition(String breakerName, CircuitBreakerState from, CircuitBreakerState to) {
        Counter.builder("mesh.circuit_breaker.transitions")
            .tag("breaker", breakerName)
            .tag("from", from.name())
            .tag("to", to.name())
            .description("Circuit breaker state transitions")
            .register(meterRegistry)
            .increment();
        metricsFor(breakerName).updateBreakerState(to);
    }
    
    public void recordCircuitBreakerRejection(String breakerName) {
        Counter.builder("mesh.circuit_breaker.rejections")
            .tag("breaker", breakerName)
            .description("Calls rejected by an open circuit breaker")
            .register(meterRegistry)
            .increment();
    }
    
    public void recordCacheLookup(String serviceName, boolean hit) {
        Counter.builder("mesh.resolver.cache")
            .tag("service", serviceName)
            .tag("hit", String.valueOf(hit))
            .description("Resolver cache lookups")
            .register(meterRegistry)
            .increment();
    }
    
    public void recordDnsFailure(String serviceName, RecordType recordType) {
        Counter.builder("mesh.resolver.failures")
            .tag("service", serviceName)
            .tag("type", recordType.name())
            .description("Failed DNS lookups")
            .register(meterRegistry)
            .increment();
    }
    
    public void updateRegisteredServices(int count) {
        registeredServices.set(count);
    }
    
    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
    
    private ServiceMetrics metricsFor(String serviceName) {
        return serviceMetrics.computeIfAbsent(serviceName, name -> new ServiceMetrics(name, meterRegistry));
    }
    
    /**
     * Per-dependency metrics container.
     */
    private static class ServiceMetrics {
        private final Counter requests;
        private final Counter failures;
        private final Timer latency;
        private final AtomicLong channels;
        private final AtomicLong breakerState; // 0 closed, 1 half-open, 2 open
        
        ServiceMetrics(String serviceName, MeterRegistry registry) {
            this.channels = new AtomicLong(0);
            this.breakerState = new AtomicLong(0);
            
            this.requests = Counter.builder("mesh.service.requests")
                .tag("service", serviceName)
                .description("Requests per service")
                .register(registry);
                
            this.failures = Counter.builder("mesh.service.failures")
                .tag("service", serviceName)
                .description("Failures per service")
                .register(registry);
                
            this.latency = Timer.builder("mesh.service.latency")
                .tag("service", serviceName)
                .description("Latency per service")
                .register(registry);
                
            Gauge.builder("mesh.service.channels", channels, AtomicLong::doubleValue)
                .tag("service", serviceName)
                .description("Open channels per service")
                .register(registry);
                
            Gauge.builder("mesh.service.circuit_breaker.state", breakerState, AtomicLong::doubleValue)
                .tag("service", serviceName)
                .description("Circuit breaker state per service (0 closed, 1 half-open, 2 open)")
                .register(registry);
        }
        
        void recordRequest(Duration requestLatency, boolean success) {
            requests.increment();
            if (!success) {
                failures.increment();
            }
            latency.record(requestLatency);
        }
        
        void recordChannelEvent(boolean opened) {
            if (opened) {
                channels.incrementAndGet();
            } else {
                channels.decrementAndGet();
            }
        }
        
        void updateBreakerState(CircuitBreakerState state) {
            breakerState.set(switch (state) {
                case CLOSED -> 0;
                case HALF_OPEN -> 1;
                case OPEN -> 2;
            });
        }
    }
}
