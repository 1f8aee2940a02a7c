package com.lucid.mesh.model;

import com.lucid.mesh.config.BreakerConfig;

import java.time.Instant;

/**
 * Point-in-time snapshot of a circuit breaker.
 */
public class BreakerStats {
    
    private final String name;
    private final CircuitBreakerState state;
    private final int failureCount;
    private final int successCount;
    private final Instant lastFailureTime;
    private final Instant lastSuccessTime;
    private final long totalRequests;
    private final long totalFailures;
    private final long rejectedCalls;
    private final BreakerConfig config;
    
    private BreakerStats(Builder builder) {
        this.name = builder.name;
        this.state = builder.state;
        this.failureCount = builder.failureCount;
        this.successCount = builder.successCount;
        this.lastFailureTime = builder.lastFailureTime;
        this.lastSuccessTime = builder.lastSuccessTime;
        this.totalRequests = builder.totalRequests;
        this.totalFailures = builder.totalFailures;
        this.rejectedCalls = builder.rejectedCalls;
        this.config = builder.config;
    }
    
    public String getName() {
        return name;
    }
    
    public CircuitBreakerState getState() {
        return state;
    }
    
    public int getFailureCount() {
        return failureCount;
    }
    
    public int getSuccessCount() {
        return successCount;
    }
    
    /**
     * @return time of the last recorded failure, or null if none was recorded
     */
    public Instant getLastFailureTime() {
        return lastFailureTime;
    }
    
    /**
     * @return time of the last recorded success, or null if none was recorded
     */
    public Instant getLastSuccessTime() {
        return lastSuccessTime;
    }
    
    /**
     * Every call attempted through the breaker, including calls rejected while open.
     */
    public long getTotalRequests() {
        return totalRequests;
    }
    
    /**
     * Every failed call, including calls rejected while open.
     */
    public long getTotalFailures() {
        return totalFailures;
    }
    
    /**
     * Calls rejected without reaching the dependency. Included in both totals.
     */
    public long getRejectedCalls() {
        return rejectedCalls;
    }
    
    public BreakerConfig getConfig() {
        return config;
    }
    
    public double getFailureRate() {
        if (totalRequests == 0) {
            return 0.0;
        }
        return ((double) totalFailures / totalRequests) * 100.0;
    }
    
    @Override
    public String toString() {
        return String.format("BreakerStats{name='%s', state=%s, failures=%d, successes=%d, total=%d, " +
                           "totalFailures=%d, rejected=%d, failureRate=%.1f%%}",
            name, state, failureCount, successCount, totalRequests, totalFailures, rejectedCalls, getFailureRate());
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private String name;
        private CircuitBreakerState state = CircuitBreakerState.CLOSED;
        private int failureCount;
        private int successCount;
        private Instant lastFailureTime;
        private Instant lastSuccessTime;
        private long totalRequests;
        private long totalFailures;
        private long rejectedCalls;
        private BreakerConfig config;
        
        public Builder name(String name) {
            this.name = name;
            return this;
        }
        
        public Builder state(CircuitBreakerState state) {
            this.state = state;
            return this;
        }
        
        public Builder failureCount(int failureCount) {
            this.failureCount = failureCount;
            return this;
        }
        
        public Builder successCount(int successCount) {
            this.successCount = successCount;
            return this;
        }
        
        public Builder lastFailureTime(Instant lastFailureTime) {
            this.lastFailureTime = lastFailureTime;
            return this;
        }
        
        public Builder lastSuccessTime(Instant lastSuccessTime) {
            this.lastSuccessTime = lastSuccessTime;
            return this;
        }
        
        public Builder totalRequests(long totalRequests) {
            this.totalRequests = totalRequests;
            return this;
        }
        
        public Builder totalFailures(long totalFailures) {
            this.totalFailures = totalFailures;
            return this;
        }
        
        public Builder rejectedCalls(long rejectedCalls) {
            this.rejectedCalls = rejectedCalls;
            return this;
        }
        
        public Builder config(BreakerConfig config) {
            this.config = config;
            return this;
        }
        
        public BreakerStats build() {
            return new BreakerStats(this);
        }
    }
}
