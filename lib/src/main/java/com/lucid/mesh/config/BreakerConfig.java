package com.lucid.mesh.config;

import java.time.Duration;

/**
 * Circuit breaker configuration for a single downstream dependency.
 * Immutable once built; every breaker keeps the config it was created with.
 */
public class BreakerConfig {
    
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final int successThreshold;
    private final Duration callTimeout;
    private final boolean serializeCalls;
    
    private BreakerConfig(Builder builder) {
        this.failureThreshold = builder.failureThreshold;
        this.recoveryTimeout = builder.recoveryTimeout;
        this.successThreshold = builder.successThreshold;
        this.callTimeout = builder.callTimeout;
        this.serializeCalls = builder.serializeCalls;
    }
    
    /**
     * Consecutive failures in CLOSED state that open the breaker.
     */
    public int getFailureThreshold() {
        return failureThreshold;
    }
    
    /**
     * Time an open breaker waits after the last failure before it lets a trial call through.
     */
    public Duration getRecoveryTimeout() {
        return recoveryTimeout;
    }
    
    /**
     * Consecutive successes in HALF_OPEN state that close the breaker.
     */
    public int getSuccessThreshold() {
        return successThreshold;
    }
    
    /**
     * Default deadline for calls guarded by this breaker.
     */
    public Duration getCallTimeout() {
        return callTimeout;
    }
    
    /**
     * Whether calls through the breaker hold its lock for the whole invocation,
     * so that no two calls through the same breaker overlap.
     */
    public boolean isSerializeCalls() {
        return serializeCalls;
    }
    
    public static BreakerConfig defaultConfig() {
        return builder().build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    @Override
    public String toString() {
        return String.format("BreakerConfig{failureThreshold=%d, recoveryTimeout=%s, successThreshold=%d, callTimeout=%s}",
            failureThreshold, recoveryTimeout, successThreshold, callTimeout);
    }
    
    public static class Builder {
        private int failureThreshold = 5;
        private Duration recoveryTimeout = Duration.ofSeconds(60);
        private int successThreshold = 3;
        private Duration callTimeout = Duration.ofSeconds(30);
        private boolean serializeCalls = false;
        
        public Builder failureThreshold(int threshold) {
            this.failureThreshold = threshold;
            return this;
        }
        
        public Builder recoveryTimeout(Duration timeout) {
            this.recoveryTimeout = timeout;
            return this;
        }
        
        public Builder successThreshold(int threshold) {
            this.successThreshold = threshold;
            return this;
        }
        
        public Builder callTimeout(Duration timeout) {
            this.callTimeout = timeout;
            return this;
        }
        
        public Builder serializeCalls(boolean serialize) {
            this.serializeCalls = serialize;
            return this;
        }
        
        public BreakerConfig build() {
            if (failureThreshold < 1) {
                throw new IllegalArgumentException("Failure threshold must be at least 1");
            }
            if (successThreshold < 1) {
                throw new IllegalArgumentException("Success threshold must be at least 1");
            }
            if (recoveryTimeout == null || recoveryTimeout.isNegative()) {
                throw new IllegalArgumentException("Recovery timeout must be a non-negative duration");
            }
            if (callTimeout == null || callTimeout.isNegative() || callTimeout.isZero()) {
                throw new IllegalArgumentException("Call timeout must be a positive duration");
            }
            return new BreakerConfig(this);
        }
    }
}
