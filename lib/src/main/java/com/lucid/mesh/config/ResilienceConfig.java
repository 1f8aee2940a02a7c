package com.lucid.mesh.config;

import io.grpc.Status;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Resilience settings shared by every outbound call: default breaker settings,
 * the retry budget and backoff, and which gRPC status codes count as transient
 * transport failures.
 */
public class ResilienceConfig {
    
    private final BreakerConfig breakerConfig;
    private final int maxRetries;
    private final Duration retryDelay;
    private final double backoffMultiplier;
    private final Set<Status.Code> transportStatusCodes;
    private final boolean enableCircuitBreaker;
    private final boolean enableRetry;
    
    private ResilienceConfig(Builder builder) {
        this.breakerConfig = builder.breakerConfig;
        this.maxRetries = builder.maxRetries;
        this.retryDelay = builder.retryDelay;
        this.backoffMultiplier = builder.backoffMultiplier;
        this.transportStatusCodes = Set.copyOf(builder.transportStatusCodes);
        this.enableCircuitBreaker = builder.enableCircuitBreaker;
        this.enableRetry = builder.enableRetry;
    }
    
    public BreakerConfig getBreakerConfig() {
        return breakerConfig;
    }
    
    /**
     * Additional attempts after the first one.
     */
    public int getMaxRetries() {
        return maxRetries;
    }
    
    /**
     * Base delay; attempt {@code n} waits {@code retryDelay * multiplier^n}.
     */
    public Duration getRetryDelay() {
        return retryDelay;
    }
    
    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }
    
    public Set<Status.Code> getTransportStatusCodes() {
        return transportStatusCodes;
    }
    
    public boolean isCircuitBreakerEnabled() {
        return enableCircuitBreaker;
    }
    
    public boolean isRetryEnabled() {
        return enableRetry;
    }
    
    /**
     * Creates the default configuration: breaker 5/60s/3/30s, 3 retries starting at 1s.
     */
    public static ResilienceConfig defaultConfig() {
        return builder().build();
    }
    
    /**
     * Creates a relaxed configuration with short delays, suitable for development or testing.
     */
    public static ResilienceConfig relaxedConfig() {
        return builder()
                .breakerConfig(BreakerConfig.builder()
                        .failureThreshold(10)
                        .recoveryTimeout(Duration.ofSeconds(5))
                        .successThreshold(1)
                        .callTimeout(Duration.ofSeconds(5))
                        .build())
                .maxRetries(2)
                .retryDelay(Duration.ofMillis(100))
                .build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private BreakerConfig breakerConfig = BreakerConfig.defaultConfig();
        private int maxRetries = 3;
        private Duration retryDelay = Duration.ofSeconds(1);
        private double backoffMultiplier = 2.0;
        private Set<Status.Code> transportStatusCodes = EnumSet.of(
                Status.Code.UNAVAILABLE,
                Status.Code.DEADLINE_EXCEEDED,
                Status.Code.RESOURCE_EXHAUSTED);
        private boolean enableCircuitBreaker = true;
        private boolean enableRetry = true;
        
        public Builder breakerConfig(BreakerConfig config) {
            this.breakerConfig = config;
            return this;
        }
        
        public Builder maxRetries(int retries) {
            this.maxRetries = retries;
            return this;
        }
        
        public Builder retryDelay(Duration delay) {
            this.retryDelay = delay;
            return this;
        }
        
        public Builder backoffMultiplier(double multiplier) {
            this.backoffMultiplier = multiplier;
            return this;
        }
        
        public Builder transportStatusCodes(Set<Status.Code> codes) {
            this.transportStatusCodes = codes;
            return this;
        }
        
        public Builder enableCircuitBreaker(boolean enable) {
            this.enableCircuitBreaker = enable;
            return this;
        }
        
        public Builder enableRetry(boolean enable) {
            this.enableRetry = enable;
            return this;
        }
        
        public ResilienceConfig build() {
            if (breakerConfig == null) {
                throw new IllegalArgumentException("Breaker config must be set");
            }
            if (maxRetries < 0) {
                throw new IllegalArgumentException("Max retries must not be negative");
            }
            if (retryDelay == null || retryDelay.isNegative() || retryDelay.isZero()) {
                throw new IllegalArgumentException("Retry delay must be a positive duration");
            }
            if (backoffMultiplier < 1.0) {
                throw new IllegalArgumentException("Backoff multiplier must be at least 1.0");
            }
            if (transportStatusCodes == null) {
                throw new IllegalArgumentException("Transport status codes must be set");
            }
            return new ResilienceConfig(this);
        }
    }
}
