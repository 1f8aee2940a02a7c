package com.lucid.mesh.config;

import java.time.Duration;

/**
 * Creation options for outbound gRPC channels.
 * Defaults keep idle channels alive with a 30s ping, 5s ping timeout,
 * pings permitted without active calls and at least 10s between pings.
 */
public class ChannelOptions {
    
    private final Duration keepAliveTime;
    private final Duration keepAliveTimeout;
    private final boolean keepAliveWithoutCalls;
    private final Duration minTimeBetweenPings;
    private final int maxInboundMessageSize;
    private final boolean plaintext;
    
    private ChannelOptions(Builder builder) {
        this.keepAliveTime = builder.keepAliveTime;
        this.keepAliveTimeout = builder.keepAliveTimeout;
        this.keepAliveWithoutCalls = builder.keepAliveWithoutCalls;
        this.minTimeBetweenPings = builder.minTimeBetweenPings;
        this.maxInboundMessageSize = builder.maxInboundMessageSize;
        this.plaintext = builder.plaintext;
    }
    
    public static ChannelOptions defaultOptions() {
        return builder().build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public Duration getKeepAliveTime() { return keepAliveTime; }
    public Duration getKeepAliveTimeout() { return keepAliveTimeout; }
    public boolean isKeepAliveWithoutCalls() { return keepAliveWithoutCalls; }
    public Duration getMinTimeBetweenPings() { return minTimeBetweenPings; }
    public int getMaxInboundMessageSize() { return maxInboundMessageSize; }
    public boolean isPlaintext() { return plaintext; }
    
    /**
     * Ping interval actually applied to the channel: never shorter than the minimum
     * time between pings.
     */
    public Duration getEffectiveKeepAliveTime() {
        return keepAliveTime.compareTo(minTimeBetweenPings) < 0 ? minTimeBetweenPings : keepAliveTime;
    }
    
    @Override
    public String toString() {
        return String.format("ChannelOptions{keepAliveTime=%s, keepAliveTimeout=%s, keepAliveWithoutCalls=%s, minTimeBetweenPings=%s}",
            keepAliveTime, keepAliveTimeout, keepAliveWithoutCalls, minTimeBetweenPings);
    }
    
    public static class Builder {
        private Duration keepAliveTime = Duration.ofSeconds(30);
        private Duration keepAliveTimeout = Duration.ofSeconds(5);
        private boolean keepAliveWithoutCalls = true;
        private Duration minTimeBetweenPings = Duration.ofSeconds(10);
        private int maxInboundMessageSize = 4 * 1024 * 1024;
        private boolean plaintext = true;
        
        public Builder keepAliveTime(Duration keepAliveTime) {
            this.keepAliveTime = keepAliveTime;
            return this;
        }
        
        public Builder keepAliveTimeout(Duration keepAliveTimeout) {
            this.keepAliveTimeout = keepAliveTimeout;
            return this;
        }
        
        public Builder keepAliveWithoutCalls(boolean keepAliveWithoutCalls) {
            this.keepAliveWithoutCalls = keepAliveWithoutCalls;
            return this;
        }
        
        public Builder minTimeBetweenPings(Duration minTimeBetweenPings) {
            this.minTimeBetweenPings = minTimeBetweenPings;
            return this;
        }
        
        public Builder maxInboundMessageSize(int bytes) {
            this.maxInboundMessageSize = bytes;
            return this;
        }
        
        public Builder plaintext(boolean plaintext) {
            this.plaintext = plaintext;
            return this;
        }
        
        public ChannelOptions build() {
            if (keepAliveTime == null || keepAliveTimeout == null || minTimeBetweenPings == null) {
                throw new IllegalArgumentException("Keep-alive durations must be set");
            }
            if (maxInboundMessageSize <= 0) {
                throw new IllegalArgumentException("Max inbound message size must be positive");
            }
            return new ChannelOptions(this);
        }
    }
}
