package com.lucid.mesh.config;

import java.time.Duration;

/**
 * Inbound listener configuration for the server registry.
 */
public class ServerConfig {
    
    private final int port;
    private final int workerThreads;
    private final boolean enableHealthService;
    private final Duration permitKeepAliveTime;
    private final boolean permitKeepAliveWithoutCalls;
    private final int maxInboundMessageSize;
    private final Duration shutdownGracePeriod;
    
    private ServerConfig(Builder builder) {
        this.port = builder.port;
        this.workerThreads = builder.workerThreads;
        this.enableHealthService = builder.enableHealthService;
        this.permitKeepAliveTime = builder.permitKeepAliveTime;
        this.permitKeepAliveWithoutCalls = builder.permitKeepAliveWithoutCalls;
        this.maxInboundMessageSize = builder.maxInboundMessageSize;
        this.shutdownGracePeriod = builder.shutdownGracePeriod;
    }
    
    public int getPort() {
        return port;
    }
    
    public int getWorkerThreads() {
        return workerThreads;
    }
    
    /**
     * Whether {@code grpc.health.v1.Health} is attached when the listener starts.
     */
    public boolean isHealthServiceEnabled() {
        return enableHealthService;
    }
    
    public Duration getPermitKeepAliveTime() {
        return permitKeepAliveTime;
    }
    
    public boolean isPermitKeepAliveWithoutCalls() {
        return permitKeepAliveWithoutCalls;
    }
    
    public int getMaxInboundMessageSize() {
        return maxInboundMessageSize;
    }
    
    /**
     * Grace period used by {@code cleanup()} when it has to stop a running listener.
     */
    public Duration getShutdownGracePeriod() {
        return shutdownGracePeriod;
    }
    
    public static ServerConfig defaultConfig() {
        return builder().build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    @Override
    public String toString() {
        return String.format("ServerConfig{port=%d, workerThreads=%d, healthService=%s}",
            port, workerThreads, enableHealthService);
    }
    
    public static class Builder {
        private int port = 50051;
        private int workerThreads = 10;
        private boolean enableHealthService = true;
        private Duration permitKeepAliveTime = Duration.ofSeconds(10);
        private boolean permitKeepAliveWithoutCalls = true;
        private int maxInboundMessageSize = 4 * 1024 * 1024;
        private Duration shutdownGracePeriod = Duration.ofSeconds(5);
        
        public Builder port(int port) {
            this.port = port;
            return this;
        }
        
        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }
        
        public Builder enableHealthService(boolean enable) {
            this.enableHealthService = enable;
            return this;
        }
        
        public Builder permitKeepAliveTime(Duration time) {
            this.permitKeepAliveTime = time;
            return this;
        }
        
        public Builder permitKeepAliveWithoutCalls(boolean permit) {
            this.permitKeepAliveWithoutCalls = permit;
            return this;
        }
        
        public Builder maxInboundMessageSize(int bytes) {
            this.maxInboundMessageSize = bytes;
            return this;
        }
        
        public Builder shutdownGracePeriod(Duration gracePeriod) {
            this.shutdownGracePeriod = gracePeriod;
            return this;
        }
        
        public ServerConfig build() {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("Port must be between 0 and 65535");
            }
            if (workerThreads < 1) {
                throw new IllegalArgumentException("At least one worker thread is required");
            }
            if (shutdownGracePeriod == null || shutdownGracePeriod.isNegative()) {
                throw new IllegalArgumentException("Shutdown grace period must be a non-negative duration");
            }
            return new ServerConfig(this);
        }
    }
}
