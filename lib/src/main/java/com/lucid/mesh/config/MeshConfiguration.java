package com.lucid.mesh.config;

import com.lucid.mesh.discovery.HostPort;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration for the mesh runtime.
 * Collects the static endpoint directory, per-dependency breaker overrides
 * and the settings of each of the four mesh components.
 */
public class MeshConfiguration {
    
    private final Map<String, String> endpoints;
    private final Map<String, BreakerConfig> breakerOverrides;
    private final ResilienceConfig resilienceConfig;
    private final ChannelOptions channelOptions;
    private final ServerConfig serverConfig;
    private final ResolverConfig resolverConfig;
    private final boolean dnsFallbackEnabled;
    
    private MeshConfiguration(Builder builder) {
        this.endpoints = Map.copyOf(builder.endpoints);
        this.breakerOverrides = Map.copyOf(builder.breakerOverrides);
        this.resilienceConfig = builder.resilienceConfig;
        this.channelOptions = builder.channelOptions;
        this.serverConfig = builder.serverConfig;
        this.resolverConfig = builder.resolverConfig;
        this.dnsFallbackEnabled = builder.dnsFallbackEnabled;
    }
    
    /**
     * Initial service-name to {@code host:port} directory used when a channel
     * is created without an explicit endpoint.
     */
    public Map<String, String> getEndpoints() {
        return endpoints;
    }
    
    public Map<String, BreakerConfig> getBreakerOverrides() {
        return breakerOverrides;
    }
    
    public ResilienceConfig getResilienceConfig() {
        return resilienceConfig;
    }
    
    public ChannelOptions getChannelOptions() {
        return channelOptions;
    }
    
    public ServerConfig getServerConfig() {
        return serverConfig;
    }
    
    public ResolverConfig getResolverConfig() {
        return resolverConfig;
    }
    
    /**
     * Whether the channel manager asks the DNS resolver for services missing
     * from the endpoint directory.
     */
    public boolean isDnsFallbackEnabled() {
        return dnsFallbackEnabled;
    }
    
    public static MeshConfiguration defaultConfig() {
        return builder().build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private final Map<String, String> endpoints = new LinkedHashMap<>();
        private final Map<String, BreakerConfig> breakerOverrides = new HashMap<>();
        private ResilienceConfig resilienceConfig = ResilienceConfig.defaultConfig();
        private ChannelOptions channelOptions = ChannelOptions.defaultOptions();
        private ServerConfig serverConfig = ServerConfig.defaultConfig();
        private ResolverConfig resolverConfig = ResolverConfig.defaultConfig();
        private boolean dnsFallbackEnabled = true;
        
        public Builder endpoint(String serviceName, String address) {
            this.endpoints.put(serviceName, address);
            return this;
        }
        
        public Builder endpoints(Map<String, String> endpoints) {
            this.endpoints.putAll(endpoints);
            return this;
        }
        
        public Builder breaker(String dependencyName, BreakerConfig config) {
            this.breakerOverrides.put(dependencyName, config);
            return this;
        }
        
        public Builder resilienceConfig(ResilienceConfig config) {
            this.resilienceConfig = config;
            return this;
        }
        
        public Builder channelOptions(ChannelOptions options) {
            this.channelOptions = options;
            return this;
        }
        
        public Builder serverConfig(ServerConfig config) {
            this.serverConfig = config;
            return this;
        }
        
        public Builder resolverConfig(ResolverConfig config) {
            this.resolverConfig = config;
            return this;
        }
        
        public Builder dnsFallbackEnabled(boolean enabled) {
            this.dnsFallbackEnabled = enabled;
            return this;
        }
        
        public MeshConfiguration build() {
            if (resilienceConfig == null || channelOptions == null
                    || serverConfig == null || resolverConfig == null) {
                throw new IllegalArgumentException("Component configurations must not be null");
            }
            for (Map.Entry<String, String> entry : endpoints.entrySet()) {
                if (entry.getKey() == null || entry.getKey().isBlank()) {
                    throw new IllegalArgumentException("Service name must not be blank");
                }
                if (HostPort.parse(entry.getValue()).isEmpty()) {
                    throw new IllegalArgumentException(String.format(
                        "Invalid endpoint for service '%s': '%s' (expected host:port)",
                        entry.getKey(), entry.getValue()));
                }
            }
            return new MeshConfiguration(this);
        }
    }
}
