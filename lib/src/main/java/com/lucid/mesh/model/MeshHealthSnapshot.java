package com.lucid.mesh.model;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view over all four mesh components, for dashboards and
 * health-check endpoints.
 */
public final class MeshHealthSnapshot {
    
    private final List<BreakerStats> breakers;
    private final List<ChannelInfo> channels;
    private final CacheStats resolverCache;
    private final ServerHealthReport server;
    private final Instant timestamp;
    
    public MeshHealthSnapshot(List<BreakerStats> breakers, List<ChannelInfo> channels,
                              CacheStats resolverCache, ServerHealthReport server, Instant timestamp) {
        this.breakers = List.copyOf(breakers);
        this.channels = List.copyOf(channels);
        this.resolverCache = resolverCache;
        this.server = server;
        this.timestamp = timestamp;
    }
    
    public List<BreakerStats> getBreakers() {
        return breakers;
    }
    
    public List<ChannelInfo> getChannels() {
        return channels;
    }
    
    public CacheStats getResolverCache() {
        return resolverCache;
    }
    
    public ServerHealthReport getServer() {
        return server;
    }
    
    public Instant getTimestamp() {
        return timestamp;
    }
    
    public long getOpenBreakers() {
        return breakers.stream()
            .filter(stats -> stats.getState() == CircuitBreakerState.OPEN)
            .count();
    }
}
