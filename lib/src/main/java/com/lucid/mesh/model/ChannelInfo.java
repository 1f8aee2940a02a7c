package com.lucid.mesh.model;

import io.grpc.ConnectivityState;

import java.time.Instant;

/**
 * Read-only view of an outbound channel.
 */
public final class ChannelInfo {
    
    private final String serviceName;
    private final String endpoint;
    private final ConnectivityState state;
    private final Instant createdAt;
    private final boolean stubCached;
    
    public ChannelInfo(String serviceName, String endpoint, ConnectivityState state,
                       Instant createdAt, boolean stubCached) {
        this.serviceName = serviceName;
        this.endpoint = endpoint;
        this.state = state;
        this.createdAt = createdAt;
        this.stubCached = stubCached;
    }
    
    public String getServiceName() {
        return serviceName;
    }
    
    public String getEndpoint() {
        return endpoint;
    }
    
    public ConnectivityState getState() {
        return state;
    }
    
    public Instant getCreatedAt() {
        return createdAt;
    }
    
    public boolean isStubCached() {
        return stubCached;
    }
    
    public boolean isReady() {
        return state == ConnectivityState.READY;
    }
    
    @Override
    public String toString() {
        return String.format("ChannelInfo{service='%s', endpoint='%s', state=%s, stub=%s}",
            serviceName, endpoint, state, stubCached);
    }
}
