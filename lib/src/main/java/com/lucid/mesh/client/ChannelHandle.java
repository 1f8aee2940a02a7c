package com.lucid.mesh.client;

import com.lucid.mesh.config.ChannelOptions;
import com.lucid.mesh.model.ChannelInfo;
import io.grpc.ConnectivityState;
import io.grpc.ManagedChannel;

import java.time.Instant;

/**
 * An open channel to one service endpoint.
 */
public final class ChannelHandle {
    
    private final String serviceName;
    private final String endpoint;
    private final ChannelOptions options;
    private final ManagedChannel channel;
    private final Instant createdAt;
    
    ChannelHandle(String serviceName, String endpoint, ChannelOptions options,
                  ManagedChannel channel, Instant createdAt) {
        this.serviceName = serviceName;
        this.endpoint = endpoint;
        this.options = options;
        this.channel = channel;
        this.createdAt = createdAt;
    }
    
    public String getServiceName() {
        return serviceName;
    }
    
    public String getEndpoint() {
        return endpoint;
    }
    
    public ChannelOptions getOptions() {
        return options;
    }
    
    public ManagedChannel getChannel() {
        return channel;
    }
    
    public Instant getCreatedAt() {
        return createdAt;
    }
    
    /**
     * Current connectivity state. Does not trigger a connection attempt.
     */
    public ConnectivityState getState() {
        return channel.getState(false);
    }
    
    ChannelInfo toInfo(boolean stubCached) {
        return new ChannelInfo(serviceName, endpoint, getState(), createdAt, stubCached);
    }
}
