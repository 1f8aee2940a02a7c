package com.lucid.mesh.client;

import io.grpc.stub.AbstractStub;

/**
 * A cached client stub bound to a specific channel.
 */
public final class StubHandle<S extends AbstractStub<S>> {
    
    private final String serviceName;
    private final ChannelHandle channel;
    private final S stub;
    
    StubHandle(String serviceName, ChannelHandle channel, S stub) {
        this.serviceName = serviceName;
        this.channel = channel;
        this.stub = stub;
    }
    
    public String getServiceName() {
        return serviceName;
    }
    
    public ChannelHandle getChannel() {
        return channel;
    }
    
    public S getStub() {
        return stub;
    }
}
