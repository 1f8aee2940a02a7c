package com.lucid.mesh.client;

import com.lucid.mesh.config.ChannelOptions;
import io.grpc.ManagedChannel;

/**
 * Creates the underlying channel for a service endpoint.
 */
@FunctionalInterface
public interface ChannelFactory {
    
    ManagedChannel create(String serviceName, String target, ChannelOptions options);
}
