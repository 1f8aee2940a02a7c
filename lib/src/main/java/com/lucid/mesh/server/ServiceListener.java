package com.lucid.mesh.server;

import io.grpc.BindableService;
import io.grpc.ServerServiceDefinition;

/**
 * The listener a mount function attaches service definitions to.
 * Definitions can be attached before or after the listener starts.
 */
public interface ServiceListener {
    
    void mount(ServerServiceDefinition definition);
    
    default void mount(BindableService service) {
        mount(service.bindService());
    }
}
