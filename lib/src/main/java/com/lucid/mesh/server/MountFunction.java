package com.lucid.mesh.server;

/**
 * Binds a service implementation to the listener, typically by mounting the
 * definition generated for it.
 *
 * @param <T> implementation type
 */
@FunctionalInterface
public interface MountFunction<T> {
    
    void mount(T implementation, ServiceListener listener);
}
