package com.lucid.mesh.server;

import io.grpc.ServerServiceDefinition;

import java.time.Instant;
import java.util.List;

/**
 * A service implementation registered on the local listener, together with the
 * definitions its mount function attached.
 */
public final class RegisteredService {
    
    private final String name;
    private final Object implementation;
    private final MountFunction<?> mountFunction;
    private final Instant addedAt;
    private final List<ServerServiceDefinition> definitions;
    
    RegisteredService(String name, Object implementation, MountFunction<?> mountFunction,
                      Instant addedAt, List<ServerServiceDefinition> definitions) {
        this.name = name;
        this.implementation = implementation;
        this.mountFunction = mountFunction;
        this.addedAt = addedAt;
        this.definitions = List.copyOf(definitions);
    }
    
    public String getName() {
        return name;
    }
    
    public Object getImplementation() {
        return implementation;
    }
    
    public MountFunction<?> getMountFunction() {
        return mountFunction;
    }
    
    public Instant getAddedAt() {
        return addedAt;
    }
    
    public List<ServerServiceDefinition> getDefinitions() {
        return definitions;
    }
    
    @Override
    public String toString() {
        return String.format("RegisteredService{name='%s', definitions=%d, addedAt=%s}",
            name, definitions.size(), addedAt);
    }
}
