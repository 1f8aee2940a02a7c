package com.lucid.mesh.client;

import com.lucid.mesh.discovery.HostPort;

import java.util.Optional;

/**
 * Fallback lookup for services missing from the static endpoint directory.
 */
@FunctionalInterface
public interface EndpointResolver {
    
    Optional<HostPort> resolve(String serviceName);
}
