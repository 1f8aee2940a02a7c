package com.lucid.mesh.server;

/**
 * Custom health check for a registered service. Throwing counts as unhealthy.
 */
@FunctionalInterface
public interface ServiceHealthCheck {
    
    boolean isHealthy() throws Exception;
}
