package com.lucid.mesh.model;

/**
 * Reachability vocabulary shared by breakers, channels and server-side services.
 */
public enum HealthState {
    HEALTHY,
    DEGRADED,
    UNHEALTHY,
    UNKNOWN;
    
    public boolean isAvailable() {
        return this == HEALTHY || this == DEGRADED;
    }
}
