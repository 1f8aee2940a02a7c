package com.lucid.mesh.model;

import java.time.Instant;

/**
 * Health of one service mounted on the local server.
 */
public final class ServiceHealthReport {
    
    private final String name;
    private final boolean healthy;
    private final boolean customCheck;
    private final Instant addedAt;
    
    public ServiceHealthReport(String name, boolean healthy, boolean customCheck, Instant addedAt) {
        this.name = name;
        this.healthy = healthy;
        this.customCheck = customCheck;
        this.addedAt = addedAt;
    }
    
    public String getName() {
        return name;
    }
    
    public boolean isHealthy() {
        return healthy;
    }
    
    /**
     * Whether the result came from a registered health check rather than the
     * registered-means-healthy default.
     */
    public boolean isCustomCheck() {
        return customCheck;
    }
    
    public Instant getAddedAt() {
        return addedAt;
    }
    
    public HealthState getHealthState() {
        return healthy ? HealthState.HEALTHY : HealthState.UNHEALTHY;
    }
    
    @Override
    public String toString() {
        return String.format("ServiceHealthReport{name='%s', healthy=%s, customCheck=%s, addedAt=%s}",
            name, healthy, customCheck, addedAt);
    }
}
