package com.lucid.mesh.model;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregated health of the local server and every service mounted on it.
 */
public final class ServerHealthReport {
    
    private final boolean running;
    private final int servicesCount;
    private final int healthyServices;
    private final Map<String, ServiceHealthReport> services;
    private final Instant timestamp;
    
    public ServerHealthReport(boolean running, Map<String, ServiceHealthReport> services, Instant timestamp) {
        this.running = running;
        this.services = Map.copyOf(services);
        this.servicesCount = this.services.size();
        this.healthyServices = (int) this.services.values().stream()
            .filter(ServiceHealthReport::isHealthy)
            .count();
        this.timestamp = timestamp;
    }
    
    public boolean isRunning() {
        return running;
    }
    
    public int getServicesCount() {
        return servicesCount;
    }
    
    public int getHealthyServices() {
        return healthyServices;
    }
    
    public Map<String, ServiceHealthReport> getServices() {
        return services;
    }
    
    public Instant getTimestamp() {
        return timestamp;
    }
    
    public boolean isHealthy() {
        return running && healthyServices == servicesCount;
    }
    
    @Override
    public String toString() {
        return String.format("ServerHealthReport{running=%s, services=%d, healthy=%d, timestamp=%s}",
            running, servicesCount, healthyServices, timestamp);
    }
}
