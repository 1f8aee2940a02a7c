package com.lucid.mesh;

import com.lucid.mesh.client.ChannelManager;
import com.lucid.mesh.config.MeshConfiguration;
import com.lucid.mesh.discovery.ServiceResolver;
import com.lucid.mesh.model.BreakerStats;
import com.lucid.mesh.model.CacheStats;
import com.lucid.mesh.model.HealthState;
import com.lucid.mesh.model.MeshHealthSnapshot;
import com.lucid.mesh.model.ServerHealthReport;
import com.lucid.mesh.observability.HealthListener;
import com.lucid.mesh.observability.MetricsCollector;
import com.lucid.mesh.resilience.ResilienceManager;
import com.lucid.mesh.server.ServerRegistry;
import reactor.core.Disposable;

/**
 * Entry point to the mesh communication layer of a process: outbound channels
 * guarded by circuit breakers, the local service listener, and DNS discovery.
 */
public interface MeshRuntime extends AutoCloseable {
    
    /**
     * Outbound channels, stubs and guarded calls.
     */
    ChannelManager channels();
    
    /**
     * The local listener and its registered services.
     */
    ServerRegistry server();
    
    /**
     * DNS-based service discovery.
     */
    ServiceResolver resolver();
    
    /**
     * Named circuit breakers and the retry policy.
     */
    ResilienceManager resilience();
    
    MetricsCollector metrics();
    
    MeshConfiguration getConfiguration();
    
    /**
     * Statistics of the breaker guarding a dependency, creating it if needed.
     */
    BreakerStats getBreakerStats(String dependencyName);
    
    CacheStats getCacheStats();
    
    ServerHealthReport getServerHealth();
    
    boolean checkServiceHealth(String serviceName);
    
    /**
     * Health of an outbound dependency, combining its breaker and channel state.
     * Unknown until the dependency has been used or connected.
     */
    HealthState getDependencyHealth(String dependencyName);
    
    /**
     * Point-in-time view of breakers, channels, resolver cache and server.
     */
    MeshHealthSnapshot getMeshHealth();
    
    /**
     * Subscribe to health change events of dependencies and local services.
     * @param listener callback for health change events
     * @return Disposable to unsubscribe from events
     */
    Disposable subscribeToHealthChanges(HealthListener listener);
    
    /**
     * Close all channels, stop the listener and release resources.
     */
    @Override
    void close();
}
