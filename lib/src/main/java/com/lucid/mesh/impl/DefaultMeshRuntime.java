package com.lucid.mesh.impl;

import com.lucid.mesh.MeshRuntime;
import com.lucid.mesh.client.ChannelFactory;
import com.lucid.mesh.client.ChannelManager;
import com.lucid.mesh.client.EndpointResolver;
import com.lucid.mesh.config.MeshConfiguration;
import com.lucid.mesh.config.ResolverConfig;
import com.lucid.mesh.config.ServerConfig;
import com.lucid.mesh.discovery.DnsClient;
import com.lucid.mesh.discovery.DnsjavaClient;
import com.lucid.mesh.discovery.EndpointSelector;
import com.lucid.mesh.discovery.ServiceResolver;
import com.lucid.mesh.model.BreakerStats;
import com.lucid.mesh.model.CacheStats;
import com.lucid.mesh.model.CircuitBreakerState;
import com.lucid.mesh.model.HealthState;
import com.lucid.mesh.model.MeshHealthSnapshot;
import com.lucid.mesh.model.ServerHealthReport;
import com.lucid.mesh.observability.HealthEventPublisher;
import com.lucid.mesh.observability.HealthListener;
import com.lucid.mesh.observability.MetricsCollector;
import com.lucid.mesh.resilience.MeshCircuitBreaker;
import com.lucid.mesh.resilience.ResilienceManager;
import com.lucid.mesh.server.ServerRegistry;
import io.grpc.ConnectivityState;
import io.grpc.ServerBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Default implementation of MeshRuntime wiring breakers, channels, the local
 * listener and the resolver around one configuration.
 */
public class DefaultMeshRuntime implements MeshRuntime {
    
    private static final Logger logger = LoggerFactory.getLogger(DefaultMeshRuntime.class);
    
    private final MeshConfiguration configuration;
    private final Clock clock;
    private final MetricsCollector metricsCollector;
    private final HealthEventPublisher eventPublisher;
    private final ResilienceManager resilienceManager;
    private final ServiceResolver serviceResolver;
    private final ChannelManager channelManager;
    private final ServerRegistry serverRegistry;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    
    public DefaultMeshRuntime(MeshConfiguration configuration, MeterRegistry meterRegistry, DnsClient dnsClient,
                              EndpointSelector endpointSelector, ChannelFactory channelFactory,
                              Function<ServerConfig, ServerBuilder<?>> serverBuilderFactory, Clock clock) {
        this.configuration = configuration;
        this.clock = clock;
        this.metricsCollector = new MetricsCollector(meterRegistry);
        this.eventPublisher = new HealthEventPublisher(clock);
        this.resilienceManager = new ResilienceManager(configuration.getResilienceConfig(),
            configuration.getBreakerOverrides(), metricsCollector, eventPublisher, clock);
        
        ResolverConfig resolverConfig = configuration.getResolverConfig();
        this.serviceResolver = new ServiceResolver(resolverConfig,
            dnsClient != null ? dnsClient : new DnsjavaClient(resolverConfig.getQueryTimeout()),
            endpointSelector, metricsCollector, clock);
        
        EndpointResolver fallback = configuration.isDnsFallbackEnabled()
            ? serviceName -> serviceResolver.resolveOne(serviceName, resolverConfig.getDefaultPort())
            : null;
        this.channelManager = new ChannelManager(configuration, resilienceManager, channelFactory,
            fallback, metricsCollector);
        this.serverRegistry = new ServerRegistry(configuration.getServerConfig(), serverBuilderFactory,
            metricsCollector, eventPublisher, clock);
        
        logger.info("Mesh runtime initialized with {} static endpoints (DNS fallback {})",
            configuration.getEndpoints().size(), configuration.isDnsFallbackEnabled() ? "enabled" : "disabled");
    }
    
    @Override
    public ChannelManager channels() {
        checkNotClosed();
        return channelManager;
    }
    
    @Override
    public ServerRegistry server() {
        checkNotClosed();
        return serverRegistry;
    }
    
    @Override
    public ServiceResolver resolver() {
        checkNotClosed();
        return serviceResolver;
    }
    
    @Override
    public ResilienceManager resilience() {
        checkNotClosed();
        return resilienceManager;
    }
    
    @Override
    public MetricsCollector metrics() {
        return metricsCollector;
    }
    
    @Override
    public MeshConfiguration getConfiguration() {
        return configuration;
    }
    
    @Override
    public BreakerStats getBreakerStats(String dependencyName) {
        return resilienceManager.getStats(dependencyName);
    }
    
    @Override
    public CacheStats getCacheStats() {
        return serviceResolver.getCacheStats();
    }
    
    @Override
    public ServerHealthReport getServerHealth() {
        return serverRegistry.getServerHealth();
    }
    
    @Override
    public boolean checkServiceHealth(String serviceName) {
        return serverRegistry.checkServiceHealth(serviceName);
    }
    
    @Override
    public HealthState getDependencyHealth(String dependencyName) {
        HealthState breakerHealth = resilienceManager.findCircuitBreaker(dependencyName)
            .map(MeshCircuitBreaker::getState)
            .map(CircuitBreakerState::toHealthState)
            .orElse(HealthState.UNKNOWN);
        Optional<ConnectivityState> channelState = channelManager.getConnectivityState(dependencyName);
        
        if (breakerHealth == HealthState.UNHEALTHY
            || channelState.filter(s -> s == ConnectivityState.TRANSIENT_FAILURE).isPresent()) {
            return HealthState.UNHEALTHY;
        }
        if (breakerHealth == HealthState.DEGRADED) {
            return HealthState.DEGRADED;
        }
        if (channelState.filter(s -> s == ConnectivityState.READY).isPresent()) {
            return HealthState.HEALTHY;
        }
        return breakerHealth;
    }
    
    @Override
    public MeshHealthSnapshot getMeshHealth() {
        return new MeshHealthSnapshot(
            resilienceManager.getAllStats(),
            channelManager.listChannels(),
            serviceResolver.getCacheStats(),
            serverRegistry.getServerHealth(),
            clock.instant());
    }
    
    @Override
    public Disposable subscribeToHealthChanges(HealthListener listener) {
        checkNotClosed();
        return eventPublisher.subscribe(listener);
    }
    
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            logger.info("Closing mesh runtime");
            cleanup();
        }
    }
    
    private void cleanup() {
        try {
            channelManager.close();
        } catch (Exception e) {
            logger.error("Error closing channels", e);
        }
        try {
            serverRegistry.cleanup();
        } catch (Exception e) {
            logger.error("Error stopping server registry", e);
        }
        try {
            eventPublisher.close();
        } catch (Exception e) {
            logger.error("Error closing event publisher", e);
        }
        logger.info("Mesh runtime closed");
    }
    
    private void checkNotClosed() {
        if (closed.get()) {
            throw new IllegalStateException("Mesh runtime has been closed");
        }
    }
}
