package com.lucid.mesh.server;

import com.lucid.mesh.config.ServerConfig;
import com.lucid.mesh.exception.MeshException;
import com.lucid.mesh.exception.MeshException.AlreadyRunningException;
import com.lucid.mesh.exception.MeshException.NotRunningException;
import com.lucid.mesh.model.HealthState;
import com.lucid.mesh.model.ServerHealthReport;
import com.lucid.mesh.model.ServiceHealthReport;
import com.lucid.mesh.observability.HealthChangeEvent;
import com.lucid.mesh.observability.HealthEventPublisher;
import com.lucid.mesh.observability.MetricsCollector;
import io.grpc.BindableService;
import io.grpc.Grpc;
import io.grpc.InsecureServerCredentials;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.ServerServiceDefinition;
import io.grpc.health.v1.HealthCheckResponse.ServingStatus;
import io.grpc.protobuf.services.HealthStatusManager;
import io.grpc.util.MutableHandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Hosts the local RPC listener and the services registered on it.
 * <p>
 * Services can be added and removed before or after {@link #start()}. Every
 * registered name is reported SERVING by the standard health service until it
 * is removed. The listener runs at most once: after {@link #stop(Duration)} a new
 * registry is needed.
 */
public class ServerRegistry implements AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(ServerRegistry.class);
    
    private final ServerConfig config;
    private final Function<ServerConfig, ServerBuilder<?>> serverBuilderFactory;
    private final MetricsCollector metricsCollector;
    private final HealthEventPublisher eventPublisher;
    private final Clock clock;
    private final MutableHandlerRegistry handlerRegistry = new MutableHandlerRegistry();
    private final HealthStatusManager healthStatusManager = new HealthStatusManager();
    
    // guarded by this
    private final Map<String, RegisteredService> services = new LinkedHashMap<>();
    private final Map<String, ServiceHealthCheck> healthChecks = new LinkedHashMap<>();
    private final Map<String, HealthState> reportedHealth = new LinkedHashMap<>();
    private ListenerState state = ListenerState.NOT_STARTED;
    private Server server;
    private ExecutorService workerPool;
    
    public ServerRegistry(ServerConfig config) {
        this(config, ServerRegistry::networkServerBuilder, new MetricsCollector(), null, Clock.systemUTC());
    }
    
    /**
     * @param serverBuilderFactory creates the transport-specific builder the listener is built from
     * @param eventPublisher receives service health changes; may be null
     */
    public ServerRegistry(ServerConfig config, Function<ServerConfig, ServerBuilder<?>> serverBuilderFactory,
                          MetricsCollector metricsCollector, HealthEventPublisher eventPublisher, Clock clock) {
        this.config = config;
        this.serverBuilderFactory = serverBuilderFactory;
        this.metricsCollector = metricsCollector;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }
    
    /**
     * Default listener: plaintext TCP on the configured port.
     */
    public static ServerBuilder<?> networkServerBuilder(ServerConfig config) {
        return Grpc.newServerBuilderForPort(config.getPort(), InsecureServerCredentials.create());
    }
    
    public void addService(String name, BindableService service) {
        addService(name, service, (impl, listener) -> listener.mount(impl));
    }
    
    /**
     * Registers a service under {@code name}, mounting it through {@code mountFunction}.
     * A service already registered under the same name is replaced once the new
     * mount succeeds, and its custom health check is dropped. If the mount fails
     * the previous registration stays in place.
     */
    public <T> void addService(String name, T implementation, MountFunction<T> mountFunction) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Service name must not be blank");
        }
        int count;
        synchronized (this) {
            RegisteredService previous = services.get(name);
            RecordingListener listener = new RecordingListener();
            try {
                mountFunction.mount(implementation, listener);
            } catch (RuntimeException e) {
                listener.getMounted().forEach(handlerRegistry::removeService);
                if (previous != null) {
                    // restore definitions the partial mount displaced
                    previous.getDefinitions().forEach(handlerRegistry::addService);
                }
                throw new MeshException("Failed to mount service " + name, e);
            }
            RegisteredService registered = new RegisteredService(name, implementation, mountFunction,
                clock.instant(), listener.getMounted());
            Set<String> servingNames = healthNames(registered);
            if (previous != null) {
                logger.warn("Service {} already registered, replacing it", name);
                // conditional removal keeps definitions the new mount re-registered
                previous.getDefinitions().forEach(handlerRegistry::removeService);
                for (String healthName : healthNames(previous)) {
                    if (!servingNames.contains(healthName)) {
                        healthStatusManager.clearStatus(healthName);
                    }
                }
                healthChecks.remove(name);
            }
            services.put(name, registered);
            for (String healthName : servingNames) {
                healthStatusManager.setStatus(healthName, ServingStatus.SERVING);
            }
            count = services.size();
        }
        logger.info("Added service {} to server registry", name);
        metricsCollector.updateRegisteredServices(count);
        reportHealth(name, HealthState.HEALTHY);
    }
    
    /**
     * Unregisters a service. Its health status is cleared immediately.
     *
     * @return false if no service was registered under the name
     */
    public boolean removeService(String name) {
        int count;
        synchronized (this) {
            RegisteredService removed = services.remove(name);
            if (removed == null) {
                return false;
            }
            unmount(removed);
            healthChecks.remove(name);
            count = services.size();
        }
        logger.info("Removed service {} from server registry", name);
        metricsCollector.updateRegisteredServices(count);
        reportHealth(name, HealthState.UNKNOWN);
        return true;
    }
    
    public synchronized Optional<RegisteredService> getService(String name) {
        return Optional.ofNullable(services.get(name));
    }
    
    public synchronized List<String> getServiceNames() {
        return List.copyOf(services.keySet());
    }
    
    /**
     * Starts the listener with every registered service mounted.
     *
     * @throws AlreadyRunningException if the listener is running
     * @throws IllegalStateException if the listener was stopped
     */
    public synchronized void start() {
        if (state == ListenerState.RUNNING) {
            throw new AlreadyRunningException(getPort());
        }
        if (state == ListenerState.STOPPED) {
            throw new IllegalStateException("Server registry has been stopped and cannot be restarted");
        }
        
        AtomicInteger threadCount = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(config.getWorkerThreads(),
            r -> new Thread(r, "mesh-server-worker-" + threadCount.incrementAndGet()));
        
        ServerBuilder<?> builder = serverBuilderFactory.apply(config)
            .executor(pool)
            .fallbackHandlerRegistry(handlerRegistry)
            .maxInboundMessageSize(config.getMaxInboundMessageSize());
        try {
            builder.permitKeepAliveTime(config.getPermitKeepAliveTime().toMillis(), TimeUnit.MILLISECONDS)
                .permitKeepAliveWithoutCalls(config.isPermitKeepAliveWithoutCalls());
        } catch (UnsupportedOperationException e) {
            logger.debug("Transport does not support keep-alive enforcement settings");
        }
        if (config.isHealthServiceEnabled()) {
            builder.addService(healthStatusManager.getHealthService());
        }
        
        try {
            server = builder.build().start();
        } catch (IOException e) {
            pool.shutdownNow();
            throw new MeshException("Failed to start server on port " + config.getPort(), e);
        }
        workerPool = pool;
        state = ListenerState.RUNNING;
        logger.info("Server started on port {} with {} services", getPort(), services.size());
    }
    
    /**
     * Stops the listener, giving in-flight calls {@code gracePeriod} to complete.
     *
     * @throws NotRunningException if the listener is not running
     */
    public void stop(Duration gracePeriod) {
        Server running;
        ExecutorService pool;
        synchronized (this) {
            if (state != ListenerState.RUNNING) {
                throw new NotRunningException(state.name());
            }
            state = ListenerState.STOPPED;
            running = server;
            pool = workerPool;
        }
        healthStatusManager.enterTerminalState();
        running.shutdown();
        try {
            if (!running.awaitTermination(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Server did not stop within {}ms, forcing shutdown", gracePeriod.toMillis());
                running.shutdownNow();
            }
        } catch (InterruptedException e) {
            running.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            pool.shutdown();
        }
        logger.info("Server stopped");
    }
    
    public void stop() {
        stop(config.getShutdownGracePeriod());
    }
    
    /**
     * Blocks until the listener terminates.
     *
     * @throws NotRunningException if the listener was never started
     */
    public void awaitTermination() throws InterruptedException {
        Server started;
        synchronized (this) {
            if (state == ListenerState.NOT_STARTED) {
                throw new NotRunningException(state.name());
            }
            started = server;
        }
        started.awaitTermination();
    }
    
    public synchronized void addHealthCheck(String name, ServiceHealthCheck healthCheck) {
        healthChecks.put(name, healthCheck);
    }
    
    /**
     * A service is healthy if it is registered and its custom check (if any) passes.
     */
    public boolean checkServiceHealth(String name) {
        ServiceHealthCheck healthCheck;
        synchronized (this) {
            if (!services.containsKey(name)) {
                return false;
            }
            healthCheck = healthChecks.get(name);
        }
        if (healthCheck == null) {
            return true;
        }
        try {
            return healthCheck.isHealthy();
        } catch (Exception e) {
            logger.warn("Health check for service {} failed", name, e);
            return false;
        }
    }
    
    public ServerHealthReport getServerHealth() {
        List<RegisteredService> snapshot;
        Set<String> withCustomCheck;
        boolean running;
        synchronized (this) {
            snapshot = new ArrayList<>(services.values());
            withCustomCheck = Set.copyOf(healthChecks.keySet());
            running = state == ListenerState.RUNNING;
        }
        
        Map<String, ServiceHealthReport> reports = new LinkedHashMap<>();
        for (RegisteredService service : snapshot) {
            String name = service.getName();
            reports.put(name, new ServiceHealthReport(name, checkServiceHealth(name),
                withCustomCheck.contains(name), service.getAddedAt()));
        }
        return new ServerHealthReport(running, reports, clock.instant());
    }
    
    /**
     * Runs the custom checks and publishes the results through the health service.
     */
    public void refreshHealthStatuses() {
        for (String name : getServiceNames()) {
            boolean healthy = checkServiceHealth(name);
            synchronized (this) {
                RegisteredService service = services.get(name);
                if (service == null) {
                    continue;
                }
                ServingStatus status = healthy ? ServingStatus.SERVING : ServingStatus.NOT_SERVING;
                for (String healthName : healthNames(service)) {
                    healthStatusManager.setStatus(healthName, status);
                }
            }
            reportHealth(name, healthy ? HealthState.HEALTHY : HealthState.UNHEALTHY);
        }
    }
    
    public synchronized ListenerState getState() {
        return state;
    }
    
    public synchronized boolean isRunning() {
        return state == ListenerState.RUNNING;
    }
    
    /**
     * Bound port once running, otherwise the configured one.
     */
    public synchronized int getPort() {
        return server != null ? server.getPort() : config.getPort();
    }
    
    /**
     * Stops the listener if running and unregisters every service.
     */
    public void cleanup() {
        if (isRunning()) {
            stop(config.getShutdownGracePeriod());
        }
        for (String name : getServiceNames()) {
            removeService(name);
        }
        logger.info("Server registry cleaned up");
    }
    
    @Override
    public void close() {
        cleanup();
    }
    
    // callers hold this
    private void unmount(RegisteredService service) {
        service.getDefinitions().forEach(handlerRegistry::removeService);
        for (String healthName : healthNames(service)) {
            healthStatusManager.clearStatus(healthName);
        }
    }
    
    private static Set<String> healthNames(RegisteredService service) {
        Set<String> names = new LinkedHashSet<>();
        names.add(service.getName());
        for (ServerServiceDefinition definition : service.getDefinitions()) {
            names.add(definition.getServiceDescriptor().getName());
        }
        return names;
    }
    
    private void reportHealth(String name, HealthState current) {
        HealthState previous;
        synchronized (this) {
            previous = current == HealthState.UNKNOWN
                ? reportedHealth.remove(name)
                : reportedHealth.put(name, current);
        }
        if (eventPublisher != null) {
            eventPublisher.publish(HealthChangeEvent.Source.SERVER, name,
                previous != null ? previous : HealthState.UNKNOWN, current);
        }
    }
    
    private class RecordingListener implements ServiceListener {
        private final List<ServerServiceDefinition> mounted = new ArrayList<>();
        
        @Override
        public void mount(ServerServiceDefinition definition) {
            handlerRegistry.addService(definition);
            mounted.add(definition);
        }
        
        List<ServerServiceDefinition> getMounted() {
            return mounted;
        }
    }
}
