package com.lucid.mesh.client;

import com.lucid.mesh.config.ChannelOptions;
import com.lucid.mesh.config.MeshConfiguration;
import com.lucid.mesh.config.ResilienceConfig;
import com.lucid.mesh.exception.MeshException.ApplicationException;
import com.lucid.mesh.exception.MeshException.CircuitOpenException;
import com.lucid.mesh.exception.MeshException.NoChannelException;
import com.lucid.mesh.exception.MeshException.NoStubException;
import com.lucid.mesh.exception.MeshException.TransportException;
import com.lucid.mesh.model.ChannelInfo;
import com.lucid.mesh.observability.MetricsCollector;
import com.lucid.mesh.resilience.ResilienceManager;
import io.grpc.Channel;
import io.grpc.ConnectivityState;
import io.grpc.Context;
import io.grpc.ManagedChannel;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.AbstractStub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Owns outbound channels and stubs, one per service name, and performs guarded
 * calls: every attempt runs through the service's circuit breaker with a deadline,
 * and transport failures are retried with exponential backoff.
 * <p>
 * Endpoint precedence when creating a channel: explicit endpoint, then the
 * endpoint directory, then the fallback resolver (DNS).
 */
public class ChannelManager implements AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(ChannelManager.class);
    
    private static final Duration CHANNEL_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
    
    private final ChannelOptions defaultOptions;
    private final ResilienceManager resilienceManager;
    private final ChannelFactory channelFactory;
    private final EndpointDirectory directory;
    private final EndpointResolver fallbackResolver;
    private final MetricsCollector metricsCollector;
    private final ConcurrentHashMap<String, ChannelHandle> channels = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, StubHandle<?>> stubs = new ConcurrentHashMap<>();
    private final Object lock = new Object();
    private final ExecutorService callExecutor;
    private final Executor contextExecutor;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    
    public ChannelManager(MeshConfiguration configuration, ResilienceManager resilienceManager) {
        this(configuration, resilienceManager, new GrpcChannelFactory(), null, new MetricsCollector());
    }
    
    /**
     * @param fallbackResolver consulted for services missing from the directory; may be null
     */
    public ChannelManager(MeshConfiguration configuration, ResilienceManager resilienceManager,
                          ChannelFactory channelFactory, EndpointResolver fallbackResolver,
                          MetricsCollector metricsCollector) {
        this.defaultOptions = configuration.getChannelOptions();
        this.resilienceManager = resilienceManager;
        this.channelFactory = channelFactory;
        this.directory = new EndpointDirectory(configuration.getEndpoints());
        this.fallbackResolver = fallbackResolver;
        this.metricsCollector = metricsCollector;
        
        AtomicInteger threadCount = new AtomicInteger();
        this.callExecutor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "mesh-call-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.contextExecutor = Context.currentContextExecutor(callExecutor);
    }
    
    /**
     * Opens a channel to a service, replacing (and shutting down) any previous one.
     * A stub cached for the previous channel is dropped.
     *
     * @param endpoint "host:port", or null to look the service up
     * @throws NoChannelException if no endpoint is known for the service
     */
    public ChannelHandle createChannel(String serviceName, String endpoint, ChannelOptions options) {
        checkNotClosed();
        String target = endpoint != null ? endpoint : resolveEndpoint(serviceName);
        synchronized (lock) {
            return replaceChannel(serviceName, target, options != null ? options : defaultOptions);
        }
    }
    
    public ChannelHandle createChannel(String serviceName, String endpoint) {
        return createChannel(serviceName, endpoint, defaultOptions);
    }
    
    public ChannelHandle createChannel(String serviceName) {
        return createChannel(serviceName, null, defaultOptions);
    }
    
    /**
     * Returns the cached stub for a service, creating the channel and stub as needed.
     * An explicit endpoint different from the current channel's replaces the channel.
     * A cached stub of a different type than {@code stubFactory} produces is replaced
     * by a new stub on the same channel.
     */
    public <S extends AbstractStub<S>> S createStub(String serviceName, Function<Channel, S> stubFactory,
                                                    String endpoint) {
        checkNotClosed();
        synchronized (lock) {
            StubHandle<S> cached = cachedStub(serviceName);
            if (cached != null && matches(cached.getChannel(), endpoint)) {
                S stub = stubFactory.apply(cached.getChannel().getChannel());
                if (stub.getClass() == cached.getStub().getClass()) {
                    return cached.getStub();
                }
                logger.debug("Stub type for {} changed from {} to {}", serviceName,
                    cached.getStub().getClass().getSimpleName(), stub.getClass().getSimpleName());
                return cacheStub(serviceName, cached.getChannel(), stub);
            }
            ChannelHandle channel = channels.get(serviceName);
            if (channel != null && matches(channel, endpoint)) {
                return bindStub(serviceName, channel, stubFactory);
            }
        }
        
        // resolve outside the lock, lookups may block
        String target = endpoint != null ? endpoint : resolveEndpoint(serviceName);
        synchronized (lock) {
            ChannelHandle channel = replaceChannel(serviceName, target, defaultOptions);
            return bindStub(serviceName, channel, stubFactory);
        }
    }
    
    public <S extends AbstractStub<S>> S createStub(String serviceName, Function<Channel, S> stubFactory) {
        return createStub(serviceName, stubFactory, null);
    }
    
    public Optional<StubHandle<?>> getStub(String serviceName) {
        return Optional.ofNullable(stubs.get(serviceName));
    }
    
    public Optional<ChannelHandle> getChannel(String serviceName) {
        return Optional.ofNullable(channels.get(serviceName));
    }
    
    /**
     * Invokes a unary method on the service's cached stub.
     *
     * @param timeout per-attempt deadline, or null for the breaker's call timeout
     * @param retries additional attempts after the first on transport failures
     * @throws NoStubException if no stub has been created for the service
     * @throws CircuitOpenException if the breaker rejects the call
     * @throws TransportException if every attempt failed at the transport level
     * @throws ApplicationException if the remote side returned a non-transport error
     */
    public <S extends AbstractStub<S>, Q, P> P call(String serviceName, RpcMethod<S, Q, P> method, Q request,
                                                    Duration timeout, int retries) {
        StubHandle<S> handle = cachedStub(serviceName);
        if (handle == null) {
            throw new NoStubException(serviceName);
        }
        Duration deadline = timeout != null ? timeout : resilienceManager.getBreakerConfig(serviceName).getCallTimeout();
        AtomicInteger attempts = new AtomicInteger();
        
        Supplier<P> attempt = () -> resilienceManager.executeSupplier(serviceName, () -> {
            attempts.incrementAndGet();
            S stub = handle.getStub().withDeadlineAfter(deadline.toMillis(), TimeUnit.MILLISECONDS);
            long start = System.nanoTime();
            try {
                P response = method.invoke(stub, request);
                metricsCollector.recordRequest(serviceName, Duration.ofNanos(System.nanoTime() - start), true);
                return response;
            } catch (RuntimeException e) {
                metricsCollector.recordRequest(serviceName, Duration.ofNanos(System.nanoTime() - start), false);
                throw e;
            }
        });
        
        ResilienceConfig resilienceConfig = resilienceManager.getConfig();
        try {
            if (resilienceConfig.isRetryEnabled() && retries > 0) {
                return resilienceManager.retryFor(serviceName, retries, resilienceConfig.getRetryDelay())
                    .executeSupplier(attempt);
            }
            return attempt.get();
        } catch (StatusRuntimeException e) {
            if (resilienceManager.isTransportFailure(e)) {
                logger.error("Call to {} failed after {} attempt(s): {}", serviceName, attempts.get(), e.getStatus());
                throw new TransportException(serviceName, attempts.get(), e);
            }
            logger.debug("Call to {} returned application error {}", serviceName, e.getStatus());
            throw new ApplicationException(serviceName, e);
        }
    }
    
    public <S extends AbstractStub<S>, Q, P> P call(String serviceName, RpcMethod<S, Q, P> method, Q request,
                                                    Duration timeout) {
        return call(serviceName, method, request, timeout, resilienceManager.getConfig().getMaxRetries());
    }
    
    public <S extends AbstractStub<S>, Q, P> P call(String serviceName, RpcMethod<S, Q, P> method, Q request) {
        return call(serviceName, method, request, null, resilienceManager.getConfig().getMaxRetries());
    }
    
    /**
     * Asynchronous variant of {@link #call}. The caller's RPC context travels with the
     * call, so cancelling it stops further retries.
     */
    public <S extends AbstractStub<S>, Q, P> CompletableFuture<P> callAsync(String serviceName,
                                                                          RpcMethod<S, Q, P> method, Q request,
                                                                          Duration timeout, int retries) {
        checkNotClosed();
        return CompletableFuture.supplyAsync(() -> call(serviceName, method, request, timeout, retries),
            contextExecutor);
    }
    
    public <S extends AbstractStub<S>, Q, P> CompletableFuture<P> callAsync(String serviceName,
                                                                          RpcMethod<S, Q, P> method, Q request) {
        return callAsync(serviceName, method, request, null, resilienceManager.getConfig().getMaxRetries());
    }
    
    /**
     * True only if a channel exists for the service and is currently READY.
     */
    public boolean healthCheck(String serviceName) {
        ChannelHandle handle = channels.get(serviceName);
        return handle != null && handle.getState() == ConnectivityState.READY;
    }
    
    public Optional<ConnectivityState> getConnectivityState(String serviceName) {
        return getChannel(serviceName).map(ChannelHandle::getState);
    }
    
    public List<ChannelInfo> listChannels() {
        List<ChannelInfo> infos = new ArrayList<>();
        for (ChannelHandle handle : channels.values()) {
            infos.add(handle.toInfo(stubs.containsKey(handle.getServiceName())));
        }
        infos.sort(Comparator.comparing(ChannelInfo::getServiceName));
        return infos;
    }
    
    /**
     * Closes the channel of a service and drops its stub. No-op if none exists.
     */
    public void closeChannel(String serviceName) {
        ChannelHandle handle;
        synchronized (lock) {
            handle = channels.remove(serviceName);
            stubs.remove(serviceName);
        }
        if (handle != null) {
            shutdown(handle);
            logger.info("Closed channel to {} ({})", serviceName, handle.getEndpoint());
        }
    }
    
    /**
     * Closes every channel. Safe to call repeatedly.
     */
    public void closeAll() {
        for (String serviceName : List.copyOf(channels.keySet())) {
            closeChannel(serviceName);
        }
    }
    
    public void addEndpoint(String serviceName, String address) {
        directory.addEndpoint(serviceName, address);
    }
    
    public boolean removeEndpoint(String serviceName) {
        return directory.removeEndpoint(serviceName);
    }
    
    public Map<String, String> listEndpoints() {
        return directory.listEndpoints();
    }
    
    public ResilienceManager getResilienceManager() {
        return resilienceManager;
    }
    
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            closeAll();
            callExecutor.shutdownNow();
            logger.info("Channel manager closed");
        }
    }
    
    private String resolveEndpoint(String serviceName) {
        Optional<String> configured = directory.lookup(serviceName);
        if (configured.isPresent()) {
            return configured.get();
        }
        if (fallbackResolver == null) {
            throw new NoChannelException(serviceName, "no endpoint configured");
        }
        return fallbackResolver.resolve(serviceName)
            .map(hostPort -> {
                logger.info("Resolved endpoint for {} via discovery: {}", serviceName, hostPort);
                return hostPort.toAddress();
            })
            .orElseThrow(() -> new NoChannelException(serviceName, "no endpoint configured or resolvable"));
    }
    
    // callers hold lock
    private ChannelHandle replaceChannel(String serviceName, String target, ChannelOptions options) {
        ManagedChannel channel = channelFactory.create(serviceName, target, options);
        ChannelHandle handle = new ChannelHandle(serviceName, target, options, channel, Instant.now());
        ChannelHandle previous = channels.put(serviceName, handle);
        metricsCollector.recordChannelEvent(serviceName, true);
        if (previous != null) {
            stubs.remove(serviceName);
            // in-flight calls on the old channel are allowed to finish
            previous.getChannel().shutdown();
            metricsCollector.recordChannelEvent(serviceName, false);
            logger.info("Replaced channel to {}: {} -> {}", serviceName, previous.getEndpoint(), target);
        } else {
            logger.info("Opened channel to {} at {}", serviceName, target);
        }
        return handle;
    }
    
    private <S extends AbstractStub<S>> S bindStub(String serviceName, ChannelHandle channel,
                                                   Function<Channel, S> stubFactory) {
        return cacheStub(serviceName, channel, stubFactory.apply(channel.getChannel()));
    }
    
    private <S extends AbstractStub<S>> S cacheStub(String serviceName, ChannelHandle channel, S stub) {
        stubs.put(serviceName, new StubHandle<>(serviceName, channel, stub));
        logger.debug("Created stub {} for {}", stub.getClass().getSimpleName(), serviceName);
        return stub;
    }
    
    @SuppressWarnings("unchecked")
    private <S extends AbstractStub<S>> StubHandle<S> cachedStub(String serviceName) {
        return (StubHandle<S>) stubs.get(serviceName);
    }
    
    private static boolean matches(ChannelHandle channel, String endpoint) {
        return endpoint == null || endpoint.equals(channel.getEndpoint());
    }
    
    private void shutdown(ChannelHandle handle) {
        ManagedChannel channel = handle.getChannel();
        channel.shutdown();
        metricsCollector.recordChannelEvent(handle.getServiceName(), false);
        try {
            if (!channel.awaitTermination(CHANNEL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Channel to {} did not terminate in time, forcing shutdown", handle.getServiceName());
                channel.shutdownNow();
            }
        } catch (InterruptedException e) {
            channel.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
    
    private void checkNotClosed() {
        if (closed.get()) {
            throw new IllegalStateException("Channel manager is closed");
        }
    }
}
