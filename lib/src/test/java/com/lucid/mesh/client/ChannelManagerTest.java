package com.lucid.mesh.client;

import com.lucid.mesh.FlakyHealthService;
import com.lucid.mesh.config.BreakerConfig;
import com.lucid.mesh.config.ChannelOptions;
import com.lucid.mesh.config.MeshConfiguration;
import com.lucid.mesh.config.ResilienceConfig;
import com.lucid.mesh.discovery.HostPort;
import com.lucid.mesh.exception.MeshException.ApplicationException;
import com.lucid.mesh.exception.MeshException.CircuitOpenException;
import com.lucid.mesh.exception.MeshException.NoChannelException;
import com.lucid.mesh.exception.MeshException.NoStubException;
import com.lucid.mesh.exception.MeshException.TransportException;
import com.lucid.mesh.model.ChannelInfo;
import com.lucid.mesh.observability.MetricsCollector;
import com.lucid.mesh.resilience.ResilienceManager;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.Status;
import io.grpc.health.v1.HealthCheckRequest;
import io.grpc.health.v1.HealthCheckResponse;
import io.grpc.health.v1.HealthGrpc;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Tests for ChannelManager against an in-process health service.
 */
@ExtendWith(MockitoExtension.class)
class ChannelManagerTest {

    private static final String SERVICE = "health";
    private static final String ENDPOINT = "localhost:50051";
    private static final HealthCheckRequest REQUEST = HealthCheckRequest.getDefaultInstance();

    @Mock
    private MetricsCollector metricsCollector;

    private FlakyHealthService healthService;
    private Server server;
    private String serverName;
    private ResilienceManager resilienceManager;
    private ChannelManager channelManager;

    @BeforeEach
    void setUp() throws Exception {
        serverName = InProcessServerBuilder.generateName();
        healthService = new FlakyHealthService();
        server = InProcessServerBuilder.forName(serverName)
            .directExecutor()
            .addService(healthService)
            .build()
            .start();

        ResilienceConfig resilienceConfig = ResilienceConfig.builder()
            .breakerConfig(BreakerConfig.builder()
                .failureThreshold(10)
                .callTimeout(Duration.ofSeconds(5))
                .build())
            .maxRetries(3)
            .retryDelay(Duration.ofMillis(10))
            .build();
        MeshConfiguration configuration = MeshConfiguration.builder()
            .resilienceConfig(resilienceConfig)
            .breaker("fragile", BreakerConfig.builder().failureThreshold(2).build())
            .endpoint("configured", "10.0.0.9:7000")
            .build();
        resilienceManager = new ResilienceManager(resilienceConfig, configuration.getBreakerOverrides(),
            metricsCollector, null, Clock.systemUTC());
        channelManager = new ChannelManager(configuration, resilienceManager, this::inProcessChannel,
            null, metricsCollector);
    }

    @AfterEach
    void tearDown() throws Exception {
        channelManager.close();
        server.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
    }

    private ManagedChannel inProcessChannel(String serviceName, String target, ChannelOptions options) {
        return InProcessChannelBuilder.forName(serverName).directExecutor().build();
    }

    private HealthCheckResponse check(String serviceName, int retries) {
        return channelManager.call(serviceName, HealthGrpc.HealthBlockingStub::check, REQUEST, null, retries);
    }

    @Test
    void testCallSucceeds() {
        channelManager.createStub(SERVICE, HealthGrpc::newBlockingStub, ENDPOINT);

        HealthCheckResponse response = channelManager.call(SERVICE, HealthGrpc.HealthBlockingStub::check, REQUEST);

        assertEquals(HealthCheckResponse.ServingStatus.SERVING, response.getStatus());
        assertEquals(1, healthService.getCalls());
        assertEquals(1, resilienceManager.getStats(SERVICE).getTotalRequests());
    }

    @Test
    void testCreateStubReusesCachedStub() {
        HealthGrpc.HealthBlockingStub first = channelManager.createStub(SERVICE, HealthGrpc::newBlockingStub, ENDPOINT);
        HealthGrpc.HealthBlockingStub second = channelManager.createStub(SERVICE, HealthGrpc::newBlockingStub);

        assertSame(first, second);
        assertEquals(1, channelManager.listChannels().size());
    }

    @Test
    void testCallWithoutStubFails() {
        NoStubException e = assertThrows(NoStubException.class, () -> check("unknown", 0));

        assertTrue(e.getMessage().contains("unknown"));
        assertEquals(0, healthService.getCalls());
    }

    @Test
    void testTransportFailuresAreRetriedWithBackoff() {
        channelManager.createStub(SERVICE, HealthGrpc::newBlockingStub, ENDPOINT);
        healthService.failWith(Status.UNAVAILABLE, 2);

        HealthCheckResponse response = check(SERVICE, 3);

        assertEquals(HealthCheckResponse.ServingStatus.SERVING, response.getStatus());
        assertEquals(3, healthService.getCalls());
        ArgumentCaptor<Duration> waits = ArgumentCaptor.forClass(Duration.class);
        verify(metricsCollector, times(2)).recordRetry(eq(SERVICE), anyInt(), waits.capture());
        assertEquals(List.of(Duration.ofMillis(10), Duration.ofMillis(20)), waits.getAllValues());
    }

    @Test
    void testTransportFailureAfterRetriesExhausted() {
        channelManager.createStub(SERVICE, HealthGrpc::newBlockingStub, ENDPOINT);
        healthService.failWith(Status.UNAVAILABLE, 100);

        TransportException e = assertThrows(TransportException.class, () -> check(SERVICE, 2));

        assertEquals(3, e.getAttempts());
        assertEquals(3, healthService.getCalls());
        assertEquals(Status.Code.UNAVAILABLE, e.getStatus().getCode());
        assertEquals(SERVICE, e.getServiceName());
    }

    @Test
    void testExhaustedRetriesLogOneError() {
        Logger meshLogger = (Logger) LoggerFactory.getLogger("com.lucid.mesh");
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        meshLogger.addAppender(appender);
        try {
            channelManager.createStub(SERVICE, HealthGrpc::newBlockingStub, ENDPOINT);
            healthService.failWith(Status.UNAVAILABLE, 100);

            assertThrows(TransportException.class, () -> check(SERVICE, 2));
        } finally {
            meshLogger.detachAppender(appender);
        }

        long errors = appender.list.stream().filter(event -> event.getLevel() == Level.ERROR).count();
        assertEquals(1, errors);
    }

    @Test
    void testApplicationErrorIsNotRetried() {
        channelManager.createStub(SERVICE, HealthGrpc::newBlockingStub, ENDPOINT);
        healthService.failWith(Status.INVALID_ARGUMENT, 1);

        ApplicationException e = assertThrows(ApplicationException.class, () -> check(SERVICE, 3));

        assertEquals(Status.Code.INVALID_ARGUMENT, e.getStatus().getCode());
        assertEquals(1, healthService.getCalls());
    }

    @Test
    void testOpenBreakerFailsFastWithoutRetry() {
        channelManager.createStub("fragile", HealthGrpc::newBlockingStub, ENDPOINT);
        healthService.failWith(Status.UNAVAILABLE, 100);

        assertThrows(TransportException.class, () -> check("fragile", 0));
        assertThrows(TransportException.class, () -> check("fragile", 0));
        assertThrows(CircuitOpenException.class, () -> check("fragile", 3));

        assertEquals(2, healthService.getCalls());
    }

    @Test
    void testCreateChannelUsesDirectory() {
        ChannelHandle handle = channelManager.createChannel("configured");

        assertEquals("10.0.0.9:7000", handle.getEndpoint());
        assertEquals(Map.of("configured", "10.0.0.9:7000"), channelManager.listEndpoints());
    }

    @Test
    void testCreateChannelWithoutEndpointFails() {
        assertThrows(NoChannelException.class, () -> channelManager.createChannel("nowhere"));
    }

    @Test
    void testCreateChannelFallsBackToResolver() {
        ChannelManager withFallback = new ChannelManager(MeshConfiguration.defaultConfig(), resilienceManager,
            this::inProcessChannel, name -> Optional.of(HostPort.of("10.1.2.3", 50051)), metricsCollector);
        try {
            ChannelHandle handle = withFallback.createChannel("discovered");

            assertEquals("10.1.2.3:50051", handle.getEndpoint());
        } finally {
            withFallback.close();
        }
    }

    @Test
    void testDirectoryTakesPrecedenceOverResolver() {
        ChannelManager withFallback = new ChannelManager(
            MeshConfiguration.builder().endpoint("configured", "10.0.0.9:7000").build(), resilienceManager,
            this::inProcessChannel, name -> Optional.of(HostPort.of("10.1.2.3", 50051)), metricsCollector);
        try {
            assertEquals("10.0.0.9:7000", withFallback.createChannel("configured").getEndpoint());
        } finally {
            withFallback.close();
        }
    }

    @Test
    void testReplacingChannelDropsStub() {
        channelManager.createStub(SERVICE, HealthGrpc::newBlockingStub, ENDPOINT);
        ManagedChannel original = channelManager.getChannel(SERVICE).orElseThrow().getChannel();

        channelManager.createChannel(SERVICE, "localhost:50052");

        assertTrue(original.isShutdown());
        assertTrue(channelManager.getStub(SERVICE).isEmpty());
        assertEquals("localhost:50052", channelManager.getChannel(SERVICE).orElseThrow().getEndpoint());
        assertThrows(NoStubException.class, () -> check(SERVICE, 0));
    }

    @Test
    void testStubForDifferentEndpointReplacesChannel() {
        HealthGrpc.HealthBlockingStub first = channelManager.createStub(SERVICE, HealthGrpc::newBlockingStub, ENDPOINT);
        HealthGrpc.HealthBlockingStub second = channelManager.createStub(SERVICE, HealthGrpc::newBlockingStub,
            "localhost:50052");

        assertNotSame(first, second);
        assertEquals("localhost:50052", channelManager.getChannel(SERVICE).orElseThrow().getEndpoint());
    }

    @Test
    void testStubOfAnotherTypeRebindsOnSameChannel() throws Exception {
        HealthGrpc.HealthBlockingStub blocking = channelManager.createStub(SERVICE, HealthGrpc::newBlockingStub, ENDPOINT);
        ManagedChannel channel = channelManager.getChannel(SERVICE).orElseThrow().getChannel();

        HealthGrpc.HealthFutureStub future = channelManager.createStub(SERVICE, HealthGrpc::newFutureStub);

        assertNotNull(future);
        assertSame(channel, channelManager.getChannel(SERVICE).orElseThrow().getChannel());
        assertFalse(channel.isShutdown());
        assertSame(future, channelManager.getStub(SERVICE).orElseThrow().getStub());
        assertEquals(HealthCheckResponse.ServingStatus.SERVING,
            future.check(REQUEST).get(5, TimeUnit.SECONDS).getStatus());

        HealthGrpc.HealthBlockingStub again = channelManager.createStub(SERVICE, HealthGrpc::newBlockingStub);
        assertNotSame(blocking, again);
        assertSame(again, channelManager.createStub(SERVICE, HealthGrpc::newBlockingStub));
    }

    @Test
    void testHealthCheck() {
        assertFalse(channelManager.healthCheck(SERVICE));

        channelManager.createStub(SERVICE, HealthGrpc::newBlockingStub, ENDPOINT);
        check(SERVICE, 0);

        assertTrue(channelManager.healthCheck(SERVICE));
    }

    @Test
    void testCallAsync() throws Exception {
        channelManager.createStub(SERVICE, HealthGrpc::newBlockingStub, ENDPOINT);

        HealthCheckResponse response = channelManager
            .callAsync(SERVICE, HealthGrpc.HealthBlockingStub::check, REQUEST)
            .get(5, TimeUnit.SECONDS);

        assertEquals(HealthCheckResponse.ServingStatus.SERVING, response.getStatus());
    }

    @Test
    void testListChannels() {
        channelManager.createStub(SERVICE, HealthGrpc::newBlockingStub, ENDPOINT);
        channelManager.createChannel("configured");

        List<ChannelInfo> channels = channelManager.listChannels();

        assertEquals(2, channels.size());
        assertEquals("configured", channels.get(0).getServiceName());
        assertFalse(channels.get(0).isStubCached());
        assertEquals(SERVICE, channels.get(1).getServiceName());
        assertTrue(channels.get(1).isStubCached());
    }

    @Test
    void testCloseAllIsIdempotent() {
        channelManager.createStub(SERVICE, HealthGrpc::newBlockingStub, ENDPOINT);
        ManagedChannel channel = channelManager.getChannel(SERVICE).orElseThrow().getChannel();

        channelManager.closeAll();
        assertDoesNotThrow(() -> channelManager.closeAll());

        assertTrue(channel.isShutdown());
        assertTrue(channelManager.listChannels().isEmpty());
        assertTrue(channelManager.getStub(SERVICE).isEmpty());
    }

    @Test
    void testClosedManagerRejectsNewChannels() {
        channelManager.close();

        assertThrows(IllegalStateException.class, () -> channelManager.createChannel(SERVICE, ENDPOINT));
    }

    @Test
    void testEndpointDirectoryMutations() {
        channelManager.addEndpoint("search", "search.mesh.internal:9000");

        assertEquals("search.mesh.internal:9000", channelManager.listEndpoints().get("search"));
        assertTrue(channelManager.removeEndpoint("search"));
        assertFalse(channelManager.removeEndpoint("search"));
        assertThrows(IllegalArgumentException.class, () -> channelManager.addEndpoint("bad", "no-port"));
    }
}
