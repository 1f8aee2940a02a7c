package com.lucid.mesh.impl;

import com.lucid.mesh.FlakyHealthService;
import com.lucid.mesh.MeshRuntime;
import com.lucid.mesh.MeshRuntimeBuilder;
import com.lucid.mesh.MutableClock;
import com.lucid.mesh.config.BreakerConfig;
import com.lucid.mesh.config.MeshConfiguration;
import com.lucid.mesh.config.ResilienceConfig;
import com.lucid.mesh.config.ResolverConfig;
import com.lucid.mesh.config.ServerConfig;
import com.lucid.mesh.discovery.DnsClient;
import com.lucid.mesh.discovery.DnsLookupException;
import com.lucid.mesh.model.CircuitBreakerState;
import com.lucid.mesh.model.HealthState;
import com.lucid.mesh.model.MeshHealthSnapshot;
import com.lucid.mesh.model.RecordType;
import com.lucid.mesh.model.ServiceEndpointRecord;
import com.lucid.mesh.observability.HealthChangeEvent;
import io.grpc.Status;
import io.grpc.health.v1.HealthCheckRequest;
import io.grpc.health.v1.HealthGrpc;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.Disposable;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

/**
 * Wires a full runtime over the in-process transport: the local registry serves a
 * health service that the channel manager calls.
 */
@ExtendWith(MockitoExtension.class)
class DefaultMeshRuntimeTest {

    private static final HealthCheckRequest REQUEST = HealthCheckRequest.getDefaultInstance();

    @Mock
    private DnsClient dnsClient;

    private String serverName;
    private MutableClock clock;
    private MeshRuntime runtime;

    @BeforeEach
    void setUp() {
        serverName = InProcessServerBuilder.generateName();
        clock = new MutableClock();
        MeshConfiguration configuration = MeshConfiguration.builder()
            .endpoint("health", "localhost:50051")
            .breaker("health", BreakerConfig.builder()
                .failureThreshold(2)
                .recoveryTimeout(Duration.ofSeconds(2))
                .successThreshold(1)
                .build())
            .resilienceConfig(ResilienceConfig.builder()
                .retryDelay(Duration.ofMillis(5))
                .build())
            .resolverConfig(ResolverConfig.builder().defaultPort(9000).build())
            .serverConfig(ServerConfig.builder().enableHealthService(false).workerThreads(2).build())
            .build();

        runtime = MeshRuntimeBuilder.builder()
            .configuration(configuration)
            .dnsClient(dnsClient)
            .channelFactory((service, target, options) -> InProcessChannelBuilder.forName(serverName).build())
            .serverBuilderFactory(config -> InProcessServerBuilder.forName(serverName))
            .clock(clock)
            .build();
    }

    @AfterEach
    void tearDown() {
        runtime.close();
    }

    @Test
    void testRoundTripThroughLocalServer() {
        runtime.server().addService("health", new FlakyHealthService());
        runtime.server().start();
        runtime.channels().createStub("health", HealthGrpc::newBlockingStub);

        runtime.channels().call("health", HealthGrpc.HealthBlockingStub::check, REQUEST);

        assertEquals(HealthState.HEALTHY, runtime.getDependencyHealth("health"));
        assertTrue(runtime.checkServiceHealth("health"));
        assertEquals(1, runtime.getBreakerStats("health").getTotalRequests());
    }

    @Test
    void testDependencyHealthFollowsBreaker() throws Exception {
        FlakyHealthService service = new FlakyHealthService();
        service.failWith(Status.UNAVAILABLE, 100);
        runtime.server().addService("health", service);
        runtime.server().start();
        runtime.channels().createStub("health", HealthGrpc::newBlockingStub);
        List<HealthChangeEvent> events = new CopyOnWriteArrayList<>();
        CountDownLatch opened = new CountDownLatch(1);
        Disposable subscription = runtime.subscribeToHealthChanges(event -> {
            events.add(event);
            opened.countDown();
        });

        assertEquals(HealthState.UNKNOWN, runtime.getDependencyHealth("health"));
        for (int i = 0; i < 2; i++) {
            assertThrows(RuntimeException.class,
                () -> runtime.channels().call("health", HealthGrpc.HealthBlockingStub::check, REQUEST, null, 0));
        }

        assertEquals(CircuitBreakerState.OPEN, runtime.getBreakerStats("health").getState());
        assertEquals(HealthState.UNHEALTHY, runtime.getDependencyHealth("health"));
        assertTrue(opened.await(5, TimeUnit.SECONDS));
        assertEquals(1, events.size());
        assertEquals(HealthChangeEvent.Source.CIRCUIT_BREAKER, events.get(0).getSource());
        assertEquals(HealthState.UNHEALTHY, events.get(0).getCurrentState());
        subscription.dispose();
    }

    @Test
    void testDnsFallbackForUnknownService() throws Exception {
        when(dnsClient.query("inventory.mesh.internal", RecordType.SRV))
            .thenThrow(DnsLookupException.notFound("inventory.mesh.internal", RecordType.SRV));
        when(dnsClient.query("inventory.mesh.internal", RecordType.A))
            .thenReturn(List.of(ServiceEndpointRecord.a("10.0.0.8", Duration.ofSeconds(30))));

        String endpoint = runtime.channels().createChannel("inventory").getEndpoint();

        assertEquals("10.0.0.8:9000", endpoint);
        assertEquals(1, runtime.getCacheStats().getTotalEntries());
    }

    @Test
    void testMeshHealthSnapshot() {
        runtime.server().addService("health", new FlakyHealthService());
        runtime.channels().createChannel("health");
        runtime.resilience().getCircuitBreaker("health");

        MeshHealthSnapshot snapshot = runtime.getMeshHealth();

        assertEquals(1, snapshot.getBreakers().size());
        assertEquals(0, snapshot.getOpenBreakers());
        assertEquals(1, snapshot.getChannels().size());
        assertEquals(1, snapshot.getServer().getServicesCount());
        assertFalse(snapshot.getServer().isRunning());
        assertEquals(clock.instant(), snapshot.getTimestamp());
    }

    @Test
    void testCloseIsIdempotent() {
        runtime.server().start();

        runtime.close();
        assertDoesNotThrow(() -> runtime.close());

        assertThrows(IllegalStateException.class, () -> runtime.channels());
        assertThrows(IllegalStateException.class, () -> runtime.subscribeToHealthChanges(event -> { }));
    }
}
