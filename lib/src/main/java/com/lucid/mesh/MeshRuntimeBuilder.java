package com.lucid.mesh;

import com.lucid.mesh.client.ChannelFactory;
import com.lucid.mesh.client.GrpcChannelFactory;
import com.lucid.mesh.config.MeshConfiguration;
import com.lucid.mesh.config.ServerConfig;
import com.lucid.mesh.discovery.DnsClient;
import com.lucid.mesh.discovery.EndpointSelector;
import com.lucid.mesh.discovery.RandomEndpointSelector;
import com.lucid.mesh.impl.DefaultMeshRuntime;
import com.lucid.mesh.server.ServerRegistry;
import io.grpc.ServerBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.util.function.Function;

/**
 * Builder for creating MeshRuntime instances.
 * Transport, DNS and clock can be replaced, which is mostly useful in tests.
 */
public class MeshRuntimeBuilder {
    
    private MeshConfiguration configuration = MeshConfiguration.defaultConfig();
    private MeterRegistry meterRegistry;
    private DnsClient dnsClient;
    private EndpointSelector endpointSelector = new RandomEndpointSelector();
    private ChannelFactory channelFactory = new GrpcChannelFactory();
    private Function<ServerConfig, ServerBuilder<?>> serverBuilderFactory = ServerRegistry::networkServerBuilder;
    private Clock clock = Clock.systemUTC();
    
    /**
     * Create a new mesh runtime with the given configuration.
     * 
     * @param configuration The mesh configuration
     * @return A new MeshRuntime instance
     */
    public static MeshRuntime create(MeshConfiguration configuration) {
        return builder().configuration(configuration).build();
    }
    
    public static MeshRuntimeBuilder builder() {
        return new MeshRuntimeBuilder();
    }
    
    public MeshRuntimeBuilder configuration(MeshConfiguration configuration) {
        this.configuration = configuration;
        return this;
    }
    
    public MeshRuntimeBuilder meterRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        return this;
    }
    
    public MeshRuntimeBuilder dnsClient(DnsClient dnsClient) {
        this.dnsClient = dnsClient;
        return this;
    }
    
    public MeshRuntimeBuilder endpointSelector(EndpointSelector endpointSelector) {
        this.endpointSelector = endpointSelector;
        return this;
    }
    
    public MeshRuntimeBuilder channelFactory(ChannelFactory channelFactory) {
        this.channelFactory = channelFactory;
        return this;
    }
    
    public MeshRuntimeBuilder serverBuilderFactory(Function<ServerConfig, ServerBuilder<?>> serverBuilderFactory) {
        this.serverBuilderFactory = serverBuilderFactory;
        return this;
    }
    
    public MeshRuntimeBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }
    
    public MeshRuntime build() {
        if (configuration == null) {
            throw new IllegalStateException("Mesh configuration is required");
        }
        return new DefaultMeshRuntime(
            configuration,
            meterRegistry != null ? meterRegistry : new SimpleMeterRegistry(),
            dnsClient,
            endpointSelector,
            channelFactory,
            serverBuilderFactory,
            clock);
    }
}
