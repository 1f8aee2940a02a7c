package com.lucid.mesh.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MeshConfigurationTest {

    @Test
    void testDefaults() {
        MeshConfiguration config = MeshConfiguration.defaultConfig();

        assertTrue(config.getEndpoints().isEmpty());
        assertTrue(config.isDnsFallbackEnabled());
        assertEquals(50051, config.getServerConfig().getPort());
        assertTrue(config.getServerConfig().isHealthServiceEnabled());
        assertEquals(Duration.ofSeconds(300), config.getResolverConfig().getCacheTtl());
        assertEquals(ResolverConfig.DEFAULT_DOMAIN_SUFFIX, config.getResolverConfig().getDomainSuffix());
    }

    @Test
    void testEndpointsAndOverrides() {
        BreakerConfig payments = BreakerConfig.builder()
            .failureThreshold(3)
            .recoveryTimeout(Duration.ofSeconds(2))
            .successThreshold(2)
            .build();

        MeshConfiguration config = MeshConfiguration.builder()
            .endpoint("payments", "payments.mesh.internal:50051")
            .endpoints(Map.of("orders", "10.0.0.3:50051"))
            .breaker("payments", payments)
            .dnsFallbackEnabled(false)
            .build();

        assertEquals(2, config.getEndpoints().size());
        assertSame(payments, config.getBreakerOverrides().get("payments"));
        assertFalse(config.isDnsFallbackEnabled());
    }

    @Test
    void testInvalidEndpointRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> MeshConfiguration.builder().endpoint("payments", "payments.mesh.internal").build());

        assertTrue(e.getMessage().contains("payments"));
    }

    @Test
    void testComponentValidation() {
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.builder().workerThreads(0).build());
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.builder().port(70000).build());
        assertThrows(IllegalArgumentException.class, () -> ResolverConfig.builder().domainSuffix("").build());
        assertThrows(IllegalArgumentException.class, () -> ResolverConfig.builder().defaultPort(0).build());
        assertThrows(IllegalArgumentException.class, () -> ChannelOptions.builder().maxInboundMessageSize(0).build());
    }

    @Test
    void testResolverServiceDomains() {
        ResolverConfig config = ResolverConfig.builder()
            .serviceDomain("auth-service", "auth.prod.example.com")
            .build();

        assertEquals(Map.of("auth-service", "auth.prod.example.com"), config.getServiceDomains());
    }
}
