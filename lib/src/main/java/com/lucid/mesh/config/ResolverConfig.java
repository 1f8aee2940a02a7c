package com.lucid.mesh.config;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * DNS resolver configuration: cache lifetime, domain naming convention
 * and per-service domain overrides.
 */
public class ResolverConfig {
    
    public static final String DEFAULT_DOMAIN_SUFFIX = "mesh.internal";
    
    private final Duration cacheTtl;
    private final String domainSuffix;
    private final Map<String, String> serviceDomains;
    private final Duration queryTimeout;
    private final int defaultPort;
    
    private ResolverConfig(Builder builder) {
        this.cacheTtl = builder.cacheTtl;
        this.domainSuffix = builder.domainSuffix;
        this.serviceDomains = Map.copyOf(builder.serviceDomains);
        this.queryTimeout = builder.queryTimeout;
        this.defaultPort = builder.defaultPort;
    }
    
    public Duration getCacheTtl() {
        return cacheTtl;
    }
    
    /**
     * Suffix appended to a service name when no explicit domain is mapped:
     * {@code <service>.<suffix>}.
     */
    public String getDomainSuffix() {
        return domainSuffix;
    }
    
    public Map<String, String> getServiceDomains() {
        return serviceDomains;
    }
    
    public Duration getQueryTimeout() {
        return queryTimeout;
    }
    
    /**
     * Port paired with A records when a caller does not provide one.
     */
    public int getDefaultPort() {
        return defaultPort;
    }
    
    public static ResolverConfig defaultConfig() {
        return builder().build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private Duration cacheTtl = Duration.ofSeconds(300);
        private String domainSuffix = DEFAULT_DOMAIN_SUFFIX;
        private final Map<String, String> serviceDomains = new HashMap<>();
        private Duration queryTimeout = Duration.ofSeconds(5);
        private int defaultPort = 50051;
        
        public Builder cacheTtl(Duration ttl) {
            this.cacheTtl = ttl;
            return this;
        }
        
        public Builder domainSuffix(String suffix) {
            this.domainSuffix = suffix;
            return this;
        }
        
        public Builder serviceDomain(String serviceName, String domain) {
            this.serviceDomains.put(serviceName, domain);
            return this;
        }
        
        public Builder serviceDomains(Map<String, String> domains) {
            this.serviceDomains.putAll(domains);
            return this;
        }
        
        public Builder queryTimeout(Duration timeout) {
            this.queryTimeout = timeout;
            return this;
        }
        
        public Builder defaultPort(int port) {
            this.defaultPort = port;
            return this;
        }
        
        public ResolverConfig build() {
            if (cacheTtl == null || cacheTtl.isNegative()) {
                throw new IllegalArgumentException("Cache TTL must be a non-negative duration");
            }
            if (domainSuffix == null || domainSuffix.isBlank()) {
                throw new IllegalArgumentException("Domain suffix must be specified");
            }
            if (queryTimeout == null || queryTimeout.isNegative() || queryTimeout.isZero()) {
                throw new IllegalArgumentException("Query timeout must be a positive duration");
            }
            if (defaultPort <= 0 || defaultPort > 65535) {
                throw new IllegalArgumentException("Default port must be between 1 and 65535");
            }
            return new ResolverConfig(this);
        }
    }
}
