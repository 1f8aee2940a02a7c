package com.lucid.mesh.discovery;

import com.lucid.mesh.config.ResolverConfig;
import com.lucid.mesh.model.CacheStats;
import com.lucid.mesh.model.RecordType;
import com.lucid.mesh.model.ServiceEndpointRecord;
import com.lucid.mesh.observability.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves logical service names to endpoints through DNS, caching answers per
 * (service, record type) for a fixed TTL.
 * <p>
 * A service maps to {@code <service>.<suffix>} unless an explicit domain is
 * registered for it. Lookup failures are logged and yield an empty list.
 */
public class ServiceResolver {
    
    private static final Logger logger = LoggerFactory.getLogger(ServiceResolver.class);
    
    private final ResolverConfig config;
    private final DnsClient dnsClient;
    private final EndpointSelector selector;
    private final MetricsCollector metricsCollector;
    private final Clock clock;
    private final ConcurrentHashMap<String, String> serviceDomains;
    private final ConcurrentHashMap<CacheKey, CacheEntry> cache;
    
    public ServiceResolver(ResolverConfig config) {
        this(config, new DnsjavaClient(config.getQueryTimeout()), new RandomEndpointSelector(),
            new MetricsCollector(), Clock.systemUTC());
    }
    
    public ServiceResolver(ResolverConfig config, DnsClient dnsClient, EndpointSelector selector,
                           MetricsCollector metricsCollector, Clock clock) {
        this.config = config;
        this.dnsClient = dnsClient;
        this.selector = selector;
        this.metricsCollector = metricsCollector;
        this.clock = clock;
        this.serviceDomains = new ConcurrentHashMap<>(config.getServiceDomains());
        this.cache = new ConcurrentHashMap<>();
    }
    
    /**
     * Resolves the A records of a service.
     */
    public List<ServiceEndpointRecord> resolve(String serviceName) {
        return resolve(serviceName, RecordType.A);
    }
    
    /**
     * Resolves records named by a type string ("A", "AAAA" or "SRV").
     * Any other type is logged and yields an empty list.
     */
    public List<ServiceEndpointRecord> resolve(String serviceName, String recordType) {
        Optional<RecordType> type = RecordType.parse(recordType);
        if (type.isEmpty()) {
            logger.error("Unsupported DNS record type '{}' requested for service {}", recordType, serviceName);
            return List.of();
        }
        return resolve(serviceName, type.get());
    }
    
    public List<ServiceEndpointRecord> resolve(String serviceName, RecordType recordType) {
        CacheKey key = new CacheKey(serviceName, recordType);
        CacheEntry cached = cache.get(key);
        if (cached != null && cached.isValid(clock.instant(), config.getCacheTtl())) {
            metricsCollector.recordCacheLookup(serviceName, true);
            logger.trace("Cache hit for {} {}", recordType, serviceName);
            return cached.records;
        }
        metricsCollector.recordCacheLookup(serviceName, false);
        
        String domain = getServiceDomain(serviceName);
        try {
            List<ServiceEndpointRecord> records = List.copyOf(dnsClient.query(domain, recordType));
            cache.put(key, new CacheEntry(records, clock.instant()));
            logger.debug("Resolved {} {} ({}) to {}", recordType, serviceName, domain, records);
            return records;
        } catch (DnsLookupException e) {
            metricsCollector.recordDnsFailure(serviceName, recordType);
            if (e.isNotFound()) {
                logger.debug("No {} records for service {} ({})", recordType, serviceName, domain);
            } else {
                logger.warn("DNS resolution failed for service {}: {}", serviceName, e.getMessage());
            }
            return List.of();
        }
    }
    
    /**
     * Resolves a service to concrete host/port pairs. SRV records win when present
     * and are ordered by ascending priority; otherwise A records are paired with
     * {@code defaultPort}.
     */
    public List<HostPort> resolveWithPort(String serviceName, int defaultPort) {
        List<ServiceEndpointRecord> srvRecords = resolve(serviceName, RecordType.SRV);
        List<HostPort> endpoints = new ArrayList<>();
        if (!srvRecords.isEmpty()) {
            List<ServiceEndpointRecord> sorted = new ArrayList<>(srvRecords);
            sorted.sort(Comparator.comparingInt(ServiceEndpointRecord::getPriority));
            for (ServiceEndpointRecord record : sorted) {
                endpoints.add(HostPort.of(record.getHost(), record.getPort()));
            }
            return endpoints;
        }
        
        for (ServiceEndpointRecord record : resolve(serviceName, RecordType.A)) {
            endpoints.add(HostPort.of(record.getHost(), defaultPort));
        }
        return endpoints;
    }
    
    public List<HostPort> resolveWithPort(String serviceName) {
        return resolveWithPort(serviceName, config.getDefaultPort());
    }
    
    /**
     * Resolves a service and picks one endpoint using the configured selector.
     */
    public Optional<HostPort> resolveOne(String serviceName, int defaultPort) {
        List<HostPort> candidates = resolveWithPort(serviceName, defaultPort);
        if (candidates.isEmpty()) {
            logger.warn("No endpoints resolved for service {}", serviceName);
            return Optional.empty();
        }
        return Optional.of(selector.select(serviceName, candidates));
    }
    
    public Optional<HostPort> resolveOne(String serviceName) {
        return resolveOne(serviceName, config.getDefaultPort());
    }
    
    public void clearCache() {
        int size = cache.size();
        cache.clear();
        logger.info("Cleared resolver cache ({} entries)", size);
    }
    
    public CacheStats getCacheStats() {
        Instant now = clock.instant();
        int total = 0;
        int valid = 0;
        for (CacheEntry entry : cache.values()) {
            total++;
            if (entry.isValid(now, config.getCacheTtl())) {
                valid++;
            }
        }
        return new CacheStats(total, valid, total - valid, config.getCacheTtl());
    }
    
    /**
     * Maps a service to an explicit domain. Cached answers for the service are dropped.
     */
    public void addServiceDomain(String serviceName, String domain) {
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("Domain must not be blank");
        }
        serviceDomains.put(serviceName, domain);
        evict(serviceName);
        logger.info("Service {} now resolves via {}", serviceName, domain);
    }
    
    public boolean removeServiceDomain(String serviceName) {
        boolean removed = serviceDomains.remove(serviceName) != null;
        if (removed) {
            evict(serviceName);
        }
        return removed;
    }
    
    public String getServiceDomain(String serviceName) {
        String domain = serviceDomains.get(serviceName);
        return domain != null ? domain : serviceName + "." + config.getDomainSuffix();
    }
    
    public Map<String, String> getServiceDomains() {
        return Map.copyOf(serviceDomains);
    }
    
    public ResolverConfig getConfig() {
        return config;
    }
    
    private void evict(String serviceName) {
        cache.keySet().removeIf(key -> key.serviceName.equals(serviceName));
    }
    
    private static final class CacheKey {
        private final String serviceName;
        private final RecordType recordType;
        
        CacheKey(String serviceName, RecordType recordType) {
            this.serviceName = serviceName;
            this.recordType = recordType;
        }
        
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof CacheKey)) return false;
            CacheKey other = (CacheKey) o;
            return serviceName.equals(other.serviceName) && recordType == other.recordType;
        }
        
        @Override
        public int hashCode() {
            return Objects.hash(serviceName, recordType);
        }
    }
    
    private static final class CacheEntry {
        private final List<ServiceEndpointRecord> records;
        private final Instant timestamp;
        
        CacheEntry(List<ServiceEndpointRecord> records, Instant timestamp) {
            this.records = records;
            this.timestamp = timestamp;
        }
        
        boolean isValid(Instant now, Duration ttl) {
            return Duration.between(timestamp, now).compareTo(ttl) < 0;
        }
    }
}
