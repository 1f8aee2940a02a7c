package com.lucid.mesh.model;

import java.time.Duration;
import java.util.Objects;

/**
 * One DNS answer for a service. Address records carry only a host;
 * SRV records also carry port, priority and weight.
 */
public final class ServiceEndpointRecord {
    
    private final RecordType recordType;
    private final String host;
    private final int port;
    private final int priority;
    private final int weight;
    private final Duration ttl;
    
    private ServiceEndpointRecord(RecordType recordType, String host, int port,
                                  int priority, int weight, Duration ttl) {
        this.recordType = Objects.requireNonNull(recordType, "recordType");
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.priority = priority;
        this.weight = weight;
        this.ttl = ttl != null ? ttl : Duration.ZERO;
    }
    
    public static ServiceEndpointRecord a(String address, Duration ttl) {
        return new ServiceEndpointRecord(RecordType.A, address, 0, 0, 0, ttl);
    }
    
    public static ServiceEndpointRecord aaaa(String address, Duration ttl) {
        return new ServiceEndpointRecord(RecordType.AAAA, address, 0, 0, 0, ttl);
    }
    
    public static ServiceEndpointRecord srv(String host, int port, int priority, int weight, Duration ttl) {
        return new ServiceEndpointRecord(RecordType.SRV, host, port, priority, weight, ttl);
    }
    
    public RecordType getRecordType() {
        return recordType;
    }
    
    /**
     * Address for A/AAAA records, target host for SRV records.
     */
    public String getHost() {
        return host;
    }
    
    /**
     * @return the SRV port, or 0 for address records
     */
    public int getPort() {
        return port;
    }
    
    public int getPriority() {
        return priority;
    }
    
    public int getWeight() {
        return weight;
    }
    
    public Duration getTtl() {
        return ttl;
    }
    
    public boolean hasPort() {
        return recordType == RecordType.SRV && port > 0;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ServiceEndpointRecord)) {
            return false;
        }
        ServiceEndpointRecord that = (ServiceEndpointRecord) o;
        return port == that.port && priority == that.priority && weight == that.weight
            && recordType == that.recordType && host.equals(that.host) && ttl.equals(that.ttl);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(recordType, host, port, priority, weight, ttl);
    }
    
    @Override
    public String toString() {
        if (recordType == RecordType.SRV) {
            return String.format("SRV{host='%s', port=%d, priority=%d, weight=%d, ttl=%s}",
                host, port, priority, weight, ttl);
        }
        return String.format("%s{address='%s', ttl=%s}", recordType, host, ttl);
    }
}
