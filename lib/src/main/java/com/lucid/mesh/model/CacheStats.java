package com.lucid.mesh.model;

import java.time.Duration;

/**
 * Resolver cache statistics, evaluated against the clock at the time they are taken.
 */
public final class CacheStats {
    
    private final int totalEntries;
    private final int validEntries;
    private final int expiredEntries;
    private final Duration ttl;
    
    public CacheStats(int totalEntries, int validEntries, int expiredEntries, Duration ttl) {
        this.totalEntries = totalEntries;
        this.validEntries = validEntries;
        this.expiredEntries = expiredEntries;
        this.ttl = ttl;
    }
    
    public int getTotalEntries() {
        return totalEntries;
    }
    
    public int getValidEntries() {
        return validEntries;
    }
    
    public int getExpiredEntries() {
        return expiredEntries;
    }
    
    public Duration getTtl() {
        return ttl;
    }
    
    @Override
    public String toString() {
        return String.format("CacheStats{total=%d, valid=%d, expired=%d, ttl=%s}",
            totalEntries, validEntries, expiredEntries, ttl);
    }
}
