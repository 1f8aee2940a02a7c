package com.lucid.mesh.discovery;

import com.lucid.mesh.model.RecordType;

/**
 * A DNS query produced no usable answer.
 */
public class DnsLookupException extends Exception {
    
    private final String domain;
    private final RecordType recordType;
    private final boolean notFound;
    
    public DnsLookupException(String domain, RecordType recordType, String reason, boolean notFound) {
        super(String.format("%s lookup for %s failed: %s", recordType, domain, reason));
        this.domain = domain;
        this.recordType = recordType;
        this.notFound = notFound;
    }
    
    public DnsLookupException(String domain, RecordType recordType, Throwable cause) {
        super(String.format("%s lookup for %s failed: %s", recordType, domain, cause.getMessage()), cause);
        this.domain = domain;
        this.recordType = recordType;
        this.notFound = false;
    }
    
    public static DnsLookupException notFound(String domain, RecordType recordType) {
        return new DnsLookupException(domain, recordType, "no such record", true);
    }
    
    public String getDomain() {
        return domain;
    }
    
    public RecordType getRecordType() {
        return recordType;
    }
    
    /**
     * True when the server answered authoritatively that the name or type does not exist.
     */
    public boolean isNotFound() {
        return notFound;
    }
}
