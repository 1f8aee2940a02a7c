package com.lucid.mesh.discovery;

import com.lucid.mesh.model.RecordType;
import com.lucid.mesh.model.ServiceEndpointRecord;

import java.util.List;

/**
 * Performs a single uncached DNS query.
 */
public interface DnsClient {
    
    /**
     * Queries {@code domain} for records of the given type.
     *
     * @return the answers, never empty
     * @throws DnsLookupException if the name or record type does not exist or the query fails
     */
    List<ServiceEndpointRecord> query(String domain, RecordType recordType) throws DnsLookupException;
}
