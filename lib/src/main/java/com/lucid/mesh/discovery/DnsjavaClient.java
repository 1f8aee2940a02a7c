package com.lucid.mesh.discovery;

import com.lucid.mesh.model.RecordType;
import com.lucid.mesh.model.ServiceEndpointRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xbill.DNS.AAAARecord;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.ExtendedResolver;
import org.xbill.DNS.Lookup;
import org.xbill.DNS.Record;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.SRVRecord;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link DnsClient} backed by dnsjava, using the system's configured name servers.
 * dnsjava's own cache is bypassed; caching is the resolver's job.
 */
public class DnsjavaClient implements DnsClient {
    
    private static final Logger logger = LoggerFactory.getLogger(DnsjavaClient.class);
    
    private final Resolver resolver;
    
    public DnsjavaClient(Duration queryTimeout) {
        this(new ExtendedResolver(), queryTimeout);
    }
    
    public DnsjavaClient(Resolver resolver, Duration queryTimeout) {
        this.resolver = resolver;
        this.resolver.setTimeout(queryTimeout);
    }
    
    @Override
    public List<ServiceEndpointRecord> query(String domain, RecordType recordType) throws DnsLookupException {
        Lookup lookup;
        try {
            lookup = new Lookup(domain, typeCode(recordType));
        } catch (TextParseException e) {
            throw new DnsLookupException(domain, recordType, e);
        }
        lookup.setResolver(resolver);
        lookup.setCache(null);
        
        Record[] answers = lookup.run();
        switch (lookup.getResult()) {
            case Lookup.SUCCESSFUL:
                break;
            case Lookup.HOST_NOT_FOUND:
            case Lookup.TYPE_NOT_FOUND:
                throw DnsLookupException.notFound(domain, recordType);
            default:
                throw new DnsLookupException(domain, recordType, lookup.getErrorString(), false);
        }
        
        List<ServiceEndpointRecord> records = new ArrayList<>();
        for (Record answer : answers) {
            ServiceEndpointRecord converted = convert(answer, recordType);
            if (converted != null) {
                records.add(converted);
            }
        }
        if (records.isEmpty()) {
            throw DnsLookupException.notFound(domain, recordType);
        }
        logger.trace("{} {} -> {}", recordType, domain, records);
        return records;
    }
    
    private static int typeCode(RecordType recordType) {
        switch (recordType) {
            case AAAA:
                return Type.AAAA;
            case SRV:
                return Type.SRV;
            case A:
            default:
                return Type.A;
        }
    }
    
    private static ServiceEndpointRecord convert(Record answer, RecordType recordType) {
        Duration ttl = Duration.ofSeconds(answer.getTTL());
        if (recordType == RecordType.A && answer instanceof ARecord) {
            return ServiceEndpointRecord.a(((ARecord) answer).getAddress().getHostAddress(), ttl);
        }
        if (recordType == RecordType.AAAA && answer instanceof AAAARecord) {
            return ServiceEndpointRecord.aaaa(((AAAARecord) answer).getAddress().getHostAddress(), ttl);
        }
        if (recordType == RecordType.SRV && answer instanceof SRVRecord) {
            SRVRecord srv = (SRVRecord) answer;
            return ServiceEndpointRecord.srv(srv.getTarget().toString(true), srv.getPort(),
                srv.getPriority(), srv.getWeight(), ttl);
        }
        return null;
    }
}
