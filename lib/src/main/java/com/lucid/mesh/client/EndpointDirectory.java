package com.lucid.mesh.client;

import com.lucid.mesh.discovery.HostPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Static mapping from service name to "host:port" address, consulted when a
 * channel is created without an explicit endpoint.
 */
public class EndpointDirectory {
    
    private static final Logger logger = LoggerFactory.getLogger(EndpointDirectory.class);
    
    private final Map<String, String> endpoints = new LinkedHashMap<>();
    
    public EndpointDirectory() {
    }
    
    public EndpointDirectory(Map<String, String> initial) {
        initial.forEach(this::addEndpoint);
    }
    
    /**
     * Adds or replaces the address of a service.
     *
     * @throws IllegalArgumentException if the address is not in "host:port" form
     */
    public synchronized void addEndpoint(String serviceName, String address) {
        if (HostPort.parse(address).isEmpty()) {
            throw new IllegalArgumentException("Invalid endpoint for " + serviceName + ": " + address);
        }
        String previous = endpoints.put(serviceName, address);
        if (previous != null && !previous.equals(address)) {
            logger.info("Endpoint for {} changed from {} to {}", serviceName, previous, address);
        }
    }
    
    public synchronized boolean removeEndpoint(String serviceName) {
        return endpoints.remove(serviceName) != null;
    }
    
    public synchronized Optional<String> lookup(String serviceName) {
        return Optional.ofNullable(endpoints.get(serviceName));
    }
    
    public synchronized Map<String, String> listEndpoints() {
        return Map.copyOf(endpoints);
    }
}
