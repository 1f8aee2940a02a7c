package com.lucid.mesh.discovery;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cycles through the candidates of each service in order.
 */
public class RoundRobinEndpointSelector implements EndpointSelector {
    
    private final ConcurrentHashMap<String, AtomicInteger> positions = new ConcurrentHashMap<>();
    
    @Override
    public HostPort select(String serviceName, List<HostPort> candidates) {
        int next = positions.computeIfAbsent(serviceName, name -> new AtomicInteger()).getAndIncrement();
        return candidates.get(Math.floorMod(next, candidates.size()));
    }
}
