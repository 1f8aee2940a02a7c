package com.lucid.mesh.discovery;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Uniformly random selection. Spreads load without per-service state.
 */
public class RandomEndpointSelector implements EndpointSelector {
    
    @Override
    public HostPort select(String serviceName, List<HostPort> candidates) {
        return candidates.get(ThreadLocalRandom.current().nextInt(candidates.size()));
    }
}
