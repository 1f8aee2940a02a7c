package com.lucid.mesh.discovery;

import java.util.List;

/**
 * Picks one endpoint out of the resolved candidates for a service.
 */
public interface EndpointSelector {
    
    /**
     * @param candidates non-empty list of resolved endpoints
     */
    HostPort select(String serviceName, List<HostPort> candidates);
}
