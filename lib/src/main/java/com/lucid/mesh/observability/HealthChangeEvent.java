package com.lucid.mesh.observability;

import com.lucid.mesh.model.HealthState;

import java.time.Instant;

/**
 * A change in the reachability of a dependency (client side) or of a
 * locally served service (server side).
 */
public final class HealthChangeEvent {
    
    /**
     * Which side of the mesh reported the change.
     */
    public enum Source {
        CIRCUIT_BREAKER,
        SERVER
    }
    
    private final Source source;
    private final String name;
    private final HealthState previousState;
    private final HealthState currentState;
    private final Instant timestamp;
    
    public HealthChangeEvent(Source source, String name, HealthState previousState,
                             HealthState currentState, Instant timestamp) {
        this.source = source;
        this.name = name;
        this.previousState = previousState;
        this.currentState = currentState;
        this.timestamp = timestamp;
    }
    
    public Source getSource() {
        return source;
    }
    
    public String getName() {
        return name;
    }
    
    public HealthState getPreviousState() {
        return previousState;
    }
    
    public HealthState getCurrentState() {
        return currentState;
    }
    
    public Instant getTimestamp() {
        return timestamp;
    }
    
    @Override
    public String toString() {
        return String.format("HealthChangeEvent{source=%s, name='%s', %s -> %s, at=%s}",
            source, name, previousState, currentState, timestamp);
    }
}
