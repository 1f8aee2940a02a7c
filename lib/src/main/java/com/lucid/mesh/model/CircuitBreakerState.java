package com.lucid.mesh.model;

/**
 * Circuit breaker state for a downstream dependency.
 */
public enum CircuitBreakerState {
    
    /**
     * Circuit breaker is closed - calls are attempted.
     */
    CLOSED,
    
    /**
     * Circuit breaker is open - calls fail fast without reaching the dependency.
     */
    OPEN,
    
    /**
     * Circuit breaker is half-open - trial calls are attempted to test recovery.
     */
    HALF_OPEN;
    
    /**
     * Maps the breaker state onto the health vocabulary shared with the server side.
     */
    public HealthState toHealthState() {
        return switch (this) {
            case CLOSED -> HealthState.HEALTHY;
            case HALF_OPEN -> HealthState.DEGRADED;
            case OPEN -> HealthState.UNHEALTHY;
        };
    }
}
