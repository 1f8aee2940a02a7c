package com.lucid.mesh.observability;

/**
 * Callback interface for mesh health change events.
 */
@FunctionalInterface
public interface HealthListener {
    /**
     * Called when a dependency or a locally served service changes health.
     *
     * @param event the change
     */
    void onHealthChange(HealthChangeEvent event);
}
