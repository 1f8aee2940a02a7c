package com.lucid.mesh.server;

/**
 * Lifecycle of the local RPC listener. A stopped listener is not restarted.
 */
public enum ListenerState {
    NOT_STARTED,
    RUNNING,
    STOPPED
}
