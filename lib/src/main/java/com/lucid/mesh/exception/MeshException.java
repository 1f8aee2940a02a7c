package com.lucid.mesh.exception;

import io.grpc.Status;

import java.time.Duration;

/**
 * Base exception for failures raised by the mesh communication layer.
 */
public class MeshException extends RuntimeException {
    
    public MeshException(String message) {
        super(message);
    }
    
    public MeshException(String message, Throwable cause) {
        super(message, cause);
    }
    
    /**
     * Thrown when a circuit breaker rejects a call without attempting it.
     */
    public static class CircuitOpenException extends MeshException {
        private final String breakerName;
        private final Duration remainingOpenTime;
        
        public CircuitOpenException(String breakerName, Duration remainingOpenTime) {
            super(String.format("Circuit breaker '%s' is OPEN (retry in %dms)",
                               breakerName, remainingOpenTime.toMillis()));
            this.breakerName = breakerName;
            this.remainingOpenTime = remainingOpenTime;
        }
        
        public String getBreakerName() {
            return breakerName;
        }
        
        public Duration getRemainingOpenTime() {
            return remainingOpenTime;
        }
    }
    
    /**
     * Thrown when an RPC fails at the transport level and the retry budget is exhausted.
     */
    public static class TransportException extends MeshException {
        private final String serviceName;
        private final int attempts;
        private final Status status;
        
        public TransportException(String serviceName, int attempts, Throwable cause) {
            super(String.format("RPC to service '%s' failed after %d attempt(s): %s",
                               serviceName, attempts, Status.fromThrowable(cause)), cause);
            this.serviceName = serviceName;
            this.attempts = attempts;
            this.status = Status.fromThrowable(cause);
        }
        
        public String getServiceName() {
            return serviceName;
        }
        
        public int getAttempts() {
            return attempts;
        }
        
        public Status getStatus() {
            return status;
        }
    }
    
    /**
     * Thrown when the callee answered with a well-formed error. Never retried.
     */
    public static class ApplicationException extends MeshException {
        private final String serviceName;
        private final Status status;
        
        public ApplicationException(String serviceName, Throwable cause) {
            super(String.format("Service '%s' returned an error: %s",
                               serviceName, Status.fromThrowable(cause)), cause);
            this.serviceName = serviceName;
            this.status = Status.fromThrowable(cause);
        }
        
        public String getServiceName() {
            return serviceName;
        }
        
        public Status getStatus() {
            return status;
        }
    }
    
    /**
     * Thrown when a call names a service that has no stub.
     */
    public static class NoStubException extends MeshException {
        public NoStubException(String serviceName) {
            super(String.format("No stub found for service '%s'", serviceName));
        }
    }
    
    /**
     * Thrown when no channel exists or can be created for a service.
     */
    public static class NoChannelException extends MeshException {
        public NoChannelException(String serviceName, String reason) {
            super(String.format("No channel for service '%s': %s", serviceName, reason));
        }
    }
    
    /**
     * Thrown when starting a listener that is already running.
     */
    public static class AlreadyRunningException extends MeshException {
        public AlreadyRunningException(int port) {
            super(String.format("Server is already running on port %d", port));
        }
    }
    
    /**
     * Thrown when stopping or waiting on a listener that is not running.
     */
    public static class NotRunningException extends MeshException {
        public NotRunningException(String state) {
            super(String.format("Server is not running (state: %s)", state));
        }
    }
}
