package com.lucid.mesh.discovery;

import java.util.Objects;
import java.util.Optional;

/**
 * A concrete network location: host name or address plus port.
 */
public final class HostPort {

    private final String host;
    private final int port;

    private HostPort(String host, int port) {
        this.host = host;
        this.port = port;
    }

    public static HostPort of(String host, int port) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Host must not be blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
        return new HostPort(host, port);
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    /**
     * Returns the address in "host:port" form, usable as a gRPC target.
     */
    public String toAddress() {
        return host + ":" + port;
    }

    /**
     * Parses a string in "host:port" format.
     * <p>
     * Valid examples: "localhost:50051", "10.0.0.5:9090", "auth.mesh.internal:50052".
     * Invalid: "localhost", ":8080", "host:", "host:abc", "host:99999".
     *
     * @param s the string to parse (may be null or blank)
     * @return Optional containing HostPort if valid, empty otherwise
     */
    public static Optional<HostPort> parse(String s) {
        if (s == null || s.isBlank()) {
            return Optional.empty();
        }
        String trimmed = s.trim();
        int colon = trimmed.lastIndexOf(':');
        if (colon <= 0 || colon == trimmed.length() - 1) {
            return Optional.empty();
        }
        String hostPart = trimmed.substring(0, colon);
        String portPart = trimmed.substring(colon + 1);
        if (hostPart.isBlank()) {
            return Optional.empty();
        }
        try {
            int port = Integer.parseInt(portPart);
            if (port > 0 && port <= 65535) {
                return Optional.of(new HostPort(hostPart, port));
            }
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HostPort)) {
            return false;
        }
        HostPort other = (HostPort) o;
        return port == other.port && host.equals(other.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port);
    }

    @Override
    public String toString() {
        return toAddress();
    }
}
