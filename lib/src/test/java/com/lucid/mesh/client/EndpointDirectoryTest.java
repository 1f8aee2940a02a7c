package com.lucid.mesh.client;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EndpointDirectoryTest {

    @Test
    void testInitialEndpointsAreValidated() {
        assertThrows(IllegalArgumentException.class,
            () -> new EndpointDirectory(Map.of("orders", "orders.mesh.internal")));
    }

    @Test
    void testAddLookupRemove() {
        EndpointDirectory directory = new EndpointDirectory(Map.of("orders", "10.0.0.1:50051"));

        directory.addEndpoint("orders", "10.0.0.2:50051");

        assertEquals(Optional.of("10.0.0.2:50051"), directory.lookup("orders"));
        assertEquals(Map.of("orders", "10.0.0.2:50051"), directory.listEndpoints());
        assertTrue(directory.removeEndpoint("orders"));
        assertEquals(Optional.empty(), directory.lookup("orders"));
    }

    @Test
    void testListIsSnapshot() {
        EndpointDirectory directory = new EndpointDirectory();
        directory.addEndpoint("a", "a:1");
        Map<String, String> snapshot = directory.listEndpoints();

        directory.addEndpoint("b", "b:2");

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.put("c", "c:3"));
    }
}
