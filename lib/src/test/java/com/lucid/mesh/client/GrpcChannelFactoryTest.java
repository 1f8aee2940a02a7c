package com.lucid.mesh.client;

import com.lucid.mesh.config.ChannelOptions;
import io.grpc.ConnectivityState;
import io.grpc.ManagedChannel;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class GrpcChannelFactoryTest {

    @Test
    void testCreatesIdleChannelForTarget() {
        ChannelOptions options = ChannelOptions.builder()
            .keepAliveTime(Duration.ofSeconds(5))
            .minTimeBetweenPings(Duration.ofSeconds(20))
            .build();

        ManagedChannel channel = new GrpcChannelFactory().create("orders", "localhost:50051", options);
        try {
            assertEquals("localhost:50051", channel.authority());
            assertEquals(ConnectivityState.IDLE, channel.getState(false));
            assertEquals(Duration.ofSeconds(20), options.getEffectiveKeepAliveTime());
        } finally {
            channel.shutdownNow();
        }
    }
}
