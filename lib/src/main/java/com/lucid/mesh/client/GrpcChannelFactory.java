package com.lucid.mesh.client;

import com.lucid.mesh.config.ChannelOptions;
import io.grpc.ChannelCredentials;
import io.grpc.Grpc;
import io.grpc.InsecureChannelCredentials;
import io.grpc.ManagedChannel;
import io.grpc.TlsChannelCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Builds network channels with the configured keep-alive behaviour.
 * The channel connects lazily on first use.
 */
public class GrpcChannelFactory implements ChannelFactory {
    
    private static final Logger logger = LoggerFactory.getLogger(GrpcChannelFactory.class);
    
    private static final String USER_AGENT = "lucid-mesh";
    
    @Override
    public ManagedChannel create(String serviceName, String target, ChannelOptions options) {
        ChannelCredentials credentials = options.isPlaintext()
            ? InsecureChannelCredentials.create()
            : TlsChannelCredentials.create();
        
        logger.debug("Building channel for {} to {} ({})", serviceName, target, options);
        return Grpc.newChannelBuilder(target, credentials)
            .keepAliveTime(options.getEffectiveKeepAliveTime().toMillis(), TimeUnit.MILLISECONDS)
            .keepAliveTimeout(options.getKeepAliveTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .keepAliveWithoutCalls(options.isKeepAliveWithoutCalls())
            .maxInboundMessageSize(options.getMaxInboundMessageSize())
            .userAgent(USER_AGENT)
            .build();
    }
}
