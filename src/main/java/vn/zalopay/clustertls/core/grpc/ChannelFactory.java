package vn.zalopay.clustertls.core.grpc;

import com.google.common.net.HostAndPort;

import io.grpc.ChannelCredentials;
import io.grpc.Grpc;
import io.grpc.ManagedChannel;
import io.grpc.TlsChannelCredentials;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import vn.zalopay.clustertls.core.tls.ClusterTlsContext;

/** Attaches a {@link ClusterTlsContext} to gRPC channels through the Credentials API. */
public class ChannelFactory {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChannelFactory.class);

    public static ChannelFactory create() {
        return new ChannelFactory();
    }

    private ChannelFactory() {}

    public ManagedChannel createChannel(HostAndPort endpoint, ClusterTlsContext tls) {
        LOGGER.debug("Creating TLS channel to {} (client identity: {})", endpoint, tls.hasClientIdentity());
        return Grpc.newChannelBuilderForAddress(
                        endpoint.getHost(), endpoint.getPort(), credentials(tls))
                .build();
    }

    public ChannelCredentials credentials(ClusterTlsContext tls) {
        return TlsChannelCredentials.newBuilder()
                .keyManager(tls.getKeyManagers())
                .trustManager(tls.getTrustManagers())
                .build();
    }
}
