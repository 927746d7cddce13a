package vn.zalopay.clustertls.core.config;

import lombok.Builder;
import lombok.Data;

/**
 * TLS related fields of a cluster connection configuration (kubeconfig style).
 *
 * <p>All fields are optional. The loader that fills this object lives elsewhere; this class only
 * splits the fields into the identity and trust inputs consumed by the resolvers.
 */
@Data
@Builder
public class ClusterTlsConfig {
    private final String clientCertData;
    private final String clientCertFile;
    private final String clientKeyData;
    private final String clientKeyFile;
    private final String clientKeyPass;
    private final String caCertData;
    private final String caCertFile;

    public ClientIdentityInput clientIdentity() {
        return ClientIdentityInput.builder()
                .certData(clientCertData)
                .certFile(clientCertFile)
                .keyData(clientKeyData)
                .keyFile(clientKeyFile)
                .keyPass(clientKeyPass)
                .build();
    }

    public TrustInput trust() {
        return TrustInput.builder().caCertData(caCertData).caCertFile(caCertFile).build();
    }

    @Override
    public String toString() {
        return "ClusterTlsConfig{" + clientIdentity() + ", " + trust() + '}';
    }
}
