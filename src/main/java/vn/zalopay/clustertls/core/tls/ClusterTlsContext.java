package vn.zalopay.clustertls.core.tls;

import lombok.Getter;

import java.util.List;
import java.util.Optional;

import javax.net.ssl.KeyManager;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;

/**
 * Ready to use TLS client configuration for one cluster.
 *
 * <p>Holds the initialised {@link SSLContext} together with the managers it was built from, so the
 * same material can be handed to clients that take managers rather than a context.
 */
public final class ClusterTlsContext {
    @Getter private final SSLContext sslContext;
    private final KeyManager[] keyManagers;
    private final TrustManager[] trustManagers;
    private final KeyStoreEntry clientIdentity;
    /** Explicitly configured anchors; empty when {@link #getTrustSource()} is DEFAULT. */
    @Getter private final List<KeyStoreEntry> trustEntries;

    @Getter private final TrustSource trustSource;

    ClusterTlsContext(
            SSLContext sslContext,
            KeyManager[] keyManagers,
            TrustManager[] trustManagers,
            KeyStoreEntry clientIdentity,
            List<KeyStoreEntry> trustEntries,
            TrustSource trustSource) {
        this.sslContext = sslContext;
        this.keyManagers = keyManagers.clone();
        this.trustManagers = trustManagers.clone();
        this.clientIdentity = clientIdentity;
        this.trustEntries = trustEntries;
        this.trustSource = trustSource;
    }

    public KeyManager[] getKeyManagers() {
        return keyManagers.clone();
    }

    public TrustManager[] getTrustManagers() {
        return trustManagers.clone();
    }

    public boolean hasClientIdentity() {
        return clientIdentity != null;
    }

    public Optional<KeyStoreEntry> getClientIdentity() {
        return Optional.ofNullable(clientIdentity);
    }

    @Override
    public String toString() {
        return "ClusterTlsContext{protocol="
                + sslContext.getProtocol()
                + ", clientIdentity="
                + (clientIdentity == null ? "none" : clientIdentity.getAlias())
                + ", trustSource="
                + trustSource
                + ", trustEntries="
                + trustEntries.size()
                + '}';
    }
}
