package vn.zalopay.clustertls.core.tls;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import vn.zalopay.clustertls.core.config.ClusterTlsConfig;
import vn.zalopay.clustertls.exception.CryptoProviderException;

import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import javax.net.ssl.KeyManager;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;

/**
 * Builds a {@link ClusterTlsContext} from a {@link ClusterTlsConfig}.
 *
 * <p>Building reads files and initialises JCA factories, so it blocks. Latency sensitive callers
 * should use {@link #buildAsync(ClusterTlsConfig, Executor)} with an executor meant for blocking
 * work. Each call assembles fresh stores; only the default stores are shared.
 */
public class TlsContextBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(TlsContextBuilder.class);
    private static final String DEFAULT_PROTOCOL = "TLS";

    private final DefaultStores defaultStores;
    private final ClientIdentityResolver identityResolver;
    private final TrustResolver trustResolver;
    private String protocol = DEFAULT_PROTOCOL;

    public TlsContextBuilder(
            DefaultStores defaultStores,
            ClientIdentityResolver identityResolver,
            TrustResolver trustResolver) {
        this.defaultStores = Objects.requireNonNull(defaultStores, "Default stores required");
        this.identityResolver = Objects.requireNonNull(identityResolver, "Identity resolver required");
        this.trustResolver = Objects.requireNonNull(trustResolver, "Trust resolver required");
    }

    /** Builder backed by the process default stores. */
    public static TlsContextBuilder create() {
        return new TlsContextBuilder(
                DefaultStores.system(), new ClientIdentityResolver(), new TrustResolver());
    }

    /**
     * Set TLS Protocol, defaults to TLS without a specific version number.
     *
     * @param protocol TLS Protocol
     * @return Builder
     */
    public TlsContextBuilder protocol(String protocol) {
        this.protocol = Objects.requireNonNull(protocol, "Protocol required");
        return this;
    }

    public ClusterTlsContext build(ClusterTlsConfig config) {
        KeyStoreAssembler identityAssembler = new KeyStoreAssembler();
        Optional<KeyStoreEntry> identity =
                identityResolver.resolve(config.clientIdentity(), identityAssembler);

        KeyStore keyStore;
        char[] keyPassword;
        if (identity.isPresent()) {
            keyStore = identityAssembler.toKeyStore();
            keyPassword = identity.get().getPassphrase();
        } else {
            keyStore = defaultStores.keyStore();
            keyPassword = defaultStores.keyStorePassword();
        }

        KeyStoreAssembler trustAssembler = new KeyStoreAssembler();
        TrustSource trustSource = trustResolver.resolve(config.trust(), trustAssembler);
        KeyStore trustStore =
                trustSource == TrustSource.DEFAULT
                        ? defaultStores.trustStore()
                        : trustAssembler.toKeyStore();

        KeyManager[] keyManagers = keyManagers(keyStore, keyPassword);
        TrustManager[] trustManagers = trustManagers(trustStore);
        SSLContext sslContext = sslContext(keyManagers, trustManagers);

        ClusterTlsContext context =
                new ClusterTlsContext(
                        sslContext,
                        keyManagers,
                        trustManagers,
                        identity.orElse(null),
                        trustAssembler.getEntries(KeyStoreEntry.Kind.TRUST),
                        trustSource);
        LOGGER.info("Built TLS context {}", context);
        return context;
    }

    /** Runs {@link #build(ClusterTlsConfig)} on {@code executor}. */
    public CompletableFuture<ClusterTlsContext> buildAsync(
            ClusterTlsConfig config, Executor executor) {
        return CompletableFuture.supplyAsync(() -> build(config), executor);
    }

    private static KeyManager[] keyManagers(KeyStore keyStore, char[] password) {
        String algorithm = KeyManagerFactory.getDefaultAlgorithm();
        try {
            KeyManagerFactory factory = KeyManagerFactory.getInstance(algorithm);
            factory.init(keyStore, password);
            return factory.getKeyManagers();
        } catch (GeneralSecurityException e) {
            throw new CryptoProviderException(
                    "KeyManagerFactory [" + algorithm + "] initialization failed", e);
        }
    }

    private static TrustManager[] trustManagers(KeyStore trustStore) {
        String algorithm = TrustManagerFactory.getDefaultAlgorithm();
        try {
            TrustManagerFactory factory = TrustManagerFactory.getInstance(algorithm);
            factory.init(trustStore);
            return factory.getTrustManagers();
        } catch (GeneralSecurityException e) {
            throw new CryptoProviderException(
                    "TrustManagerFactory [" + algorithm + "] initialization failed", e);
        }
    }

    private SSLContext sslContext(KeyManager[] keyManagers, TrustManager[] trustManagers) {
        try {
            SSLContext sslContext = SSLContext.getInstance(protocol);
            sslContext.init(keyManagers, trustManagers, new SecureRandom());
            return sslContext;
        } catch (GeneralSecurityException e) {
            throw new CryptoProviderException(
                    "SSLContext creation failed with protocol [" + protocol + "]", e);
        }
    }
}
