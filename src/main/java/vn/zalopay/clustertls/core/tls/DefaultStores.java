package vn.zalopay.clustertls.core.tls;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import vn.zalopay.clustertls.core.config.DefaultStoreSettings;
import vn.zalopay.clustertls.exception.CryptoProviderException;
import vn.zalopay.clustertls.exception.TlsIoException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.UnrecoverableKeyException;

/**
 * Default key store and trust store, each loaded at most once and shared afterwards.
 *
 * <p>Trust store lookup order: configured path, {@code jssecacerts} in the security directory if
 * it is a regular file, then {@code cacerts}. The key store is the configured file, or an empty
 * store when none is set. A failed load is not cached; the next call tries again.
 *
 * <p>The returned stores are shared and must not be modified.
 */
public class DefaultStores {
    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultStores.class);

    static final String ALTERNATE_TRUST_BUNDLE = "jssecacerts";
    static final String STANDARD_TRUST_BUNDLE = "cacerts";

    private static final Supplier<DefaultStores> SYSTEM =
            Suppliers.memoize(() -> new DefaultStores(DefaultStoreSettings.fromSystemProperties()));

    private final DefaultStoreSettings settings;
    private final Supplier<KeyStore> keyStore;
    private final Supplier<KeyStore> trustStore;

    public DefaultStores(DefaultStoreSettings settings) {
        this.settings = settings;
        this.keyStore = Suppliers.memoize(this::loadKeyStore);
        this.trustStore = Suppliers.memoize(this::loadTrustStore);
    }

    /** Stores configured by the {@code javax.net.ssl.*} system properties of this process. */
    public static DefaultStores system() {
        return SYSTEM.get();
    }

    public KeyStore keyStore() {
        return keyStore.get();
    }

    public KeyStore trustStore() {
        return trustStore.get();
    }

    /** Password protecting the entries of {@link #keyStore()}. */
    public char[] keyStorePassword() {
        return settings.keyStorePasswordChars();
    }

    /** Path the trust store is (or would be) loaded from. */
    Path trustStorePath() {
        if (!PemSources.isBlank(settings.getTrustStorePath())) {
            return Paths.get(settings.getTrustStorePath());
        }
        Path alternate = Paths.get(settings.getSecurityDirectory(), ALTERNATE_TRUST_BUNDLE);
        if (Files.isRegularFile(alternate)) {
            return alternate;
        }
        return Paths.get(settings.getSecurityDirectory(), STANDARD_TRUST_BUNDLE);
    }

    private KeyStore loadKeyStore() {
        if (PemSources.isBlank(settings.getKeyStorePath())) {
            LOGGER.debug("No default key store configured, starting from an empty key store");
            return KeyStoreAssembler.emptyKeyStore();
        }
        Path path = Paths.get(settings.getKeyStorePath());
        return load(path, settings.keyStorePasswordChars());
    }

    private KeyStore loadTrustStore() {
        return load(trustStorePath(), settings.trustStorePasswordChars());
    }

    private static KeyStore load(Path path, char[] password) {
        String type = KeyStore.getDefaultType();
        KeyStore store;
        try {
            store = KeyStore.getInstance(type);
        } catch (GeneralSecurityException e) {
            throw new CryptoProviderException("Key Store Type [" + type + "] unavailable", e);
        }
        try (InputStream in = Files.newInputStream(path)) {
            store.load(in, password);
        } catch (IOException e) {
            if (e.getCause() instanceof UnrecoverableKeyException) {
                throw new CryptoProviderException("Wrong password for key store " + path, e);
            }
            throw new TlsIoException(path.toString(), e);
        } catch (GeneralSecurityException e) {
            throw new CryptoProviderException("Loading key store " + path + " failed", e);
        }
        LOGGER.info("Loaded default store {}", path);
        return store;
    }
}
