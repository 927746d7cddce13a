package vn.zalopay.clustertls.core.tls;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import vn.zalopay.clustertls.exception.CryptoProviderException;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.KeyStoreException;
import java.security.PrivateKey;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates identity and trust entries for one TLS context, then materialises them as a
 * {@link KeyStore}.
 *
 * <p>Aliases keep their case here; the JDK store types lower-case them. Adding an alias twice
 * replaces the earlier entry.
 */
public class KeyStoreAssembler {
    private static final Logger LOGGER = LoggerFactory.getLogger(KeyStoreAssembler.class);

    private final Map<String, KeyStoreEntry> entries = new LinkedHashMap<>();
    private int trustOrdinal;

    /** Adds a private key entry keyed by the leaf certificate's subject name. */
    public KeyStoreEntry addIdentityEntry(
            PrivateKey privateKey, char[] passphrase, List<ParsedCertificate> chain) {
        if (chain.isEmpty()) {
            throw new IllegalArgumentException("Certificate chain must not be empty");
        }
        List<X509Certificate> certificates = new ArrayList<>(chain.size());
        for (ParsedCertificate certificate : chain) {
            certificates.add(certificate.getCertificate());
        }
        String alias = chain.get(0).getSubjectName();
        return put(KeyStoreEntry.identity(alias, privateKey, passphrase, certificates));
    }

    /** Adds a trust anchor keyed by subject name and a running ordinal, e.g. {@code CN=ca-0}. */
    public KeyStoreEntry addTrustEntry(ParsedCertificate certificate) {
        String alias = certificate.getSubjectName() + "-" + trustOrdinal++;
        return put(KeyStoreEntry.trust(alias, certificate.getCertificate()));
    }

    public Map<String, KeyStoreEntry> getEntries() {
        return Collections.unmodifiableMap(entries);
    }

    public List<KeyStoreEntry> getEntries(KeyStoreEntry.Kind kind) {
        List<KeyStoreEntry> matching = new ArrayList<>();
        for (KeyStoreEntry entry : entries.values()) {
            if (entry.getKind() == kind) {
                matching.add(entry);
            }
        }
        return Collections.unmodifiableList(matching);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** A fresh in-memory store of the platform default type holding every entry. */
    public KeyStore toKeyStore() {
        KeyStore keyStore = emptyKeyStore();
        for (KeyStoreEntry entry : entries.values()) {
            try {
                if (entry.getKind() == KeyStoreEntry.Kind.IDENTITY) {
                    keyStore.setKeyEntry(
                            entry.getAlias(),
                            entry.getPrivateKey(),
                            entry.getPassphrase(),
                            entry.getCertificateChain().toArray(new Certificate[0]));
                } else {
                    keyStore.setCertificateEntry(entry.getAlias(), entry.getCertificate());
                }
            } catch (KeyStoreException e) {
                throw new CryptoProviderException("Set entry [" + entry.getAlias() + "] failed", e);
            }
        }
        return keyStore;
    }

    static KeyStore emptyKeyStore() {
        String type = KeyStore.getDefaultType();
        try {
            KeyStore keyStore = KeyStore.getInstance(type);
            keyStore.load(null, null);
            return keyStore;
        } catch (GeneralSecurityException | IOException e) {
            throw new CryptoProviderException("Key Store Type [" + type + "] initialization failed", e);
        }
    }

    private KeyStoreEntry put(KeyStoreEntry entry) {
        KeyStoreEntry previous = entries.put(entry.getAlias(), entry);
        if (previous != null) {
            LOGGER.warn("Replaced key store entry [{}]", entry.getAlias());
        } else {
            LOGGER.debug("Added {} entry [{}]", entry.getKind(), entry.getAlias());
        }
        return entry;
    }
}
