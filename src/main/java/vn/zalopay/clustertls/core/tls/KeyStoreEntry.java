package vn.zalopay.clustertls.core.tls;

import lombok.AccessLevel;
import lombok.Getter;

import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** One aliased entry of an assembled key store or trust store. */
@Getter
public final class KeyStoreEntry {
    public enum Kind {
        IDENTITY,
        TRUST
    }

    private final String alias;
    private final Kind kind;
    /** Null for trust entries. */
    private final PrivateKey privateKey;
    @Getter(AccessLevel.NONE)
    private final char[] passphrase;
    private final List<X509Certificate> certificateChain;

    private KeyStoreEntry(
            String alias,
            Kind kind,
            PrivateKey privateKey,
            char[] passphrase,
            List<X509Certificate> certificateChain) {
        this.alias = alias;
        this.kind = kind;
        this.privateKey = privateKey;
        this.passphrase = passphrase;
        this.certificateChain = Collections.unmodifiableList(new ArrayList<>(certificateChain));
    }

    static KeyStoreEntry identity(
            String alias, PrivateKey privateKey, char[] passphrase, List<X509Certificate> chain) {
        return new KeyStoreEntry(alias, Kind.IDENTITY, privateKey, passphrase.clone(), chain);
    }

    static KeyStoreEntry trust(String alias, X509Certificate certificate) {
        return new KeyStoreEntry(
                alias, Kind.TRUST, null, null, Collections.singletonList(certificate));
    }

    /** Copy of the entry passphrase; null for trust entries. */
    public char[] getPassphrase() {
        return passphrase == null ? null : passphrase.clone();
    }

    /** Leaf certificate for identity entries, the anchor itself for trust entries. */
    public X509Certificate getCertificate() {
        return certificateChain.get(0);
    }

    @Override
    public String toString() {
        return "KeyStoreEntry{alias='" + alias + "', kind=" + kind + ", chainLength=" + certificateChain.size() + '}';
    }
}
