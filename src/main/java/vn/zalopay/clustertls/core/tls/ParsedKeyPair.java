package vn.zalopay.clustertls.core.tls;

import lombok.AccessLevel;
import lombok.Getter;

import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Optional;

/**
 * Private key decoded from a key input, plus the public half when the PEM block carried it
 * (PKCS#1 and SEC1 do, plain PKCS#8 does not).
 */
public final class ParsedKeyPair {
    @Getter private final PrivateKey privateKey;

    @Getter(AccessLevel.NONE)
    private final PublicKey publicKey;

    @Getter private final PemObjectKind kind;

    public ParsedKeyPair(PrivateKey privateKey, PublicKey publicKey, PemObjectKind kind) {
        this.privateKey = privateKey;
        this.publicKey = publicKey;
        this.kind = kind;
    }

    public Optional<PublicKey> getPublicKey() {
        return Optional.ofNullable(publicKey);
    }

    @Override
    public String toString() {
        return "ParsedKeyPair{algorithm=" + privateKey.getAlgorithm() + ", kind=" + kind + '}';
    }
}
