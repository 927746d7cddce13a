package vn.zalopay.clustertls.core.tls;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.X509TrustedCertificateBlock;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;

/** Kinds of objects {@link org.bouncycastle.openssl.PEMParser} hands back for a key input. */
public enum PemObjectKind {
    /** PKCS#1 RSA or SEC1 EC key, private and public parts. */
    KEY_PAIR(PEMKeyPair.class),
    /** Unencrypted PKCS#8. */
    PRIVATE_KEY_INFO(PrivateKeyInfo.class),
    CERTIFICATE(X509CertificateHolder.class),
    TRUSTED_CERTIFICATE(X509TrustedCertificateBlock.class),
    ENCRYPTED_KEY_PAIR(PEMEncryptedKeyPair.class),
    ENCRYPTED_PRIVATE_KEY(PKCS8EncryptedPrivateKeyInfo.class),
    CERTIFICATION_REQUEST(PKCS10CertificationRequest.class),
    /** Anything else, including nothing at all. */
    OTHER(null);

    private final Class<?> type;

    PemObjectKind(Class<?> type) {
        this.type = type;
    }

    public static PemObjectKind of(Object parsed) {
        if (parsed == null) {
            return OTHER;
        }
        for (PemObjectKind kind : values()) {
            if (kind.type != null && kind.type.isInstance(parsed)) {
                return kind;
            }
        }
        return OTHER;
    }
}
