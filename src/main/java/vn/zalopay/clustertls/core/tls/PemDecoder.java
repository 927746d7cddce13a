package vn.zalopay.clustertls.core.tls;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.PEMException;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.util.encoders.DecoderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import vn.zalopay.clustertls.exception.CryptoProviderException;
import vn.zalopay.clustertls.exception.MalformedInputException;
import vn.zalopay.clustertls.exception.MalformedInputException.Reason;
import vn.zalopay.clustertls.exception.TlsIoException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Security;
import java.security.cert.Certificate;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.security.interfaces.RSAKey;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Decodes PEM private keys and X.509 certificates for TLS/mTLS.
 *
 * <p>Keys:
 * - PKCS#1 ("BEGIN RSA PRIVATE KEY") and SEC1 ("BEGIN EC PRIVATE KEY") key pairs.
 * - Unencrypted PKCS#8 ("BEGIN PRIVATE KEY").
 * - A certificate in the key input is reported as {@link Reason#CERTIFICATE_IN_KEY_SLOT}; any
 *   other block (encrypted keys, CSRs) as {@link Reason#UNSUPPORTED_PEM_OBJECT}.
 *
 * <p>Input is read fully and the stream closed before parsing, so read failures surface as
 * {@link TlsIoException} and everything after as {@link MalformedInputException}.
 */
public final class PemDecoder {
    private static final Logger LOGGER = LoggerFactory.getLogger(PemDecoder.class);
    private static final String CERTIFICATE_TYPE = "X.509";

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    private PemDecoder() {}

    /** Reads the first PEM object of {@code source}, which must be an unencrypted private key. */
    public static ParsedKeyPair decodeKeyPair(PemSource source) {
        byte[] bytes = readAll(source);
        Object parsed;
        try (PEMParser parser =
                new PEMParser(
                        new InputStreamReader(
                                new ByteArrayInputStream(bytes), StandardCharsets.US_ASCII))) {
            parsed = parser.readObject();
        } catch (IOException | IllegalArgumentException | DecoderException e) {
            // DecoderException: PEM armour intact, base64 body corrupt
            throw new MalformedInputException(
                    Reason.INVALID_PRIVATE_KEY,
                    "failed to parse the private key from " + source.describe() + ": " + e.getMessage(),
                    e);
        }
        return toKeyPair(parsed, source);
    }

    /** Reads every certificate of a PEM bundle. An empty input yields an empty list. */
    public static List<ParsedCertificate> decodeCertificates(PemSource source) {
        CertificateFactory factory = certificateFactory();
        byte[] bytes = readAll(source);
        Collection<? extends Certificate> certificates;
        try {
            certificates = factory.generateCertificates(new ByteArrayInputStream(bytes));
        } catch (CertificateException e) {
            throw new MalformedInputException(
                    Reason.INVALID_CERTIFICATE,
                    "failed to parse certificate from " + source.describe() + ": " + e.getMessage(),
                    e);
        }
        List<ParsedCertificate> parsed = new ArrayList<>(certificates.size());
        for (Certificate certificate : certificates) {
            if (!(certificate instanceof X509Certificate)) {
                throw new MalformedInputException(
                        Reason.INVALID_CERTIFICATE,
                        source.describe() + " holds a " + certificate.getType() + " certificate, not X.509");
            }
            parsed.add(new ParsedCertificate((X509Certificate) certificate));
        }
        LOGGER.debug("Decoded {} certificate(s) from {}", parsed.size(), source.describe());
        return Collections.unmodifiableList(parsed);
    }

    /** Reads a leaf certificate optionally followed by its intermediates. */
    public static List<ParsedCertificate> decodeCertificateChain(PemSource source) {
        List<ParsedCertificate> chain = decodeCertificates(source);
        if (chain.isEmpty()) {
            throw new MalformedInputException(
                    Reason.INVALID_CERTIFICATE, "no certificate found in " + source.describe());
        }
        return chain;
    }

    /**
     * Fails when the key carries its public half and that half differs from the leaf certificate.
     * PKCS#8 keys carry no public half and are not checked.
     */
    public static void verifyKeyMatchesCertificate(ParsedKeyPair keyPair, ParsedCertificate leaf) {
        if (!keyPair.getPublicKey().isPresent()) {
            return;
        }
        PublicKey fromKey = keyPair.getPublicKey().get();
        PublicKey fromCertificate = leaf.getCertificate().getPublicKey();
        boolean matches;
        if (fromKey instanceof RSAKey && fromCertificate instanceof RSAKey) {
            matches = ((RSAKey) fromKey).getModulus().equals(((RSAKey) fromCertificate).getModulus());
        } else {
            matches = Arrays.equals(fromKey.getEncoded(), fromCertificate.getEncoded());
        }
        if (!matches) {
            throw new MalformedInputException(
                    Reason.KEY_CERTIFICATE_MISMATCH,
                    "the client private key does not match the certificate " + leaf.getSubjectName());
        }
    }

    private static ParsedKeyPair toKeyPair(Object parsed, PemSource source) {
        PemObjectKind kind = PemObjectKind.of(parsed);
        JcaPEMKeyConverter converter =
                new JcaPEMKeyConverter().setProvider(BouncyCastleProvider.PROVIDER_NAME);
        try {
            switch (kind) {
                case KEY_PAIR:
                    PEMKeyPair keyPair = (PEMKeyPair) parsed;
                    PrivateKey privateKey = converter.getPrivateKey(keyPair.getPrivateKeyInfo());
                    PublicKey publicKey =
                            keyPair.getPublicKeyInfo() == null
                                    ? null
                                    : converter.getPublicKey(keyPair.getPublicKeyInfo());
                    return new ParsedKeyPair(privateKey, publicKey, kind);
                case PRIVATE_KEY_INFO:
                    return new ParsedKeyPair(
                            converter.getPrivateKey((PrivateKeyInfo) parsed), null, kind);
                case CERTIFICATE:
                case TRUSTED_CERTIFICATE:
                    throw new MalformedInputException(
                            Reason.CERTIFICATE_IN_KEY_SLOT,
                            "failed to parse the private key from "
                                    + source.describe()
                                    + ", it looks like you might be specifying the client certificate"
                                    + " instead of the private key");
                case ENCRYPTED_KEY_PAIR:
                case ENCRYPTED_PRIVATE_KEY:
                case CERTIFICATION_REQUEST:
                    throw unsupported(parsed.getClass().getSimpleName(), source);
                case OTHER:
                    if (parsed == null) {
                        throw new MalformedInputException(
                                Reason.INVALID_PRIVATE_KEY, "no PEM object found in " + source.describe());
                    }
                    throw unsupported(parsed.getClass().getSimpleName(), source);
                default:
                    throw new IllegalStateException("Unhandled PEM object kind " + kind);
            }
        } catch (PEMException e) {
            throw new MalformedInputException(
                    Reason.INVALID_PRIVATE_KEY,
                    "failed to convert the private key from " + source.describe() + ": " + e.getMessage(),
                    e);
        }
    }

    private static MalformedInputException unsupported(String objectKind, PemSource source) {
        return new MalformedInputException(
                Reason.UNSUPPORTED_PEM_OBJECT,
                "failed to parse the private key from "
                        + source.describe()
                        + ": "
                        + objectKind
                        + " is not a PEM key-pair");
    }

    private static byte[] readAll(PemSource source) {
        try (InputStream in = source.openStream()) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new TlsIoException(source.describe(), e);
        }
    }

    private static CertificateFactory certificateFactory() {
        try {
            return CertificateFactory.getInstance(CERTIFICATE_TYPE);
        } catch (CertificateException e) {
            throw new CryptoProviderException("CertificateFactory " + CERTIFICATE_TYPE + " unavailable", e);
        }
    }
}
