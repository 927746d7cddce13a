package vn.zalopay.clustertls.core.tls;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.security.cert.X509Certificate;

/** One X.509 certificate, stored under its subject distinguished name. */
@Getter
@RequiredArgsConstructor
public final class ParsedCertificate {
    private final X509Certificate certificate;

    /** RFC 2253 form of the subject, e.g. {@code CN=client,O=acme}. */
    public String getSubjectName() {
        return certificate.getSubjectX500Principal().getName();
    }

    @Override
    public String toString() {
        return "ParsedCertificate{subject=" + getSubjectName() + '}';
    }
}
