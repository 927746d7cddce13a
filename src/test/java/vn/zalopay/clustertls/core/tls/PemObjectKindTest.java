package vn.zalopay.clustertls.core.tls;

import org.bouncycastle.cert.X509CertificateHolder;
import org.testng.Assert;
import org.testng.annotations.Test;

import vn.zalopay.clustertls.core.TestCertificates;

public class PemObjectKindTest {
    @Test
    public void classifiesCertificateHolder() throws Exception {
        TestCertificates.Bundle ca = TestCertificates.selfSigned("CN=kind");
        PemObjectKind kind = PemObjectKind.of(new X509CertificateHolder(ca.certificate.getEncoded()));
        Assert.assertEquals(kind, PemObjectKind.CERTIFICATE);
    }

    @Test
    public void unknownObjectsAndNullAreOther() {
        Assert.assertEquals(PemObjectKind.of("text"), PemObjectKind.OTHER);
        Assert.assertEquals(PemObjectKind.of(null), PemObjectKind.OTHER);
    }
}
