package vn.zalopay.clustertls.core.tls;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.testng.Assert;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import vn.zalopay.clustertls.core.TestCertificates;
import vn.zalopay.clustertls.core.config.ClientIdentityInput;
import vn.zalopay.clustertls.exception.MalformedInputException;
import vn.zalopay.clustertls.exception.TlsIoException;

public class ClientIdentityResolverTest {
    private TestCertificates.Bundle ca;
    private TestCertificates.Bundle client;

    @BeforeClass
    public void generate() throws Exception {
        ca = TestCertificates.selfSigned("CN=Identity CA");
        client = TestCertificates.signedBy(ca, "CN=identity-client");
    }

    @Test
    public void inlineKeyAndCertificateProduceIdentityEntry() {
        KeyStoreAssembler assembler = new KeyStoreAssembler();
        ClientIdentityInput input =
                ClientIdentityInput.builder()
                        .certData(TestCertificates.base64(client.certificatePem()))
                        .keyData(TestCertificates.base64(client.pkcs1KeyPem()))
                        .keyPass("pass")
                        .build();

        Optional<KeyStoreEntry> entry = new ClientIdentityResolver().resolve(input, assembler);

        Assert.assertTrue(entry.isPresent());
        Assert.assertEquals(entry.get().getAlias(), "CN=identity-client");
        Assert.assertEquals(entry.get().getCertificate(), client.certificate);
        Assert.assertEquals(entry.get().getPassphrase(), "pass".toCharArray());
        Assert.assertEquals(assembler.getEntries(KeyStoreEntry.Kind.IDENTITY).size(), 1);
    }

    @Test
    public void filesAreReadWhenNoInlineData() throws Exception {
        Path dir = Files.createTempDirectory("identity");
        Path cert = Files.write(dir.resolve("client.crt"), client.certificatePem().getBytes(StandardCharsets.US_ASCII));
        Path key = Files.write(dir.resolve("client.key"), client.pkcs8KeyPem().getBytes(StandardCharsets.US_ASCII));

        Optional<KeyStoreEntry> entry =
                new ClientIdentityResolver()
                        .resolve(
                                ClientIdentityInput.builder()
                                        .certFile(cert.toString())
                                        .keyFile(key.toString())
                                        .build(),
                                new KeyStoreAssembler());

        Assert.assertTrue(entry.isPresent());
        Assert.assertEquals(entry.get().getPassphrase().length, 0);
    }

    @Test
    public void inlineDataShadowsFiles() throws Exception {
        FileOpener opener = mock(FileOpener.class);
        ClientIdentityInput input =
                ClientIdentityInput.builder()
                        .certData(TestCertificates.base64(client.certificatePem()))
                        .certFile("/nowhere/client.crt")
                        .keyData(TestCertificates.base64(client.pkcs1KeyPem()))
                        .keyFile("/nowhere/client.key")
                        .build();

        Assert.assertTrue(new ClientIdentityResolver(opener).resolve(input, new KeyStoreAssembler()).isPresent());
        verify(opener, never()).open(any());
    }

    @Test
    public void nothingConfiguredAddsNothing() {
        KeyStoreAssembler assembler = new KeyStoreAssembler();
        Assert.assertFalse(
                new ClientIdentityResolver().resolve(ClientIdentityInput.builder().build(), assembler).isPresent());
        Assert.assertTrue(assembler.isEmpty());
    }

    @Test
    public void keyWithoutCertificateIsSkipped() {
        KeyStoreAssembler assembler = new KeyStoreAssembler();
        ClientIdentityInput input =
                ClientIdentityInput.builder().keyData(TestCertificates.base64(client.pkcs1KeyPem())).build();
        Assert.assertFalse(new ClientIdentityResolver().resolve(input, assembler).isPresent());
        Assert.assertTrue(assembler.isEmpty());
    }

    @Test
    public void certificateWithoutKeyIsSkippedWithoutReadingIt() throws Exception {
        FileOpener opener = mock(FileOpener.class);
        ClientIdentityInput input = ClientIdentityInput.builder().certFile("/etc/client.crt").build();
        Assert.assertFalse(new ClientIdentityResolver(opener).resolve(input, new KeyStoreAssembler()).isPresent());
        verify(opener, never()).open(any());
    }

    @Test
    public void swappedKeyAndCertificateFailWithSpecificReason() {
        ClientIdentityInput input =
                ClientIdentityInput.builder()
                        .certData(TestCertificates.base64(client.certificatePem()))
                        .keyData(TestCertificates.base64(client.certificatePem()))
                        .build();
        MalformedInputException e =
                Assert.expectThrows(
                        MalformedInputException.class,
                        () -> new ClientIdentityResolver().resolve(input, new KeyStoreAssembler()));
        Assert.assertEquals(e.getReason(), MalformedInputException.Reason.CERTIFICATE_IN_KEY_SLOT);
    }

    @Test
    public void keyOfAnotherCertificateIsRejected() {
        ClientIdentityInput input =
                ClientIdentityInput.builder()
                        .certData(TestCertificates.base64(client.certificatePem()))
                        .keyData(TestCertificates.base64(ca.pkcs1KeyPem()))
                        .build();
        MalformedInputException e =
                Assert.expectThrows(
                        MalformedInputException.class,
                        () -> new ClientIdentityResolver().resolve(input, new KeyStoreAssembler()));
        Assert.assertEquals(e.getReason(), MalformedInputException.Reason.KEY_CERTIFICATE_MISMATCH);
    }

    @Test
    public void missingKeyFileIsIoFailure() {
        ClientIdentityInput input =
                ClientIdentityInput.builder()
                        .certData(TestCertificates.base64(client.certificatePem()))
                        .keyFile("/definitely/missing/client.key")
                        .build();
        TlsIoException e =
                Assert.expectThrows(
                        TlsIoException.class,
                        () -> new ClientIdentityResolver().resolve(input, new KeyStoreAssembler()));
        Assert.assertTrue(e.getPath().endsWith("client.key"));
    }
}
