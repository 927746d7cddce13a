package vn.zalopay.clustertls.core.tls;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import vn.zalopay.clustertls.core.config.ClientIdentityInput;

import java.util.List;
import java.util.Optional;

/**
 * Adds the client identity entry, if one is configured, to a {@link KeyStoreAssembler}.
 *
 * <p>Key and certificate are resolved independently, inline data before file. When either one is
 * missing no entry is added and the context is built without a client certificate.
 */
public class ClientIdentityResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(ClientIdentityResolver.class);

    static final String CERT_FIELD = "client certificate";
    static final String KEY_FIELD = "client key";

    private final FileOpener fileOpener;

    public ClientIdentityResolver() {
        this(FileOpener.DEFAULT);
    }

    public ClientIdentityResolver(FileOpener fileOpener) {
        this.fileOpener = fileOpener;
    }

    public Optional<KeyStoreEntry> resolve(ClientIdentityInput input, KeyStoreAssembler assembler) {
        Optional<PemSource> keySource =
                PemSources.resolve(KEY_FIELD, input.getKeyData(), input.getKeyFile(), fileOpener);
        Optional<PemSource> certSource =
                PemSources.resolve(CERT_FIELD, input.getCertData(), input.getCertFile(), fileOpener);

        if (!keySource.isPresent() && !certSource.isPresent()) {
            LOGGER.debug("No client identity configured, client authentication disabled");
            return Optional.empty();
        }
        if (!keySource.isPresent() || !certSource.isPresent()) {
            // TODO: decide with cluster owners whether a half-configured identity should fail instead
            LOGGER.warn(
                    "Ignoring client identity: {} is configured but {} is not",
                    keySource.isPresent() ? KEY_FIELD : CERT_FIELD,
                    keySource.isPresent() ? CERT_FIELD : KEY_FIELD);
            return Optional.empty();
        }

        ParsedKeyPair keyPair = PemDecoder.decodeKeyPair(keySource.get());
        List<ParsedCertificate> chain = PemDecoder.decodeCertificateChain(certSource.get());
        PemDecoder.verifyKeyMatchesCertificate(keyPair, chain.get(0));

        char[] passphrase =
                input.getKeyPass() == null ? new char[0] : input.getKeyPass().toCharArray();
        KeyStoreEntry entry = assembler.addIdentityEntry(keyPair.getPrivateKey(), passphrase, chain);
        LOGGER.debug(
                "Client identity [{}] loaded from {} and {}",
                entry.getAlias(),
                keySource.get().describe(),
                certSource.get().describe());
        return Optional.of(entry);
    }
}
