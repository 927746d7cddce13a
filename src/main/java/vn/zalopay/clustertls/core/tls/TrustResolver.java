package vn.zalopay.clustertls.core.tls;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import vn.zalopay.clustertls.core.config.TrustInput;

import java.util.List;
import java.util.Optional;

/**
 * Adds configured CA certificates to a {@link KeyStoreAssembler}: inline data first, then the
 * file. Every certificate of a bundle becomes its own trust entry.
 */
public class TrustResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(TrustResolver.class);

    static final String CA_FIELD = "certificate authority";

    private final FileOpener fileOpener;

    public TrustResolver() {
        this(FileOpener.DEFAULT);
    }

    public TrustResolver(FileOpener fileOpener) {
        this.fileOpener = fileOpener;
    }

    /** @return {@link TrustSource#DEFAULT} when nothing was configured and nothing was added */
    public TrustSource resolve(TrustInput input, KeyStoreAssembler assembler) {
        Optional<PemSource> source =
                PemSources.resolve(CA_FIELD, input.getCaCertData(), input.getCaCertFile(), fileOpener);
        if (!source.isPresent()) {
            LOGGER.debug("No certificate authority configured, using default trust store");
            return TrustSource.DEFAULT;
        }

        List<ParsedCertificate> certificates = PemDecoder.decodeCertificates(source.get());
        if (certificates.isEmpty()) {
            LOGGER.warn("{} contains no certificates, no server will be trusted", source.get().describe());
        }
        for (ParsedCertificate certificate : certificates) {
            assembler.addTrustEntry(certificate);
        }
        return source.get().isInline() ? TrustSource.INLINE : TrustSource.FILE;
    }
}
