package vn.zalopay.clustertls.core.tls;

import vn.zalopay.clustertls.exception.MalformedInputException;

import java.nio.file.Paths;
import java.util.Base64;
import java.util.Optional;

/** Picks the source for one PEM input: inline base64 data first, then the file path. */
public final class PemSources {
    private PemSources() {}

    public static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    /**
     * Resolves one configuration field pair.
     *
     * @param field name used in diagnostics
     * @param data base64 encoded PEM, may be blank
     * @param file path to a PEM file, may be blank; ignored when {@code data} is set
     * @param opener used when the file source is eventually opened
     * @return the chosen source, or empty when neither is set
     */
    public static Optional<PemSource> resolve(
            String field, String data, String file, FileOpener opener) {
        if (!isBlank(data)) {
            return Optional.of(PemSource.inline(field, decodeBase64(field, data)));
        }
        if (!isBlank(file)) {
            return Optional.of(PemSource.file(field, Paths.get(file.trim()), opener));
        }
        return Optional.empty();
    }

    private static byte[] decodeBase64(String field, String data) {
        try {
            return Base64.getDecoder().decode(data.trim());
        } catch (IllegalArgumentException e) {
            throw new MalformedInputException(
                    MalformedInputException.Reason.INVALID_ENCODING,
                    field + " is not valid base64: " + e.getMessage(),
                    e);
        }
    }
}
