package vn.zalopay.clustertls.core.config;

import lombok.Builder;
import lombok.Data;

/**
 * Client certificate and key sources for mTLS.
 *
 * <p>For each of certificate and key, inline base64 data wins over the file path when both are
 * set; the file is then never opened.
 */
@Data
@Builder
public class ClientIdentityInput {
    /** Base64 of the client certificate (PEM, optionally followed by intermediates). */
    private final String certData;

    /** Path to the client certificate PEM file. */
    private final String certFile;

    /** Base64 of the client private key PEM. */
    private final String keyData;

    /** Path to the client private key PEM file. */
    private final String keyFile;

    /** Passphrase protecting the key entry in the assembled key store. Optional. */
    private final String keyPass;

    @Override
    public String toString() {
        return "ClientIdentityInput{"
                + "certData="
                + (certData == null ? "null" : "<inline>")
                + ", certFile='"
                + certFile
                + '\''
                + ", keyData="
                + (keyData == null ? "null" : "<inline>")
                + ", keyFile='"
                + keyFile
                + '\''
                + ", keyPass="
                + (keyPass == null ? "null" : "<hidden>")
                + '}';
    }
}
