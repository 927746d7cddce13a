package vn.zalopay.clustertls.core.config;

import lombok.Builder;
import lombok.Data;

/** Certificate authority sources. When both are blank the default trust store is used. */
@Data
@Builder
public class TrustInput {
    /** Base64 of one or more concatenated PEM CA certificates. */
    private final String caCertData;

    /** Path to a PEM CA bundle. */
    private final String caCertFile;

    @Override
    public String toString() {
        return "TrustInput{"
                + "caCertData="
                + (caCertData == null ? "null" : "<inline>")
                + ", caCertFile='"
                + caCertFile
                + '\''
                + '}';
    }
}
