package vn.zalopay.clustertls.exception;

/**
 * The JCA layer rejected the assembled material, e.g. an unavailable algorithm or a key store
 * that cannot be initialised.
 */
public class CryptoProviderException extends TlsContextException {
    public CryptoProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
