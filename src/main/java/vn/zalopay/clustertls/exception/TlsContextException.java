package vn.zalopay.clustertls.exception;

/**
 * Root of every failure raised while assembling a TLS client context.
 *
 * <p>Construction never degrades: either a usable context is returned or one of the subclasses is
 * thrown with the underlying cause attached.
 */
public abstract class TlsContextException extends RuntimeException {
    protected TlsContextException(String message) {
        super(message);
    }

    protected TlsContextException(String message, Throwable cause) {
        super(message, cause);
    }
}
