package vn.zalopay.clustertls.exception;

/** Parsing produced a structurally wrong or unsupported artifact. */
public class MalformedInputException extends TlsContextException {

    public enum Reason {
        /** A certificate was found where a private key was expected. */
        CERTIFICATE_IN_KEY_SLOT,
        /** The PEM object is not a supported private key format. */
        UNSUPPORTED_PEM_OBJECT,
        /** Bytes are not a valid DER/PEM X.509 certificate. */
        INVALID_CERTIFICATE,
        /** A key block was found but could not be read or converted. */
        INVALID_PRIVATE_KEY,
        /** Inline data is not valid base64. */
        INVALID_ENCODING,
        /** The private key does not belong to the leaf certificate. */
        KEY_CERTIFICATE_MISMATCH
    }

    private final Reason reason;

    public MalformedInputException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public MalformedInputException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
