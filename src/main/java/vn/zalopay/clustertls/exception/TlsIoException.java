package vn.zalopay.clustertls.exception;

import java.io.IOException;

/** A file input or default store location could not be opened or read. */
public class TlsIoException extends TlsContextException {
    private final String path;

    public TlsIoException(String path, IOException cause) {
        super("Unable to read " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
