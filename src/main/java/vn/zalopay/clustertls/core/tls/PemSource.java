package vn.zalopay.clustertls.core.tls;

import vn.zalopay.clustertls.exception.TlsIoException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Where the bytes of one PEM input come from: decoded inline data or a file.
 *
 * <p>Nothing is read until {@link #openStream()}; callers own the returned stream.
 */
public abstract class PemSource {
    private final String field;

    private PemSource(String field) {
        this.field = field;
    }

    public static PemSource inline(String field, byte[] bytes) {
        return new Inline(field, bytes);
    }

    public static PemSource file(String field, Path path, FileOpener opener) {
        return new FileBacked(field, path, opener);
    }

    /** Name of the configuration field this source was resolved from. */
    public String getField() {
        return field;
    }

    public abstract boolean isInline();

    /** Human readable origin, safe to log. */
    public abstract String describe();

    public abstract InputStream openStream();

    @Override
    public String toString() {
        return describe();
    }

    private static final class Inline extends PemSource {
        private final byte[] bytes;

        Inline(String field, byte[] bytes) {
            super(field);
            this.bytes = bytes.clone();
        }

        @Override
        public boolean isInline() {
            return true;
        }

        @Override
        public String describe() {
            return getField() + " (inline, " + bytes.length + " bytes)";
        }

        @Override
        public InputStream openStream() {
            return new ByteArrayInputStream(bytes);
        }
    }

    private static final class FileBacked extends PemSource {
        private final Path path;
        private final FileOpener opener;

        FileBacked(String field, Path path, FileOpener opener) {
            super(field);
            this.path = path;
            this.opener = opener;
        }

        @Override
        public boolean isInline() {
            return false;
        }

        @Override
        public String describe() {
            return getField() + " (file " + path + ")";
        }

        @Override
        public InputStream openStream() {
            try {
                return opener.open(path);
            } catch (IOException e) {
                throw new TlsIoException(path.toString(), e);
            }
        }
    }
}
