package vn.zalopay.clustertls.core.tls;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/** Opens file backed PEM sources. */
@FunctionalInterface
public interface FileOpener {
    FileOpener DEFAULT = Files::newInputStream;

    InputStream open(Path path) throws IOException;
}
