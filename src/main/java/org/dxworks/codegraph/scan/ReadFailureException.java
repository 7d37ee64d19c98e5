package org.dxworks.codegraph.scan;

import java.nio.file.Path;

/**
 * A file could not be opened or decoded with either the primary or the fallback encoding.
 */
public class ReadFailureException extends Exception {

    private final Path path;

    public ReadFailureException(Path path, Throwable cause) {
        super("Failed to read " + path + ": " + describe(cause), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
