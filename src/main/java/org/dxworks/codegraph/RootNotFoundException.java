package org.dxworks.codegraph;

import java.nio.file.Path;

/**
 * The project root does not exist. Raised before any file is enumerated.
 */
public class RootNotFoundException extends RuntimeException {

    private final Path root;

    public RootNotFoundException(Path root) {
        super("Project root does not exist: " + root);
        this.root = root;
    }

    public Path getRoot() {
        return root;
    }
}
