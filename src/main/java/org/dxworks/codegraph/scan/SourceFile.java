package org.dxworks.codegraph.scan;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A candidate file found by the {@link SourceCatalog} and the language its extension maps to.
 */
public record SourceFile(Path path, String language) {

    public SourceFile {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(language, "language");
    }
}
