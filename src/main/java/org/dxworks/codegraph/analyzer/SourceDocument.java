package org.dxworks.codegraph.analyzer;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Decoded text of one file together with the identity its nodes are keyed by.
 */
public record SourceDocument(String path, String moduleId, NodeIdStrategy idStrategy, String text) {

    public SourceDocument {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(moduleId, "moduleId");
        Objects.requireNonNull(idStrategy, "idStrategy");
        Objects.requireNonNull(text, "text");
    }

    public static SourceDocument of(Path file, Path root, NodeIdStrategy idStrategy, String text) {
        return new SourceDocument(file.toString(), idStrategy.moduleId(file, root), idStrategy, text);
    }

    public static SourceDocument of(Path file, String text) {
        return of(file, null, NodeIdStrategy.STEM, text);
    }

    public String nodeId(String unitName) {
        return idStrategy.nodeId(moduleId, unitName);
    }
}
