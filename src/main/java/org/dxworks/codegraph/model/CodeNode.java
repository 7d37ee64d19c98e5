package org.dxworks.codegraph.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One syntactic unit discovered in a source file.
 * <p>
 * {@code line} is 1-based and 0 when the analyzer cannot recover it. {@code complexity} and
 * {@code linesOfCode} stay 0 when the analyzer does not compute them. {@code dependencyRefs}
 * lists the distinct targets of the edges emitted from this node; edges remain the
 * authoritative relation source.
 */
public record CodeNode(
        String id,
        String name,
        NodeKind kind,
        String language,
        String path,
        int line,
        double complexity,
        @JsonProperty("lines_of_code") int linesOfCode,
        @JsonProperty("dependency_refs") List<String> dependencyRefs) {

    public CodeNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(path, "path");
        if (line < 0) {
            throw new IllegalArgumentException("line must be >= 0, was " + line);
        }
        if (complexity < 0) {
            throw new IllegalArgumentException("complexity must be >= 0, was " + complexity);
        }
        if (linesOfCode < 0) {
            throw new IllegalArgumentException("linesOfCode must be >= 0, was " + linesOfCode);
        }
        dependencyRefs = dependencyRefs == null ? List.of() : List.copyOf(dependencyRefs);
    }

    public CodeNode(String id, String name, NodeKind kind, String language, String path,
                    int line, double complexity, int linesOfCode) {
        this(id, name, kind, language, path, line, complexity, linesOfCode, List.of());
    }
}
