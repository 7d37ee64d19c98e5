package org.dxworks.codegraph.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The nodes and edges one analyzer produced for one file.
 * <p>
 * When {@code failure} is present the result is partial: it holds only what was extracted
 * before the analyzer hit the failure.
 */
public record FileAnalysis(
        String filePath,
        String language,
        List<CodeNode> nodes,
        List<CodeDependency> edges,
        Optional<AnalysisFailure> failure) {

    public FileAnalysis {
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(language, "language");
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        failure = failure == null ? Optional.empty() : failure;
    }

    public FileAnalysis(String filePath, String language, List<CodeNode> nodes, List<CodeDependency> edges) {
        this(filePath, language, nodes, edges, Optional.empty());
    }

    public static FileAnalysis empty(String filePath, String language) {
        return new FileAnalysis(filePath, language, List.of(), List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return nodes.isEmpty() && edges.isEmpty();
    }

    @JsonIgnore
    public boolean isPartial() {
        return failure.isPresent();
    }
}
