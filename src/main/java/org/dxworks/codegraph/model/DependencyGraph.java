package org.dxworks.codegraph.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Project-wide graph. Nodes and edges are kept in discovery order: catalog order first,
 * then per-file order. Plain data with no references back into the analysis machinery.
 */
public record DependencyGraph(
        List<CodeNode> nodes,
        List<CodeDependency> edges,
        GraphMetadata metadata,
        @JsonIgnore List<AnalysisFailure> failures) {

    public DependencyGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    @JsonIgnore
    public boolean isPartial() {
        return metadata.partial();
    }
}
