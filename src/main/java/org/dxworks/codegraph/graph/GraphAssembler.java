package org.dxworks.codegraph.graph;

import org.dxworks.codegraph.model.AnalysisFailure;
import org.dxworks.codegraph.model.CodeDependency;
import org.dxworks.codegraph.model.CodeNode;
import org.dxworks.codegraph.model.DependencyGraph;
import org.dxworks.codegraph.model.FileAnalysis;
import org.dxworks.codegraph.model.GraphMetadata;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Accumulates per-file results into one {@link DependencyGraph}.
 * <p>
 * Results are appended in the order they are accepted. Nothing is deduplicated and edges are
 * not checked against node ids. Not thread-safe: the orchestrator is its only caller.
 */
public class GraphAssembler {

    private final List<CodeNode> nodes = new ArrayList<>();
    private final List<CodeDependency> edges = new ArrayList<>();
    private final List<AnalysisFailure> failures = new ArrayList<>();
    private int filesAnalyzed;
    private int filesSkipped;

    public void accept(FileOutcome outcome) {
        switch (outcome.status()) {
            case ANALYZED -> accept(outcome.analysis());
            case SKIPPED -> filesSkipped++;
            case FAILED -> failures.add(outcome.failure());
        }
    }

    public void accept(FileAnalysis analysis) {
        filesAnalyzed++;
        nodes.addAll(analysis.nodes());
        edges.addAll(analysis.edges());
        analysis.failure().ifPresent(failures::add);
    }

    public DependencyGraph build(boolean partial) {
        Set<String> languages = new TreeSet<>();
        long totalLinesOfCode = 0;
        double complexitySum = 0;
        double maxComplexity = 0;
        for (CodeNode node : nodes) {
            languages.add(node.language());
            totalLinesOfCode += node.linesOfCode();
            complexitySum += node.complexity();
            maxComplexity = Math.max(maxComplexity, node.complexity());
        }
        double averageComplexity = nodes.isEmpty() ? 0 : complexitySum / nodes.size();

        GraphMetadata metadata = new GraphMetadata(
                filesAnalyzed,
                nodes.size(),
                edges.size(),
                new ArrayList<>(languages),
                partial,
                failures.size(),
                filesSkipped,
                totalLinesOfCode,
                averageComplexity,
                maxComplexity);
        return new DependencyGraph(nodes, edges, metadata, failures);
    }
}
