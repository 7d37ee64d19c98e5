package org.dxworks.codegraph.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Summary of a {@link DependencyGraph}, computed once after all files are merged.
 * {@code languages} is sorted and holds exactly the languages present on the graph's nodes.
 */
public record GraphMetadata(
        @JsonProperty("total_files") int totalFiles,
        @JsonProperty("total_nodes") int totalNodes,
        @JsonProperty("total_dependencies") int totalDependencies,
        @JsonProperty("languages") List<String> languages,
        @JsonProperty("partial") boolean partial,
        @JsonProperty("files_with_errors") int filesWithErrors,
        @JsonProperty("skipped_files") int skippedFiles,
        @JsonProperty("total_lines_of_code") long totalLinesOfCode,
        @JsonProperty("average_complexity") double averageComplexity,
        @JsonProperty("max_complexity") double maxComplexity) {

    public GraphMetadata {
        languages = List.copyOf(languages);
    }
}
