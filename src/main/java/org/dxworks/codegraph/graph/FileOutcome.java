package org.dxworks.codegraph.graph;

import org.dxworks.codegraph.model.AnalysisFailure;
import org.dxworks.codegraph.model.FileAnalysis;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of one per-file task. Failures travel as values so the scan loop never has to catch
 * per-file exceptions.
 */
public record FileOutcome(Status status, String path, FileAnalysis analysis, AnalysisFailure failure) {

    public enum Status {
        /** An analyzer ran; the analysis may still be partial. */
        ANALYZED,
        /** No analyzer is registered for the file's language. */
        SKIPPED,
        /** The file could not be read or the analyzer crashed. */
        FAILED
    }

    public FileOutcome {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(path, "path");
    }

    public static FileOutcome analyzed(FileAnalysis analysis) {
        return new FileOutcome(Status.ANALYZED, analysis.filePath(), analysis, analysis.failure().orElse(null));
    }

    public static FileOutcome skipped(String path) {
        return new FileOutcome(Status.SKIPPED, path, null, null);
    }

    public static FileOutcome failed(AnalysisFailure failure) {
        return new FileOutcome(Status.FAILED, failure.path(), null, failure);
    }

    public Optional<FileAnalysis> analysisIfPresent() {
        return Optional.ofNullable(analysis);
    }
}
