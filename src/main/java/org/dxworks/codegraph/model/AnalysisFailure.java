package org.dxworks.codegraph.model;

import java.util.Objects;

/**
 * A soft, per-file failure. Never aborts a project scan.
 */
public record AnalysisFailure(String path, FailureKind kind, String message) {

    public AnalysisFailure {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
    }

    public static AnalysisFailure of(String path, FailureKind kind, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new AnalysisFailure(path, kind, message);
    }
}
