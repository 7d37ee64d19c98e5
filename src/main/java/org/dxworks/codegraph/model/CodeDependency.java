package org.dxworks.codegraph.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * A directed, typed relation. The target may name something that never became a node
 * (an external library, an unresolved base class); such dangling edges are valid.
 */
public record CodeDependency(
        String source,
        String target,
        DependencyKind kind,
        double weight,
        @JsonInclude(JsonInclude.Include.NON_NULL) Integer line) {

    public static final double DEFAULT_WEIGHT = 1.0;

    public CodeDependency {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(kind, "kind");
    }

    public CodeDependency(String source, String target, DependencyKind kind, Integer line) {
        this(source, target, kind, DEFAULT_WEIGHT, line);
    }

    public CodeDependency(String source, String target, DependencyKind kind) {
        this(source, target, kind, DEFAULT_WEIGHT, null);
    }
}
