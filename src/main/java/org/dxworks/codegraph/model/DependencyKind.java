package org.dxworks.codegraph.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DependencyKind {
    IMPORTS("imports"),
    CALLS("calls"),
    INHERITS("inherits"),
    USES("uses");

    private final String name;

    DependencyKind(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}
