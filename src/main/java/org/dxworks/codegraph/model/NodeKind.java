package org.dxworks.codegraph.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NodeKind {
    MODULE("module"),
    CLASS("class"),
    FUNCTION("function"),
    VARIABLE("variable");

    private final String name;

    NodeKind(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}
