package org.dxworks.codegraph.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FailureKind {
    READ_FAILURE("read_failure"),
    PARSE_FAILURE("parse_failure"),
    ANALYZER_FAILURE("analyzer_failure");

    private final String name;

    FailureKind(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}
