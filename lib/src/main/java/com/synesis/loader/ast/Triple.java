package com.synesis.loader.ast;

import java.util.Objects;

public record Triple(String from, String relation, String to) {
    public static final String IMPLICIT = "IMPLICIT";

    public Triple {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(relation, "relation");
        Objects.requireNonNull(to, "to");
    }

    @Override
    public String toString() {
        return "(" + from + ", " + relation + ", " + to + ")";
    }
}
