package com.synesis.loader.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class FieldRequirementsNode implements BlockNode {

    public enum ClauseKind {
        REQUIRED,
        REQUIRED_BUNDLE,
        OPTIONAL,
        FORBIDDEN
    }

    public record Clause(ClauseKind kind, List<String> names, SourceLocation location) {
        public Clause {
            Objects.requireNonNull(kind, "kind");
            names = List.copyOf(names);
            Objects.requireNonNull(location, "location");
        }
    }

    private final Scope scope;
    private final List<Clause> clauses;
    private final SourceLocation location;

    public FieldRequirementsNode(Scope scope, List<Clause> clauses, SourceLocation location) {
        this.scope = Objects.requireNonNull(scope, "scope");
        this.clauses = List.copyOf(clauses);
        this.location = Objects.requireNonNull(location, "location");
    }

    public Scope getScope() {
        return scope;
    }

    public List<Clause> getClauses() {
        return clauses;
    }

    public List<String> getNames(ClauseKind kind) {
        List<String> names = new ArrayList<>();
        for (Clause clause : clauses) {
            if (clause.kind() == kind) {
                names.addAll(clause.names());
            }
        }
        return names;
    }

    public List<List<String>> getBundles() {
        List<List<String>> bundles = new ArrayList<>();
        for (Clause clause : clauses) {
            if (clause.kind() == ClauseKind.REQUIRED_BUNDLE) {
                bundles.add(clause.names());
            }
        }
        return bundles;
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }
}
