package com.synesis.loader.ast;

import java.util.Objects;

public final class IncludeNode {

    public enum IncludeType {
        TEMPLATE,
        BIBLIOGRAPHY,
        ANNOTATIONS,
        ONTOLOGY
    }

    private final IncludeType includeType;
    private final String path;
    private final SourceLocation location;

    public IncludeNode(IncludeType includeType, String path, SourceLocation location) {
        this.includeType = Objects.requireNonNull(includeType, "includeType");
        this.path = Objects.requireNonNull(path, "path");
        this.location = Objects.requireNonNull(location, "location");
    }

    public IncludeType getIncludeType() {
        return includeType;
    }

    public String getPath() {
        return path;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public boolean isGlob() {
        return path.indexOf('*') >= 0 || path.indexOf('?') >= 0 || path.indexOf('[') >= 0;
    }
}
