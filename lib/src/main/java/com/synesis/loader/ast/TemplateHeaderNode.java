package com.synesis.loader.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class TemplateHeaderNode implements BlockNode {
    private final String name;
    private final Map<String, String> metadata;
    private final SourceLocation location;

    public TemplateHeaderNode(String name, Map<String, String> metadata, SourceLocation location) {
        this.name = Objects.requireNonNull(name, "name");
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.location = Objects.requireNonNull(location, "location");
    }

    public String getName() {
        return name;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }
}
