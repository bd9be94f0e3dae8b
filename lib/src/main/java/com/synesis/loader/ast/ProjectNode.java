package com.synesis.loader.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

public final class ProjectNode implements BlockNode {
    private final String name;
    private final String templatePath;
    private final List<IncludeNode> includes;
    private final Map<String, String> metadata;
    private final String description;
    private final SourceLocation location;

    public ProjectNode(
            String name,
            String templatePath,
            List<IncludeNode> includes,
            Map<String, String> metadata,
            String description,
            SourceLocation location) {
        this.name = Objects.requireNonNull(name, "name");
        this.templatePath = templatePath == null ? "" : templatePath;
        this.includes = List.copyOf(includes);
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.description = description;
        this.location = Objects.requireNonNull(location, "location");
    }

    public static ProjectNode unnamed(String sourceName) {
        return new ProjectNode("", "", List.of(), Map.of(), null, SourceLocation.startOf(sourceName));
    }

    public String getName() {
        return name;
    }

    public String getTemplatePath() {
        return templatePath;
    }

    public List<IncludeNode> getIncludes() {
        return includes;
    }

    public List<IncludeNode> getIncludes(IncludeNode.IncludeType type) {
        return includes.stream()
                .filter(include -> include.getIncludeType() == type)
                .collect(Collectors.toList());
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(description);
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }
}
