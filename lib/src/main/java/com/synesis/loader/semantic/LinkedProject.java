package com.synesis.loader.semantic;

import com.synesis.loader.ast.ItemNode;
import com.synesis.loader.ast.OntologyNode;
import com.synesis.loader.ast.ProjectNode;
import com.synesis.loader.ast.SourceNode;
import com.synesis.loader.ast.Triple;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Consolidated, read-only view of a compilation run. Map keys are normalized: sources by reference, ontology and code
 * usage by code, hierarchy on both sides. Topic keys are kept as written.
 */
public final class LinkedProject {
    private final ProjectNode project;
    private final Map<String, SourceNode> sources;
    private final Map<String, OntologyNode> ontologyIndex;
    private final Map<String, List<ItemNode>> codeUsage;
    private final Map<String, String> hierarchy;
    private final List<Triple> allTriples;
    private final Map<String, List<String>> topicIndex;
    private final Map<Triple, RelationInfo> relationIndex;

    public LinkedProject(
            ProjectNode project,
            Map<String, SourceNode> sources,
            Map<String, OntologyNode> ontologyIndex,
            Map<String, List<ItemNode>> codeUsage,
            Map<String, String> hierarchy,
            List<Triple> allTriples,
            Map<String, List<String>> topicIndex,
            Map<Triple, RelationInfo> relationIndex) {
        this.project = Objects.requireNonNull(project, "project");
        this.sources = Collections.unmodifiableMap(new LinkedHashMap<>(sources));
        this.ontologyIndex = Collections.unmodifiableMap(new LinkedHashMap<>(ontologyIndex));
        this.codeUsage = copyOfLists(codeUsage);
        this.hierarchy = Collections.unmodifiableMap(new LinkedHashMap<>(hierarchy));
        this.allTriples = List.copyOf(allTriples);
        this.topicIndex = copyOfLists(topicIndex);
        this.relationIndex = Collections.unmodifiableMap(new LinkedHashMap<>(relationIndex));
    }

    private static <T> Map<String, List<T>> copyOfLists(Map<String, List<T>> source) {
        Map<String, List<T>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<T>> entry : source.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
        }
        return Collections.unmodifiableMap(copy);
    }

    public ProjectNode getProject() {
        return project;
    }

    public Map<String, SourceNode> getSources() {
        return sources;
    }

    public Map<String, OntologyNode> getOntologyIndex() {
        return ontologyIndex;
    }

    /** Items per normalized code, in item order; an item appears once per time it cites the code. */
    public Map<String, List<ItemNode>> getCodeUsage() {
        return codeUsage;
    }

    public Map<String, String> getHierarchy() {
        return hierarchy;
    }

    public List<Triple> getAllTriples() {
        return allTriples;
    }

    public Map<String, List<String>> getTopicIndex() {
        return topicIndex;
    }

    public Map<Triple, RelationInfo> getRelationIndex() {
        return relationIndex;
    }

    public List<ItemNode> getItems() {
        List<ItemNode> items = new ArrayList<>();
        for (SourceNode source : sources.values()) {
            items.addAll(source.getItems());
        }
        return items;
    }
}
