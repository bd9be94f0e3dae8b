package com.synesis.loader.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A chain of elements split on {@code ->}. Whether the elements alternate codes and relation labels depends on the
 * owning field definition, so the node stores them flat.
 */
public final class ChainNode {
    private final List<String> nodes;
    private final List<String> relations;
    private final SourceLocation location;
    private final List<SourceLocation> nodeLocations;

    public ChainNode(List<String> nodes, SourceLocation location, List<SourceLocation> nodeLocations) {
        this.nodes = List.copyOf(nodes);
        this.relations = List.of();
        this.location = Objects.requireNonNull(location, "location");
        this.nodeLocations = nodeLocations == null ? List.of() : List.copyOf(nodeLocations);
    }

    public List<String> getNodes() {
        return nodes;
    }

    public List<String> getRelations() {
        return relations;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public List<SourceLocation> getNodeLocations() {
        return nodeLocations;
    }

    public SourceLocation locationOf(int index) {
        if (index >= 0 && index < nodeLocations.size()) {
            return nodeLocations.get(index);
        }
        return location;
    }

    public boolean isWellFormedQualified() {
        return nodes.size() >= 3 && nodes.size() % 2 == 1;
    }

    public List<String> codes(boolean qualified) {
        if (!qualified) {
            return nodes;
        }
        List<String> codes = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i += 2) {
            codes.add(nodes.get(i));
        }
        return codes;
    }

    /**
     * Derives triples. Qualified chains pair the codes at even positions through the relation at the odd position
     * between them, and yield nothing when malformed. Simple chains link consecutive elements with
     * {@link Triple#IMPLICIT}.
     */
    public List<Triple> toTriples(boolean qualified) {
        List<Triple> triples = new ArrayList<>();
        if (qualified) {
            if (!isWellFormedQualified()) {
                return triples;
            }
            for (int i = 0; i + 2 < nodes.size(); i += 2) {
                triples.add(new Triple(nodes.get(i), nodes.get(i + 1), nodes.get(i + 2)));
            }
            return triples;
        }
        for (int i = 0; i + 1 < nodes.size(); i++) {
            triples.add(new Triple(nodes.get(i), Triple.IMPLICIT, nodes.get(i + 1)));
        }
        return triples;
    }

    @Override
    public String toString() {
        return String.join(" -> ", nodes);
    }
}
