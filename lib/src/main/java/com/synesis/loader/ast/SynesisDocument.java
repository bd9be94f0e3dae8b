package com.synesis.loader.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class SynesisDocument {
    private final String sourceName;
    private final List<BlockNode> blocks;

    public SynesisDocument(String sourceName, List<BlockNode> blocks) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.blocks = List.copyOf(blocks);
    }

    public String getSourceName() {
        return sourceName;
    }

    public List<BlockNode> getBlocks() {
        return blocks;
    }

    public List<ProjectNode> getProjects() {
        return blocksOf(ProjectNode.class);
    }

    public List<SourceNode> getSources() {
        return blocksOf(SourceNode.class);
    }

    public List<ItemNode> getItems() {
        return blocksOf(ItemNode.class);
    }

    public List<OntologyNode> getOntologies() {
        return blocksOf(OntologyNode.class);
    }

    public <T extends BlockNode> List<T> blocksOf(Class<T> type) {
        List<T> matches = new ArrayList<>();
        for (BlockNode block : blocks) {
            if (type.isInstance(block)) {
                matches.add(type.cast(block));
            }
        }
        return matches;
    }
}
