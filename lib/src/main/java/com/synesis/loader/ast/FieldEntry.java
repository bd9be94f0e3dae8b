package com.synesis.loader.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Raw lines of one {@code name: value} entry, kept so values can be re-split once a template is known. */
public record FieldEntry(String name, SourceLocation location, List<FieldLine> lines) {
    public static final String CODE_SEPARATOR = ",";
    public static final String CHAIN_SEPARATOR = "->";

    public FieldEntry {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(location, "location");
        lines = List.copyOf(lines);
    }

    public List<FieldLine> codes() {
        List<FieldLine> codes = new ArrayList<>();
        for (FieldLine line : lines) {
            codes.addAll(line.split(CODE_SEPARATOR));
        }
        return codes;
    }

    public ChainNode chain() {
        List<String> nodes = new ArrayList<>();
        List<SourceLocation> nodeLocations = new ArrayList<>();
        for (FieldLine line : lines) {
            for (FieldLine segment : line.split(CHAIN_SEPARATOR)) {
                nodes.add(segment.text());
                nodeLocations.add(segment.location());
            }
        }
        return new ChainNode(nodes, location, nodeLocations);
    }
}
