package com.synesis.loader.ast;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class OntologyNode implements BlockNode {
    private final String concept;
    private final String description;
    private final FieldBag fields;
    private final List<ChainNode> parentChains;
    private final List<String> fieldNames;
    private final SourceLocation location;

    public OntologyNode(
            String concept,
            String description,
            FieldBag fields,
            List<ChainNode> parentChains,
            List<String> fieldNames,
            SourceLocation location) {
        this.concept = Objects.requireNonNull(concept, "concept");
        this.description = description == null ? "" : description;
        this.fields = Objects.requireNonNull(fields, "fields").copy();
        this.parentChains = List.copyOf(parentChains);
        this.fieldNames = List.copyOf(fieldNames);
        this.location = Objects.requireNonNull(location, "location");
    }

    public String getConcept() {
        return concept;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, FieldValue> getFields() {
        return fields.asMap();
    }

    public List<ChainNode> getParentChains() {
        return parentChains;
    }

    public List<String> getFieldNames() {
        return fieldNames;
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }
}
