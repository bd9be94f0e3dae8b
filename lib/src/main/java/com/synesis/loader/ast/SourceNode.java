package com.synesis.loader.ast;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class SourceNode implements BlockNode {
    private final String bibref;
    private final FieldBag fields;
    private final SourceLocation location;
    private List<ItemNode> items = List.of();

    public SourceNode(String bibref, FieldBag fields, SourceLocation location) {
        this.bibref = Objects.requireNonNull(bibref, "bibref");
        this.fields = Objects.requireNonNull(fields, "fields").copy();
        this.location = Objects.requireNonNull(location, "location");
    }

    public String getBibref() {
        return bibref;
    }

    public Map<String, FieldValue> getFields() {
        return fields.asMap();
    }

    public List<ItemNode> getItems() {
        return items;
    }

    public void setItems(List<ItemNode> items) {
        this.items = List.copyOf(items);
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }
}
