package com.synesis.loader.ast;

import java.util.Objects;

/**
 * One entry of a VALUES block. ORDERED fields carry an explicit index; ENUMERATED fields ignore it. An index of
 * {@link #NO_INDEX} means the entry was written without the {@code [n]} prefix.
 */
public final class OrderedValue {
    public static final int NO_INDEX = -1;

    private final int index;
    private final boolean explicitIndex;
    private final String label;
    private final String description;
    private final SourceLocation location;

    public OrderedValue(int index, boolean explicitIndex, String label, String description, SourceLocation location) {
        this.index = index;
        this.explicitIndex = explicitIndex;
        this.label = Objects.requireNonNull(label, "label");
        this.description = Objects.requireNonNull(description, "description");
        this.location = Objects.requireNonNull(location, "location");
    }

    public static OrderedValue labelOnly(String label, String description, SourceLocation location) {
        return new OrderedValue(NO_INDEX, false, label, description, location);
    }

    public int getIndex() {
        return index;
    }

    public boolean hasExplicitIndex() {
        return explicitIndex;
    }

    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
