package com.synesis.loader.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public final class FieldSpec implements BlockNode {
    private final String name;
    private final FieldType type;
    private final Scope scope;
    private final String format;
    private final String description;
    private final List<OrderedValue> values;
    private final Map<String, String> relations;
    private final String arity;
    private final SourceLocation location;

    private FieldSpec(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name");
        this.type = Objects.requireNonNull(builder.type, "type");
        this.scope = builder.scope == null ? Scope.ITEM : builder.scope;
        this.format = builder.format;
        this.description = builder.description;
        this.values = builder.values == null ? null : List.copyOf(builder.values);
        this.relations =
                builder.relations == null
                        ? null
                        : Collections.unmodifiableMap(new LinkedHashMap<>(builder.relations));
        this.arity = builder.arity;
        this.location = Objects.requireNonNull(builder.location, "location");
    }

    public static Builder builder(String name, FieldType type, SourceLocation location) {
        return new Builder(name, type, location);
    }

    public String getName() {
        return name;
    }

    public FieldType getType() {
        return type;
    }

    public Scope getScope() {
        return scope;
    }

    public Optional<String> getFormat() {
        return Optional.ofNullable(format);
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(description);
    }

    public List<OrderedValue> getValues() {
        return values == null ? List.of() : values;
    }

    public boolean hasValues() {
        return values != null && !values.isEmpty();
    }

    public Map<String, String> getRelations() {
        return relations == null ? Map.of() : relations;
    }

    public boolean isQualifiedChain() {
        return relations != null && !relations.isEmpty();
    }

    public Optional<String> getArity() {
        return Optional.ofNullable(arity);
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    public static final class Builder {
        private final String name;
        private final FieldType type;
        private final SourceLocation location;
        private Scope scope;
        private String format;
        private String description;
        private List<OrderedValue> values;
        private Map<String, String> relations;
        private String arity;

        private Builder(String name, FieldType type, SourceLocation location) {
            this.name = name;
            this.type = type;
            this.location = location;
        }

        public Builder scope(Scope scope) {
            this.scope = scope;
            return this;
        }

        public Builder format(String format) {
            this.format = format;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder values(List<OrderedValue> values) {
            this.values = values;
            return this;
        }

        public Builder relations(Map<String, String> relations) {
            this.relations = relations;
            return this;
        }

        public Builder arity(String comparator, String count) {
            this.arity = comparator + " " + count;
            return this;
        }

        public FieldSpec build() {
            return new FieldSpec(this);
        }
    }
}
