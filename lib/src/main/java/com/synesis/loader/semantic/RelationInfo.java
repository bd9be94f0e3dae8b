package com.synesis.loader.semantic;

import com.synesis.loader.ast.SourceLocation;
import java.util.Locale;
import java.util.Objects;

public record RelationInfo(SourceLocation location, Type type) {

    public enum Type {
        QUALIFIED,
        SIMPLE;

        public String tag() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public RelationInfo {
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(type, "type");
    }
}
