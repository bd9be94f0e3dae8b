package com.synesis.loader.validation;

import com.synesis.loader.ast.SourceLocation;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

public final class InvalidOrderedValue extends Diagnostic {
    private final String fieldName;
    private final String value;
    private final boolean index;
    private final List<String> validOptions;

    public InvalidOrderedValue(
            SourceLocation location, String fieldName, String value, boolean index, List<String> validOptions) {
        super(Severity.ERROR, location);
        this.fieldName = Objects.requireNonNull(fieldName, "fieldName");
        this.value = Objects.requireNonNull(value, "value");
        this.index = index;
        this.validOptions = List.copyOf(validOptions);
    }

    public String getFieldName() {
        return fieldName;
    }

    public String getValue() {
        return value;
    }

    public boolean isIndex() {
        return index;
    }

    public List<String> getValidOptions() {
        return validOptions;
    }

    @Override
    public String render() {
        if (index) {
            StringJoiner indices = new StringJoiner(", ");
            for (int i = 1; i <= validOptions.size(); i++) {
                indices.add("[" + i + "]");
            }
            return "Indice " + value + " invalido para campo '" + fieldName + "'.\n  Indices validos: " + indices;
        }
        return "Label '"
                + value
                + "' invalido para campo '"
                + fieldName
                + "'.\n  Valores validos: "
                + String.join(", ", validOptions);
    }
}
