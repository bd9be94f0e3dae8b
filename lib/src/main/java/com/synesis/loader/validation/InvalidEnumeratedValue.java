package com.synesis.loader.validation;

import com.synesis.loader.ast.SourceLocation;
import java.util.List;
import java.util.Objects;

public final class InvalidEnumeratedValue extends Diagnostic {
    private final String fieldName;
    private final String value;
    private final List<String> validValues;

    public InvalidEnumeratedValue(SourceLocation location, String fieldName, String value, List<String> validValues) {
        super(Severity.ERROR, location);
        this.fieldName = Objects.requireNonNull(fieldName, "fieldName");
        this.value = Objects.requireNonNull(value, "value");
        this.validValues = List.copyOf(validValues);
    }

    public String getFieldName() {
        return fieldName;
    }

    public String getValue() {
        return value;
    }

    public List<String> getValidValues() {
        return validValues;
    }

    @Override
    public String render() {
        return "Valor '"
                + value
                + "' invalido para campo '"
                + fieldName
                + "'.\n  Valores permitidos: "
                + String.join(", ", validValues);
    }
}
