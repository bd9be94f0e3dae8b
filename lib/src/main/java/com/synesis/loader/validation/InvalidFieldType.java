package com.synesis.loader.validation;

import com.synesis.loader.ast.SourceLocation;
import java.util.Objects;

public final class InvalidFieldType extends Diagnostic {
    private final String fieldName;
    private final String expected;
    private final String actual;

    public InvalidFieldType(SourceLocation location, String fieldName, String expected, String actual) {
        super(Severity.ERROR, location);
        this.fieldName = Objects.requireNonNull(fieldName, "fieldName");
        this.expected = Objects.requireNonNull(expected, "expected");
        this.actual = Objects.requireNonNull(actual, "actual");
    }

    public String getFieldName() {
        return fieldName;
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }

    @Override
    public String render() {
        return "Tipo invalido para campo '"
                + fieldName
                + "'.\n  Esperado: "
                + expected
                + "\n  Encontrado: "
                + actual;
    }
}
