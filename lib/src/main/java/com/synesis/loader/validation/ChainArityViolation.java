package com.synesis.loader.validation;

import com.synesis.loader.ast.SourceLocation;
import java.util.Objects;

public final class ChainArityViolation extends Diagnostic {
    private final String expected;
    private final int found;

    public ChainArityViolation(SourceLocation location, String expected, int found) {
        super(Severity.ERROR, location);
        this.expected = Objects.requireNonNull(expected, "expected");
        this.found = found;
    }

    public String getExpected() {
        return expected;
    }

    public int getFound() {
        return found;
    }

    @Override
    public String render() {
        return "Cadeia causal viola ARITY "
                + expected
                + " (encontrados "
                + found
                + " codigos).\n  Ajuste o numero de elementos na cadeia.";
    }
}
