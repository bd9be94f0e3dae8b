package com.synesis.loader.validation;

import com.synesis.loader.ast.SourceLocation;
import java.util.List;
import java.util.Objects;

public final class InvalidSyntax extends Diagnostic {
    private static final int MAX_EXPECTED = 5;

    private final String message;
    private final List<String> expected;

    public InvalidSyntax(SourceLocation location, String message, List<String> expected) {
        super(Severity.ERROR, location);
        this.message = Objects.requireNonNull(message, "message");
        this.expected = List.copyOf(expected);
    }

    public String getMessage() {
        return message;
    }

    public List<String> getExpected() {
        return expected;
    }

    @Override
    public String render() {
        String rendered = "Erro de sintaxe: " + message;
        if (!expected.isEmpty()) {
            rendered += "\n  Esperado: " + String.join(", ", expected.subList(0, Math.min(MAX_EXPECTED, expected.size())));
        }
        return rendered;
    }
}
