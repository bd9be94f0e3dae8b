package com.synesis.loader.validation;

import com.synesis.loader.ast.SourceLocation;
import java.util.List;

public final class MalformedQualifiedChain extends Diagnostic {
    private final List<String> elements;

    public MalformedQualifiedChain(SourceLocation location, List<String> elements) {
        super(Severity.ERROR, location);
        this.elements = List.copyOf(elements);
    }

    public List<String> getElements() {
        return elements;
    }

    @Override
    public String render() {
        return "Cadeia qualificada mal formada.\n"
                + "  Padrao esperado: Codigo -> RELACAO -> Codigo -> RELACAO -> Codigo\n"
                + "  Encontrado: "
                + String.join(" -> ", elements);
    }
}
