package com.synesis.loader.validation;

import com.synesis.loader.ast.SourceLocation;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

public final class MissingBundleField extends Diagnostic {
    private final List<String> bundleFields;
    private final Set<String> presentFields;

    public MissingBundleField(SourceLocation location, List<String> bundleFields, Set<String> presentFields) {
        super(Severity.ERROR, location);
        this.bundleFields = List.copyOf(bundleFields);
        this.presentFields = Set.copyOf(presentFields);
    }

    public List<String> getBundleFields() {
        return bundleFields;
    }

    public Set<String> getPresentFields() {
        return presentFields;
    }

    public List<String> getMissingFields() {
        return bundleFields.stream().filter(name -> !presentFields.contains(name)).collect(Collectors.toList());
    }

    @Override
    public String render() {
        return "Campos do BUNDLE ("
                + String.join(", ", bundleFields)
                + ") devem aparecer juntos.\n"
                + "  Faltam: "
                + String.join(", ", getMissingFields())
                + "\n  Adicione os campos faltantes ou remova os presentes.";
    }
}
