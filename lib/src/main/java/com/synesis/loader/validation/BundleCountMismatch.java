package com.synesis.loader.validation;

import com.synesis.loader.ast.SourceLocation;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public final class BundleCountMismatch extends Diagnostic {
    private final List<String> bundleFields;
    private final Map<String, Integer> counts;

    public BundleCountMismatch(SourceLocation location, List<String> bundleFields, Map<String, Integer> counts) {
        super(Severity.ERROR, location);
        this.bundleFields = List.copyOf(bundleFields);
        this.counts = Collections.unmodifiableMap(new LinkedHashMap<>(counts));
    }

    public List<String> getBundleFields() {
        return bundleFields;
    }

    public Map<String, Integer> getCounts() {
        return counts;
    }

    @Override
    public String render() {
        String countText =
                counts.entrySet().stream()
                        .map(entry -> entry.getKey() + "=" + entry.getValue())
                        .collect(Collectors.joining(", "));
        return "BUNDLE ("
                + String.join(", ", bundleFields)
                + ") tem contagens diferentes: "
                + countText
                + "\n  Todos os campos do bundle devem aparecer o mesmo numero de vezes.\n"
                + "  Adicione ou remova entradas para igualar as contagens.";
    }
}
