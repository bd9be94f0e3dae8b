package com.synesis.loader.validation;

import com.synesis.loader.ast.SourceLocation;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

public final class InvalidChainRelation extends Diagnostic {
    private final String relation;
    private final List<String> validRelations;
    private final Map<String, String> relationDescriptions;
    private final String suggestion;

    /**
     * @param suggestion closest valid relation, upper-cased, or {@code null} when nothing is similar enough
     */
    public InvalidChainRelation(
            SourceLocation location,
            String relation,
            List<String> validRelations,
            Map<String, String> relationDescriptions,
            String suggestion) {
        super(Severity.ERROR, location);
        this.relation = Objects.requireNonNull(relation, "relation");
        this.validRelations = List.copyOf(validRelations);
        this.relationDescriptions = Collections.unmodifiableMap(new TreeMap<>(relationDescriptions));
        this.suggestion = suggestion;
    }

    public String getRelation() {
        return relation;
    }

    public List<String> getValidRelations() {
        return validRelations;
    }

    public Map<String, String> getRelationDescriptions() {
        return relationDescriptions;
    }

    public Optional<String> getSuggestion() {
        return Optional.ofNullable(suggestion);
    }

    @Override
    public String render() {
        StringBuilder message = new StringBuilder();
        message.append("Relacao '").append(relation).append("' nao existe no template.");
        if (suggestion != null) {
            message.append(" Voce quis dizer '").append(suggestion).append("'?\n");
        } else {
            message.append('\n');
        }
        if (!relationDescriptions.isEmpty()) {
            message.append("\nRelacoes validas:\n");
            relationDescriptions.forEach(
                    (name, description) ->
                            message.append("  ").append(name).append(" - ").append(description).append('\n'));
        } else {
            List<String> sorted = new ArrayList<>(validRelations);
            Collections.sort(sorted);
            message.append("\nRelacoes validas: ").append(String.join(", ", sorted)).append('\n');
        }
        return message.toString().stripTrailing();
    }
}
