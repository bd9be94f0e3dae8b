package com.synesis.loader.validation;

import com.synesis.loader.ast.SourceLocation;
import java.util.List;
import java.util.Objects;

public final class UnregisteredSource extends Diagnostic {
    private final String bibref;
    private final List<String> suggestions;

    public UnregisteredSource(SourceLocation location, String bibref, List<String> suggestions) {
        super(Severity.ERROR, location);
        this.bibref = Objects.requireNonNull(bibref, "bibref");
        this.suggestions = List.copyOf(suggestions);
    }

    public String getBibref() {
        return bibref;
    }

    public List<String> getSuggestions() {
        return suggestions;
    }

    @Override
    public String render() {
        StringBuilder message = new StringBuilder();
        message.append("Fonte @").append(bibref).append(" nao encontrada no arquivo .bib\n");
        if (suggestions.isEmpty()) {
            message.append("\nNenhuma entrada similar encontrada.\n");
            message.append("Dica: Verifique o campo 'ID' da entrada BibTeX\n");
        } else {
            String best = suggestions.get(0);
            int differences = countDifferences(bibref, best);
            message.append("\nVoce quis dizer @")
                    .append(best)
                    .append("? (diferenca: ")
                    .append(differences)
                    .append(differences == 1 ? " letra" : " letras")
                    .append(")\n");
            if (suggestions.size() > 1) {
                message.append("\nOutras opcoes similares:\n");
                for (String other : suggestions.subList(1, Math.min(3, suggestions.size()))) {
                    message.append("  @").append(other).append('\n');
                }
            }
        }
        return message.toString().stripTrailing();
    }

    static int countDifferences(String left, String right) {
        int shared = Math.min(left.length(), right.length());
        int differences = Math.abs(left.length() - right.length());
        for (int i = 0; i < shared; i++) {
            if (left.charAt(i) != right.charAt(i)) {
                differences++;
            }
        }
        return differences;
    }
}
