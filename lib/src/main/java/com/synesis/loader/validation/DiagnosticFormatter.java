package com.synesis.loader.validation;

import java.util.ArrayList;
import java.util.List;

public final class DiagnosticFormatter {
    private static final String INDENT = "    ";

    private DiagnosticFormatter() {}

    /**
     * One diagnostic as {@code location: [SEVERITY] first line}, each further line of the rendering indented below
     * it.
     */
    public static String format(Diagnostic diagnostic) {
        String[] lines = diagnostic.render().split("\n", -1);
        StringBuilder out = new StringBuilder();
        out.append(diagnostic.getLocation())
                .append(": [")
                .append(diagnostic.getSeverity())
                .append("] ")
                .append(lines[0]);
        for (int i = 1; i < lines.length; i++) {
            out.append('\n');
            if (!lines[i].isEmpty()) {
                out.append(INDENT).append(lines[i]);
            }
        }
        return out.toString();
    }

    public static List<String> formatAll(ValidationResult result) {
        List<String> formatted = new ArrayList<>();
        for (Diagnostic diagnostic : result.getAll()) {
            formatted.add(format(diagnostic));
        }
        return formatted;
    }

    public static String summary(ValidationResult result) {
        List<String> lines = new ArrayList<>();
        appendSection(lines, "=== ERROS ===", result.getErrors());
        appendSection(lines, "=== AVISOS ===", result.getWarnings());
        appendSection(lines, "=== INFORMACOES ===", result.getInfo());
        return String.join("\n", lines);
    }

    private static void appendSection(List<String> lines, String header, List<Diagnostic> diagnostics) {
        if (diagnostics.isEmpty()) {
            return;
        }
        lines.add(header);
        for (Diagnostic diagnostic : diagnostics) {
            lines.add(diagnostic.render());
            lines.add("");
        }
    }
}
