package com.synesis.loader.grammar;

import com.synesis.loader.SynesisSyntaxException;
import com.synesis.loader.ast.SourceLocation;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;

/**
 * Builds the pedagogical messages of syntax errors. Every message starts with {@code erro: <location>:} and, where
 * a common mistake is recognized, shows the corrected line.
 */
public final class SyntaxErrorFormatter {
    private static final int MAX_EXPECTED = 5;
    private static final int MAX_TYPO_DISTANCE = 2;
    private static final Pattern FIELD_LINE = Pattern.compile("^\\s*([a-zA-Z_][a-zA-Z0-9_]*)\\s*:");
    private static final List<String> KNOWN_FIELD_NAMES =
            List.of(
                    "quote",
                    "quotation",
                    "code",
                    "codes",
                    "chain",
                    "chains",
                    "note",
                    "notes",
                    "memo",
                    "memos",
                    "description",
                    "topic",
                    "aspect",
                    "dimension",
                    "confidence",
                    "parent",
                    "parents",
                    "is_a",
                    "isa");
    private static final Map<String, String> FRIENDLY_NAMES =
            Map.of(
                    "NEWLINE", "nova linha",
                    "IDENTIFIER", "identificador",
                    "FIELD_NAME", "nome de campo",
                    "STRING", "texto entre aspas",
                    "NUMBER", "numero",
                    "BIBREF", "referencia @...",
                    "NAME", "nome",
                    "INDENT", "indentacao",
                    "DEDENT", "fim de indentacao",
                    "TEXT_LINE", "texto");

    private final String sourceName;
    private final List<String> lines;

    public SyntaxErrorFormatter(String sourceName, List<String> lines) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.lines = List.copyOf(lines);
    }

    public static SyntaxErrorFormatter forInput(String sourceName, CharStream input) {
        String text = input.size() == 0 ? "" : input.getText(Interval.of(0, input.size() - 1));
        List<String> lines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i <= text.length(); i++) {
            if (i == text.length() ? start < text.length() : text.charAt(i) == '\n') {
                String line = text.substring(start, i);
                lines.add(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
                start = i + 1;
            }
        }
        return new SyntaxErrorFormatter(sourceName, lines);
    }

    public SourceLocation locationOf(Token token) {
        return new SourceLocation(sourceName, token.getLine(), token.getCharPositionInLine() + 1);
    }

    public SynesisSyntaxException unexpectedToken(Token token, List<Integer> expected, OpenBlock openBlock) {
        SourceLocation location = locationOf(token);
        List<String> expectedNames = new ArrayList<>();
        for (Integer type : expected) {
            expectedNames.add(symbolicName(type));
        }
        String currentLine = lineText(token.getLine());

        if (token.getType() == SynesisLexer.FIELD_NAME
                && (expected.contains(SynesisLexer.INDENT) || expected.contains(SynesisLexer.KW_END))) {
            return new SynesisSyntaxException(location, unindentedField(location, token.getText(), currentLine), expectedNames);
        }
        if (token.getType() == Token.EOF && expected.contains(SynesisLexer.KW_END) && openBlock != null) {
            return new SynesisSyntaxException(location, unclosedBlock(location, openBlock), expectedNames);
        }
        String[] typo = detectFieldTypo(currentLine);
        if (typo != null) {
            return new SynesisSyntaxException(location, fieldTypo(location, currentLine, typo), expectedNames);
        }
        return new SynesisSyntaxException(
                location, genericUnexpectedToken(location, token, currentLine, expectedNames), expectedNames);
    }

    public SynesisSyntaxException unexpectedCharacter(int line, int charPositionInLine, char character) {
        SourceLocation location = new SourceLocation(sourceName, line, charPositionInLine + 1);
        String currentLine = lineText(line);
        StringBuilder message = new StringBuilder();
        message.append("erro: ").append(location).append(": Caractere inesperado '").append(character).append("'\n");
        message.append("    ").append(currentLine).append('\n');
        message.append("    ").append(" ".repeat(charPositionInLine)).append("^ aqui\n");
        message.append("\nVerifique:\n");
        message.append("  - Aspas abertas mas nao fechadas\n");
        message.append("  - Caracteres especiais invalidos\n");
        message.append("  - Indentacao incorreta\n");
        return new SynesisSyntaxException(location, message.toString());
    }

    public SynesisSyntaxException inconsistentIndentation(int line, int width) {
        SourceLocation location = new SourceLocation(sourceName, line, width + 1);
        String message =
                "erro: "
                        + location
                        + ": Indentacao inconsistente.\n"
                        + "    "
                        + lineText(line)
                        + "\n\nA linha volta para um nivel de indentacao que nao foi aberto antes.\n"
                        + "Alinhe a linha com o bloco a que ela pertence (use multiplos de 4 espacos).";
        return new SynesisSyntaxException(location, message);
    }

    public SynesisSyntaxException semantic(SourceLocation location, String message) {
        return new SynesisSyntaxException(location, message);
    }

    private String unindentedField(SourceLocation location, String fieldName, String line) {
        return "erro: "
                + location
                + ": Campo '"
                + fieldName
                + "' precisa estar indentado dentro do bloco.\n"
                + "    "
                + line
                + "\n\nIndente os campos do bloco:\n"
                + "        "
                + line.strip();
    }

    private String unclosedBlock(SourceLocation location, OpenBlock openBlock) {
        return "erro: "
                + location
                + ": Bloco "
                + openBlock.keyword()
                + " iniciado em "
                + openBlock.location()
                + " nao foi fechado.\n\nFeche o bloco com:\n    END "
                + openBlock.keyword();
    }

    private String fieldTypo(SourceLocation location, String line, String[] typo) {
        String corrected =
                Pattern.compile("\\b" + Pattern.quote(typo[0]) + "\\b", Pattern.CASE_INSENSITIVE)
                        .matcher(line)
                        .replaceAll(Matcher.quoteReplacement(typo[1]));
        return "erro: "
                + location
                + ": Nome de campo desconhecido '"
                + typo[0]
                + "'.\n"
                + "    "
                + line.strip()
                + "\n\nVoce quis dizer '"
                + typo[1]
                + "'?\n"
                + "    "
                + corrected.strip()
                + "\n\nCampos comuns:\n"
                + "    quote, quotation - Excerto textual\n"
                + "    code, codes - Rotulos conceituais\n"
                + "    chain, chains - Cadeias causais\n"
                + "    note, notes, memo - Anotacoes analiticas\n"
                + "    description - Descricao do conceito";
    }

    private String genericUnexpectedToken(
            SourceLocation location, Token token, String currentLine, List<String> expectedNames) {
        StringBuilder message = new StringBuilder();
        message.append("erro: ").append(location).append(": Token inesperado ").append(describe(token)).append('\n');
        int index = token.getLine() - 1;
        if (index >= 1 && index + 1 < lines.size()) {
            message.append("\nContexto:\n");
            for (int i = index - 1; i <= index + 1; i++) {
                message.append(i == index ? ">>>" : "  ").append(' ').append(lines.get(i)).append('\n');
            }
        } else {
            message.append("    ").append(currentLine).append('\n');
        }
        if (!expectedNames.isEmpty()) {
            Set<String> friendly = new LinkedHashSet<>();
            for (String name : expectedNames) {
                friendly.add(humanize(name));
            }
            List<String> ordered = new ArrayList<>(friendly);
            message.append("\nEsperado: ")
                    .append(String.join(", ", ordered.subList(0, Math.min(MAX_EXPECTED, ordered.size()))));
            if (ordered.size() > MAX_EXPECTED) {
                message.append(" (e ").append(ordered.size() - MAX_EXPECTED).append(" outros)");
            }
        }
        return message.toString().stripTrailing();
    }

    private static String describe(Token token) {
        if (token.getType() == Token.EOF) {
            return "<EOF>";
        }
        String text = token.getText() == null ? "" : token.getText();
        if (token.getType() == SynesisLexer.NEWLINE) {
            text = "\\n";
        }
        return symbolicName(token.getType()) + " '" + text + "'";
    }

    static String symbolicName(int type) {
        if (type == Token.EOF) {
            return "EOF";
        }
        String name = SynesisLexer.VOCABULARY.getSymbolicName(type);
        return name == null ? "#" + type : name;
    }

    /** Reader-facing name: {@code KW_END} becomes {@code END}, {@code NEWLINE} becomes {@code nova linha}. */
    static String humanize(String symbolicName) {
        if (symbolicName.startsWith("KW_")) {
            return symbolicName.substring(3);
        }
        if ("EOF".equals(symbolicName)) {
            return "fim do arquivo";
        }
        return FRIENDLY_NAMES.getOrDefault(symbolicName, symbolicName);
    }

    private String lineText(int line) {
        if (line >= 1 && line <= lines.size()) {
            return lines.get(line - 1);
        }
        return "";
    }

    /** Returns {typo, suggestion} when the line starts with an unknown field name close to a known one. */
    static String[] detectFieldTypo(String line) {
        Matcher matcher = FIELD_LINE.matcher(line);
        if (!matcher.find()) {
            return null;
        }
        String fieldName = matcher.group(1).toLowerCase(Locale.ROOT);
        if (KNOWN_FIELD_NAMES.contains(fieldName)) {
            return null;
        }
        String closest = null;
        int best = Integer.MAX_VALUE;
        for (String known : KNOWN_FIELD_NAMES) {
            int distance = levenshtein(fieldName, known);
            if (distance < best) {
                best = distance;
                closest = known;
            }
        }
        if (closest != null && best <= MAX_TYPO_DISTANCE) {
            return new String[] {fieldName, closest};
        }
        return null;
    }

    static int levenshtein(String left, String right) {
        int[] previous = new int[right.length() + 1];
        for (int j = 0; j <= right.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= left.length(); i++) {
            int[] current = new int[right.length() + 1];
            current[0] = i;
            for (int j = 1; j <= right.length(); j++) {
                int substitution = previous[j - 1] + (left.charAt(i - 1) == right.charAt(j - 1) ? 0 : 1);
                current[j] = Math.min(Math.min(previous[j] + 1, current[j - 1] + 1), substitution);
            }
            previous = current;
        }
        return previous[right.length()];
    }

    public record OpenBlock(String keyword, SourceLocation location) {}
}
