package com.synesis.loader.grammar;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.synesis.loader.SynesisAstBuilder;
import com.synesis.loader.SynesisLoggingConfig;
import com.synesis.loader.SynesisSyntaxException;
import com.synesis.loader.ast.SourceNode;
import java.util.ArrayList;
import java.util.List;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.Token;
import org.junit.jupiter.api.Test;

class SynesisLexerTest extends SynesisLoggingConfig {
    @Test
    void emitsIndentationTokensAroundFieldBody() {
        List<Token> tokens = tokens("SOURCE @a", "    title: t", "END SOURCE");

        assertEquals(
                List.of(
                        "KW_SOURCE", "BIBREF", "NEWLINE",
                        "INDENT", "FIELD_NAME", "TEXT_LINE", "NEWLINE",
                        "DEDENT", "KW_END", "KW_SOURCE", "NEWLINE",
                        "EOF"),
                names(tokens));
        Token fieldName = tokens.get(4);
        assertEquals("title", fieldName.getText());
        assertEquals(2, fieldName.getLine());
        assertEquals(4, fieldName.getCharPositionInLine());
        assertEquals("t", tokens.get(5).getText());
    }

    @Test
    void fieldValuesAreStringsNumbersOrText() {
        List<Token> tokens =
                tokens("SOURCE @a", "    title: \"quoted text\"", "    year: 2023", "    pages: 42 apples", "END SOURCE");

        assertEquals("STRING", SyntaxErrorFormatter.symbolicName(tokens.get(5).getType()));
        assertEquals("NUMBER", SyntaxErrorFormatter.symbolicName(tokens.get(8).getType()));
        Token text = tokens.get(11);
        assertEquals("TEXT_LINE", SyntaxErrorFormatter.symbolicName(text.getType()));
        assertEquals("42 apples", text.getText());
    }

    @Test
    void deeperLinesAfterFieldBecomeWholeTextLines() {
        List<Token> tokens =
                tokens("ITEM @a", "    note: first", "        second", "", "        third", "END ITEM");

        assertEquals(
                List.of(
                        "KW_ITEM", "BIBREF", "NEWLINE",
                        "INDENT", "FIELD_NAME", "TEXT_LINE", "NEWLINE", "TEXT_LINE", "TEXT_LINE", "TEXT_LINE",
                        "DEDENT", "KW_END", "KW_ITEM", "NEWLINE",
                        "EOF"),
                names(tokens));
        assertEquals("        second", tokens.get(7).getText());
        assertEquals("", tokens.get(8).getText());
        assertEquals("        third", tokens.get(9).getText());
        assertEquals(0, tokens.get(9).getCharPositionInLine());
    }

    @Test
    void headerNamesRunToEndOfLine() {
        List<Token> tokens = tokens("ONTOLOGY Energia Solar", "END ONTOLOGY", "ONTOLOGY FIELDS");

        assertEquals("NAME", SyntaxErrorFormatter.symbolicName(tokens.get(1).getType()));
        assertEquals("Energia Solar", tokens.get(1).getText());
        assertEquals("KW_FIELDS", SyntaxErrorFormatter.symbolicName(tokens.get(7).getType()));
    }

    @Test
    void keywordsIgnoreCaseAndCommentsAreSkipped() {
        List<Token> tokens = tokens("# comentario", "source @a", "", "end Source");

        assertEquals(List.of("KW_SOURCE", "BIBREF", "NEWLINE", "KW_END", "KW_SOURCE", "NEWLINE", "EOF"), names(tokens));
        assertEquals(2, tokens.get(0).getLine());
    }

    @Test
    void tabsAdvanceToNextMultipleOfFour() throws Exception {
        String input = String.join("\n", "SOURCE @a", "\ttitle: t", "    year: 2023", "END SOURCE", "");

        SourceNode source =
                (SourceNode) new SynesisAstBuilder().parse("tabs.syn", input).getBlocks().get(0);

        assertEquals("t", source.getFields().get("title").asText());
        assertEquals("2023", source.getFields().get("year").asText());
    }

    @Test
    void humanizesSymbolicNames() {
        assertEquals("END", SyntaxErrorFormatter.humanize("KW_END"));
        assertEquals("fim do arquivo", SyntaxErrorFormatter.humanize("EOF"));
        assertEquals("KW_ONTOLOGY", SyntaxErrorFormatter.symbolicName(SynesisLexer.KW_ONTOLOGY));
    }

    @Test
    void inconsistentDedentIsRejected() {
        String input = String.join("\n", "SOURCE @a", "        title: t", "    year: 1", "END SOURCE", "");

        SynesisSyntaxException error =
                assertThrows(
                        SynesisSyntaxException.class, () -> new SynesisAstBuilder().parse("dedent.syn", input));

        assertTrue(error.getMessage().startsWith("erro: dedent.syn:3:"), error.getMessage());
        assertTrue(error.getMessage().contains("Indentacao inconsistente"), error.getMessage());
    }

    @Test
    void unterminatedStringPointsAtQuote() {
        String input = String.join("\n", "PROJECT P", "    TEMPLATE \"open.synt", "END PROJECT", "");

        SynesisSyntaxException error =
                assertThrows(
                        SynesisSyntaxException.class, () -> new SynesisAstBuilder().parse("string.synp", input));

        assertTrue(error.getMessage().contains("Caractere inesperado '\"'"), error.getMessage());
        assertEquals(2, error.getLocation().getLine());
        assertEquals(14, error.getLocation().getColumn());
    }

    @Test
    void unexpectedTopLevelTokenListsExpectations() {
        String input = String.join("\n", "SOURCE @a", "    title: t", "END SOURCE", "BOGUS", "");

        SynesisSyntaxException error =
                assertThrows(
                        SynesisSyntaxException.class, () -> new SynesisAstBuilder().parse("bogus.syn", input));

        assertTrue(error.getMessage().contains("Token inesperado"), error.getMessage());
        assertTrue(error.getMessage().contains("Esperado: PROJECT, SOURCE, ITEM, ONTOLOGY, TEMPLATE"));
        assertTrue(error.getMessage().contains("(e 1 outros)"), error.getMessage());
        assertTrue(error.getExpectedTokens().contains("KW_FIELD"));
    }

    @Test
    void detectsFieldNameTypos() {
        assertArrayEquals(new String[] {"qoute", "quote"}, SyntaxErrorFormatter.detectFieldTypo("    qoute: texto"));
        assertArrayEquals(new String[] {"chian", "chain"}, SyntaxErrorFormatter.detectFieldTypo("chian: A -> B"));
        assertNull(SyntaxErrorFormatter.detectFieldTypo("    quote: texto"));
        assertNull(SyntaxErrorFormatter.detectFieldTypo("    publisher: Editora"));
        assertNull(SyntaxErrorFormatter.detectFieldTypo("END SOURCE"));
    }

    @Test
    void levenshteinCountsEdits() {
        assertEquals(0, SyntaxErrorFormatter.levenshtein("code", "code"));
        assertEquals(1, SyntaxErrorFormatter.levenshtein("code", "codes"));
        assertEquals(3, SyntaxErrorFormatter.levenshtein("kitten", "sitting"));
    }

    private static List<Token> tokens(String... lines) {
        String input = String.join("\n", lines) + "\n";
        SynesisLexer lexer = new SynesisLexer(CharStreams.fromString(input, "lexer.syn"));
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = lexer.nextToken();
            tokens.add(token);
        } while (token.getType() != Token.EOF);
        return tokens;
    }

    private static List<String> names(List<Token> tokens) {
        List<String> names = new ArrayList<>();
        for (Token token : tokens) {
            names.add(SyntaxErrorFormatter.symbolicName(token.getType()));
        }
        return names;
    }
}
