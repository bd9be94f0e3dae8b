package com.synesis.loader;

import com.synesis.loader.grammar.SynesisLexer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.Trees;

public final class DebugFlags {
    private static final String TOKENS_PROPERTY = "synesis.debugTokens";
    private static final String PARSER_PROPERTY = "synesis.debugParser";
    private static final String TOKENS_ENV = "SYNESIS_DEBUG_TOKENS";
    private static final String PARSER_ENV = "SYNESIS_DEBUG_PARSER";
    private static final ThreadLocal<List<String>> CAPTURED_TOKENS = ThreadLocal.withInitial(ArrayList::new);
    private static final ThreadLocal<List<String>> CAPTURED_TREES = ThreadLocal.withInitial(ArrayList::new);

    private DebugFlags() {}

    public static boolean isTokenDebugEnabled() {
        return flag(TOKENS_PROPERTY, TOKENS_ENV);
    }

    public static boolean isParserTraceEnabled() {
        return flag(PARSER_PROPERTY, PARSER_ENV);
    }

    private static boolean flag(String property, String env) {
        String value = System.getProperty(property);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(env));
    }

    public static void logTokens(String sourceName, CommonTokenStream tokens, SynesisLexer lexer) {
        System.err.printf(Locale.ROOT, "[Synesis] Token dump for %s:%n", sourceName);
        for (Token token : tokens.getTokens()) {
            String name = lexer.getVocabulary().getSymbolicName(token.getType());
            String line =
                    String.format(
                            Locale.ROOT,
                            "%-25s @ %4d:%-3d -> %s",
                            name != null ? name : String.format(Locale.ROOT, "#%d", token.getType()),
                            token.getLine(),
                            token.getCharPositionInLine(),
                            token.getText());
            System.err.printf(Locale.ROOT, "  %s%n", line);
            CAPTURED_TOKENS.get().add(line);
        }
    }

    public static void logParseTree(String sourceName, ParseTree tree, Parser parser) {
        String rendered = Trees.toStringTree(tree, parser);
        System.err.printf(Locale.ROOT, "[Synesis] Parse tree for %s:%n  %s%n", sourceName, rendered);
        CAPTURED_TREES.get().add(rendered);
    }

    public static List<String> drainCapturedTokens() {
        List<String> captured = new ArrayList<>(CAPTURED_TOKENS.get());
        CAPTURED_TOKENS.get().clear();
        return captured;
    }

    public static List<String> drainCapturedTrees() {
        List<String> captured = new ArrayList<>(CAPTURED_TREES.get());
        CAPTURED_TREES.get().clear();
        return captured;
    }
}
