package com.synesis.loader;

import com.synesis.loader.grammar.SynesisParser;
import com.synesis.loader.grammar.SyntaxErrorFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.LexerNoViableAltException;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.RuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.misc.IntervalSet;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/**
 * Aborts lexing or parsing on the first error. The pedagogical {@link SynesisSyntaxException} travels as the cause of
 * the {@link ParseCancellationException}; {@link SynesisAstBuilder} unwraps it.
 */
final class ThrowingErrorListener extends BaseErrorListener {
    private final SyntaxErrorFormatter errors;

    ThrowingErrorListener(SyntaxErrorFormatter errors) {
        this.errors = Objects.requireNonNull(errors, "errors");
    }

    @Override
    public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e) {
        SynesisSyntaxException failure;
        if (recognizer instanceof Lexer) {
            failure = lexerFailure((Lexer) recognizer, line, charPositionInLine, e);
        } else {
            failure = parserFailure((Parser) recognizer, (Token) offendingSymbol, e);
        }
        throw new ParseCancellationException(
                "line " + line + ":" + (charPositionInLine + 1) + " " + msg, failure);
    }

    private SynesisSyntaxException lexerFailure(Lexer lexer, int line, int charPositionInLine, RecognitionException e) {
        if (e instanceof LexerNoViableAltException) {
            CharStream input = lexer.getInputStream();
            int start = ((LexerNoViableAltException) e).getStartIndex();
            String text = input.getText(Interval.of(start, start));
            return errors.unexpectedCharacter(line, charPositionInLine, text.isEmpty() ? '?' : text.charAt(0));
        }
        return errors.inconsistentIndentation(line, charPositionInLine);
    }

    private SynesisSyntaxException parserFailure(Parser parser, Token offending, RecognitionException e) {
        IntervalSet expected = e != null ? e.getExpectedTokens() : parser.getExpectedTokens();
        List<Integer> types = new ArrayList<>();
        if (expected != null) {
            for (int type : expected.toArray()) {
                if (type != Token.EOF) {
                    types.add(type);
                }
            }
        }
        return errors.unexpectedToken(offending, types, openBlock(parser.getContext()));
    }

    /** Innermost block around the failure whose END line has not been reached yet. */
    private SyntaxErrorFormatter.OpenBlock openBlock(ParserRuleContext context) {
        for (RuleContext current = context; current != null; current = current.parent) {
            String keyword = blockKeyword(current);
            if (keyword != null) {
                Token start = ((ParserRuleContext) current).getStart();
                return new SyntaxErrorFormatter.OpenBlock(keyword, errors.locationOf(start));
            }
        }
        return null;
    }

    private static String blockKeyword(RuleContext context) {
        if (context instanceof SynesisParser.SourceBlockContext) {
            return ((SynesisParser.SourceBlockContext) context).fieldRequirements() == null
                    ? "SOURCE"
                    : "SOURCE FIELDS";
        }
        if (context instanceof SynesisParser.ItemBlockContext) {
            return ((SynesisParser.ItemBlockContext) context).fieldRequirements() == null ? "ITEM" : "ITEM FIELDS";
        }
        if (context instanceof SynesisParser.OntologyBlockContext) {
            return ((SynesisParser.OntologyBlockContext) context).fieldRequirements() == null
                    ? "ONTOLOGY"
                    : "ONTOLOGY FIELDS";
        }
        if (context instanceof SynesisParser.ProjectBlockContext) {
            return "PROJECT";
        }
        if (context instanceof SynesisParser.MetadataBlockContext) {
            return "METADATA";
        }
        if (context instanceof SynesisParser.DescriptionBlockContext) {
            return "DESCRIPTION";
        }
        if (context instanceof SynesisParser.FieldDefBlockContext) {
            return "FIELD";
        }
        if (context instanceof SynesisParser.ValuesPropContext) {
            return "VALUES";
        }
        if (context instanceof SynesisParser.RelationsPropContext) {
            return "RELATIONS";
        }
        return null;
    }
}
