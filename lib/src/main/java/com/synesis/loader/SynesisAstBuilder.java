package com.synesis.loader;

import com.synesis.loader.ast.BlockNode;
import com.synesis.loader.ast.ChainNode;
import com.synesis.loader.ast.FieldBag;
import com.synesis.loader.ast.FieldEntry;
import com.synesis.loader.ast.FieldLine;
import com.synesis.loader.ast.FieldRequirementsNode;
import com.synesis.loader.ast.FieldSlot;
import com.synesis.loader.ast.FieldSpec;
import com.synesis.loader.ast.FieldType;
import com.synesis.loader.ast.FieldValue;
import com.synesis.loader.ast.IncludeNode;
import com.synesis.loader.ast.ItemNode;
import com.synesis.loader.ast.Keys;
import com.synesis.loader.ast.OntologyNode;
import com.synesis.loader.ast.OrderedValue;
import com.synesis.loader.ast.ProjectNode;
import com.synesis.loader.ast.Scope;
import com.synesis.loader.ast.SourceLocation;
import com.synesis.loader.ast.SourceNode;
import com.synesis.loader.ast.SynesisDocument;
import com.synesis.loader.ast.TemplateHeaderNode;
import com.synesis.loader.grammar.SynesisLexer;
import com.synesis.loader.grammar.SynesisParser;
import com.synesis.loader.grammar.SynesisParserBaseVisitor;
import com.synesis.loader.grammar.SyntaxErrorFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.antlr.v4.runtime.tree.TerminalNode;

/**
 * Parses Synesis text into a {@link SynesisDocument}. Instances hold no state between calls; create one per caller
 * or share it freely.
 */
public final class SynesisAstBuilder {
    private static final Logger LOG = Logger.getLogger(SynesisAstBuilder.class.getName());

    public SynesisDocument parse(String sourceName, String input) throws SynesisSyntaxException {
        Objects.requireNonNull(input, "input");
        CharStream stream = CharStreams.fromString(input, sourceName);
        return parse(sourceName, stream);
    }

    public SynesisDocument parse(String sourceName, CharStream input) throws SynesisSyntaxException {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(input, "input");

        SyntaxErrorFormatter errors = SyntaxErrorFormatter.forInput(sourceName, input);
        ThrowingErrorListener listener = new ThrowingErrorListener(errors);

        SynesisLexer lexer = new SynesisLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(listener);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        SynesisParser parser = new SynesisParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(listener);

        try {
            if (DebugFlags.isTokenDebugEnabled()) {
                tokens.fill();
                DebugFlags.logTokens(sourceName, tokens, lexer);
                tokens.seek(0);
            }
            SynesisParser.FileContext context = parser.file();
            if (DebugFlags.isParserTraceEnabled()) {
                DebugFlags.logParseTree(sourceName, context, parser);
            }
            SynesisDocument document = new AstBuildingVisitor(sourceName, errors).build(context);
            LOG.fine(
                    () -> String.format(
                            Locale.ROOT, "Parsed %d blocks from %s", document.getBlocks().size(), sourceName));
            return document;
        } catch (ParseCancellationException ex) {
            if (ex.getCause() instanceof SynesisSyntaxException) {
                throw (SynesisSyntaxException) ex.getCause();
            }
            throw new SynesisSyntaxException(new SourceLocation(sourceName, 1, 1), String.valueOf(ex.getMessage()));
        }
    }

    static String normalizeFieldName(String name) {
        if (name.length() > 1 && hasLetter(name) && name.equals(name.toUpperCase(Locale.ROOT))) {
            return name.toLowerCase(Locale.ROOT);
        }
        return name;
    }

    private static boolean hasLetter(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.isLetter(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    static String unquote(String literal) {
        if (literal.length() < 2 || literal.charAt(0) != '"' || literal.charAt(literal.length() - 1) != '"') {
            return literal;
        }
        String body = literal.substring(1, literal.length() - 1);
        StringBuilder result = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                result.append(c);
                continue;
            }
            char escaped = body.charAt(++i);
            switch (escaped) {
                case 'n':
                    result.append('\n');
                    break;
                case 't':
                    result.append('\t');
                    break;
                case '"':
                case '\\':
                    result.append(escaped);
                    break;
                default:
                    result.append('\\').append(escaped);
                    break;
            }
        }
        return result.toString();
    }

    /** Removes the whitespace prefix shared by every non-blank line; blank lines become empty. */
    static List<String> dedent(List<String> lines) {
        String common = null;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            String indent = line.substring(0, line.length() - line.stripLeading().length());
            if (common == null) {
                common = indent;
            } else {
                int length = 0;
                while (length < common.length()
                        && length < indent.length()
                        && common.charAt(length) == indent.charAt(length)) {
                    length++;
                }
                common = common.substring(0, length);
            }
        }
        List<String> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (line.isBlank()) {
                result.add("");
            } else {
                result.add(common == null ? line : line.substring(common.length()));
            }
        }
        return result;
    }

    private static final class AstBuildingVisitor extends SynesisParserBaseVisitor<Void> {
        private static final Pattern LEADING_COLON = Pattern.compile("^\\s*:\\s*");

        private final String sourceName;
        private final SyntaxErrorFormatter errors;
        private final List<BlockNode> blocks = new ArrayList<>();

        AstBuildingVisitor(String sourceName, SyntaxErrorFormatter errors) {
            this.sourceName = sourceName;
            this.errors = errors;
        }

        SynesisDocument build(SynesisParser.FileContext context) {
            visitFile(context);
            return new SynesisDocument(sourceName, blocks);
        }

        @Override
        public Void visitFile(SynesisParser.FileContext ctx) {
            for (SynesisParser.BlockContext block : ctx.block()) {
                visit(block);
            }
            return null;
        }

        @Override
        public Void visitProjectBlock(SynesisParser.ProjectBlockContext ctx) {
            String templatePath = null;
            List<IncludeNode> includes = new ArrayList<>();
            Map<String, String> metadata = new LinkedHashMap<>();
            String description = null;
            for (SynesisParser.ProjectItemContext item : ctx.projectItem()) {
                if (item instanceof SynesisParser.TemplateRefContext) {
                    templatePath = unquote(((SynesisParser.TemplateRefContext) item).STRING().getText());
                } else if (item instanceof SynesisParser.IncludeStmtContext) {
                    SynesisParser.IncludeStmtContext include = (SynesisParser.IncludeStmtContext) item;
                    includes.add(
                            new IncludeNode(
                                    IncludeNode.IncludeType.valueOf(
                                            include.includeKind().getText().toUpperCase(Locale.ROOT)),
                                    unquote(include.STRING().getText()),
                                    location(include.getStart())));
                } else if (item instanceof SynesisParser.MetadataBlockContext) {
                    metadata.putAll(metadata(((SynesisParser.MetadataBlockContext) item).metadataLine()));
                } else if (item instanceof SynesisParser.DescriptionBlockContext) {
                    SynesisParser.DescriptionBlockContext block = (SynesisParser.DescriptionBlockContext) item;
                    description = freeText(text(block.TEXT_LINE()), block.textBlock(), false);
                }
            }
            blocks.add(
                    new ProjectNode(
                            blockName(ctx.blockName()),
                            templatePath,
                            includes,
                            metadata,
                            description,
                            location(ctx.getStart())));
            return null;
        }

        @Override
        public Void visitSourceBlock(SynesisParser.SourceBlockContext ctx) {
            if (ctx.fieldRequirements() != null) {
                blocks.add(requirements(Scope.SOURCE, ctx.getStart(), ctx.fieldRequirements()));
                return null;
            }
            FieldBag fields = new FieldBag();
            for (SynesisParser.FieldEntryContext entryContext : ctx.fieldBody().fieldEntry()) {
                ParsedEntry entry = entry(entryContext);
                fields.accumulate(entry.name, entry.value);
            }
            blocks.add(new SourceNode(ctx.BIBREF().getText(), fields, location(ctx.getStart())));
            return null;
        }

        @Override
        public Void visitItemBlock(SynesisParser.ItemBlockContext ctx) {
            if (ctx.fieldRequirements() != null) {
                blocks.add(requirements(Scope.ITEM, ctx.getStart(), ctx.fieldRequirements()));
                return null;
            }
            ItemNode.Builder item = ItemNode.builder(ctx.BIBREF().getText(), location(ctx.getStart()));
            for (SynesisParser.FieldEntryContext entryContext : ctx.fieldBody().fieldEntry()) {
                ParsedEntry entry = entry(entryContext);
                item.entry(entry.raw);
                FieldSlot slot = FieldSlot.forItemField(entry.name).orElse(null);
                if (slot == null) {
                    item.extraField(entry.name, entry.value);
                    continue;
                }
                switch (slot) {
                    case QUOTE:
                        item.quote(entry.value.asText());
                        break;
                    case CODES:
                        for (FieldLine code : entry.raw.codes()) {
                            item.code(code.text(), code.location());
                        }
                        break;
                    case NOTES:
                        item.note(entry.value.asText());
                        break;
                    case CHAINS:
                        item.chain(entry.raw.chain());
                        break;
                    default:
                        item.extraField(entry.name, entry.value);
                        break;
                }
            }
            blocks.add(item.build());
            return null;
        }

        @Override
        public Void visitOntologyBlock(SynesisParser.OntologyBlockContext ctx) {
            if (ctx.fieldRequirements() != null) {
                blocks.add(requirements(Scope.ONTOLOGY, ctx.getStart(), ctx.fieldRequirements()));
                return null;
            }
            String concept = blockName(ctx.blockName());
            SourceLocation location = location(ctx.getStart());
            String description = "";
            FieldBag fields = new FieldBag();
            List<ChainNode> parentChains = new ArrayList<>();
            List<String> fieldNames = new ArrayList<>();
            for (SynesisParser.FieldEntryContext entryContext : ctx.fieldBody().fieldEntry()) {
                ParsedEntry entry = entry(entryContext);
                fieldNames.add(entry.name);
                FieldSlot slot = FieldSlot.forOntologyField(entry.name).orElse(null);
                if (slot == FieldSlot.DESCRIPTION) {
                    description = entry.value.asText();
                } else if (slot == FieldSlot.PARENTS) {
                    parentChains.add(parentChain(concept, location, entry.raw.chain()));
                } else {
                    fields.accumulate(entry.name, entry.value);
                }
            }
            blocks.add(new OntologyNode(concept, description, fields, parentChains, fieldNames, location));
            return null;
        }

        @Override
        public Void visitTemplateHeader(SynesisParser.TemplateHeaderContext ctx) {
            blocks.add(
                    new TemplateHeaderNode(
                            blockName(ctx.blockName()), metadata(ctx.metadataLine()), location(ctx.getStart())));
            return null;
        }

        @Override
        public Void visitFieldDefBlock(SynesisParser.FieldDefBlockContext ctx) {
            String name = normalizeFieldName(ctx.word().getText());
            FieldType type = FieldType.fromKeyword(ctx.fieldType().getText()).orElseThrow();
            FieldSpec.Builder spec = FieldSpec.builder(name, type, location(ctx.getStart()));
            if (ctx.scope() != null) {
                spec.scope(scope(ctx.scope()));
            }
            for (SynesisParser.FieldPropContext prop : ctx.fieldProp()) {
                fieldProp(spec, prop);
            }
            blocks.add(spec.build());
            return null;
        }

        /** {@code parent: Energy} inside {@code ONTOLOGY Solar} reads as {@code Solar -> Energy}. */
        private static ChainNode parentChain(String concept, SourceLocation conceptLocation, ChainNode chain) {
            List<String> nodes = chain.getNodes();
            if (nodes.isEmpty() || Keys.code(nodes.get(0)).equals(Keys.code(concept))) {
                return chain;
            }
            List<String> prefixed = new ArrayList<>();
            prefixed.add(concept);
            prefixed.addAll(nodes);
            List<SourceLocation> locations = new ArrayList<>();
            locations.add(conceptLocation);
            locations.addAll(chain.getNodeLocations());
            return new ChainNode(prefixed, chain.getLocation(), locations);
        }

        private Map<String, String> metadata(List<SynesisParser.MetadataLineContext> lines) {
            Map<String, String> metadata = new LinkedHashMap<>();
            for (SynesisParser.MetadataLineContext line : lines) {
                SynesisParser.FieldValueContext value = line.fieldValue();
                metadata.put(line.FIELD_NAME().getText(), value == null ? "" : scalarText(value.getStart()));
            }
            return metadata;
        }

        private FieldRequirementsNode requirements(
                Scope scope, Token scopeToken, SynesisParser.FieldRequirementsContext ctx) {
            List<FieldRequirementsNode.Clause> clauses = new ArrayList<>();
            for (SynesisParser.RequirementClauseContext clause : ctx.requirementClause()) {
                Token kindToken = clause.getStart();
                FieldRequirementsNode.ClauseKind kind;
                switch (kindToken.getType()) {
                    case SynesisLexer.KW_REQUIRED:
                        kind =
                                clause.getToken(SynesisLexer.KW_BUNDLE, 0) == null
                                        ? FieldRequirementsNode.ClauseKind.REQUIRED
                                        : FieldRequirementsNode.ClauseKind.REQUIRED_BUNDLE;
                        break;
                    case SynesisLexer.KW_OPTIONAL:
                        kind = FieldRequirementsNode.ClauseKind.OPTIONAL;
                        break;
                    default:
                        kind = FieldRequirementsNode.ClauseKind.FORBIDDEN;
                        break;
                }
                List<String> names = new ArrayList<>();
                SynesisParser.FieldNamesContext fieldNames =
                        clause.getRuleContext(SynesisParser.FieldNamesContext.class, 0);
                for (SynesisParser.WordContext word : fieldNames.word()) {
                    names.add(normalizeFieldName(word.getText()));
                }
                clauses.add(new FieldRequirementsNode.Clause(kind, names, location(kindToken)));
            }
            return new FieldRequirementsNode(scope, clauses, location(scopeToken));
        }

        private void fieldProp(FieldSpec.Builder spec, SynesisParser.FieldPropContext prop) {
            if (prop instanceof SynesisParser.ScopePropContext) {
                spec.scope(scope(((SynesisParser.ScopePropContext) prop).scope()));
            } else if (prop instanceof SynesisParser.FormatPropContext) {
                SynesisParser.FormatPropContext format = (SynesisParser.FormatPropContext) prop;
                spec.format(freeText(text(format.TEXT_LINE()), format.textBlock(), false));
            } else if (prop instanceof SynesisParser.DescriptionPropContext) {
                SynesisParser.DescriptionPropContext description = (SynesisParser.DescriptionPropContext) prop;
                spec.description(freeText(text(description.TEXT_LINE()), description.textBlock(), true));
            } else if (prop instanceof SynesisParser.NamedPropContext) {
                namedProp(spec, (SynesisParser.NamedPropContext) prop);
            } else if (prop instanceof SynesisParser.ArityPropContext) {
                SynesisParser.ArityPropContext arity = (SynesisParser.ArityPropContext) prop;
                spec.arity(arity.COMPARATOR().getText(), arity.NUMBER().getText());
            } else if (prop instanceof SynesisParser.ValuesPropContext) {
                spec.values(orderedValues(((SynesisParser.ValuesPropContext) prop).valueEntry()));
            } else if (prop instanceof SynesisParser.RelationsPropContext) {
                Map<String, String> relations = new LinkedHashMap<>();
                for (SynesisParser.RelationEntryContext entry :
                        ((SynesisParser.RelationsPropContext) prop).relationEntry()) {
                    relations.put(entry.FIELD_NAME().getText(), entryDescription(entry.fieldValue()));
                }
                spec.relations(relations);
            }
        }

        private void namedProp(FieldSpec.Builder spec, SynesisParser.NamedPropContext prop) {
            Token name = prop.FIELD_NAME().getSymbol();
            String inline = prop.fieldValue() == null ? null : scalarText(prop.fieldValue().getStart());
            switch (name.getText().toLowerCase(Locale.ROOT)) {
                case "description":
                    spec.description(freeText(inline, prop.textBlock(), false));
                    break;
                case "format":
                    spec.format(freeText(inline, prop.textBlock(), false));
                    break;
                default:
                    throw fail(
                            errors.semantic(
                                    location(name),
                                    "Propriedade desconhecida em FIELD: '"
                                            + name.getText()
                                            + "'. Use SCOPE, FORMAT, DESCRIPTION, ARITY, VALUES ou RELATIONS."));
            }
        }

        private List<OrderedValue> orderedValues(List<SynesisParser.ValueEntryContext> entries) {
            List<OrderedValue> values = new ArrayList<>();
            for (SynesisParser.ValueEntryContext entry : entries) {
                SourceLocation location = location(entry.getStart());
                String label = entry.FIELD_NAME().getText();
                String description = entryDescription(entry.fieldValue());
                TerminalNode index = entry.NUMBER();
                if (index == null) {
                    values.add(OrderedValue.labelOnly(label, description, location));
                    continue;
                }
                int parsed;
                try {
                    parsed = Integer.parseInt(index.getText());
                } catch (NumberFormatException ex) {
                    throw fail(
                            errors.semantic(
                                    location(index.getSymbol()),
                                    "Indice de VALUES deve ser inteiro: '" + index.getText() + "'"));
                }
                values.add(new OrderedValue(parsed, true, label, description, location));
            }
            return values;
        }

        private static String entryDescription(SynesisParser.FieldValueContext value) {
            return value == null ? "" : value.getText().strip();
        }

        private static String freeText(
                String inline, SynesisParser.TextBlockContext block, boolean stripLeadingColon) {
            List<String> lines = new ArrayList<>();
            if (inline != null) {
                String text = inline.strip();
                if (stripLeadingColon) {
                    text = LEADING_COLON.matcher(text).replaceFirst("");
                }
                if (!text.isEmpty()) {
                    lines.add(text);
                }
            }
            lines.addAll(dedent(continuation(block)));
            String joined = String.join("\n", lines).strip();
            return joined.isEmpty() ? null : joined;
        }

        private ParsedEntry entry(SynesisParser.FieldEntryContext context) {
            Token nameToken = context.FIELD_NAME().getSymbol();
            String name = normalizeFieldName(nameToken.getText());
            SourceLocation location = location(nameToken);
            Token inline = context.fieldValue() == null ? null : context.fieldValue().getStart();
            List<String> continuation = continuation(context.textBlock());

            List<FieldLine> lines = new ArrayList<>();
            if (inline != null) {
                if (inline.getType() == SynesisLexer.STRING) {
                    lines.add(new FieldLine(unquote(inline.getText()), location(inline).withColumnOffset(1)));
                } else {
                    lines.add(new FieldLine(inline.getText(), location(inline)));
                }
            }
            if (context.textBlock() != null) {
                for (TerminalNode node : context.textBlock().TEXT_LINE()) {
                    Token token = node.getSymbol();
                    if (!token.getText().isBlank()) {
                        lines.add(new FieldLine(token.getText(), new SourceLocation(sourceName, token.getLine(), 1)));
                    }
                }
            }
            FieldEntry raw = new FieldEntry(name, location, lines);

            FieldValue value;
            if (continuation.isEmpty()) {
                if (inline == null) {
                    throw emptyValue(location, name);
                }
                value = scalar(inline);
                if (!value.hasContent()) {
                    throw emptyValue(location, name);
                }
            } else {
                List<String> text = new ArrayList<>();
                if (inline != null) {
                    text.add(scalarText(inline));
                }
                text.addAll(dedent(continuation));
                while (!text.isEmpty() && text.get(0).isBlank()) {
                    text.remove(0);
                }
                String joined = String.join("\n", text).stripTrailing();
                if (joined.isBlank()) {
                    throw emptyValue(location, name);
                }
                value = FieldValue.text(joined);
            }
            return new ParsedEntry(name, value, raw);
        }

        private ParseCancellationException emptyValue(SourceLocation location, String name) {
            return fail(errors.semantic(location, "Empty value for field '" + name + "'"));
        }

        private static ParseCancellationException fail(SynesisSyntaxException cause) {
            return new ParseCancellationException(cause.getMessage(), cause);
        }

        private static FieldValue scalar(Token token) {
            if (token.getType() == SynesisLexer.NUMBER) {
                return FieldValue.NumberValue.parse(token.getText());
            }
            return FieldValue.text(scalarText(token));
        }

        private static String scalarText(Token token) {
            if (token.getType() == SynesisLexer.STRING) {
                return unquote(token.getText());
            }
            return token.getText().strip();
        }

        private static String text(TerminalNode node) {
            return node == null ? null : node.getText();
        }

        private static List<String> continuation(SynesisParser.TextBlockContext block) {
            List<String> lines = new ArrayList<>();
            if (block != null) {
                for (TerminalNode node : block.TEXT_LINE()) {
                    lines.add(node.getText());
                }
            }
            return lines;
        }

        private static String blockName(SynesisParser.BlockNameContext ctx) {
            if (ctx.STRING() != null) {
                return unquote(ctx.STRING().getText());
            }
            return ctx.NAME().getText().strip();
        }

        private static Scope scope(SynesisParser.ScopeContext ctx) {
            return Scope.fromKeyword(ctx.getText()).orElseThrow();
        }

        private SourceLocation location(Token token) {
            return new SourceLocation(sourceName, token.getLine(), token.getCharPositionInLine() + 1);
        }
    }

    private static final class ParsedEntry {
        private final String name;
        private final FieldValue value;
        private final FieldEntry raw;

        ParsedEntry(String name, FieldValue value, FieldEntry raw) {
            this.name = name;
            this.value = value;
            this.raw = raw;
        }
    }
}
