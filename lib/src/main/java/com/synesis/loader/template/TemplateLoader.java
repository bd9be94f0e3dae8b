package com.synesis.loader.template;

import com.synesis.loader.SynesisAstBuilder;
import com.synesis.loader.SynesisSyntaxException;
import com.synesis.loader.ast.FieldRequirementsNode;
import com.synesis.loader.ast.FieldRequirementsNode.Clause;
import com.synesis.loader.ast.FieldRequirementsNode.ClauseKind;
import com.synesis.loader.ast.FieldSpec;
import com.synesis.loader.ast.FieldType;
import com.synesis.loader.ast.OrderedValue;
import com.synesis.loader.ast.Scope;
import com.synesis.loader.ast.SourceLocation;
import com.synesis.loader.ast.SynesisDocument;
import com.synesis.loader.ast.TemplateHeaderNode;
import com.synesis.loader.ast.TemplateNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import org.antlr.v4.runtime.CharStreams;

/**
 * Loads a {@code .synt} file into a {@link TemplateNode}. The checks run in a fixed order and the first violation
 * aborts loading:
 *
 * <ol>
 *   <li>no two FIELD definitions share a name;
 *   <li>every VALUES entry of an ORDERED field carries a non-negative index;
 *   <li>every name listed in REQUIRED, OPTIONAL, FORBIDDEN or a BUNDLE has a FIELD definition.
 * </ol>
 *
 * Bundle members are kept apart from the plain required names. A file without a TEMPLATE header yields a template
 * with an empty name and metadata.
 */
public final class TemplateLoader {
    private static final Logger LOG = Logger.getLogger(TemplateLoader.class.getName());

    private final SynesisAstBuilder astBuilder;

    public TemplateLoader() {
        this(new SynesisAstBuilder());
    }

    public TemplateLoader(SynesisAstBuilder astBuilder) {
        this.astBuilder = Objects.requireNonNull(astBuilder, "astBuilder");
    }

    public TemplateNode load(Path path) throws IOException, SynesisSyntaxException, TemplateLoadException {
        Objects.requireNonNull(path, "path");
        String sourceName = path.toString();
        SynesisDocument document =
                astBuilder.parse(sourceName, CharStreams.fromPath(path, StandardCharsets.UTF_8));
        return assemble(document);
    }

    public TemplateNode loadFromString(String content, String filename)
            throws SynesisSyntaxException, TemplateLoadException {
        return assemble(astBuilder.parse(filename, content));
    }

    TemplateNode assemble(SynesisDocument document) throws TemplateLoadException {
        Map<String, FieldSpec> fieldSpecs = new LinkedHashMap<>();
        for (FieldSpec spec : document.blocksOf(FieldSpec.class)) {
            if (fieldSpecs.containsKey(spec.getName())) {
                throw new TemplateLoadException(
                        spec.getLocation(), "Campo FIELD duplicado: '" + spec.getName() + "'");
            }
            if (spec.getType() == FieldType.ORDERED) {
                for (OrderedValue value : spec.getValues()) {
                    if (!value.hasExplicitIndex() || value.getIndex() < 0) {
                        throw new TemplateLoadException(
                                value.getLocation(), "ORDERED exige indice em VALUES: '" + spec.getName() + "'");
                    }
                }
            }
            fieldSpecs.put(spec.getName(), spec);
        }

        Map<Scope, List<String>> required = byScope();
        Map<Scope, List<String>> optional = byScope();
        Map<Scope, List<String>> forbidden = byScope();
        Map<Scope, List<List<String>>> bundled = new EnumMap<>(Scope.class);
        Map<ClauseKind, Map<Scope, List<Clause>>> clausesByKind = new EnumMap<>(ClauseKind.class);
        for (ClauseKind kind : ClauseKind.values()) {
            Map<Scope, List<Clause>> perScope = new EnumMap<>(Scope.class);
            for (Scope scope : Scope.values()) {
                perScope.put(scope, new ArrayList<>());
            }
            clausesByKind.put(kind, perScope);
        }
        for (FieldRequirementsNode block : document.blocksOf(FieldRequirementsNode.class)) {
            Scope scope = block.getScope();
            for (Clause clause : block.getClauses()) {
                clausesByKind.get(clause.kind()).get(scope).add(clause);
                switch (clause.kind()) {
                    case REQUIRED:
                        required.get(scope).addAll(clause.names());
                        break;
                    case REQUIRED_BUNDLE:
                        bundled.computeIfAbsent(scope, key -> new ArrayList<>()).add(clause.names());
                        break;
                    case OPTIONAL:
                        optional.get(scope).addAll(clause.names());
                        break;
                    case FORBIDDEN:
                        forbidden.get(scope).addAll(clause.names());
                        break;
                    default:
                        break;
                }
            }
        }

        for (ClauseKind kind :
                List.of(ClauseKind.REQUIRED, ClauseKind.OPTIONAL, ClauseKind.FORBIDDEN, ClauseKind.REQUIRED_BUNDLE)) {
            for (Scope scope : Scope.values()) {
                for (Clause clause : clausesByKind.get(kind).get(scope)) {
                    checkListedNames(scope, clause, fieldSpecs);
                }
            }
        }

        List<TemplateHeaderNode> headers = document.blocksOf(TemplateHeaderNode.class);
        String name = "";
        Map<String, String> metadata = Map.of();
        SourceLocation location = SourceLocation.startOf(document.getSourceName());
        if (!headers.isEmpty()) {
            TemplateHeaderNode header = headers.get(0);
            name = header.getName();
            metadata = header.getMetadata();
            location = header.getLocation();
        }
        TemplateNode template =
                new TemplateNode(name, metadata, fieldSpecs, required, optional, forbidden, bundled, location);
        LOG.fine(() -> "Loaded template '" + template.getName() + "' with " + fieldSpecs.size() + " fields");
        return template;
    }

    private static void checkListedNames(Scope scope, Clause clause, Map<String, FieldSpec> fieldSpecs)
            throws TemplateLoadException {
        for (String name : clause.names()) {
            if (!fieldSpecs.containsKey(name)) {
                throw new TemplateLoadException(
                        clause.location(),
                        "Campo '" + name + "' listado em " + scope.name() + " FIELDS nao definido em FIELD");
            }
        }
    }

    private static Map<Scope, List<String>> byScope() {
        Map<Scope, List<String>> map = new EnumMap<>(Scope.class);
        for (Scope scope : Scope.values()) {
            map.put(scope, new ArrayList<>());
        }
        return map;
    }
}
