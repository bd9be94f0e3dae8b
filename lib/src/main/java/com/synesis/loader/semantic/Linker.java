package com.synesis.loader.semantic;

import com.synesis.loader.ast.ChainNode;
import com.synesis.loader.ast.FieldSpec;
import com.synesis.loader.ast.FieldType;
import com.synesis.loader.ast.FieldValue;
import com.synesis.loader.ast.ItemNode;
import com.synesis.loader.ast.Keys;
import com.synesis.loader.ast.OntologyNode;
import com.synesis.loader.ast.ProjectNode;
import com.synesis.loader.ast.SourceNode;
import com.synesis.loader.ast.TemplateNode;
import com.synesis.loader.ast.Triple;
import com.synesis.loader.semantic.ItemFieldBinder.CodeReference;
import com.synesis.loader.validation.OrphanItem;
import com.synesis.loader.validation.SourceWithoutItems;
import com.synesis.loader.validation.UndefinedCode;
import com.synesis.loader.validation.ValidationResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Connects items to their sources and codes to ontology concepts, and derives the relation graph. Linking never
 * throws: problems are collected in {@link #getValidationResult()} and a best-effort {@link LinkedProject} is still
 * returned. Items whose reference has no SOURCE are reported once per reference and left out of every output
 * structure.
 */
public final class Linker {
    private static final Logger LOG = Logger.getLogger(Linker.class.getName());
    private static final String CHAIN_FIELD = "chain";
    private static final String TOPIC_FIELD = "topic";
    private static final String UNKNOWN_SOURCE = "<unknown>";

    private final List<SourceNode> sources;
    private final List<ItemNode> items;
    private final List<OntologyNode> ontologies;
    private final ProjectNode project;
    private final TemplateNode template;
    private ValidationResult validationResult = new ValidationResult();

    public Linker(List<SourceNode> sources, List<ItemNode> items, List<OntologyNode> ontologies) {
        this(sources, items, ontologies, null, null);
    }

    /**
     * @param project project block of the run, or {@code null} for an unnamed project
     * @param template schema of the run, or {@code null} when none is known
     */
    public Linker(
            List<SourceNode> sources,
            List<ItemNode> items,
            List<OntologyNode> ontologies,
            ProjectNode project,
            TemplateNode template) {
        this.sources = List.copyOf(Objects.requireNonNull(sources, "sources"));
        this.items = List.copyOf(Objects.requireNonNull(items, "items"));
        this.ontologies = List.copyOf(Objects.requireNonNull(ontologies, "ontologies"));
        this.project = project;
        this.template = template;
    }

    public LinkedProject link() {
        validationResult = new ValidationResult();
        ItemFieldBinder binder = template == null ? null : new ItemFieldBinder(template);

        Map<String, SourceNode> sourcesByBibref = new LinkedHashMap<>();
        for (SourceNode source : sources) {
            sourcesByBibref.put(Keys.bibref(source.getBibref()), source);
        }
        Map<String, List<ItemNode>> itemsByBibref = new LinkedHashMap<>();
        for (ItemNode item : items) {
            if (binder != null) {
                binder.bind(item);
            }
            itemsByBibref.computeIfAbsent(Keys.bibref(item.getBibref()), key -> new ArrayList<>()).add(item);
        }

        List<ItemNode> linkedItems = new ArrayList<>();
        for (Map.Entry<String, SourceNode> entry : sourcesByBibref.entrySet()) {
            entry.getValue().setItems(itemsByBibref.getOrDefault(entry.getKey(), List.of()));
        }
        for (Map.Entry<String, List<ItemNode>> group : itemsByBibref.entrySet()) {
            if (!sourcesByBibref.containsKey(group.getKey())) {
                validationResult.add(new OrphanItem(group.getValue().get(0).getLocation(), group.getKey()));
            }
        }
        for (ItemNode item : items) {
            if (sourcesByBibref.containsKey(Keys.bibref(item.getBibref()))) {
                linkedItems.add(item);
            }
        }
        for (Map.Entry<String, SourceNode> entry : sourcesByBibref.entrySet()) {
            if (entry.getValue().getItems().isEmpty()) {
                validationResult.add(new SourceWithoutItems(entry.getValue().getLocation(), entry.getKey()));
            }
        }

        Map<String, OntologyNode> ontologyIndex = new LinkedHashMap<>();
        for (OntologyNode ontology : ontologies) {
            ontologyIndex.put(Keys.code(ontology.getConcept()), ontology);
        }

        Map<String, List<ItemNode>> codeUsage = new LinkedHashMap<>();
        List<Triple> allTriples = new ArrayList<>();
        Map<Triple, RelationInfo> relationIndex = new LinkedHashMap<>();
        boolean qualified = hasChainRelations();
        RelationInfo.Type relationType = qualified ? RelationInfo.Type.QUALIFIED : RelationInfo.Type.SIMPLE;
        for (ItemNode item : linkedItems) {
            List<CodeReference> codes =
                    binder == null ? ItemFieldBinder.slotCodeReferences(item) : binder.codeReferences(item);
            for (CodeReference reference : codes) {
                String code = Keys.code(reference.code());
                codeUsage.computeIfAbsent(code, key -> new ArrayList<>()).add(item);
                if (!ontologyIndex.containsKey(code)) {
                    validationResult.add(new UndefinedCode(item.getLocation(), code, "ITEM"));
                }
            }
            for (ChainNode chain : item.getChains()) {
                List<Triple> triples = chain.toTriples(qualified);
                allTriples.addAll(triples);
                for (Triple triple : triples) {
                    relationIndex.putIfAbsent(triple, new RelationInfo(chain.getLocation(), relationType));
                }
            }
        }

        Map<String, String> hierarchy = new LinkedHashMap<>();
        for (OntologyNode ontology : ontologies) {
            for (ChainNode chain : ontology.getParentChains()) {
                List<String> nodes = nonBlank(chain.getNodes());
                for (int i = 0; i + 1 < nodes.size(); i++) {
                    hierarchy.put(Keys.code(nodes.get(i)), Keys.code(nodes.get(i + 1)));
                }
            }
        }

        Map<String, List<String>> topicIndex = new LinkedHashMap<>();
        for (OntologyNode ontology : ontologies) {
            for (String topic : extractTopics(ontology)) {
                topicIndex.computeIfAbsent(topic, key -> new ArrayList<>()).add(ontology.getConcept());
            }
        }

        LinkedProject linked =
                new LinkedProject(
                        project == null ? ProjectNode.unnamed(UNKNOWN_SOURCE) : project,
                        sourcesByBibref,
                        ontologyIndex,
                        codeUsage,
                        hierarchy,
                        allTriples,
                        topicIndex,
                        relationIndex);
        LOG.fine(
                () ->
                        "Linked "
                                + linkedItems.size()
                                + " items to "
                                + sourcesByBibref.size()
                                + " sources, "
                                + allTriples.size()
                                + " triples, "
                                + validationResult);
        return linked;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }

    private boolean hasChainRelations() {
        if (template == null) {
            return false;
        }
        Optional<FieldSpec> chainSpec = template.getFieldSpec(CHAIN_FIELD);
        return chainSpec.isPresent() && chainSpec.get().isQualifiedChain();
    }

    private List<String> extractTopics(OntologyNode ontology) {
        List<String> topics = new ArrayList<>();
        if (template == null) {
            FieldValue value = ontology.getFields().get(TOPIC_FIELD);
            if (value != null) {
                for (FieldValue element : value.elements()) {
                    topics.add(element.asText());
                }
            }
            return topics;
        }
        for (Map.Entry<String, FieldValue> field : ontology.getFields().entrySet()) {
            Optional<FieldSpec> spec = template.getFieldSpec(field.getKey());
            if (spec.isPresent() && spec.get().getType() == FieldType.TOPIC) {
                for (FieldValue element : field.getValue().elements()) {
                    topics.add(element.asText());
                }
            }
        }
        return topics;
    }

    private static List<String> nonBlank(List<String> nodes) {
        List<String> kept = new ArrayList<>();
        for (String node : nodes) {
            String stripped = node.strip();
            if (!stripped.isEmpty()) {
                kept.add(stripped);
            }
        }
        return kept;
    }
}
