package com.synesis.loader.semantic;

import com.synesis.loader.ast.ChainNode;
import com.synesis.loader.ast.FieldSlot;
import com.synesis.loader.ast.FieldSpec;
import com.synesis.loader.ast.FieldType;
import com.synesis.loader.ast.FieldValue;
import com.synesis.loader.ast.FieldValue.ChainValue;
import com.synesis.loader.ast.FieldValue.NumberValue;
import com.synesis.loader.ast.FieldValue.TextValue;
import com.synesis.loader.ast.ItemNode;
import com.synesis.loader.ast.Keys;
import com.synesis.loader.ast.OntologyNode;
import com.synesis.loader.ast.OrderedValue;
import com.synesis.loader.ast.ProjectNode;
import com.synesis.loader.ast.Scope;
import com.synesis.loader.ast.SourceLocation;
import com.synesis.loader.ast.SourceNode;
import com.synesis.loader.ast.TemplateNode;
import com.synesis.loader.semantic.ItemFieldBinder.CodeReference;
import com.synesis.loader.validation.BundleCountMismatch;
import com.synesis.loader.validation.ChainArityViolation;
import com.synesis.loader.validation.ForbiddenFieldPresent;
import com.synesis.loader.validation.InvalidChainRelation;
import com.synesis.loader.validation.InvalidEnumeratedValue;
import com.synesis.loader.validation.InvalidFieldType;
import com.synesis.loader.validation.InvalidOrderedValue;
import com.synesis.loader.validation.MalformedQualifiedChain;
import com.synesis.loader.validation.MissingBundleField;
import com.synesis.loader.validation.MissingRequiredField;
import com.synesis.loader.validation.ScaleOutOfRange;
import com.synesis.loader.validation.UndefinedCode;
import com.synesis.loader.validation.UnknownFieldName;
import com.synesis.loader.validation.UnregisteredSource;
import com.synesis.loader.validation.ValidationResult;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Checks parsed blocks against a template. One instance serves one compilation run; every call returns a fresh
 * {@link ValidationResult} and never throws on invalid input.
 *
 * <p>Bibliography references are only checked when a bibliography is supplied. A {@code null} bibliography means
 * none was provided, which is different from an empty one.
 */
public final class SemanticValidator {
    private static final Logger LOG = Logger.getLogger(SemanticValidator.class.getName());
    private static final int MAX_BIBREF_SUGGESTIONS = 3;
    private static final String CHAIN_FIELD = "chain";

    private final TemplateNode template;
    private final Bibliography bibliography;
    private final Map<String, OntologyNode> ontologyIndex;
    private final SimilarityMatcher matcher;
    private final ItemFieldBinder binder;

    public SemanticValidator(
            TemplateNode template, Bibliography bibliography, Map<String, OntologyNode> ontologyIndex) {
        this(template, bibliography, ontologyIndex, new SequenceSimilarityMatcher());
    }

    public SemanticValidator(
            TemplateNode template,
            Bibliography bibliography,
            Map<String, OntologyNode> ontologyIndex,
            SimilarityMatcher matcher) {
        this.template = Objects.requireNonNull(template, "template");
        this.bibliography = bibliography;
        Map<String, OntologyNode> normalized = new HashMap<>();
        for (Map.Entry<String, OntologyNode> entry : ontologyIndex.entrySet()) {
            normalized.put(Keys.code(entry.getKey()), entry.getValue());
        }
        this.ontologyIndex = Collections.unmodifiableMap(normalized);
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.binder = new ItemFieldBinder(template);
    }

    public static Map<String, OntologyNode> indexOntologies(Collection<OntologyNode> ontologies) {
        Map<String, OntologyNode> index = new LinkedHashMap<>();
        for (OntologyNode ontology : ontologies) {
            index.put(ontology.getConcept(), ontology);
        }
        return index;
    }

    public ValidationResult validateProject(ProjectNode project) {
        return new ValidationResult();
    }

    public ValidationResult validateSource(SourceNode source) {
        ValidationResult result = new ValidationResult();
        validateBibref(source, result);
        validateDeclaredFields(source.getFields().keySet(), Scope.SOURCE, source.getLocation(), result);
        Map<String, FieldValue> fields = new LinkedHashMap<>(source.getFields());
        validateFields(fields, Scope.SOURCE, source.getLocation(), result);
        result.addAll(validateBundle(fields, Scope.SOURCE, source.getLocation()).getAll());
        LOG.finer(() -> "Validated SOURCE " + source.getBibref() + ": " + result);
        return result;
    }

    public ValidationResult validateItem(ItemNode item) {
        ValidationResult result = new ValidationResult();
        validateDeclaredFields(item.getFieldNames(), Scope.ITEM, item.getLocation(), result);
        Map<String, FieldValue> fields = collectItemFields(item);
        validateFields(fields, Scope.ITEM, item.getLocation(), result);
        validateCodesDefined(item, result);
        Optional<FieldSpec> chainSpec = template.getFieldSpec(CHAIN_FIELD);
        if (chainSpec.isPresent()) {
            for (ChainNode chain : item.getChains()) {
                result.addAll(validateChain(chain, chainSpec.get()).getAll());
            }
        }
        result.addAll(validateBundle(fields, Scope.ITEM, item.getLocation()).getAll());
        LOG.finer(() -> "Validated ITEM " + item.getBibref() + " at " + item.getLocation() + ": " + result);
        return result;
    }

    public ValidationResult validateOntology(OntologyNode ontology) {
        ValidationResult result = new ValidationResult();
        validateDeclaredFields(ontology.getFieldNames(), Scope.ONTOLOGY, ontology.getLocation(), result);
        Map<String, FieldValue> fields = collectOntologyFields(ontology);
        validateFields(fields, Scope.ONTOLOGY, ontology.getLocation(), result);
        result.addAll(validateBundle(fields, Scope.ONTOLOGY, ontology.getLocation()).getAll());
        LOG.finer(() -> "Validated ONTOLOGY " + ontology.getConcept() + ": " + result);
        return result;
    }

    /**
     * Checks one ORDERED value. Integers must equal a declared index; text must equal a declared label ignoring case.
     * A field without VALUES accepts nothing.
     */
    public Optional<InvalidOrderedValue> validateOrderedValue(
            FieldSpec spec, FieldValue value, SourceLocation location) {
        List<String> labels = spec.getValues().stream().map(OrderedValue::getLabel).collect(Collectors.toList());
        boolean integer = value instanceof NumberValue && ((NumberValue) value).isInteger();
        if (!spec.hasValues()) {
            return Optional.of(new InvalidOrderedValue(location, spec.getName(), value.asText(), integer, labels));
        }
        if (integer) {
            BigDecimal number = ((NumberValue) value).number();
            for (OrderedValue declared : spec.getValues()) {
                if (number.compareTo(BigDecimal.valueOf(declared.getIndex())) == 0) {
                    return Optional.empty();
                }
            }
            return Optional.of(new InvalidOrderedValue(location, spec.getName(), value.asText(), true, labels));
        }
        if (value instanceof TextValue) {
            String wanted = value.asText().toLowerCase(Locale.ROOT);
            for (String label : labels) {
                if (label.toLowerCase(Locale.ROOT).equals(wanted)) {
                    return Optional.empty();
                }
            }
        }
        return Optional.of(new InvalidOrderedValue(location, spec.getName(), value.asText(), false, labels));
    }

    /**
     * Checks the shape of a chain against its field definition. Qualified chains alternate codes and relations and
     * must have an odd number of at least three elements; a malformed one gets no further checks. ARITY counts codes
     * only. Every code must be defined in the ontology.
     */
    public ValidationResult validateChain(ChainNode chain, FieldSpec spec) {
        ValidationResult result = new ValidationResult();
        List<String> elements = new ArrayList<>();
        List<SourceLocation> elementLocations = new ArrayList<>();
        for (int i = 0; i < chain.getNodes().size(); i++) {
            String element = chain.getNodes().get(i).strip();
            if (!element.isEmpty()) {
                elements.add(element);
                elementLocations.add(chain.locationOf(i));
            }
        }
        if (elements.isEmpty()) {
            return result;
        }
        List<String> codes = new ArrayList<>();
        List<SourceLocation> codeLocations = new ArrayList<>();
        if (spec.isQualifiedChain()) {
            if (elements.size() < 3 || elements.size() % 2 == 0) {
                result.add(new MalformedQualifiedChain(chain.getLocation(), elements));
                return result;
            }
            for (int i = 0; i < elements.size(); i++) {
                String element = elements.get(i);
                if (i % 2 == 0) {
                    codes.add(element);
                    codeLocations.add(elementLocations.get(i));
                } else if (!spec.getRelations().containsKey(element)) {
                    result.add(invalidRelation(chain.getLocation(), element, spec));
                }
            }
        } else {
            codes.addAll(elements);
            codeLocations.addAll(elementLocations);
        }
        checkArity(spec, codes.size(), chain.getLocation()).ifPresent(result::add);
        for (int i = 0; i < codes.size(); i++) {
            String code = codes.get(i);
            if (!ontologyIndex.containsKey(Keys.code(code))) {
                result.add(new UndefinedCode(codeLocations.get(i), code, "CHAIN"));
            }
        }
        return result;
    }

    public ValidationResult validateBundle(SourceNode source) {
        return validateBundle(new LinkedHashMap<>(source.getFields()), Scope.SOURCE, source.getLocation());
    }

    public ValidationResult validateBundle(ItemNode item) {
        return validateBundle(collectItemFields(item), Scope.ITEM, item.getLocation());
    }

    public ValidationResult validateBundle(OntologyNode ontology) {
        return validateBundle(collectOntologyFields(ontology), Scope.ONTOLOGY, ontology.getLocation());
    }

    private ValidationResult validateBundle(Map<String, FieldValue> fields, Scope scope, SourceLocation location) {
        ValidationResult result = new ValidationResult();
        for (List<String> bundle : template.getBundledFields(scope)) {
            if (!bundleTypesValid(bundle, fields)) {
                continue;
            }
            Map<String, Integer> counts = new LinkedHashMap<>();
            Set<String> present = new LinkedHashSet<>();
            for (String name : bundle) {
                FieldValue value = fields.get(name);
                if (value == null) {
                    continue;
                }
                present.add(name);
                counts.put(name, value.count());
            }
            if (present.size() != bundle.size()) {
                result.add(new MissingBundleField(location, bundle, present));
                continue;
            }
            if (new LinkedHashSet<>(counts.values()).size() > 1) {
                result.add(new BundleCountMismatch(location, bundle, counts));
            }
        }
        return result;
    }

    private void validateBibref(SourceNode source, ValidationResult result) {
        if (bibliography == null) {
            return;
        }
        String key = Keys.bibref(source.getBibref());
        if (bibliography.contains(key)) {
            return;
        }
        List<String> suggestions =
                matcher.closeMatches(key, new ArrayList<>(bibliography.keys()), MAX_BIBREF_SUGGESTIONS);
        result.add(new UnregisteredSource(source.getLocation(), key, suggestions));
    }

    private void validateDeclaredFields(
            Collection<String> fieldNames, Scope scope, SourceLocation location, ValidationResult result) {
        for (String name : new TreeSet<>(fieldNames)) {
            if (!template.isDefined(name)) {
                result.add(new UnknownFieldName(location, name, scope.name()));
            }
        }
    }

    private void validateFields(
            Map<String, FieldValue> fields, Scope scope, SourceLocation location, ValidationResult result) {
        for (String name : template.getRequiredFields(scope)) {
            if (!hasValue(fields.get(name))) {
                result.add(new MissingRequiredField(location, name, scope.name()));
            }
        }
        for (String name : template.getForbiddenFields(scope)) {
            if (hasValue(fields.get(name))) {
                result.add(new ForbiddenFieldPresent(location, name, scope.name()));
            }
        }
        for (Map.Entry<String, FieldValue> field : fields.entrySet()) {
            Optional<FieldSpec> spec = template.getFieldSpec(field.getKey());
            if (spec.isPresent()) {
                validateValue(spec.get(), field.getValue(), location, result);
            }
        }
    }

    private void validateValue(FieldSpec spec, FieldValue value, SourceLocation location, ValidationResult result) {
        if (value instanceof FieldValue.ListValue) {
            for (FieldValue element : value.elements()) {
                validateValue(spec, element, location, result);
            }
            return;
        }
        FieldType type = spec.getType();
        if (type.isTextual()) {
            if (value instanceof ChainValue) {
                result.add(new InvalidFieldType(location, spec.getName(), "string", value.typeName()));
            }
            return;
        }
        switch (type) {
            case CHAIN:
                if (!(value instanceof ChainValue)) {
                    result.add(new InvalidFieldType(location, spec.getName(), "chain", value.typeName()));
                }
                return;
            case ENUMERATED:
                if (value instanceof ChainValue) {
                    result.add(new InvalidFieldType(location, spec.getName(), "string", value.typeName()));
                    return;
                }
                List<String> labels =
                        spec.getValues().stream().map(OrderedValue::getLabel).collect(Collectors.toList());
                if (!labels.contains(value.asText())) {
                    result.add(new InvalidEnumeratedValue(location, spec.getName(), value.asText(), labels));
                }
                return;
            case ORDERED:
                validateOrderedValue(spec, value, location).ifPresent(result::add);
                return;
            case SCALE:
                if (!(value instanceof NumberValue)) {
                    result.add(new InvalidFieldType(location, spec.getName(), "number", value.typeName()));
                    return;
                }
                double number = ((NumberValue) value).number().doubleValue();
                Optional<double[]> range = parseScaleFormat(spec.getFormat().orElse(null));
                if (range.isPresent() && (number < range.get()[0] || number > range.get()[1])) {
                    result.add(
                            new ScaleOutOfRange(location, spec.getName(), number, range.get()[0], range.get()[1]));
                }
                return;
            default:
                return;
        }
    }

    /** {@code "[0..10]"} gives {@code {0.0, 10.0}}; anything else gives empty and disables the range check. */
    static Optional<double[]> parseScaleFormat(String format) {
        if (format == null) {
            return Optional.empty();
        }
        String trimmed = format.strip();
        if (!trimmed.startsWith("[") || !trimmed.endsWith("]") || !trimmed.contains("..")) {
            return Optional.empty();
        }
        String inner = trimmed.substring(1, trimmed.length() - 1);
        int separator = inner.indexOf("..");
        try {
            double min = Double.parseDouble(inner.substring(0, separator).strip());
            double max = Double.parseDouble(inner.substring(separator + 2).strip());
            return Optional.of(new double[] {min, max});
        } catch (NumberFormatException ex) {
            LOG.fine(() -> "Ignoring unparseable SCALE format '" + format + "'");
            return Optional.empty();
        }
    }

    private Optional<ChainArityViolation> checkArity(FieldSpec spec, int count, SourceLocation location) {
        if (spec.getArity().isEmpty()) {
            return Optional.empty();
        }
        String arity = spec.getArity().get();
        String[] parts = arity.strip().split("\\s+");
        if (parts.length != 2) {
            return Optional.empty();
        }
        int target;
        try {
            target = Integer.parseInt(parts[1]);
        } catch (NumberFormatException ex) {
            LOG.fine(() -> "Ignoring unparseable ARITY '" + arity + "'");
            return Optional.empty();
        }
        boolean satisfied;
        switch (parts[0]) {
            case "=":
                satisfied = count == target;
                break;
            case ">=":
                satisfied = count >= target;
                break;
            case "<=":
                satisfied = count <= target;
                break;
            case ">":
                satisfied = count > target;
                break;
            case "<":
                satisfied = count < target;
                break;
            default:
                satisfied = false;
                break;
        }
        return satisfied ? Optional.empty() : Optional.of(new ChainArityViolation(location, arity, count));
    }

    private InvalidChainRelation invalidRelation(SourceLocation location, String relation, FieldSpec spec) {
        List<String> valid = new ArrayList<>(spec.getRelations().keySet());
        List<String> upperValid =
                valid.stream().map(name -> name.toUpperCase(Locale.ROOT)).collect(Collectors.toList());
        List<String> matches = matcher.closeMatches(relation.toUpperCase(Locale.ROOT), upperValid, 1);
        String suggestion = matches.isEmpty() ? null : matches.get(0);
        return new InvalidChainRelation(location, relation, valid, spec.getRelations(), suggestion);
    }

    private void validateCodesDefined(ItemNode item, ValidationResult result) {
        for (CodeReference reference : binder.codeReferences(item)) {
            if (!ontologyIndex.containsKey(Keys.code(reference.code()))) {
                result.add(new UndefinedCode(reference.location(), reference.code(), "ITEM"));
            }
        }
    }

    private boolean bundleTypesValid(List<String> bundle, Map<String, FieldValue> fields) {
        for (String name : bundle) {
            FieldValue value = fields.get(name);
            Optional<FieldSpec> spec = template.getFieldSpec(name);
            if (value != null && spec.isPresent() && !hasValidType(spec.get().getType(), value)) {
                return false;
            }
        }
        return true;
    }

    private static boolean hasValidType(FieldType type, FieldValue value) {
        if (value instanceof FieldValue.ListValue) {
            for (FieldValue element : value.elements()) {
                if (!hasValidType(type, element)) {
                    return false;
                }
            }
            return true;
        }
        switch (type) {
            case CHAIN:
                return value instanceof ChainValue;
            case SCALE:
                return value instanceof NumberValue;
            case ORDERED:
                return value instanceof TextValue
                        || (value instanceof NumberValue && ((NumberValue) value).isInteger());
            default:
                return !(value instanceof ChainValue);
        }
    }

    private static boolean hasValue(FieldValue value) {
        return value != null && value.hasContent();
    }

    private Map<String, FieldValue> collectItemFields(ItemNode item) {
        Map<String, FieldValue> fields = new LinkedHashMap<>(item.getExtraFields());
        fields.putAll(binder.boundFields(item));
        if (!item.getQuote().isEmpty()) {
            putSlot(fields, FieldSlot.QUOTE, FieldValue.text(item.getQuote()));
        }
        if (!item.getCodes().isEmpty()) {
            putSlot(fields, FieldSlot.CODES, listOfTexts(item.getCodes()));
        }
        if (!item.getNotes().isEmpty()) {
            putSlot(fields, FieldSlot.NOTES, listOfTexts(item.getNotes()));
        }
        if (!item.getChains().isEmpty()) {
            List<FieldValue> chains = new ArrayList<>();
            for (ChainNode chain : item.getChains()) {
                chains.add(FieldValue.chain(chain));
            }
            putSlot(fields, FieldSlot.CHAINS, new FieldValue.ListValue(chains));
        }
        return fields;
    }

    private static Map<String, FieldValue> collectOntologyFields(OntologyNode ontology) {
        Map<String, FieldValue> fields = new LinkedHashMap<>(ontology.getFields());
        if (!ontology.getDescription().isEmpty()) {
            putSlot(fields, FieldSlot.DESCRIPTION, FieldValue.text(ontology.getDescription()));
        }
        return fields;
    }

    private static FieldValue listOfTexts(List<String> texts) {
        List<FieldValue> values = new ArrayList<>();
        for (String text : texts) {
            values.add(FieldValue.text(text));
        }
        return new FieldValue.ListValue(values);
    }

    private static void putSlot(Map<String, FieldValue> fields, FieldSlot slot, FieldValue value) {
        for (String name : slot.getNames()) {
            fields.putIfAbsent(name, value);
        }
    }
}
