package com.synesis.loader.semantic;

import com.synesis.loader.ast.ChainNode;
import com.synesis.loader.ast.FieldEntry;
import com.synesis.loader.ast.FieldLine;
import com.synesis.loader.ast.FieldSlot;
import com.synesis.loader.ast.FieldSpec;
import com.synesis.loader.ast.FieldType;
import com.synesis.loader.ast.FieldValue;
import com.synesis.loader.ast.ItemNode;
import com.synesis.loader.ast.Scope;
import com.synesis.loader.ast.SourceLocation;
import com.synesis.loader.ast.TemplateNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Applies the template to the custom fields of ITEM blocks. The parser cannot know that a field such as
 * {@code themes} is CODE typed, so its value arrives as plain text; binding re-splits it into one code per comma,
 * each located at its own column. CHAIN typed custom fields become chain nodes. Values are rebuilt from the raw
 * entry lines every time, so binding an item twice leaves it unchanged.
 */
public final class ItemFieldBinder {
    private static final Logger LOG = Logger.getLogger(ItemFieldBinder.class.getName());

    public record CodeReference(String code, String fieldName, SourceLocation location) {
        public CodeReference {
            Objects.requireNonNull(code, "code");
            Objects.requireNonNull(fieldName, "fieldName");
            Objects.requireNonNull(location, "location");
        }
    }

    private final TemplateNode template;

    public ItemFieldBinder(TemplateNode template) {
        this.template = Objects.requireNonNull(template, "template");
    }

    public void bind(ItemNode item) {
        for (Map.Entry<String, Binding> entry : bindings(item).entrySet()) {
            Binding binding = entry.getValue();
            item.bindExtraField(entry.getKey(), binding.value(), binding.codeLocations());
        }
    }

    public void bindAll(List<ItemNode> items) {
        for (ItemNode item : items) {
            bind(item);
        }
    }

    public Map<String, FieldValue> boundFields(ItemNode item) {
        Map<String, FieldValue> values = new LinkedHashMap<>();
        for (Map.Entry<String, Binding> entry : bindings(item).entrySet()) {
            values.put(entry.getKey(), entry.getValue().value());
        }
        return values;
    }

    private Map<String, Binding> bindings(ItemNode item) {
        Map<String, Binding> bindings = new LinkedHashMap<>();
        for (FieldSpec spec : template.getFieldSpecs().values()) {
            if (spec.getScope() != Scope.ITEM || isSlotField(spec.getName())) {
                continue;
            }
            List<FieldEntry> entries = item.getFieldEntries(spec.getName());
            if (entries.isEmpty()) {
                continue;
            }
            Binding binding = null;
            if (spec.getType() == FieldType.CODE) {
                binding = bindCodes(entries);
            } else if (spec.getType() == FieldType.CHAIN) {
                binding = bindChains(entries);
            }
            if (binding != null) {
                bindings.put(spec.getName(), binding);
            }
        }
        if (!bindings.isEmpty()) {
            LOG.finer(() -> "Bound fields " + bindings.keySet() + " of ITEM at " + item.getLocation());
        }
        return bindings;
    }

    private static Binding bindCodes(List<FieldEntry> entries) {
        List<String> codes = new ArrayList<>();
        List<SourceLocation> locations = new ArrayList<>();
        for (FieldEntry entry : entries) {
            for (FieldLine code : entry.codes()) {
                codes.add(code.text());
                locations.add(code.location());
            }
        }
        if (codes.isEmpty()) {
            return null;
        }
        return new Binding(FieldValue.texts(codes), locations);
    }

    private static Binding bindChains(List<FieldEntry> entries) {
        FieldValue value = null;
        for (FieldEntry entry : entries) {
            ChainNode chain = entry.chain();
            if (!chain.getNodes().isEmpty()) {
                value = FieldValue.accumulate(value, FieldValue.chain(chain));
            }
        }
        return value == null ? null : new Binding(value, List.of());
    }

    private record Binding(FieldValue value, List<SourceLocation> codeLocations) {}

    /**
     * Codes an item references: the fixed {@code code}/{@code codes} slot plus every custom ITEM field the template
     * types as CODE, in template declaration order. The fixed slot is read once even when both of its names are
     * declared. Custom fields are read from their raw lines, so the result does not depend on {@link #bind}.
     */
    public List<CodeReference> codeReferences(ItemNode item) {
        List<CodeReference> references = new ArrayList<>();
        boolean slotSeen = false;
        for (FieldSpec spec : template.getFieldSpecs().values()) {
            if (spec.getScope() != Scope.ITEM || spec.getType() != FieldType.CODE) {
                continue;
            }
            if (FieldSlot.CODES.matches(spec.getName())) {
                if (!slotSeen) {
                    addSlotCodes(item, references);
                    slotSeen = true;
                }
                continue;
            }
            if (isSlotField(spec.getName())) {
                continue;
            }
            for (FieldEntry entry : item.getFieldEntries(spec.getName())) {
                for (FieldLine code : entry.codes()) {
                    references.add(new CodeReference(code.text(), spec.getName(), code.location()));
                }
            }
        }
        if (!slotSeen && references.isEmpty()) {
            addSlotCodes(item, references);
        }
        return references;
    }

    public static List<CodeReference> slotCodeReferences(ItemNode item) {
        List<CodeReference> references = new ArrayList<>();
        addSlotCodes(item, references);
        return references;
    }

    private static void addSlotCodes(ItemNode item, List<CodeReference> references) {
        List<String> codes = item.getCodes();
        List<SourceLocation> locations = item.getCodeLocations();
        for (int i = 0; i < codes.size(); i++) {
            SourceLocation location = i < locations.size() ? locations.get(i) : item.getLocation();
            references.add(new CodeReference(codes.get(i), FieldSlot.CODES.getNames().get(0), location));
        }
    }

    private static boolean isSlotField(String fieldName) {
        return FieldSlot.forItemField(fieldName).isPresent();
    }
}
