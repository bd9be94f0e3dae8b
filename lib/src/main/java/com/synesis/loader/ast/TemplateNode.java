package com.synesis.loader.ast;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

public final class TemplateNode {
    private final String name;
    private final Map<String, String> metadata;
    private final Map<String, FieldSpec> fieldSpecs;
    private final Map<Scope, List<String>> requiredFields;
    private final Map<Scope, List<String>> optionalFields;
    private final Map<Scope, List<String>> forbiddenFields;
    private final Map<Scope, List<List<String>>> bundledFields;
    private final SourceLocation location;

    public TemplateNode(
            String name,
            Map<String, String> metadata,
            Map<String, FieldSpec> fieldSpecs,
            Map<Scope, List<String>> requiredFields,
            Map<Scope, List<String>> optionalFields,
            Map<Scope, List<String>> forbiddenFields,
            Map<Scope, List<List<String>>> bundledFields,
            SourceLocation location) {
        this.name = Objects.requireNonNull(name, "name");
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.fieldSpecs = Collections.unmodifiableMap(new LinkedHashMap<>(fieldSpecs));
        this.requiredFields = copyByScope(requiredFields);
        this.optionalFields = copyByScope(optionalFields);
        this.forbiddenFields = copyByScope(forbiddenFields);
        Map<Scope, List<List<String>>> bundles = new EnumMap<>(Scope.class);
        for (Scope scope : Scope.values()) {
            List<List<String>> copies = new ArrayList<>();
            for (List<String> bundle : bundledFields.getOrDefault(scope, List.of())) {
                copies.add(List.copyOf(bundle));
            }
            bundles.put(scope, List.copyOf(copies));
        }
        this.bundledFields = Collections.unmodifiableMap(bundles);
        this.location = Objects.requireNonNull(location, "location");
    }

    private static Map<Scope, List<String>> copyByScope(Map<Scope, List<String>> source) {
        Map<Scope, List<String>> copy = new EnumMap<>(Scope.class);
        for (Scope scope : Scope.values()) {
            copy.put(scope, List.copyOf(source.getOrDefault(scope, List.of())));
        }
        return Collections.unmodifiableMap(copy);
    }

    public String getName() {
        return name;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public Map<String, FieldSpec> getFieldSpecs() {
        return fieldSpecs;
    }

    public Optional<FieldSpec> getFieldSpec(String fieldName) {
        return Optional.ofNullable(fieldSpecs.get(fieldName));
    }

    public boolean isDefined(String fieldName) {
        return fieldSpecs.containsKey(fieldName);
    }

    public Optional<FieldSpec> getSlotSpec(FieldSlot slot) {
        for (String slotName : slot.getNames()) {
            FieldSpec spec = fieldSpecs.get(slotName);
            if (spec != null) {
                return Optional.of(spec);
            }
        }
        return Optional.empty();
    }

    public List<String> getRequiredFields(Scope scope) {
        return requiredFields.get(scope);
    }

    public List<String> getOptionalFields(Scope scope) {
        return optionalFields.get(scope);
    }

    public List<String> getForbiddenFields(Scope scope) {
        return forbiddenFields.get(scope);
    }

    public List<List<String>> getBundledFields(Scope scope) {
        return bundledFields.get(scope);
    }

    public List<String> getFieldNamesForScope(Scope scope) {
        List<String> names = new ArrayList<>();
        for (FieldSpec spec : fieldSpecs.values()) {
            if (spec.getScope() == scope) {
                names.add(spec.getName());
            }
        }
        return names;
    }

    public List<String> getFieldNamesForScopeAndTypes(Scope scope, Collection<FieldType> types) {
        Set<FieldType> wanted = types.isEmpty() ? Set.of() : Set.copyOf(types);
        List<String> names = new ArrayList<>();
        for (FieldSpec spec : fieldSpecs.values()) {
            if (spec.getScope() == scope && wanted.contains(spec.getType())) {
                names.add(spec.getName());
            }
        }
        return names;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
