package com.synesis.loader.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class FieldBag {
    private final Map<String, FieldValue> values = new LinkedHashMap<>();

    public void accumulate(String name, FieldValue value) {
        values.put(name, FieldValue.accumulate(values.get(name), value));
    }

    public void replace(String name, FieldValue value) {
        values.put(name, value);
    }

    public Optional<FieldValue> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, FieldValue> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public FieldBag copy() {
        FieldBag copy = new FieldBag();
        copy.values.putAll(values);
        return copy;
    }
}
