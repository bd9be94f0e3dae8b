package com.synesis.loader.semantic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public final class BibEntry {
    private final String key;
    private final Map<String, String> fields;

    public BibEntry(String key, Map<String, String> fields) {
        this.key = Objects.requireNonNull(key, "key");
        Map<String, String> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : fields.entrySet()) {
            normalized.put(entry.getKey().toLowerCase(Locale.ROOT), entry.getValue());
        }
        this.fields = Collections.unmodifiableMap(normalized);
    }

    public String getKey() {
        return key;
    }

    public Map<String, String> getFields() {
        return fields;
    }

    public Optional<String> field(String name) {
        return Optional.ofNullable(fields.get(name.toLowerCase(Locale.ROOT)));
    }
}
