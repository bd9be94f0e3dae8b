package com.synesis.loader.semantic;

import com.synesis.loader.ast.Keys;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class MapBibliography implements Bibliography {
    private final Map<String, BibEntry> entries;

    public MapBibliography(Collection<BibEntry> entries) {
        Map<String, BibEntry> index = new LinkedHashMap<>();
        for (BibEntry entry : entries) {
            index.put(Keys.bibref(entry.getKey()), entry);
        }
        this.entries = Collections.unmodifiableMap(index);
    }

    public static MapBibliography of(BibEntry... entries) {
        return new MapBibliography(List.of(entries));
    }

    public static MapBibliography empty() {
        return new MapBibliography(List.of());
    }

    @Override
    public Optional<BibEntry> lookup(String key) {
        return Optional.ofNullable(entries.get(Keys.bibref(key)));
    }

    @Override
    public Collection<String> keys() {
        return entries.keySet();
    }

    public int size() {
        return entries.size();
    }
}
