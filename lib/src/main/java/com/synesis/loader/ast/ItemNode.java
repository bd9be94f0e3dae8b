package com.synesis.loader.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An {@code ITEM @ref} block. Quote, codes, notes and chains live in fixed slots; every other field lands in
 * {@link #getExtraFields()}. Custom CODE and CHAIN fields are re-bound once the template is known.
 */
public final class ItemNode implements BlockNode {
    private final String bibref;
    private final String quote;
    private final List<String> codes;
    private final List<SourceLocation> codeLocations;
    private final List<String> notes;
    private final List<ChainNode> chains;
    private final FieldBag extraFields;
    private final Map<String, List<SourceLocation>> extraCodeLocations;
    private final List<String> fieldNames;
    private final List<FieldEntry> fieldEntries;
    private final SourceLocation location;

    private ItemNode(Builder builder) {
        this.bibref = Objects.requireNonNull(builder.bibref, "bibref");
        this.quote = builder.quote;
        this.codes = List.copyOf(builder.codes);
        this.codeLocations = List.copyOf(builder.codeLocations);
        this.notes = List.copyOf(builder.notes);
        this.chains = List.copyOf(builder.chains);
        this.extraFields = builder.extraFields.copy();
        this.extraCodeLocations = new LinkedHashMap<>();
        this.fieldNames = List.copyOf(builder.fieldNames);
        this.fieldEntries = List.copyOf(builder.fieldEntries);
        this.location = Objects.requireNonNull(builder.location, "location");
    }

    public static Builder builder(String bibref, SourceLocation location) {
        return new Builder(bibref, location);
    }

    public String getBibref() {
        return bibref;
    }

    public String getQuote() {
        return quote;
    }

    public List<String> getCodes() {
        return codes;
    }

    public List<SourceLocation> getCodeLocations() {
        return codeLocations;
    }

    public List<String> getNotes() {
        return notes;
    }

    public List<ChainNode> getChains() {
        return chains;
    }

    public Map<String, FieldValue> getExtraFields() {
        return extraFields.asMap();
    }

    public Optional<FieldValue> getExtraField(String name) {
        return extraFields.get(name);
    }

    public List<SourceLocation> getExtraCodeLocations(String fieldName) {
        return extraCodeLocations.getOrDefault(fieldName, List.of());
    }

    public List<String> getFieldNames() {
        return fieldNames;
    }

    public List<FieldEntry> getFieldEntries() {
        return fieldEntries;
    }

    public List<FieldEntry> getFieldEntries(String name) {
        List<FieldEntry> entries = new ArrayList<>();
        for (FieldEntry entry : fieldEntries) {
            if (entry.name().equals(name)) {
                entries.add(entry);
            }
        }
        return entries;
    }

    public void bindExtraField(String name, FieldValue value, List<SourceLocation> codeLocations) {
        extraFields.replace(name, value);
        if (codeLocations.isEmpty()) {
            extraCodeLocations.remove(name);
        } else {
            extraCodeLocations.put(name, Collections.unmodifiableList(new ArrayList<>(codeLocations)));
        }
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    public static final class Builder {
        private final String bibref;
        private final SourceLocation location;
        private String quote = "";
        private final List<String> codes = new ArrayList<>();
        private final List<SourceLocation> codeLocations = new ArrayList<>();
        private final List<String> notes = new ArrayList<>();
        private final List<ChainNode> chains = new ArrayList<>();
        private final FieldBag extraFields = new FieldBag();
        private final List<String> fieldNames = new ArrayList<>();
        private final List<FieldEntry> fieldEntries = new ArrayList<>();

        private Builder(String bibref, SourceLocation location) {
            this.bibref = bibref;
            this.location = location;
        }

        public Builder quote(String quote) {
            this.quote = Objects.requireNonNull(quote, "quote");
            return this;
        }

        public Builder code(String code, SourceLocation codeLocation) {
            codes.add(code);
            codeLocations.add(codeLocation);
            return this;
        }

        public Builder note(String note) {
            notes.add(note);
            return this;
        }

        public Builder chain(ChainNode chain) {
            chains.add(chain);
            return this;
        }

        public Builder extraField(String name, FieldValue value) {
            extraFields.accumulate(name, value);
            return this;
        }

        public Builder entry(FieldEntry entry) {
            fieldNames.add(entry.name());
            fieldEntries.add(entry);
            return this;
        }

        public ItemNode build() {
            return new ItemNode(this);
        }
    }
}
