package com.synesis.loader.ast;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed field slots of ITEM and ONTOLOGY blocks and the names that fill them. Every component that special-cases
 * {@code quote}, {@code code}, {@code note}, {@code chain}, {@code description} or parent fields goes through this
 * table.
 */
public enum FieldSlot {
    QUOTE("quote", "quotation"),
    CODES("code", "codes"),
    NOTES("note", "notes", "memo", "memos"),
    CHAINS("chain", "chains"),
    DESCRIPTION("description"),
    PARENTS("parent", "parents", "is_a", "isa");

    private static final Set<FieldSlot> ITEM_SLOTS = EnumSet.of(QUOTE, CODES, NOTES, CHAINS);
    private static final Set<FieldSlot> ONTOLOGY_SLOTS = EnumSet.of(DESCRIPTION, PARENTS);

    private final List<String> names;

    FieldSlot(String... names) {
        this.names = List.of(names);
    }

    public List<String> getNames() {
        return names;
    }

    public boolean matches(String fieldName) {
        return fieldName != null && names.contains(fieldName.toLowerCase(Locale.ROOT));
    }

    public static Optional<FieldSlot> forItemField(String fieldName) {
        return find(ITEM_SLOTS, fieldName);
    }

    public static Optional<FieldSlot> forOntologyField(String fieldName) {
        return find(ONTOLOGY_SLOTS, fieldName);
    }

    private static Optional<FieldSlot> find(Set<FieldSlot> slots, String fieldName) {
        for (FieldSlot slot : slots) {
            if (slot.matches(fieldName)) {
                return Optional.of(slot);
            }
        }
        return Optional.empty();
    }
}
