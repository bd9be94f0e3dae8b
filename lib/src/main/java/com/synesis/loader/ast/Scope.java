package com.synesis.loader.ast;

import java.util.Locale;
import java.util.Optional;

public enum Scope {
    SOURCE,
    ITEM,
    ONTOLOGY;

    public static Optional<Scope> fromKeyword(String keyword) {
        if (keyword == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(keyword.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
