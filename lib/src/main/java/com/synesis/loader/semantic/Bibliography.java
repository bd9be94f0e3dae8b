package com.synesis.loader.semantic;

import java.util.Collection;
import java.util.Optional;

/**
 * Read-only view of the bibliography a project cites. Keys are normalized: no leading {@code @}, trimmed and lower
 * case. Loading a bibliography from disk is up to the caller.
 */
public interface Bibliography {

    Optional<BibEntry> lookup(String key);

    Collection<String> keys();

    default boolean contains(String key) {
        return lookup(key).isPresent();
    }
}
