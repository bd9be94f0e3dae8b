package com.synesis.loader.semantic;

import java.util.Collection;
import java.util.List;

public interface SimilarityMatcher {

    double DEFAULT_CUTOFF = 0.6;

    /**
     * Candidates whose similarity to {@code word} is at least {@code cutoff}, best first.
     *
     * @param word Name as written by the user.
     * @param candidates Known names.
     * @param limit Maximum number of suggestions to return.
     * @param cutoff Minimum similarity in {@code [0, 1]}.
     * @return Suggestions, possibly empty. Never null.
     */
    List<String> closeMatches(String word, Collection<String> candidates, int limit, double cutoff);

    default List<String> closeMatches(String word, Collection<String> candidates, int limit) {
        return closeMatches(word, candidates, limit, DEFAULT_CUTOFF);
    }
}
