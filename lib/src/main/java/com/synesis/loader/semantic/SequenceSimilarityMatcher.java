package com.synesis.loader.semantic;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ratcliff/Obershelp similarity: twice the number of matched characters over the total length, where matches are
 * found by taking the longest common block and recursing on both sides of it. Ties in score are broken by the
 * lexicographically greater candidate first.
 */
public final class SequenceSimilarityMatcher implements SimilarityMatcher {

    @Override
    public List<String> closeMatches(String word, Collection<String> candidates, int limit, double cutoff) {
        Objects.requireNonNull(word, "word");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0: " + limit);
        }
        if (cutoff < 0.0 || cutoff > 1.0) {
            throw new IllegalArgumentException("cutoff must be in [0.0, 1.0]: " + cutoff);
        }
        List<Scored> scored = new ArrayList<>();
        for (String candidate : candidates) {
            double score = ratio(candidate, word);
            if (score >= cutoff) {
                scored.add(new Scored(candidate, score));
            }
        }
        scored.sort(
                Comparator.comparingDouble(Scored::score)
                        .thenComparing(Scored::candidate)
                        .reversed());
        List<String> matches = new ArrayList<>();
        for (Scored entry : scored) {
            if (matches.size() == limit) {
                break;
            }
            matches.add(entry.candidate());
        }
        return matches;
    }

    public static double ratio(String left, String right) {
        int total = left.length() + right.length();
        if (total == 0) {
            return 1.0;
        }
        Map<Character, List<Integer>> positions = indexPositions(right);
        int matched = matchedCharacters(left, right, positions, 0, left.length(), 0, right.length());
        return 2.0 * matched / total;
    }

    private static Map<Character, List<Integer>> indexPositions(String text) {
        Map<Character, List<Integer>> positions = new HashMap<>();
        for (int j = 0; j < text.length(); j++) {
            positions.computeIfAbsent(text.charAt(j), key -> new ArrayList<>()).add(j);
        }
        return positions;
    }

    private static int matchedCharacters(
            String left,
            String right,
            Map<Character, List<Integer>> positions,
            int leftLow,
            int leftHigh,
            int rightLow,
            int rightHigh) {
        if (leftLow >= leftHigh || rightLow >= rightHigh) {
            return 0;
        }
        int bestLeft = leftLow;
        int bestRight = rightLow;
        int bestSize = 0;
        Map<Integer, Integer> lengths = new HashMap<>();
        for (int i = leftLow; i < leftHigh; i++) {
            Map<Integer, Integer> nextLengths = new HashMap<>();
            for (int j : positions.getOrDefault(left.charAt(i), List.of())) {
                if (j < rightLow) {
                    continue;
                }
                if (j >= rightHigh) {
                    break;
                }
                int length = lengths.getOrDefault(j - 1, 0) + 1;
                nextLengths.put(j, length);
                if (length > bestSize) {
                    bestLeft = i - length + 1;
                    bestRight = j - length + 1;
                    bestSize = length;
                }
            }
            lengths = nextLengths;
        }
        if (bestSize == 0) {
            return 0;
        }
        return bestSize
                + matchedCharacters(left, right, positions, leftLow, bestLeft, rightLow, bestRight)
                + matchedCharacters(
                        left, right, positions, bestLeft + bestSize, leftHigh, bestRight + bestSize, rightHigh);
    }

    private static final class Scored {
        private final String candidate;
        private final double score;

        Scored(String candidate, double score) {
            this.candidate = candidate;
            this.score = score;
        }

        String candidate() {
            return candidate;
        }

        double score() {
            return score;
        }
    }
}
