package com.synesis.loader.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record FieldLine(String text, SourceLocation location) {
    public FieldLine {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(location, "location");
    }

    /**
     * Splits the line on {@code separator}. Segments are trimmed, empty ones are dropped and each keeps the column
     * of its first non-blank character.
     */
    public List<FieldLine> split(String separator) {
        List<FieldLine> segments = new ArrayList<>();
        int start = 0;
        while (start <= text.length()) {
            int end = text.indexOf(separator, start);
            String segment = end < 0 ? text.substring(start) : text.substring(start, end);
            String trimmed = segment.strip();
            if (!trimmed.isEmpty()) {
                int leading = segment.length() - segment.stripLeading().length();
                segments.add(new FieldLine(trimmed, location.withColumnOffset(start + leading)));
            }
            if (end < 0) {
                break;
            }
            start = end + separator.length();
        }
        return segments;
    }
}
