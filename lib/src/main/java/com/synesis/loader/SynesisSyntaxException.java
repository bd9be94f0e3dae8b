package com.synesis.loader;

import com.synesis.loader.ast.SourceLocation;
import java.util.List;
import java.util.Objects;

/**
 * Checked exception raised when a Synesis file cannot be parsed. Parsing stops at the first failure; the message is
 * the pedagogical rendering shown to the author.
 */
public final class SynesisSyntaxException extends Exception {
    private final SourceLocation location;
    private final String detail;
    private final List<String> expectedTokens;

    public SynesisSyntaxException(SourceLocation location, String detail) {
        this(location, detail, List.of());
    }

    public SynesisSyntaxException(SourceLocation location, String detail, List<String> expectedTokens) {
        super(detail.startsWith("erro:") ? detail : location + ": " + detail);
        this.location = Objects.requireNonNull(location, "location");
        this.detail = Objects.requireNonNull(detail, "detail");
        this.expectedTokens = List.copyOf(expectedTokens);
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getDetail() {
        return detail;
    }

    public List<String> getExpectedTokens() {
        return expectedTokens;
    }
}
