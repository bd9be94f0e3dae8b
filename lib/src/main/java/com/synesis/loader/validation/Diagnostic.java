package com.synesis.loader.validation;

import com.synesis.loader.ast.SourceLocation;
import java.util.Objects;

/**
 * A semantic problem found while validating or linking a compilation unit. Each kind has a fixed severity and renders
 * its own multi-line pedagogical message; callers add the location prefix.
 */
public abstract class Diagnostic {

    public enum Severity {
        ERROR,
        WARNING,
        INFO
    }

    private final Severity severity;
    private final SourceLocation location;

    protected Diagnostic(Severity severity, SourceLocation location) {
        this.severity = Objects.requireNonNull(severity, "severity");
        this.location = Objects.requireNonNull(location, "location");
    }

    public Severity getSeverity() {
        return severity;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public abstract String render();

    @Override
    public String toString() {
        return location + ": [" + severity + "] " + render();
    }
}
