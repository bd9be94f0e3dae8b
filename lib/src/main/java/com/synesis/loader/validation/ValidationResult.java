package com.synesis.loader.validation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class ValidationResult {
    private final List<Diagnostic> errors = new ArrayList<>();
    private final List<Diagnostic> warnings = new ArrayList<>();
    private final List<Diagnostic> info = new ArrayList<>();

    public void add(Diagnostic diagnostic) {
        Objects.requireNonNull(diagnostic, "diagnostic");
        switch (diagnostic.getSeverity()) {
            case ERROR:
                errors.add(diagnostic);
                break;
            case WARNING:
                warnings.add(diagnostic);
                break;
            case INFO:
                info.add(diagnostic);
                break;
            default:
                throw new IllegalStateException("Unknown severity: " + diagnostic.getSeverity());
        }
    }

    public void addAll(Collection<? extends Diagnostic> diagnostics) {
        for (Diagnostic diagnostic : diagnostics) {
            add(diagnostic);
        }
    }

    public ValidationResult merge(ValidationResult other) {
        ValidationResult merged = new ValidationResult();
        merged.errors.addAll(errors);
        merged.errors.addAll(other.errors);
        merged.warnings.addAll(warnings);
        merged.warnings.addAll(other.warnings);
        merged.info.addAll(info);
        merged.info.addAll(other.info);
        return merged;
    }

    public List<Diagnostic> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<Diagnostic> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public List<Diagnostic> getInfo() {
        return Collections.unmodifiableList(info);
    }

    public List<Diagnostic> getAll() {
        List<Diagnostic> all = new ArrayList<>(errors.size() + warnings.size() + info.size());
        all.addAll(errors);
        all.addAll(warnings);
        all.addAll(info);
        return all;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public boolean isValid() {
        return !hasErrors();
    }

    public boolean isEmpty() {
        return errors.isEmpty() && warnings.isEmpty() && info.isEmpty();
    }

    public String toDiagnostics() {
        return DiagnosticFormatter.summary(this);
    }

    @Override
    public String toString() {
        return "ValidationResult{errors="
                + errors.size()
                + ", warnings="
                + warnings.size()
                + ", info="
                + info.size()
                + "}";
    }
}
