package com.synesis.compiler;

import com.synesis.loader.ast.TemplateNode;
import com.synesis.loader.semantic.Bibliography;
import com.synesis.loader.semantic.LinkedProject;
import com.synesis.loader.validation.ValidationResult;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a compilation run. The linked project is always present, even when validation found errors, so callers
 * can inspect a partially valid project; whether to export it is their decision.
 */
public final class CompilationResult {
    private final LinkedProject linkedProject;
    private final ValidationResult validationResult;
    private final CompilationStats stats;
    private final TemplateNode template;
    private final Bibliography bibliography;

    CompilationResult(
            LinkedProject linkedProject,
            ValidationResult validationResult,
            CompilationStats stats,
            TemplateNode template,
            Bibliography bibliography) {
        this.linkedProject = Objects.requireNonNull(linkedProject, "linkedProject");
        this.validationResult = Objects.requireNonNull(validationResult, "validationResult");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.template = Objects.requireNonNull(template, "template");
        this.bibliography = bibliography;
    }

    public boolean isSuccess() {
        return !validationResult.hasErrors();
    }

    public LinkedProject getLinkedProject() {
        return linkedProject;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }

    public CompilationStats getStats() {
        return stats;
    }

    public TemplateNode getTemplate() {
        return template;
    }

    public Optional<Bibliography> getBibliography() {
        return Optional.ofNullable(bibliography);
    }

    public boolean hasErrors() {
        return validationResult.hasErrors();
    }

    public boolean hasWarnings() {
        return validationResult.hasWarnings();
    }

    public String getDiagnostics() {
        return validationResult.toDiagnostics();
    }
}
