package com.synesis.compiler;

import com.synesis.loader.ast.ProjectNode;
import com.synesis.loader.ast.TemplateNode;
import com.synesis.loader.semantic.Bibliography;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

public final class SchemaContext {
    private final Path workspaceRoot;
    private final Path projectFile;
    private final ProjectNode project;
    private final TemplateNode template;
    private final Bibliography bibliography;

    SchemaContext(
            Path workspaceRoot, Path projectFile, ProjectNode project, TemplateNode template, Bibliography bibliography) {
        this.workspaceRoot = Objects.requireNonNull(workspaceRoot, "workspaceRoot");
        this.projectFile = Objects.requireNonNull(projectFile, "projectFile");
        this.project = Objects.requireNonNull(project, "project");
        this.template = template;
        this.bibliography = bibliography;
    }

    public Path getWorkspaceRoot() {
        return workspaceRoot;
    }

    public Path getProjectFile() {
        return projectFile;
    }

    public ProjectNode getProject() {
        return project;
    }

    public Optional<TemplateNode> getTemplate() {
        return Optional.ofNullable(template);
    }

    public Optional<Bibliography> getBibliography() {
        return Optional.ofNullable(bibliography);
    }
}
