package com.synesis.loader.validation;

import com.synesis.loader.ast.SourceLocation;
import java.util.Objects;

public final class MissingTemplateFile extends Diagnostic {
    private final String templatePath;
    private final String projectFile;

    public MissingTemplateFile(SourceLocation location, String templatePath, String projectFile) {
        super(Severity.ERROR, location);
        this.templatePath = Objects.requireNonNull(templatePath, "templatePath");
        this.projectFile = Objects.requireNonNull(projectFile, "projectFile");
    }

    public String getTemplatePath() {
        return templatePath;
    }

    public String getProjectFile() {
        return projectFile;
    }

    @Override
    public String render() {
        return "Template '"
                + templatePath
                + "' especificado em '"
                + projectFile
                + "' nao encontrado.\n"
                + "  Verifique se o caminho esta correto e relativo ao diretorio do projeto.\n"
                + "  Ou crie o arquivo de template no local especificado.";
    }
}
