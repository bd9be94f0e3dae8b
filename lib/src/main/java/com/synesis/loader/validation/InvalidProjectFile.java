package com.synesis.loader.validation;

import com.synesis.loader.ast.SourceLocation;
import java.util.Objects;

public final class InvalidProjectFile extends Diagnostic {
    private final String projectFile;
    private final String detail;

    public InvalidProjectFile(SourceLocation location, String projectFile, String detail) {
        super(Severity.WARNING, location);
        this.projectFile = Objects.requireNonNull(projectFile, "projectFile");
        this.detail = Objects.requireNonNull(detail, "detail");
    }

    public String getProjectFile() {
        return projectFile;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String render() {
        return "Arquivo de projeto '"
                + projectFile
                + "' contem erros de sintaxe:\n  "
                + detail
                + "\n  Validacao semantica desativada ate que o arquivo seja corrigido.";
    }
}
