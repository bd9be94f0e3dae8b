package com.synesis.loader.validation;

import com.synesis.loader.ast.SourceLocation;
import java.util.Objects;

public final class MissingProjectFile extends Diagnostic {
    private final String workspaceRoot;

    public MissingProjectFile(SourceLocation location, String workspaceRoot) {
        super(Severity.WARNING, location);
        this.workspaceRoot = Objects.requireNonNull(workspaceRoot, "workspaceRoot");
    }

    public String getWorkspaceRoot() {
        return workspaceRoot;
    }

    @Override
    public String render() {
        return "Nenhum arquivo .synp encontrado na raiz do workspace: "
                + workspaceRoot
                + "\n  Validacao semantica desativada.\n"
                + "  Para ativar validacao completa, crie um arquivo PROJECT na raiz do workspace.\n"
                + "  Exemplo: projeto.synp";
    }
}
