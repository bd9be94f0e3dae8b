package com.synesis.loader.validation;

import com.synesis.loader.ast.SourceLocation;
import java.util.Objects;

public final class SourceWithoutItems extends Diagnostic {
    private final String bibref;

    public SourceWithoutItems(SourceLocation location, String bibref) {
        super(Severity.WARNING, location);
        this.bibref = Objects.requireNonNull(bibref, "bibref");
    }

    public String getBibref() {
        return bibref;
    }

    @Override
    public String render() {
        return "SOURCE @"
                + bibref
                + " nao possui ITEMs associados.\n"
                + "  Verifique se ha ITEMs com essa referencia.";
    }
}
