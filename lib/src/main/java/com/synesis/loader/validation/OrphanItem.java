package com.synesis.loader.validation;

import com.synesis.loader.ast.SourceLocation;
import java.util.Objects;

public final class OrphanItem extends Diagnostic {
    private final String bibref;

    public OrphanItem(SourceLocation location, String bibref) {
        super(Severity.ERROR, location);
        this.bibref = Objects.requireNonNull(bibref, "bibref");
    }

    public String getBibref() {
        return bibref;
    }

    @Override
    public String render() {
        return "ITEM referencia @"
                + bibref
                + ", mas nao ha SOURCE com essa referencia.\n"
                + "  Crie um bloco SOURCE @"
                + bibref
                + " antes de usar em ITEMs.";
    }
}
