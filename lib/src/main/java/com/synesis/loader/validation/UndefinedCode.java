package com.synesis.loader.validation;

import com.synesis.loader.ast.SourceLocation;
import java.util.Objects;

public final class UndefinedCode extends Diagnostic {
    private final String code;
    private final String context;

    public UndefinedCode(SourceLocation location, String code, String context) {
        super(Severity.WARNING, location);
        this.code = Objects.requireNonNull(code, "code");
        this.context = Objects.requireNonNull(context, "context");
    }

    public String getCode() {
        return code;
    }

    public String getContext() {
        return context;
    }

    @Override
    public String render() {
        return "O codigo '"
                + code
                + "' usado em "
                + context
                + " nao esta definido na ontologia.\n"
                + "  Considere criar: ONTOLOGY "
                + code
                + "\n      description: ...\n  END ONTOLOGY";
    }
}
