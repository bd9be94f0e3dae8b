package com.synesis.loader.validation;

import com.synesis.loader.ast.SourceLocation;
import java.util.Objects;

public final class MissingRequiredField extends Diagnostic {
    private final String fieldName;
    private final String blockType;

    public MissingRequiredField(SourceLocation location, String fieldName, String blockType) {
        super(Severity.ERROR, location);
        this.fieldName = Objects.requireNonNull(fieldName, "fieldName");
        this.blockType = Objects.requireNonNull(blockType, "blockType");
    }

    public String getFieldName() {
        return fieldName;
    }

    public String getBlockType() {
        return blockType;
    }

    @Override
    public String render() {
        return "Campo obrigatorio '"
                + fieldName
                + "' ausente no bloco "
                + blockType
                + ".\n  Adicione: "
                + fieldName
                + ": <valor>";
    }
}
