package com.synesis.loader.template;

import com.synesis.loader.ast.SourceLocation;
import java.util.Objects;

public final class TemplateLoadException extends Exception {
    private final SourceLocation location;
    private final String detail;

    public TemplateLoadException(SourceLocation location, String detail) {
        super(location + ": " + detail);
        this.location = Objects.requireNonNull(location, "location");
        this.detail = Objects.requireNonNull(detail, "detail");
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getDetail() {
        return detail;
    }
}
