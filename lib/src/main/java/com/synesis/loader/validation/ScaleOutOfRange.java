package com.synesis.loader.validation;

import com.synesis.loader.ast.SourceLocation;
import java.util.Objects;

public final class ScaleOutOfRange extends Diagnostic {
    private final String fieldName;
    private final double value;
    private final double minValue;
    private final double maxValue;

    public ScaleOutOfRange(SourceLocation location, String fieldName, double value, double minValue, double maxValue) {
        super(Severity.ERROR, location);
        this.fieldName = Objects.requireNonNull(fieldName, "fieldName");
        this.value = value;
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    public String getFieldName() {
        return fieldName;
    }

    public double getValue() {
        return value;
    }

    public double getMinValue() {
        return minValue;
    }

    public double getMaxValue() {
        return maxValue;
    }

    @Override
    public String render() {
        return "Valor "
                + value
                + " fora do intervalo para '"
                + fieldName
                + "'.\n  Intervalo permitido: ["
                + minValue
                + ".."
                + maxValue
                + "]";
    }
}
