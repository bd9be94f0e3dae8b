package com.synesis.loader.ast;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public sealed interface FieldValue
        permits FieldValue.TextValue, FieldValue.NumberValue, FieldValue.ChainValue, FieldValue.ListValue {

    String asText();

    String typeName();

    default List<FieldValue> elements() {
        return List.of(this);
    }

    default int count() {
        return 1;
    }

    default boolean hasContent() {
        return true;
    }

    static FieldValue text(String text) {
        return new TextValue(text);
    }

    static FieldValue texts(List<String> texts) {
        if (texts.size() == 1) {
            return new TextValue(texts.get(0));
        }
        return new ListValue(texts.stream().map(TextValue::new).collect(Collectors.toList()));
    }

    static FieldValue chain(ChainNode chain) {
        return new ChainValue(chain);
    }

    static FieldValue accumulate(FieldValue existing, FieldValue added) {
        if (existing == null) {
            return added;
        }
        List<FieldValue> merged = new ArrayList<>(existing.elements());
        merged.addAll(added.elements());
        return new ListValue(merged);
    }

    record TextValue(String text) implements FieldValue {
        public TextValue {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public String asText() {
            return text;
        }

        @Override
        public String typeName() {
            return "texto";
        }

        @Override
        public boolean hasContent() {
            return !text.isBlank();
        }
    }

    record NumberValue(String literal, BigDecimal number) implements FieldValue {
        public NumberValue {
            Objects.requireNonNull(literal, "literal");
            Objects.requireNonNull(number, "number");
        }

        public static NumberValue parse(String literal) {
            return new NumberValue(literal, new BigDecimal(literal));
        }

        public boolean isInteger() {
            return literal.indexOf('.') < 0;
        }

        @Override
        public String asText() {
            return literal;
        }

        @Override
        public String typeName() {
            return isInteger() ? "inteiro" : "numero";
        }
    }

    record ChainValue(ChainNode chain) implements FieldValue {
        public ChainValue {
            Objects.requireNonNull(chain, "chain");
        }

        @Override
        public String asText() {
            return chain.toString();
        }

        @Override
        public String typeName() {
            return "cadeia";
        }

        @Override
        public boolean hasContent() {
            return !chain.getNodes().isEmpty();
        }
    }

    record ListValue(List<FieldValue> values) implements FieldValue {
        public ListValue {
            values = List.copyOf(values);
        }

        @Override
        public String asText() {
            return values.stream().map(FieldValue::asText).collect(Collectors.joining(", "));
        }

        @Override
        public String typeName() {
            return "lista";
        }

        @Override
        public List<FieldValue> elements() {
            return values;
        }

        @Override
        public int count() {
            return values.size();
        }

        @Override
        public boolean hasContent() {
            return !values.isEmpty();
        }
    }
}
