package com.synesis.loader.ast;

import java.util.Locale;
import java.util.Optional;

public enum FieldType {
    QUOTATION,
    MEMO,
    CODE,
    CHAIN,
    TEXT,
    DATE,
    SCALE,
    ENUMERATED,
    ORDERED,
    TOPIC;

    public static Optional<FieldType> fromKeyword(String keyword) {
        if (keyword == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(keyword.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }

    public boolean isTextual() {
        switch (this) {
            case QUOTATION:
            case MEMO:
            case CODE:
            case TEXT:
            case DATE:
            case TOPIC:
                return true;
            default:
                return false;
        }
    }
}
