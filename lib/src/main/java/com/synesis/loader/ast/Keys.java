package com.synesis.loader.ast;

import java.util.Locale;

public final class Keys {
    private Keys() {}

    public static String bibref(String bibref) {
        String trimmed = bibref.strip();
        int start = 0;
        while (start < trimmed.length() && trimmed.charAt(start) == '@') {
            start++;
        }
        return trimmed.substring(start).strip().toLowerCase(Locale.ROOT);
    }

    public static String code(String code) {
        String[] words = code.strip().split("\\s+");
        return String.join(" ", words).toLowerCase(Locale.ROOT);
    }
}
