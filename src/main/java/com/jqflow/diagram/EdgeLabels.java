package com.jqflow.diagram;

import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Sets;

import java.util.Locale;

public final class EdgeLabels {
    // Words the diagram format treats as keywords or type names
    private static final ImmutableSet<String> RESERVED = Sets.immutable.of(
        "array", "object", "string", "number", "boolean", "bool", "null", "true", "false");

    private EdgeLabels() {
    }

    /**
     * Trims quotes and whitespace from {@code label}; returns an empty string when
     * nothing is left or the result is a reserved word (case-insensitive).
     */
    public static String sanitize(String label) {
        if (label == null) {
            return "";
        }
        int start = 0;
        int end = label.length();
        while (start < end && isTrimmable(label.charAt(start))) {
            start++;
        }
        while (end > start && isTrimmable(label.charAt(end - 1))) {
            end--;
        }
        String trimmed = label.substring(start, end);
        if (RESERVED.contains(trimmed.toLowerCase(Locale.ROOT))) {
            return "";
        }
        return trimmed;
    }

    public static boolean isReserved(String word) {
        return word != null && RESERVED.contains(word.toLowerCase(Locale.ROOT));
    }

    private static boolean isTrimmable(char c) {
        return c == '"' || c == '\'' || Character.isWhitespace(c);
    }
}
