package com.jqflow.diagram;

/**
 * Coarse type of the values a stage emits, as far as it can be told from the filter's shape.
 */
public enum ValueType {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    NULL("null"),
    ARRAY("array"),
    OBJECT("object"),
    UNKNOWN("");

    private final String label;

    ValueType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }
}
