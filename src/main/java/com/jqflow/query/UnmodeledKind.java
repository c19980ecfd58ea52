package com.jqflow.query;

/**
 * Constructs the diagram draws from their source text instead of their structure.
 */
public enum UnmodeledKind {
    IF,
    TRY,
    REDUCE,
    FOREACH,
    LABEL,
    BREAK,
    FORMAT,
    STRING_INTERPOLATION,
    NEGATION
}
