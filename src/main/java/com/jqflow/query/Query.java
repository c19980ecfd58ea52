package com.jqflow.query;

import java.util.Objects;

/**
 * One node of a parsed filter. Operator nodes ({@code op != NONE}) are read through
 * {@link #left()} and {@link #right()}; term nodes through {@link #term()}.
 */
public record Query(Operator op, Term term, Query left, Query right) {
    public Query {
        Objects.requireNonNull(op, "op");
    }

    public static Query of(Term term) {
        return new Query(Operator.NONE, Objects.requireNonNull(term, "term"), null, null);
    }

    public static Query binary(Operator op, Query left, Query right) {
        return new Query(op, null, left, right);
    }

    public static Query pipe(Query left, Query right) {
        return binary(Operator.PIPE, left, right);
    }
}
