package com.jqflow.diagram;

import com.jqflow.query.Operator;
import com.jqflow.query.Query;
import com.jqflow.query.Suffix;
import com.jqflow.query.Term;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Sets;

/**
 * Guesses the output type of a filter from its shape alone.
 */
public final class TypeInference {
    private static final ImmutableSet<String> STRING_FUNCTIONS = Sets.immutable.of("cat", "tee", "sh");
    private static final ImmutableSet<String> HASH_FUNCTIONS = Sets.immutable.of("md5", "sha1", "sha256", "sha512");
    private static final ImmutableSet<String> NUMBER_FUNCTIONS = Sets.immutable.of("length", "keys");

    private TypeInference() {
    }

    public static ValueType infer(Query query) {
        if (query == null) {
            return ValueType.UNKNOWN;
        }
        if (query.term() != null) {
            return ofTerm(query.term());
        }
        Operator op = query.op();
        if (op.isArithmetic()) {
            return ValueType.NUMBER;
        }
        if (op.isComparison() || op.isLogical()) {
            return ValueType.BOOLEAN;
        }
        return ValueType.UNKNOWN;
    }

    /**
     * Type of a term's output. Path suffixes make it unknown; {@code as $x} bindings pass the value through.
     */
    public static ValueType ofTerm(Term term) {
        if (term.suffixes().anySatisfy(suffix -> !(suffix instanceof Suffix.Bind))) {
            return ValueType.UNKNOWN;
        }
        if (term instanceof Term.StringLiteral) {
            return ValueType.STRING;
        }
        if (term instanceof Term.NumberLiteral) {
            return ValueType.NUMBER;
        }
        if (term instanceof Term.BooleanLiteral) {
            return ValueType.BOOLEAN;
        }
        if (term instanceof Term.NullLiteral) {
            return ValueType.NULL;
        }
        if (term instanceof Term.ArrayLiteral) {
            return ValueType.ARRAY;
        }
        if (term instanceof Term.ObjectLiteral) {
            return ValueType.OBJECT;
        }
        if (term instanceof Term.FunctionCall call) {
            return ofFunction(call.name());
        }
        if (term instanceof Term.Subquery subquery) {
            return infer(subquery.query());
        }
        return ValueType.UNKNOWN;
    }

    public static ValueType ofFunction(String name) {
        if (name.endsWith("_encode") || name.endsWith("_decode")
                || name.startsWith("base") || name.startsWith("hex")
                || STRING_FUNCTIONS.contains(name)) {
            return ValueType.STRING;
        }
        if (HASH_FUNCTIONS.contains(name) || name.startsWith("sha")) {
            return ValueType.STRING;
        }
        if (NUMBER_FUNCTIONS.contains(name)) {
            return ValueType.NUMBER;
        }
        return ValueType.UNKNOWN;
    }
}
