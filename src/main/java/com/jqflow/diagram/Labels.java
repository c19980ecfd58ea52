package com.jqflow.diagram;

import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.jqflow.query.IndexSpec;
import com.jqflow.query.ObjectEntry;
import com.jqflow.query.Operator;
import com.jqflow.query.Query;
import com.jqflow.query.Suffix;
import com.jqflow.query.Term;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.regex.Pattern;

/**
 * Human-readable text for diagram nodes. {@link #render(Query)} gives a compact,
 * source-like rendering; {@link #nodeLabel(Query)} adds the stage-specific forms
 * ({@code Slice [2:5]}, {@code name()}, {@code Object}, operator names).
 */
public final class Labels {
    public static final String SLICE_PREFIX = "Slice ";

    private static final int MAX_LENGTH = 50;
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final JsonStringEncoder ENCODER = JsonStringEncoder.getInstance();

    private Labels() {
    }

    /**
     * Label for the stage built from {@code query}.
     */
    public static String nodeLabel(Query query) {
        if (query == null) {
            return "";
        }
        if (query.term() != null) {
            return termLabel(query.term());
        }
        if (query.op() == Operator.NONE) {
            // Slice shapes the parser leaves without a term
            for (Query side : new Query[]{query.left(), query.right()}) {
                if (side != null && side.term() != null) {
                    String label = termLabel(side.term());
                    if (label.startsWith(SLICE_PREFIX)) {
                        return label;
                    }
                }
            }
            return abbreviate(render(query));
        }
        if (query.op() == Operator.COMMA) {
            return abbreviate(render(query));
        }
        return query.op().label();
    }

    public static String termLabel(Term term) {
        String slice = sliceLabel(term);
        if (slice != null) {
            return slice;
        }
        if (term instanceof Term.FunctionCall call && call.suffixes().isEmpty()) {
            return functionLabel(call);
        }
        if (term instanceof Term.ObjectLiteral object && object.suffixes().isEmpty()) {
            return objectLabel(object);
        }
        if (term instanceof Term.Unmodeled) {
            return abbreviate(renderTerm(term));
        }
        return renderTerm(term);
    }

    /**
     * Label of a function container: the bare name followed by {@code ()}.
     */
    public static String containerLabel(Term.FunctionCall call) {
        if (call.suffixes().isEmpty()) {
            return call.name() + "()";
        }
        return termLabel(call);
    }

    /**
     * {@code name(arg1, arg2)}, or {@code name()} without arguments.
     */
    public static String functionLabel(Term.FunctionCall call) {
        return call.name() + "(" + call.args().collect(Labels::render).makeString(", ") + ")";
    }

    /**
     * Lists the entries when any value calls a function, otherwise just {@code Object}.
     */
    public static String objectLabel(Term.ObjectLiteral object) {
        if (object.entries().noneSatisfy(entry -> containsCall(entry.value()))) {
            return "Object";
        }
        return object.entries()
            .collect(entry -> keyLabel(entry.key()) + ": " + render(entry.value()))
            .makeString("{", ", ", "}");
    }

    public static String keyLabel(ObjectEntry.Key key) {
        if (key instanceof ObjectEntry.Key.Named named) {
            return IDENTIFIER.matcher(named.name()).matches() ? named.name() : quote(named.name());
        }
        return "(" + render(((ObjectEntry.Key.Computed) key).expression()) + ")";
    }

    /**
     * Returns the {@code Slice [start:end]} label when the term slices its input, or null.
     * A slice suffix wins over whatever surrounds it: suffixes before it become an
     * {@code of <prefix>} tail, suffixes after it are appended to the bounds.
     */
    public static String sliceLabel(Term term) {
        ImmutableList<Suffix> suffixes = term.suffixes();
        if (term instanceof Term.Index index && index.index() instanceof IndexSpec.Slice slice) {
            return SLICE_PREFIX + bounds(slice) + renderSuffixes(suffixes);
        }
        int at = suffixes.detectIndex(suffix -> suffix instanceof Suffix.Index index
            && index.index() instanceof IndexSpec.Slice);
        if (at < 0) {
            return null;
        }
        IndexSpec.Slice slice = (IndexSpec.Slice) ((Suffix.Index) suffixes.get(at)).index();
        String label = SLICE_PREFIX + bounds(slice) + renderSuffixes(suffixes.drop(at + 1));
        String prefix = renderTerm(term.withSuffixes(suffixes.take(at)));
        return ".".equals(prefix) ? label : label + " of " + prefix;
    }

    /**
     * Compact single-line rendering of a filter.
     */
    public static String render(Query query) {
        if (query == null) {
            return "";
        }
        if (query.term() != null) {
            return renderTerm(query.term());
        }
        String left = render(query.left());
        String right = render(query.right());
        switch (query.op()) {
            case NONE:
                return left.isEmpty() ? right : right.isEmpty() ? left : left + " " + right;
            case PIPE:
                return left + " | " + right;
            case COMMA:
                return left + ", " + right;
            default:
                return left + " " + query.op().symbol() + " " + right;
        }
    }

    public static String renderTerm(Term term) {
        String base = term.accept(RENDERER);
        StringBuilder out = new StringBuilder(base);
        for (Suffix suffix : term.suffixes()) {
            String text = renderSuffix(suffix);
            if (".".equals(out.toString()) && text.startsWith(".")) {
                out.setLength(0);
            }
            out.append(text);
        }
        return out.toString();
    }

    /**
     * True when a function call appears anywhere inside {@code query}.
     */
    public static boolean containsCall(Query query) {
        if (query == null) {
            return false;
        }
        if (query.term() != null) {
            return termContainsCall(query.term());
        }
        return containsCall(query.left()) || containsCall(query.right());
    }

    /**
     * Shortens long text to 47 characters followed by {@code ...}.
     */
    public static String abbreviate(String text) {
        if (text.length() <= MAX_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_LENGTH - 3) + "...";
    }

    public static String quote(String value) {
        return "\"" + new String(ENCODER.quoteAsString(value)) + "\"";
    }

    private static boolean termContainsCall(Term term) {
        if (term.accept(CALL_FINDER)) {
            return true;
        }
        return term.suffixes().anySatisfy(suffix -> suffix instanceof Suffix.Index index
            && indexContainsCall(index.index()));
    }

    private static boolean indexContainsCall(IndexSpec spec) {
        if (spec instanceof IndexSpec.Expression expression) {
            return containsCall(expression.index());
        }
        if (spec instanceof IndexSpec.Slice slice) {
            return containsCall(slice.start()) || containsCall(slice.end());
        }
        return false;
    }

    private static String bounds(IndexSpec.Slice slice) {
        return "[" + bound(slice.start()) + ":" + bound(slice.end()) + "]";
    }

    private static String bound(Query bound) {
        if (bound == null) {
            return "";
        }
        if (bound.term() instanceof Term.NumberLiteral number && number.suffixes().isEmpty()) {
            return number.text();
        }
        return render(bound);
    }

    private static String renderSuffixes(ImmutableList<Suffix> suffixes) {
        return suffixes.collect(Labels::renderSuffix).makeString("");
    }

    private static String renderSuffix(Suffix suffix) {
        if (suffix instanceof Suffix.Index index) {
            return renderIndex(index.index(), true);
        }
        if (suffix instanceof Suffix.Iterate) {
            return "[]";
        }
        if (suffix instanceof Suffix.Suppress) {
            return "?";
        }
        return " as $" + ((Suffix.Bind) suffix).variable();
    }

    private static String renderIndex(IndexSpec spec, boolean chained) {
        if (spec instanceof IndexSpec.Field field) {
            return "." + field.name();
        }
        if (spec instanceof IndexSpec.Key key) {
            return chained ? "[" + quote(key.key()) + "]" : ".[" + quote(key.key()) + "]";
        }
        String bracket;
        if (spec instanceof IndexSpec.Expression expression) {
            bracket = "[" + render(expression.index()) + "]";
        } else {
            bracket = bounds((IndexSpec.Slice) spec);
        }
        return chained ? bracket : "." + bracket;
    }

    private static final Term.Visitor<String> RENDERER = new Term.Visitor<>() {
        @Override
        public String visitIdentity(Term.Identity identity) {
            return ".";
        }

        @Override
        public String visitRecurse(Term.Recurse recurse) {
            return "..";
        }

        @Override
        public String visitNull(Term.NullLiteral literal) {
            return "null";
        }

        @Override
        public String visitBoolean(Term.BooleanLiteral literal) {
            return String.valueOf(literal.value());
        }

        @Override
        public String visitNumber(Term.NumberLiteral literal) {
            return literal.text();
        }

        @Override
        public String visitString(Term.StringLiteral literal) {
            return quote(literal.value());
        }

        @Override
        public String visitIndex(Term.Index index) {
            return renderIndex(index.index(), false);
        }

        @Override
        public String visitFunctionCall(Term.FunctionCall call) {
            return call.args().isEmpty() ? call.name() : functionLabel(call);
        }

        @Override
        public String visitArray(Term.ArrayLiteral array) {
            return "[" + render(array.body()) + "]";
        }

        @Override
        public String visitObject(Term.ObjectLiteral object) {
            return object.entries()
                .collect(entry -> keyLabel(entry.key()) + ": " + render(entry.value()))
                .makeString("{", ", ", "}");
        }

        @Override
        public String visitVariable(Term.Variable variable) {
            return "$" + variable.name();
        }

        @Override
        public String visitSubquery(Term.Subquery subquery) {
            return "(" + render(subquery.query()) + ")";
        }

        @Override
        public String visitUnmodeled(Term.Unmodeled unmodeled) {
            return unmodeled.text();
        }
    };

    private static final Term.Visitor<Boolean> CALL_FINDER = new Term.Visitor<>() {
        @Override
        public Boolean visitIdentity(Term.Identity identity) {
            return false;
        }

        @Override
        public Boolean visitRecurse(Term.Recurse recurse) {
            return false;
        }

        @Override
        public Boolean visitNull(Term.NullLiteral literal) {
            return false;
        }

        @Override
        public Boolean visitBoolean(Term.BooleanLiteral literal) {
            return false;
        }

        @Override
        public Boolean visitNumber(Term.NumberLiteral literal) {
            return false;
        }

        @Override
        public Boolean visitString(Term.StringLiteral literal) {
            return false;
        }

        @Override
        public Boolean visitIndex(Term.Index index) {
            return indexContainsCall(index.index());
        }

        @Override
        public Boolean visitFunctionCall(Term.FunctionCall call) {
            return true;
        }

        @Override
        public Boolean visitArray(Term.ArrayLiteral array) {
            return containsCall(array.body());
        }

        @Override
        public Boolean visitObject(Term.ObjectLiteral object) {
            return object.entries().anySatisfy(entry -> containsCall(entry.value())
                || entry.key() instanceof ObjectEntry.Key.Computed computed && containsCall(computed.expression()));
        }

        @Override
        public Boolean visitVariable(Term.Variable variable) {
            return false;
        }

        @Override
        public Boolean visitSubquery(Term.Subquery subquery) {
            return containsCall(subquery.query());
        }

        @Override
        public Boolean visitUnmodeled(Term.Unmodeled unmodeled) {
            return false;
        }
    };
}
