package com.jqflow.query;

import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.Objects;

/**
 * Leaf or structured construct of a filter. Each variant keeps the suffixes
 * ({@code .name}, {@code [..]}, {@code ?}, {@code as $x}) chained after it.
 */
public sealed interface Term {
    ImmutableList<Suffix> suffixes();

    Term withSuffixes(ImmutableList<Suffix> suffixes);

    <R> R accept(Visitor<R> visitor);

    default Term withSuffix(Suffix suffix) {
        return withSuffixes(suffixes().newWith(suffix));
    }

    interface Visitor<R> {
        R visitIdentity(Identity identity);
        R visitRecurse(Recurse recurse);
        R visitNull(NullLiteral literal);
        R visitBoolean(BooleanLiteral literal);
        R visitNumber(NumberLiteral literal);
        R visitString(StringLiteral literal);
        R visitIndex(Index index);
        R visitFunctionCall(FunctionCall call);
        R visitArray(ArrayLiteral array);
        R visitObject(ObjectLiteral object);
        R visitVariable(Variable variable);
        R visitSubquery(Subquery subquery);
        R visitUnmodeled(Unmodeled unmodeled);
    }

    private static ImmutableList<Suffix> orEmpty(ImmutableList<Suffix> suffixes) {
        return suffixes == null ? Lists.immutable.empty() : suffixes;
    }

    record Identity(ImmutableList<Suffix> suffixes) implements Term {
        public Identity {
            suffixes = orEmpty(suffixes);
        }

        public Identity() {
            this(null);
        }

        @Override
        public Term withSuffixes(ImmutableList<Suffix> suffixes) {
            return new Identity(suffixes);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIdentity(this);
        }
    }

    record Recurse(ImmutableList<Suffix> suffixes) implements Term {
        public Recurse {
            suffixes = orEmpty(suffixes);
        }

        public Recurse() {
            this(null);
        }

        @Override
        public Term withSuffixes(ImmutableList<Suffix> suffixes) {
            return new Recurse(suffixes);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRecurse(this);
        }
    }

    record NullLiteral(ImmutableList<Suffix> suffixes) implements Term {
        public NullLiteral {
            suffixes = orEmpty(suffixes);
        }

        public NullLiteral() {
            this(null);
        }

        @Override
        public Term withSuffixes(ImmutableList<Suffix> suffixes) {
            return new NullLiteral(suffixes);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNull(this);
        }
    }

    record BooleanLiteral(boolean value, ImmutableList<Suffix> suffixes) implements Term {
        public BooleanLiteral {
            suffixes = orEmpty(suffixes);
        }

        public BooleanLiteral(boolean value) {
            this(value, null);
        }

        @Override
        public Term withSuffixes(ImmutableList<Suffix> suffixes) {
            return new BooleanLiteral(value, suffixes);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBoolean(this);
        }
    }

    /** Keeps the number as written so labels show it verbatim. */
    record NumberLiteral(String text, ImmutableList<Suffix> suffixes) implements Term {
        public NumberLiteral {
            Objects.requireNonNull(text, "text");
            suffixes = orEmpty(suffixes);
        }

        public NumberLiteral(String text) {
            this(text, null);
        }

        @Override
        public Term withSuffixes(ImmutableList<Suffix> suffixes) {
            return new NumberLiteral(text, suffixes);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumber(this);
        }
    }

    record StringLiteral(String value, ImmutableList<Suffix> suffixes) implements Term {
        public StringLiteral {
            Objects.requireNonNull(value, "value");
            suffixes = orEmpty(suffixes);
        }

        public StringLiteral(String value) {
            this(value, null);
        }

        @Override
        public Term withSuffixes(ImmutableList<Suffix> suffixes) {
            return new StringLiteral(value, suffixes);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitString(this);
        }
    }

    /** A path expression starting at the input, such as {@code .foo} or {@code .[2:5]}. */
    record Index(IndexSpec index, ImmutableList<Suffix> suffixes) implements Term {
        public Index {
            Objects.requireNonNull(index, "index");
            suffixes = orEmpty(suffixes);
        }

        public Index(IndexSpec index) {
            this(index, null);
        }

        @Override
        public Term withSuffixes(ImmutableList<Suffix> suffixes) {
            return new Index(index, suffixes);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIndex(this);
        }
    }

    /** Arguments are full independent filters, not values. */
    record FunctionCall(String name, ImmutableList<Query> args, ImmutableList<Suffix> suffixes) implements Term {
        public FunctionCall {
            Objects.requireNonNull(name, "name");
            args = args == null ? Lists.immutable.empty() : args;
            suffixes = orEmpty(suffixes);
        }

        public FunctionCall(String name, ImmutableList<Query> args) {
            this(name, args, null);
        }

        @Override
        public Term withSuffixes(ImmutableList<Suffix> suffixes) {
            return new FunctionCall(name, args, suffixes);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionCall(this);
        }
    }

    /** {@code body} is null for {@code []}. */
    record ArrayLiteral(Query body, ImmutableList<Suffix> suffixes) implements Term {
        public ArrayLiteral {
            suffixes = orEmpty(suffixes);
        }

        public ArrayLiteral(Query body) {
            this(body, null);
        }

        @Override
        public Term withSuffixes(ImmutableList<Suffix> suffixes) {
            return new ArrayLiteral(body, suffixes);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitArray(this);
        }
    }

    record ObjectLiteral(ImmutableList<ObjectEntry> entries, ImmutableList<Suffix> suffixes) implements Term {
        public ObjectLiteral {
            entries = entries == null ? Lists.immutable.empty() : entries;
            suffixes = orEmpty(suffixes);
        }

        public ObjectLiteral(ImmutableList<ObjectEntry> entries) {
            this(entries, null);
        }

        @Override
        public Term withSuffixes(ImmutableList<Suffix> suffixes) {
            return new ObjectLiteral(entries, suffixes);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitObject(this);
        }
    }

    /** {@code name} excludes the leading {@code $}. */
    record Variable(String name, ImmutableList<Suffix> suffixes) implements Term {
        public Variable {
            Objects.requireNonNull(name, "name");
            suffixes = orEmpty(suffixes);
        }

        public Variable(String name) {
            this(name, null);
        }

        @Override
        public Term withSuffixes(ImmutableList<Suffix> suffixes) {
            return new Variable(name, suffixes);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVariable(this);
        }
    }

    /** A parenthesized filter. */
    record Subquery(Query query, ImmutableList<Suffix> suffixes) implements Term {
        public Subquery {
            Objects.requireNonNull(query, "query");
            suffixes = orEmpty(suffixes);
        }

        public Subquery(Query query) {
            this(query, null);
        }

        @Override
        public Term withSuffixes(ImmutableList<Suffix> suffixes) {
            return new Subquery(query, suffixes);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSubquery(this);
        }
    }

    /** Control constructs and other syntax kept only as source text. */
    record Unmodeled(UnmodeledKind kind, String text, ImmutableList<Suffix> suffixes) implements Term {
        public Unmodeled {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(text, "text");
            suffixes = orEmpty(suffixes);
        }

        public Unmodeled(UnmodeledKind kind, String text) {
            this(kind, text, null);
        }

        @Override
        public Term withSuffixes(ImmutableList<Suffix> suffixes) {
            return new Unmodeled(kind, text, suffixes);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnmodeled(this);
        }
    }
}
