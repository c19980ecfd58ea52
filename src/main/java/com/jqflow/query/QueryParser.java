package com.jqflow.query;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;

import java.io.IOException;

/**
 * Recursive-descent parser for jq filters. Operator precedence, loosest first:
 * {@code |}, {@code ,}, {@code //}, assignments, {@code or}, {@code and},
 * comparisons, {@code + -}, {@code * / %}.
 */
public class QueryParser {
    private static final JsonFactory JSON = new JsonFactory();

    private static final ImmutableSet<String> RESERVED = Sets.immutable.of(
        "and", "or", "then", "elif", "else", "end", "as", "catch", "def");
    private static final ImmutableSet<String> ASSIGNMENTS = Sets.immutable.of(
        "=", "|=", "+=", "-=", "*=", "/=", "%=", "//=");
    private static final ImmutableSet<String> COMPARISONS = Sets.immutable.of(
        "==", "!=", "<", "<=", ">", ">=");

    public Query parse(String queryString) {
        if (queryString == null || queryString.isBlank()) {
            return Query.of(new Term.Identity());
        }
        return new Session(queryString).run();
    }

    private static final class Session {
        private final String source;
        private final MutableList<Token> tokens;
        private int pos;

        Session(String source) {
            this.source = source;
            this.tokens = new QueryLexer(source).tokenize();
        }

        Query run() {
            Query query = parsePipe();
            Token trailing = peek();
            if (!trailing.is(Token.Type.EOF)) {
                throw new QueryParseException("Unexpected '" + trailing.text() + "'", trailing.start());
            }
            return query;
        }

        private Query parsePipe() {
            Query first = null;
            if (startsTerm(peek())) {
                // "term as $x | body" can only be told apart from an ordinary term after the term is read
                Term term = parsePostfixTerm();
                if (peek().isKeyword("as")) {
                    return parseBinding(term);
                }
                first = Query.of(term);
            }
            Query left = parseComma(first);
            if (peek().is(Token.Type.PIPE)) {
                advance();
                return Query.pipe(left, parsePipe());
            }
            return left;
        }

        private Query parseComma(Query first) {
            Query left = parseAlternative(first);
            while (peek().is(Token.Type.COMMA)) {
                advance();
                left = Query.binary(Operator.COMMA, left, parseAlternative(null));
            }
            return left;
        }

        private Query parseAlternative(Query first) {
            Query left = parseAssignment(first);
            if (peek().isOperator("//")) {
                advance();
                return Query.binary(Operator.ALT, left, parseAlternative(null));
            }
            return left;
        }

        private Query parseAssignment(Query first) {
            Query left = parseOr(first);
            Token t = peek();
            if (t.is(Token.Type.OPERATOR) && ASSIGNMENTS.contains(t.text())) {
                advance();
                Operator op = switch (t.text()) {
                    case "=" -> Operator.ASSIGN;
                    case "|=" -> Operator.MODIFY;
                    default -> Operator.fromSymbol(t.text());
                };
                return Query.binary(op, left, parseOr(null));
            }
            return left;
        }

        private Query parseOr(Query first) {
            Query left = parseAnd(first);
            while (peek().isKeyword("or")) {
                advance();
                left = Query.binary(Operator.OR, left, parseAnd(null));
            }
            return left;
        }

        private Query parseAnd(Query first) {
            Query left = parseComparison(first);
            while (peek().isKeyword("and")) {
                advance();
                left = Query.binary(Operator.AND, left, parseComparison(null));
            }
            return left;
        }

        private Query parseComparison(Query first) {
            Query left = parseAdditive(first);
            Token t = peek();
            if (t.is(Token.Type.OPERATOR) && COMPARISONS.contains(t.text())) {
                advance();
                return Query.binary(Operator.fromSymbol(t.text()), left, parseAdditive(null));
            }
            return left;
        }

        private Query parseAdditive(Query first) {
            Query left = parseMultiplicative(first);
            while (peek().isOperator("+") || peek().isOperator("-")) {
                Token op = advance();
                left = Query.binary(Operator.fromSymbol(op.text()), left, parseMultiplicative(null));
            }
            return left;
        }

        private Query parseMultiplicative(Query first) {
            Query left = first != null ? first : parseUnary();
            while (peek().isOperator("*") || peek().isOperator("/") || peek().isOperator("%")) {
                Token op = advance();
                left = Query.binary(Operator.fromSymbol(op.text()), left, parseUnary());
            }
            return left;
        }

        private Query parseUnary() {
            Token t = peek();
            if (t.isOperator("-")) {
                advance();
                parsePostfixTerm();
                return Query.of(new Term.Unmodeled(UnmodeledKind.NEGATION, textFrom(t.start())));
            }
            Term term = parsePostfixTerm();
            return peek().isKeyword("as") ? parseBinding(term) : Query.of(term);
        }

        /**
         * {@code term as $name | body}; the body extends to the end of the enclosing pipe.
         */
        private Query parseBinding(Term term) {
            advance();
            Token variable = expect(Token.Type.VARIABLE, "variable after 'as'");
            expect(Token.Type.PIPE, "'|' after binding");
            Query body = parsePipe();
            return Query.pipe(Query.of(term.withSuffix(new Suffix.Bind(variable.text()))), body);
        }

        private Term parsePostfixTerm() {
            Term term = parsePrimary();
            while (true) {
                Token t = peek();
                if (t.is(Token.Type.FIELD)) {
                    advance();
                    term = term.withSuffix(new Suffix.Index(new IndexSpec.Field(t.text())));
                } else if (t.is(Token.Type.DOT) && peekAt(1).is(Token.Type.STRING)) {
                    advance();
                    term = term.withSuffix(new Suffix.Index(new IndexSpec.Key(decodeString(advance()))));
                } else if (t.is(Token.Type.DOT) && peekAt(1).is(Token.Type.LBRACKET)) {
                    advance();
                    term = term.withSuffix(parseBracket());
                } else if (t.is(Token.Type.LBRACKET)) {
                    term = term.withSuffix(parseBracket());
                } else if (t.is(Token.Type.QUESTION)) {
                    advance();
                    term = term.withSuffix(new Suffix.Suppress());
                } else {
                    return term;
                }
            }
        }

        private Term parsePrimary() {
            Token t = peek();
            switch (t.type()) {
                case DOT -> {
                    advance();
                    if (peek().is(Token.Type.LBRACKET)) {
                        Suffix bracket = parseBracket();
                        if (bracket instanceof Suffix.Index index) {
                            return new Term.Index(index.index());
                        }
                        return new Term.Identity().withSuffix(bracket);
                    }
                    if (peek().is(Token.Type.STRING)) {
                        return new Term.Index(new IndexSpec.Key(decodeString(advance())));
                    }
                    return new Term.Identity();
                }
                case RECURSE -> {
                    advance();
                    return new Term.Recurse();
                }
                case FIELD -> {
                    advance();
                    return new Term.Index(new IndexSpec.Field(t.text()));
                }
                case NUMBER -> {
                    advance();
                    return new Term.NumberLiteral(t.text());
                }
                case STRING -> {
                    advance();
                    return new Term.StringLiteral(decodeString(t));
                }
                case INTERPOLATED -> {
                    advance();
                    return new Term.Unmodeled(UnmodeledKind.STRING_INTERPOLATION, t.text());
                }
                case FORMAT -> {
                    advance();
                    if (peek().is(Token.Type.STRING) || peek().is(Token.Type.INTERPOLATED)) {
                        advance();
                    }
                    return new Term.Unmodeled(UnmodeledKind.FORMAT, textFrom(t.start()));
                }
                case VARIABLE -> {
                    advance();
                    return new Term.Variable(t.text());
                }
                case LPAREN -> {
                    advance();
                    Query inner = parsePipe();
                    expect(Token.Type.RPAREN, "')'");
                    return new Term.Subquery(inner);
                }
                case LBRACKET -> {
                    advance();
                    if (peek().is(Token.Type.RBRACKET)) {
                        advance();
                        return new Term.ArrayLiteral(null);
                    }
                    Query body = parsePipe();
                    expect(Token.Type.RBRACKET, "']'");
                    return new Term.ArrayLiteral(body);
                }
                case LBRACE -> {
                    return parseObject();
                }
                case IDENT -> {
                    return parseKeywordOrCall(t);
                }
                default -> throw new QueryParseException(
                    t.is(Token.Type.EOF) ? "Unexpected end of input" : "Unexpected '" + t.text() + "'", t.start());
            }
        }

        private Term parseKeywordOrCall(Token t) {
            switch (t.text()) {
                case "null":
                    advance();
                    return new Term.NullLiteral();
                case "true":
                    advance();
                    return new Term.BooleanLiteral(true);
                case "false":
                    advance();
                    return new Term.BooleanLiteral(false);
                case "if":
                    return parseIf(t);
                case "try":
                    advance();
                    parsePostfixTerm();
                    if (peek().isKeyword("catch")) {
                        advance();
                        parsePostfixTerm();
                    }
                    return new Term.Unmodeled(UnmodeledKind.TRY, textFrom(t.start()));
                case "reduce":
                    return parseFold(t, UnmodeledKind.REDUCE);
                case "foreach":
                    return parseFold(t, UnmodeledKind.FOREACH);
                case "label":
                    advance();
                    expect(Token.Type.VARIABLE, "label name");
                    expect(Token.Type.PIPE, "'|' after label");
                    parsePipe();
                    return new Term.Unmodeled(UnmodeledKind.LABEL, textFrom(t.start()));
                case "break":
                    advance();
                    expect(Token.Type.VARIABLE, "label name after 'break'");
                    return new Term.Unmodeled(UnmodeledKind.BREAK, textFrom(t.start()));
                case "def":
                    throw new QueryParseException("Function definitions are not supported", t.start());
                default:
                    break;
            }
            if (RESERVED.contains(t.text())) {
                throw new QueryParseException("Unexpected keyword '" + t.text() + "'", t.start());
            }
            advance();
            MutableList<Query> args = Lists.mutable.empty();
            if (peek().is(Token.Type.LPAREN)) {
                advance();
                args.add(parsePipe());
                while (peek().is(Token.Type.SEMICOLON)) {
                    advance();
                    args.add(parsePipe());
                }
                expect(Token.Type.RPAREN, "')' after arguments of " + t.text());
            }
            return new Term.FunctionCall(t.text(), args.toImmutable());
        }

        private Term parseIf(Token start) {
            advance();
            parsePipe();
            expectKeyword("then");
            parsePipe();
            while (peek().isKeyword("elif")) {
                advance();
                parsePipe();
                expectKeyword("then");
                parsePipe();
            }
            if (peek().isKeyword("else")) {
                advance();
                parsePipe();
            }
            expectKeyword("end");
            return new Term.Unmodeled(UnmodeledKind.IF, textFrom(start.start()));
        }

        private Term parseFold(Token start, UnmodeledKind kind) {
            advance();
            parsePostfixTerm();
            expectKeyword("as");
            expect(Token.Type.VARIABLE, "variable after 'as'");
            expect(Token.Type.LPAREN, "'('");
            parsePipe();
            expect(Token.Type.SEMICOLON, "';'");
            parsePipe();
            if (kind == UnmodeledKind.FOREACH && peek().is(Token.Type.SEMICOLON)) {
                advance();
                parsePipe();
            }
            expect(Token.Type.RPAREN, "')'");
            return new Term.Unmodeled(kind, textFrom(start.start()));
        }

        /**
         * Parses {@code [..]} into an index suffix, or {@link Suffix.Iterate} for {@code []}.
         */
        private Suffix parseBracket() {
            expect(Token.Type.LBRACKET, "'['");
            if (peek().is(Token.Type.RBRACKET)) {
                advance();
                return new Suffix.Iterate();
            }
            if (peek().is(Token.Type.COLON)) {
                advance();
                Query end = null;
                if (!peek().is(Token.Type.RBRACKET)) {
                    end = parsePipe();
                }
                expect(Token.Type.RBRACKET, "']'");
                return new Suffix.Index(new IndexSpec.Slice(null, end));
            }
            Query first = parsePipe();
            if (peek().is(Token.Type.COLON)) {
                advance();
                Query end = null;
                if (!peek().is(Token.Type.RBRACKET)) {
                    end = parsePipe();
                }
                expect(Token.Type.RBRACKET, "']'");
                return new Suffix.Index(new IndexSpec.Slice(first, end));
            }
            expect(Token.Type.RBRACKET, "']'");
            return new Suffix.Index(new IndexSpec.Expression(first));
        }

        private Term parseObject() {
            expect(Token.Type.LBRACE, "'{'");
            MutableList<ObjectEntry> entries = Lists.mutable.empty();
            if (peek().is(Token.Type.RBRACE)) {
                advance();
                return new Term.ObjectLiteral(entries.toImmutable());
            }
            while (true) {
                entries.add(parseObjectEntry());
                if (peek().is(Token.Type.COMMA)) {
                    advance();
                    if (!peek().is(Token.Type.RBRACE)) {
                        continue;
                    }
                }
                expect(Token.Type.RBRACE, "',' or '}' in object");
                return new Term.ObjectLiteral(entries.toImmutable());
            }
        }

        private ObjectEntry parseObjectEntry() {
            Token t = advance();
            ObjectEntry.Key key;
            Query shorthand = null;
            switch (t.type()) {
                case VARIABLE -> {
                    key = new ObjectEntry.Key.Named(t.text());
                    shorthand = Query.of(new Term.Variable(t.text()));
                }
                case IDENT -> {
                    key = new ObjectEntry.Key.Named(t.text());
                    shorthand = Query.of(new Term.Index(new IndexSpec.Field(t.text())));
                }
                case STRING -> {
                    String name = decodeString(t);
                    key = new ObjectEntry.Key.Named(name);
                    shorthand = Query.of(new Term.Index(new IndexSpec.Key(name)));
                }
                case INTERPOLATED -> key = new ObjectEntry.Key.Computed(
                    Query.of(new Term.Unmodeled(UnmodeledKind.STRING_INTERPOLATION, t.text())));
                case LPAREN -> {
                    Query expression = parsePipe();
                    expect(Token.Type.RPAREN, "')'");
                    key = new ObjectEntry.Key.Computed(expression);
                }
                default -> throw new QueryParseException("Invalid object key '" + t.text() + "'", t.start());
            }
            if (peek().is(Token.Type.COLON)) {
                advance();
                return new ObjectEntry(key, parseObjectValue());
            }
            if (shorthand == null) {
                throw new QueryParseException("Expected ':' after computed object key", peek().start());
            }
            return new ObjectEntry(key, shorthand);
        }

        // Object values stop at ',' so only terms and pipes between them are allowed
        private Query parseObjectValue() {
            Query value = parseUnary();
            if (peek().is(Token.Type.PIPE)) {
                advance();
                return Query.pipe(value, parseObjectValue());
            }
            return value;
        }

        private String decodeString(Token token) {
            try (JsonParser parser = JSON.createParser(token.text())) {
                parser.nextToken();
                return parser.getText();
            } catch (IOException e) {
                throw new QueryParseException("Invalid string literal " + token.text(), token.start(), e);
            }
        }

        private boolean startsTerm(Token t) {
            return switch (t.type()) {
                case DOT, RECURSE, FIELD, VARIABLE, NUMBER, STRING, INTERPOLATED, FORMAT,
                     LPAREN, LBRACKET, LBRACE -> true;
                case IDENT -> !RESERVED.contains(t.text());
                default -> false;
            };
        }

        private String textFrom(int start) {
            return source.substring(start, tokens.get(pos - 1).end());
        }

        private Token peek() {
            return tokens.get(pos);
        }

        private Token peekAt(int offset) {
            return tokens.get(Math.min(pos + offset, tokens.size() - 1));
        }

        private Token advance() {
            Token t = tokens.get(pos);
            if (!t.is(Token.Type.EOF)) {
                pos++;
            }
            return t;
        }

        private Token expect(Token.Type type, String what) {
            Token t = peek();
            if (!t.is(type)) {
                String found = t.is(Token.Type.EOF) ? "end of input" : "'" + t.text() + "'";
                throw new QueryParseException("Expected " + what + " but found " + found, t.start());
            }
            return advance();
        }

        private void expectKeyword(String keyword) {
            Token t = peek();
            if (!t.isKeyword(keyword)) {
                String found = t.is(Token.Type.EOF) ? "end of input" : "'" + t.text() + "'";
                throw new QueryParseException("Expected '" + keyword + "' but found " + found, t.start());
            }
            advance();
        }
    }
}
