package com.jqflow.query;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

class QueryLexer {
    // Longest symbols first so "//=" wins over "//" and "/"
    private static final String[] OPERATORS = {
        "//=", "//", "|=", "==", "!=", "<=", ">=", "+=", "-=", "*=", "/=", "%=",
        "=", "<", ">", "+", "-", "*", "/", "%"
    };

    private final String source;
    private int pos;
    private boolean interpolated;

    QueryLexer(String source) {
        this.source = source;
    }

    MutableList<Token> tokenize() {
        MutableList<Token> tokens = Lists.mutable.empty();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= source.length()) {
                tokens.add(new Token(Token.Type.EOF, "", pos, pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        int start = pos;
        char c = source.charAt(pos);

        if (c == '.') {
            if (peek(1) == '.') {
                pos += 2;
                return new Token(Token.Type.RECURSE, "..", start, pos);
            }
            if (isIdentStart(peek(1))) {
                pos++;
                String name = readIdent();
                return new Token(Token.Type.FIELD, name, start, pos);
            }
            pos++;
            return new Token(Token.Type.DOT, ".", start, pos);
        }
        if (c == '$') {
            pos++;
            if (!isIdentStart(peek(0))) {
                throw new QueryParseException("Expected variable name after '$'", start);
            }
            String name = readIdent();
            return new Token(Token.Type.VARIABLE, name, start, pos);
        }
        if (c == '@') {
            pos++;
            if (!isIdentStart(peek(0))) {
                throw new QueryParseException("Expected format name after '@'", start);
            }
            String name = readIdent();
            return new Token(Token.Type.FORMAT, name, start, pos);
        }
        if (isIdentStart(c)) {
            String name = readIdent();
            return new Token(Token.Type.IDENT, name, start, pos);
        }
        if (Character.isDigit(c)) {
            return readNumber();
        }
        if (c == '"') {
            interpolated = false;
            pos = scanString(start);
            Token.Type type = interpolated ? Token.Type.INTERPOLATED : Token.Type.STRING;
            return new Token(type, source.substring(start, pos), start, pos);
        }

        Token.Type punctuation = switch (c) {
            case '(' -> Token.Type.LPAREN;
            case ')' -> Token.Type.RPAREN;
            case '[' -> Token.Type.LBRACKET;
            case ']' -> Token.Type.RBRACKET;
            case '{' -> Token.Type.LBRACE;
            case '}' -> Token.Type.RBRACE;
            case ',' -> Token.Type.COMMA;
            case ':' -> Token.Type.COLON;
            case ';' -> Token.Type.SEMICOLON;
            case '?' -> Token.Type.QUESTION;
            default -> null;
        };
        if (punctuation != null) {
            pos++;
            return new Token(punctuation, String.valueOf(c), start, pos);
        }

        for (String op : OPERATORS) {
            if (source.startsWith(op, pos)) {
                pos += op.length();
                return new Token(Token.Type.OPERATOR, op, start, pos);
            }
        }
        if (c == '|') {
            pos++;
            return new Token(Token.Type.PIPE, "|", start, pos);
        }

        throw new QueryParseException("Unexpected character '" + c + "'", start);
    }

    private void skipWhitespaceAndComments() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '#') {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    pos++;
                }
            } else {
                return;
            }
        }
    }

    private String readIdent() {
        int start = pos;
        while (pos < source.length() && isIdentPart(source.charAt(pos))) {
            pos++;
        }
        return source.substring(start, pos);
    }

    private Token readNumber() {
        int start = pos;
        while (Character.isDigit(peek(0))) {
            pos++;
        }
        if (peek(0) == '.' && Character.isDigit(peek(1))) {
            pos++;
            while (Character.isDigit(peek(0))) {
                pos++;
            }
        }
        if (peek(0) == 'e' || peek(0) == 'E') {
            int mark = pos;
            pos++;
            if (peek(0) == '+' || peek(0) == '-') {
                pos++;
            }
            if (!Character.isDigit(peek(0))) {
                pos = mark;
            } else {
                while (Character.isDigit(peek(0))) {
                    pos++;
                }
            }
        }
        return new Token(Token.Type.NUMBER, source.substring(start, pos), start, pos);
    }

    /**
     * Returns the index just past the closing quote of the string starting at {@code start}.
     */
    private int scanString(int start) {
        int i = start + 1;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\') {
                if (i + 1 < source.length() && source.charAt(i + 1) == '(') {
                    interpolated = true;
                    i = scanInterpolation(i + 2);
                    continue;
                }
                i += 2;
                continue;
            }
            if (c == '"') {
                return i + 1;
            }
            i++;
        }
        throw new QueryParseException("Unterminated string", start);
    }

    private int scanInterpolation(int i) {
        int open = i - 2;
        int depth = 1;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '"') {
                i = scanString(i);
                continue;
            }
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
            i++;
        }
        throw new QueryParseException("Unterminated string interpolation", open);
    }

    private char peek(int offset) {
        int i = pos + offset;
        return i < source.length() ? source.charAt(i) : '\0';
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
