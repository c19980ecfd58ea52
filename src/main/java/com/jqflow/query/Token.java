package com.jqflow.query;

/**
 * A lexical token; {@code start} and {@code end} index into the filter source.
 */
record Token(Type type, String text, int start, int end) {
    enum Type {
        DOT,            // .
        RECURSE,        // ..
        FIELD,          // .name, text is the name
        IDENT,          // names and keywords
        VARIABLE,       // $name, text is the name
        NUMBER,
        STRING,         // text is the raw quoted lexeme
        INTERPOLATED,   // string containing \( ... ), raw lexeme
        FORMAT,         // @name
        LPAREN, RPAREN,
        LBRACKET, RBRACKET,
        LBRACE, RBRACE,
        PIPE,
        COMMA,
        COLON,
        SEMICOLON,
        QUESTION,
        OPERATOR,       // + - * / % == != < <= > >= = |= += -= *= /= %= //= //
        EOF
    }

    boolean is(Type expected) {
        return type == expected;
    }

    boolean isKeyword(String keyword) {
        return type == Type.IDENT && text.equals(keyword);
    }

    boolean isOperator(String symbol) {
        return type == Type.OPERATOR && text.equals(symbol);
    }
}
