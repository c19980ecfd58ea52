package com.jqflow.query;

public enum Operator {
    NONE("", ""),
    PIPE("|", "Pipe"),
    COMMA(",", "Comma"),
    ALT("//", "Alternative"),
    ASSIGN("=", "Assign"),
    MODIFY("|=", "Modify"),
    UPDATE_ADD("+=", "Update Add"),
    UPDATE_SUB("-=", "Update Subtract"),
    UPDATE_MUL("*=", "Update Multiply"),
    UPDATE_DIV("/=", "Update Divide"),
    UPDATE_MOD("%=", "Update Modulo"),
    UPDATE_ALT("//=", "Update Alternative"),
    OR("or", "Or"),
    AND("and", "And"),
    EQ("==", "Equal"),
    NE("!=", "Not Equal"),
    GT(">", "Greater Than"),
    LT("<", "Less Than"),
    GE(">=", "Greater or Equal"),
    LE("<=", "Less or Equal"),
    ADD("+", "Add"),
    SUB("-", "Subtract"),
    MUL("*", "Multiply"),
    DIV("/", "Divide"),
    MOD("%", "Modulo");

    private final String symbol;
    private final String displayName;

    Operator(String symbol, String displayName) {
        this.symbol = symbol;
        this.displayName = displayName;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Human-readable node label, e.g. {@code Add (+)}. Empty for {@link #NONE}.
     */
    public String label() {
        return this == NONE ? "" : displayName + " (" + symbol + ")";
    }

    public boolean isArithmetic() {
        return this == ADD || this == SUB || this == MUL || this == DIV || this == MOD;
    }

    public boolean isComparison() {
        return this == EQ || this == NE || this == GT || this == LT || this == GE || this == LE;
    }

    public boolean isLogical() {
        return this == AND || this == OR;
    }

    public static Operator fromSymbol(String symbol) {
        for (Operator op : values()) {
            if (op != NONE && op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown operator: " + symbol);
    }
}
