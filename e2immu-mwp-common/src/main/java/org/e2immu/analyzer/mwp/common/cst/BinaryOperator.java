package org.e2immu.analyzer.mwp.common.cst;

public enum BinaryOperator {
    PLUS("+", Kind.ADDITIVE),
    MINUS("-", Kind.ADDITIVE),
    TIMES("*", Kind.MULTIPLICATIVE),
    DIVIDE("/", Kind.OTHER),
    REMAINDER("%", Kind.OTHER),
    LESS("<", Kind.COMPARISON),
    LESS_EQUALS("<=", Kind.COMPARISON),
    GREATER(">", Kind.COMPARISON),
    GREATER_EQUALS(">=", Kind.COMPARISON),
    EQUALS("==", Kind.COMPARISON),
    NOT_EQUALS("!=", Kind.COMPARISON),
    AND("&&", Kind.COMPARISON),
    OR("||", Kind.COMPARISON),
    BIT_AND("&", Kind.OTHER),
    BIT_OR("|", Kind.OTHER),
    XOR("^", Kind.OTHER),
    SHIFT_LEFT("<<", Kind.OTHER),
    SHIFT_RIGHT(">>", Kind.OTHER);

    public enum Kind {
        ADDITIVE, MULTIPLICATIVE, COMPARISON, OTHER
    }

    public final String symbol;
    public final Kind kind;

    BinaryOperator(String symbol, Kind kind) {
        this.symbol = symbol;
        this.kind = kind;
    }

    public boolean isArithmetic() {
        return kind == Kind.ADDITIVE || kind == Kind.MULTIPLICATIVE;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
