package org.e2immu.analyzer.mwp.common.cst;

public enum UnaryOperator {
    PRE_INCREMENT("++", true),
    POST_INCREMENT("++", false),
    PRE_DECREMENT("--", true),
    POST_DECREMENT("--", false),
    MINUS("-", true),
    PLUS("+", true),
    NOT("!", true),
    SIZEOF("sizeof ", true),
    ADDRESS_OF("&", true),
    DEREFERENCE("*", true),
    BITWISE_NOT("~", true);

    public final String symbol;
    public final boolean prefix;

    UnaryOperator(String symbol, boolean prefix) {
        this.symbol = symbol;
        this.prefix = prefix;
    }

    public boolean isIncrement() {
        return this == PRE_INCREMENT || this == POST_INCREMENT;
    }

    public boolean isDecrement() {
        return this == PRE_DECREMENT || this == POST_DECREMENT;
    }

    public boolean isIncrementOrDecrement() {
        return isIncrement() || isDecrement();
    }
}
