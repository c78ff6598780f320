package org.e2immu.analyzer.mwp.common.cst;

public enum AssignmentOperator {
    ASSIGN("=", null),
    PLUS_ASSIGN("+=", BinaryOperator.PLUS),
    MINUS_ASSIGN("-=", BinaryOperator.MINUS),
    TIMES_ASSIGN("*=", BinaryOperator.TIMES),
    DIVIDE_ASSIGN("/=", BinaryOperator.DIVIDE),
    REMAINDER_ASSIGN("%=", BinaryOperator.REMAINDER);

    public final String symbol;
    // null for plain assignment
    public final BinaryOperator binaryOperator;

    AssignmentOperator(String symbol, BinaryOperator binaryOperator) {
        this.symbol = symbol;
        this.binaryOperator = binaryOperator;
    }

    public boolean isCompound() {
        return binaryOperator != null;
    }
}
