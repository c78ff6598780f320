package org.e2immu.analyzer.mwp.common.cst;

import java.util.List;

public record BinaryOperation(BinaryOperator operator, Expression left, Expression right) implements Expression {

    @Override
    public OperatorShape shape() {
        return OperatorShape.BINARY;
    }

    @Override
    public List<Expression> operands() {
        return List.of(left, right);
    }

    @Override
    public String toString() {
        return left + " " + operator + " " + right;
    }
}
