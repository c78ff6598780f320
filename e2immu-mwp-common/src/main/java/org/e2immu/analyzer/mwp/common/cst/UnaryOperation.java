package org.e2immu.analyzer.mwp.common.cst;

import java.util.List;

public record UnaryOperation(UnaryOperator operator, Expression operand) implements Expression {

    @Override
    public OperatorShape shape() {
        return OperatorShape.UNARY;
    }

    @Override
    public List<Expression> operands() {
        return List.of(operand);
    }

    @Override
    public String toString() {
        return operator.prefix ? operator.symbol + operand : operand + operator.symbol;
    }
}
