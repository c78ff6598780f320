package org.e2immu.analyzer.mwp.common.cst;

import java.util.List;
import java.util.stream.Collectors;

/*
a flattened chain of the same operator: x1 + x2 + ... + xn
 */
public record NaryOperation(BinaryOperator operator, List<Expression> operands) implements Expression {

    public NaryOperation {
        operands = List.copyOf(operands);
        assert operands.size() >= 2;
    }

    @Override
    public OperatorShape shape() {
        return OperatorShape.NARY;
    }

    @Override
    public String toString() {
        return operands.stream().map(Object::toString).collect(Collectors.joining(" " + operator + " "));
    }
}
