package org.e2immu.analyzer.mwp.common.cst;

import java.util.List;

public record Constant(String value) implements Expression {

    @Override
    public OperatorShape shape() {
        return OperatorShape.LEAF;
    }

    @Override
    public List<Expression> operands() {
        return List.of();
    }

    @Override
    public String toString() {
        return value;
    }
}
