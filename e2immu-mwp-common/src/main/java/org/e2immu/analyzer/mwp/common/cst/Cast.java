package org.e2immu.analyzer.mwp.common.cst;

import java.util.List;

public record Cast(String type, Expression expression) implements Expression {

    @Override
    public OperatorShape shape() {
        return expression.shape();
    }

    @Override
    public List<Expression> operands() {
        return List.of(expression);
    }

    @Override
    public Expression unwrapCasts() {
        return expression.unwrapCasts();
    }

    @Override
    public String toString() {
        return "(" + type + ") " + expression;
    }
}
