package org.e2immu.analyzer.mwp.common.cst;

import java.util.List;
import java.util.stream.Stream;

public record ExpressionAsStatement(Expression expression) implements Statement {

    @Override
    public List<Expression> expressions() {
        return List.of(expression);
    }

    @Override
    public Stream<String> assignedVariables() {
        if (expression instanceof UnaryOperation u && u.operator().isIncrementOrDecrement()
            && u.operand().unwrapCasts() instanceof VariableExpression ve) {
            return Stream.of(ve.name());
        }
        return Stream.empty();
    }

    @Override
    public String toString() {
        return expression + ";";
    }
}
