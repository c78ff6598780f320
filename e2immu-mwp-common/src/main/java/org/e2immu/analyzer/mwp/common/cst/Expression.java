package org.e2immu.analyzer.mwp.common.cst;

import java.util.List;
import java.util.stream.Stream;

public sealed interface Expression permits VariableExpression, Constant, UnaryOperation, BinaryOperation,
        NaryOperation, Cast, FunctionCall {

    OperatorShape shape();

    List<Expression> operands();

    /**
     * @return the names of the variables read by this expression, in order of occurrence, with duplicates
     */
    default Stream<String> variableNames() {
        return operands().stream().flatMap(Expression::variableNames);
    }

    /**
     * @return the expression without surrounding casts
     */
    default Expression unwrapCasts() {
        return this;
    }
}
