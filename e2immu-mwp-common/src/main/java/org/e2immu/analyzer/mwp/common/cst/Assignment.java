package org.e2immu.analyzer.mwp.common.cst;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

public record Assignment(String target, AssignmentOperator operator, Expression value) implements Statement {

    public Assignment {
        Objects.requireNonNull(target);
        Objects.requireNonNull(operator);
        Objects.requireNonNull(value);
    }

    public Assignment(String target, Expression value) {
        this(target, AssignmentOperator.ASSIGN, value);
    }

    /**
     * @return the equivalent plain assignment: {@code x += e} becomes {@code x = x + e}
     */
    public Assignment desugar() {
        if (!operator.isCompound()) return this;
        return new Assignment(target, new BinaryOperation(operator.binaryOperator, new VariableExpression(target),
                value));
    }

    @Override
    public List<Expression> expressions() {
        return List.of(value);
    }

    @Override
    public Stream<String> assignedVariables() {
        return Stream.of(target);
    }

    @Override
    public String toString() {
        return target + " " + operator.symbol + " " + value + ";";
    }
}
