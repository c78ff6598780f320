package org.e2immu.analyzer.mwp.common.cst;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

public record VariableExpression(String name) implements Expression {

    public VariableExpression {
        Objects.requireNonNull(name);
        assert !name.isBlank();
    }

    @Override
    public OperatorShape shape() {
        return OperatorShape.LEAF;
    }

    @Override
    public List<Expression> operands() {
        return List.of();
    }

    @Override
    public Stream<String> variableNames() {
        return Stream.of(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
