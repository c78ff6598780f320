package org.e2immu.analyzer.mwp.common.cst;

import java.util.List;
import java.util.stream.Collectors;

public record FunctionCall(String name, List<Expression> arguments) implements Expression {

    public FunctionCall {
        arguments = List.copyOf(arguments);
    }

    @Override
    public OperatorShape shape() {
        return OperatorShape.NARY;
    }

    @Override
    public List<Expression> operands() {
        return arguments;
    }

    @Override
    public String toString() {
        return name + "(" + arguments.stream().map(Object::toString).collect(Collectors.joining(", ")) + ")";
    }
}
