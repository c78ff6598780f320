package org.e2immu.analyzer.mwp.common.cst;

import java.util.List;
import java.util.stream.Stream;

/*
initializer is null for a declaration without initializer
 */
public record LocalVariableCreation(String type, String name, Expression initializer) implements Statement {

    public boolean hasInitializer() {
        return initializer != null;
    }

    @Override
    public List<Expression> expressions() {
        return initializer == null ? List.of() : List.of(initializer);
    }

    @Override
    public Stream<String> assignedVariables() {
        return initializer == null ? Stream.empty() : Stream.of(name);
    }

    @Override
    public String toString() {
        return type + " " + name + (initializer == null ? "" : " = " + initializer) + ";";
    }
}
