package org.e2immu.analyzer.mwp.common.cst;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public record FunctionDefinition(String name, List<VariableDeclaration> parameters, Block body) {

    public FunctionDefinition {
        Objects.requireNonNull(name);
        parameters = List.copyOf(parameters);
        Objects.requireNonNull(body);
    }

    public FunctionDefinition withBody(Block newBody) {
        return new FunctionDefinition(name, parameters, newBody);
    }

    @Override
    public String toString() {
        return name + "(" + parameters.stream().map(VariableDeclaration::name).collect(Collectors.joining(", "))
               + ")";
    }
}
