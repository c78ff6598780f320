package org.e2immu.analyzer.mwp.common.cst;

import java.util.List;
import java.util.Optional;

public record TranslationUnit(String name, List<FunctionDefinition> functions) {

    public TranslationUnit {
        functions = List.copyOf(functions);
    }

    public Optional<FunctionDefinition> findFunction(String functionName) {
        return functions.stream().filter(f -> f.name().equals(functionName)).findFirst();
    }
}
