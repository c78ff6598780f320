package org.e2immu.analyzer.mwp.prepwork;

import org.e2immu.analyzer.mwp.common.cst.*;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Computes the fixed variable ordering of a function or of a loop: parameters first, in declaration order,
 * then local variable declarations, then every other variable, in order of first occurrence.
 */
public class Variables {

    private Variables() {
    }

    public static List<String> of(FunctionDefinition functionDefinition) {
        Set<String> set = new LinkedHashSet<>();
        functionDefinition.parameters().forEach(vd -> set.add(vd.name()));
        add(set, functionDefinition.body());
        return List.copyOf(set);
    }

    public static List<String> of(Statement statement) {
        Set<String> set = new LinkedHashSet<>();
        add(set, statement);
        return List.copyOf(set);
    }

    private static void add(Set<String> set, Statement statement) {
        statement.recursively()
                .filter(s -> s instanceof LocalVariableCreation)
                .forEach(s -> set.add(((LocalVariableCreation) s).name()));
        statement.recursively().flatMap(Variables::referenced).forEach(set::add);
    }

    private static Stream<String> referenced(Statement statement) {
        if (statement instanceof UnsupportedStatement us) {
            return us.variables().stream();
        }
        List<String> list = new ArrayList<>();
        statement.assignedVariables().forEach(list::add);
        statement.expressions().forEach(e -> e.variableNames().forEach(list::add));
        return list.stream();
    }
}
