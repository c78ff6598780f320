package org.e2immu.analyzer.mwp.common.cst;

import java.util.List;

/*
produced by the front end for syntax it cannot map onto the other statement types (switch, goto, ...)
 */
public record UnsupportedStatement(String kind, String source, List<String> variables) implements Statement {

    public UnsupportedStatement {
        variables = List.copyOf(variables);
    }

    @Override
    public String toString() {
        return source;
    }
}
