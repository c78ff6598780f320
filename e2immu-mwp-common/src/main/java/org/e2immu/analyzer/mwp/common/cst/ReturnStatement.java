package org.e2immu.analyzer.mwp.common.cst;

import java.util.List;

public record ReturnStatement(Expression value) implements Statement {

    @Override
    public List<Expression> expressions() {
        return value == null ? List.of() : List.of(value);
    }

    @Override
    public String toString() {
        return value == null ? "return;" : "return " + value + ";";
    }
}
