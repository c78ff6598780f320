package org.e2immu.analyzer.mwp.common.cst;

import java.util.List;

public record WhileStatement(Expression condition, Statement body) implements Statement {

    @Override
    public List<Statement> subStatements() {
        return List.of(body);
    }

    @Override
    public List<Expression> expressions() {
        return List.of(condition);
    }

    @Override
    public boolean isLoop() {
        return true;
    }

    @Override
    public String toString() {
        return "while (" + condition + ") " + body;
    }
}
