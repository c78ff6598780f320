package org.e2immu.analyzer.mwp.common.cst;

import java.util.ArrayList;
import java.util.List;

/*
initializer, condition and updater may be null, as in 'for(;;)'
 */
public record ForStatement(Statement initializer, Expression condition, Statement updater,
                           Statement body) implements Statement {

    @Override
    public List<Statement> subStatements() {
        List<Statement> list = new ArrayList<>(3);
        if (initializer != null) list.add(initializer);
        list.add(body);
        if (updater != null) list.add(updater);
        return List.copyOf(list);
    }

    @Override
    public List<Expression> expressions() {
        return condition == null ? List.of() : List.of(condition);
    }

    @Override
    public boolean isLoop() {
        return true;
    }

    @Override
    public String toString() {
        return "for (" + (initializer == null ? ";" : initializer) + " " + (condition == null ? "" : condition)
               + "; " + (updater == null ? "" : updater) + ") " + body;
    }
}
