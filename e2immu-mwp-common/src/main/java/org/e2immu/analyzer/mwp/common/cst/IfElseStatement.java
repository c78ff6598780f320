package org.e2immu.analyzer.mwp.common.cst;

import java.util.List;
import java.util.Objects;

/*
elseBranch is null when there is no else
 */
public record IfElseStatement(Expression condition, Statement ifBranch, Statement elseBranch) implements Statement {

    public IfElseStatement {
        Objects.requireNonNull(condition);
        Objects.requireNonNull(ifBranch);
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public List<Statement> subStatements() {
        return elseBranch == null ? List.of(ifBranch) : List.of(ifBranch, elseBranch);
    }

    @Override
    public List<Expression> expressions() {
        return List.of(condition);
    }

    @Override
    public String toString() {
        return "if (" + condition + ") " + ifBranch + (elseBranch == null ? "" : " else " + elseBranch);
    }
}
