package org.e2immu.analyzer.mwp.common.cst;

public record ContinueStatement() implements Statement {

    @Override
    public String toString() {
        return "continue;";
    }
}
