package org.e2immu.analyzer.mwp.common.cst;

public record BreakStatement() implements Statement {

    @Override
    public String toString() {
        return "break;";
    }
}
