package org.e2immu.analyzer.mwp.common.cst;

public record EmptyStatement() implements Statement {

    @Override
    public String toString() {
        return ";";
    }
}
