package org.e2immu.analyzer.mwp.common.cst;

import java.util.List;
import java.util.stream.Collectors;

public record Block(List<Statement> statements) implements Statement {
    public static final Block EMPTY = new Block(List.of());

    public Block {
        statements = List.copyOf(statements);
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    public int size() {
        return statements.size();
    }

    @Override
    public List<Statement> subStatements() {
        return statements;
    }

    @Override
    public String toString() {
        return statements.stream().map(Object::toString).collect(Collectors.joining(" ", "{ ", " }"));
    }
}
