package org.e2immu.analyzer.mwp.common.cst;

import java.util.Objects;

public record VariableDeclaration(String name, Kind kind) {

    public enum Kind {
        PARAMETER, LOCAL
    }

    public VariableDeclaration {
        Objects.requireNonNull(name);
        Objects.requireNonNull(kind);
    }

    public static VariableDeclaration parameter(String name) {
        return new VariableDeclaration(name, Kind.PARAMETER);
    }
}
