package org.e2immu.analyzer.mwp.flow.semiring;

/*
The growth labels of the mwp calculus, in increasing order of severity: 0 < m < w < p < i.

sum is the join (maximum) and has 0 as unit.
prod is sequential combination: 0 annihilates, otherwise the maximum is taken; m is its unit, and i absorbs
every non-zero label.
 */
public enum Scalar {
    ZERO("0"),
    MAX("m"),
    WEAK("w"),
    POLY("p"),
    INFINITY("i");

    public final String symbol;

    Scalar(String symbol) {
        this.symbol = symbol;
    }

    public static Scalar of(String symbol) {
        for (Scalar scalar : values()) {
            if (scalar.symbol.equals(symbol)) return scalar;
        }
        throw new IllegalArgumentException("Unknown scalar " + symbol);
    }

    public Scalar sum(Scalar other) {
        return compareTo(other) >= 0 ? this : other;
    }

    public Scalar prod(Scalar other) {
        if (this == ZERO || other == ZERO) return ZERO;
        return sum(other);
    }

    public boolean le(Scalar other) {
        return compareTo(other) <= 0;
    }

    public boolean isZero() {
        return this == ZERO;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
