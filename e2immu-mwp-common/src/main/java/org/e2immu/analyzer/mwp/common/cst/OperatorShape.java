package org.e2immu.analyzer.mwp.common.cst;

/*
the closed set of expression shapes the flow calculus distinguishes.
LEAF covers variables and constants.
 */
public enum OperatorShape {
    LEAF, UNARY, BINARY, NARY
}
