package org.e2immu.analyzer.mwp.flow;

import org.e2immu.analyzer.mwp.flow.bound.MwpBound;
import org.e2immu.analyzer.mwp.flow.choice.Choices;
import org.e2immu.analyzer.mwp.flow.semiring.Scalar;

/**
 * The growth class of one variable: the least label among m, w and p such that some admissible choice assignment
 * keeps every entry of the variable's column at or below it. 0 when the column is zero; i when no label works.
 *
 * @param choices the admissible assignments for the label; null when the label is i
 * @param bound   the bound under the first admissible assignment; null when the label is i
 */
public record VariableResult(String variable, Scalar label, Choices choices, MwpBound bound) {

    public static VariableResult unbounded(String variable) {
        return new VariableResult(variable, Scalar.INFINITY, null, null);
    }

    public boolean isBounded() {
        return label != Scalar.INFINITY;
    }

    @Override
    public String toString() {
        return variable + ": " + label + (bound == null ? "" : ", " + variable + "' ≤ " + bound);
    }
}
