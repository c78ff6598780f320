package org.e2immu.analyzer.mwp.flow;

import org.e2immu.analyzer.mwp.flow.choice.DeltaGraph;
import org.e2immu.analyzer.mwp.flow.semiring.Delta;
import org.e2immu.analyzer.mwp.flow.semiring.Polynomial;
import org.e2immu.analyzer.mwp.flow.semiring.Scalar;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * A square matrix of polynomials over an ordered list of variables. Rows are sources, columns targets:
 * the entry at (x, y) describes how the value of y after the fragment depends on the value of x before it.
 * <p>
 * Relations are immutable. Operations combining two relations over different variables first extend both to the
 * union of their variables, adding identity rows and columns for the new variables.
 */
public interface Relation {

    List<String> variables();

    default int size() {
        return variables().size();
    }

    Polynomial get(int source, int target);

    Polynomial get(String source, String target);

    /**
     * @return sequential composition: first this, then other
     */
    Relation compose(Relation other);

    /**
     * @return the entry-wise sum
     */
    Relation join(Relation other);

    /**
     * @param variables a list containing all variables of this relation
     * @return this relation extended with identity rows and columns, in the order of the list
     * @throws IllegalArgumentException when a variable of this relation is missing from the list
     */
    Relation homogenize(List<String> variables);

    /**
     * @return every entry multiplied by the indicator term
     */
    Relation qualify(Delta delta);

    /**
     * @return every delta on one of the operations removed, so that each entry holds for all their cases
     */
    Relation withoutIndicators(Set<Integer> operations);

    /**
     * Computes the reflexive transitive closure: R0 = identity, Rk+1 = Rk + Rk.this, until stable.
     *
     * @throws FixpointDivergenceException when no fixpoint is reached within maxIterations
     */
    Relation fixpoint(int maxIterations);

    /**
     * The correction of a while loop applied to a fixpoint: every monomial with label p, and every monomial
     * with label w on the diagonal, gets label i. Their delta lists are inserted into the delta graph.
     */
    Relation whileCorrection(DeltaGraph deltaGraph);

    /**
     * The correction of a loop bounded by a variable, applied to a fixpoint: monomials w and p on the diagonal
     * get label i, and are inserted into the delta graph; for every p in a column, a p with the same deltas is
     * added from the bound variable to that column.
     */
    Relation loopCorrection(String bound, DeltaGraph deltaGraph);

    Scalar[][] applyChoice(int[] assignment);

    /**
     * @return the delta lists of all monomials with label i
     */
    Set<List<Delta>> infinitePaths();

    /**
     * @return the delta lists of the monomials in the column of the target with one of the given labels
     */
    Set<List<Delta>> columnPaths(String target, Set<Scalar> scalars);

    /**
     * @return "source ➔ target" for every entry holding an i, restricted to the given targets
     */
    List<String> infiniteFlows(Collection<String> targets);

    boolean isColumnZero(String target);
}
