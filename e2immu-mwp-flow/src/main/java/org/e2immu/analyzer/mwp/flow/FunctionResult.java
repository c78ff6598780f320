package org.e2immu.analyzer.mwp.flow;

import org.e2immu.analyzer.mwp.flow.bound.Bound;
import org.e2immu.analyzer.mwp.flow.choice.Choices;

import java.util.List;

public sealed interface FunctionResult {

    String name();

    List<String> variables();

    /**
     * @return the number of operation indices allocated during the analysis
     */
    int indexCount();

    boolean isBounded();

    /**
     * Some admissible choice assignment keeps every entry of the relation below i.
     * The relation keeps the branch indicators of conditionals; choices, bounds and variable results are computed
     * with those indicators removed, and hold for both branches.
     *
     * @param bound the bound of every variable under {@code choices.first()}
     */
    record Bounded(String name,
                   Relation relation,
                   int indexCount,
                   Choices choices,
                   Bound bound,
                   List<VariableResult> variableResults) implements FunctionResult {
        public Bounded {
            variableResults = List.copyOf(variableResults);
            assert !choices.infinite();
        }

        @Override
        public List<String> variables() {
            return relation.variables();
        }

        @Override
        public boolean isBounded() {
            return true;
        }

        public VariableResult variableResult(String variable) {
            return variableResults.stream().filter(vr -> vr.variable().equals(variable)).findFirst().orElseThrow();
        }

        @Override
        public String toString() {
            return name + ": bounded, " + bound;
        }
    }

    /**
     * No admissible choice assignment exists.
     *
     * @param relation      the final relation; null when the analysis stopped early
     * @param infiniteFlows the entries "source ➔ target" holding i, restricted to the targets without admissible
     *                      assignment; empty when the analysis stopped early
     */
    record Unbounded(String name,
                     List<String> variables,
                     int indexCount,
                     Relation relation,
                     List<String> infiniteFlows) implements FunctionResult {
        public Unbounded {
            variables = List.copyOf(variables);
            infiniteFlows = List.copyOf(infiniteFlows);
        }

        @Override
        public boolean isBounded() {
            return false;
        }

        @Override
        public String toString() {
            return name + ": infinite" + (infiniteFlows.isEmpty() ? "" : ", " + String.join(", ", infiniteFlows));
        }
    }
}
