package org.e2immu.analyzer.mwp.flow.impl;

import org.e2immu.analyzer.mwp.flow.Relation;
import org.e2immu.analyzer.mwp.flow.VariableResult;
import org.e2immu.analyzer.mwp.flow.bound.MwpBound;
import org.e2immu.analyzer.mwp.flow.choice.ChoiceRegistry;
import org.e2immu.analyzer.mwp.flow.choice.ChoiceSolver;
import org.e2immu.analyzer.mwp.flow.choice.Choices;
import org.e2immu.analyzer.mwp.flow.semiring.Delta;
import org.e2immu.analyzer.mwp.flow.semiring.Scalar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/*
Reads a finished relation and its choice registry.

A variable has class m when some admissible assignment keeps its column free of w, p and i; class w when some
keeps it free of p and i; class p when some keeps it free of i. The first label that works is the class.
 */
public class ResultClassifier {
    private static final Logger LOGGER = LoggerFactory.getLogger(ResultClassifier.class);

    private record Level(Scalar label, Set<Scalar> bad) {
    }

    private static final List<Level> LEVELS = List.of(
            new Level(Scalar.MAX, EnumSet.of(Scalar.WEAK, Scalar.POLY, Scalar.INFINITY)),
            new Level(Scalar.WEAK, EnumSet.of(Scalar.POLY, Scalar.INFINITY)),
            new Level(Scalar.POLY, EnumSet.of(Scalar.INFINITY)));

    private static final Set<Scalar> INFINITE = EnumSet.of(Scalar.INFINITY);

    private ResultClassifier() {
    }

    /**
     * @return the choice assignments that keep every entry of the relation below i
     */
    public static Choices choices(Relation relation, ChoiceRegistry registry) {
        return ChoiceSolver.generate(registry, relation.infinitePaths());
    }

    public static List<VariableResult> classifyAll(Relation relation, ChoiceRegistry registry) {
        return relation.variables().stream().map(v -> classify(relation, registry, v)).toList();
    }

    public static VariableResult classify(Relation relation, ChoiceRegistry registry, String variable) {
        if (relation.isColumnZero(variable)) {
            Choices all = ChoiceSolver.generate(registry, Set.of());
            return new VariableResult(variable, Scalar.ZERO, all, MwpBound.of(relation.variables(),
                    column(relation, all.first(), variable)));
        }
        for (Level level : LEVELS) {
            Choices choices = ChoiceSolver.generate(registry, relation.columnPaths(variable, level.bad));
            if (!choices.infinite()) {
                MwpBound bound = MwpBound.of(relation.variables(), column(relation, choices.first(), variable));
                LOGGER.debug("Variable {}: {}, bound {}", variable, level.label, bound);
                return new VariableResult(variable, level.label, choices, bound);
            }
        }
        LOGGER.debug("Variable {}: no bound", variable);
        return VariableResult.unbounded(variable);
    }

    private static Scalar[] column(Relation relation, int[] assignment, String variable) {
        Scalar[][] matrix = relation.applyChoice(assignment);
        int j = relation.variables().indexOf(variable);
        Scalar[] column = new Scalar[matrix.length];
        for (int i = 0; i < matrix.length; i++) column[i] = matrix[i][j];
        return column;
    }

    /**
     * Classification when some variables have no bound: the others are classified when, under an assignment
     * that is admissible for all of them together, they do not depend on a failing variable.
     */
    public static List<VariableResult> classifyPartially(Relation relation, ChoiceRegistry registry) {
        List<VariableResult> results = classifyAll(relation, registry);
        List<String> failing = results.stream().filter(vr -> !vr.isBounded()).map(VariableResult::variable)
                .toList();
        if (failing.isEmpty()) return results;
        Set<List<Delta>> restPaths = new LinkedHashSet<>();
        for (VariableResult vr : results) {
            if (vr.isBounded()) restPaths.addAll(relation.columnPaths(vr.variable(), INFINITE));
        }
        Choices joint = ChoiceSolver.generate(registry, restPaths);
        if (joint.infinite()) {
            return relation.variables().stream().map(VariableResult::unbounded).toList();
        }
        Scalar[][] matrix = relation.applyChoice(joint.first());
        List<String> variables = relation.variables();
        List<VariableResult> partial = new ArrayList<>(results.size());
        for (VariableResult vr : results) {
            if (!vr.isBounded()) {
                partial.add(vr);
                continue;
            }
            int j = variables.indexOf(vr.variable());
            boolean dependsOnFailing = failing.stream().anyMatch(f -> !matrix[variables.indexOf(f)][j].isZero());
            partial.add(dependsOnFailing ? VariableResult.unbounded(vr.variable()) : vr);
        }
        return partial;
    }
}
