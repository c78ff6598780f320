package org.e2immu.analyzer.mwp.flow.bound;

import org.e2immu.analyzer.mwp.flow.semiring.Scalar;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The bounds of all variables, computed from a relation evaluated under one choice assignment.
 * Rows of the matrix are sources, columns targets.
 */
public record Bound(Map<String, MwpBound> bounds) {

    public Bound {
        bounds = Map.copyOf(bounds);
    }

    public static Bound calculate(List<String> variables, Scalar[][] matrix) {
        int n = variables.size();
        assert matrix.length == n;
        Map<String, MwpBound> map = new LinkedHashMap<>();
        for (int j = 0; j < n; j++) {
            Scalar[] column = new Scalar[n];
            for (int i = 0; i < n; i++) column[i] = matrix[i][j];
            map.put(variables.get(j), MwpBound.of(variables, column));
        }
        return new Bound(map);
    }

    public MwpBound get(String variable) {
        return bounds.get(variable);
    }

    @Override
    public String toString() {
        return bounds.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> e.getKey() + "' ≤ " + e.getValue())
                .collect(Collectors.joining(", "));
    }
}
