package org.e2immu.analyzer.mwp.flow.impl;

import org.e2immu.analyzer.mwp.flow.FixpointDivergenceException;
import org.e2immu.analyzer.mwp.flow.Relation;
import org.e2immu.analyzer.mwp.flow.choice.DeltaGraph;
import org.e2immu.analyzer.mwp.flow.semiring.Delta;
import org.e2immu.analyzer.mwp.flow.semiring.Monomial;
import org.e2immu.analyzer.mwp.flow.semiring.Polynomial;
import org.e2immu.analyzer.mwp.flow.semiring.Scalar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Predicate;

public class RelationImpl implements Relation {
    private static final Logger LOGGER = LoggerFactory.getLogger("mwp-fixpoint");

    private final List<String> variables;
    private final Map<String, Integer> indexOf;
    private final Polynomial[][] matrix;

    private RelationImpl(List<String> variables, Polynomial[][] matrix) {
        this.variables = variables;
        this.matrix = matrix;
        Map<String, Integer> map = new HashMap<>();
        for (int i = 0; i < variables.size(); i++) {
            if (map.put(variables.get(i), i) != null) {
                throw new IllegalArgumentException("Duplicate variable " + variables.get(i));
            }
        }
        this.indexOf = map;
    }

    public static RelationImpl identity(List<String> variables) {
        return new Builder(variables).build();
    }

    public static RelationImpl zero(List<String> variables) {
        Builder builder = new Builder(variables);
        for (String v : variables) builder.set(v, v, Polynomial.ZERO);
        return builder.build();
    }

    /**
     * Starts from the identity over the variables.
     */
    public static class Builder {
        private final List<String> variables;
        private final Map<String, Integer> indexOf = new HashMap<>();
        private final Polynomial[][] matrix;

        public Builder(List<String> variables) {
            this.variables = List.copyOf(variables);
            int n = variables.size();
            matrix = new Polynomial[n][n];
            for (int i = 0; i < n; i++) {
                indexOf.put(this.variables.get(i), i);
                Arrays.fill(matrix[i], Polynomial.ZERO);
                matrix[i][i] = Polynomial.M;
            }
        }

        public Builder set(String source, String target, Polynomial polynomial) {
            matrix[index(source)][index(target)] = Objects.requireNonNull(polynomial);
            return this;
        }

        /**
         * Replaces the column of the target: the sources in the map get their polynomial, all others 0.
         */
        public Builder setColumn(String target, Map<String, Polynomial> column) {
            int j = index(target);
            for (Polynomial[] row : matrix) row[j] = Polynomial.ZERO;
            column.forEach((source, p) -> set(source, target, p));
            return this;
        }

        private int index(String variable) {
            Integer i = indexOf.get(variable);
            if (i == null) throw new IllegalArgumentException("Unknown variable " + variable + " in " + variables);
            return i;
        }

        public RelationImpl build() {
            int n = matrix.length;
            Polynomial[][] copy = new Polynomial[n][];
            for (int i = 0; i < n; i++) copy[i] = matrix[i].clone();
            return new RelationImpl(variables, copy);
        }
    }

    @Override
    public List<String> variables() {
        return variables;
    }

    @Override
    public Polynomial get(int source, int target) {
        return matrix[source][target];
    }

    @Override
    public Polynomial get(String source, String target) {
        return matrix[index(source)][index(target)];
    }

    private int index(String variable) {
        Integer i = indexOf.get(variable);
        if (i == null) throw new IllegalArgumentException("Unknown variable " + variable + " in " + variables);
        return i;
    }

    private List<String> union(Relation other) {
        if (variables.equals(other.variables())) return variables;
        List<String> union = new ArrayList<>(variables);
        for (String v : other.variables()) {
            if (!indexOf.containsKey(v)) union.add(v);
        }
        return List.copyOf(union);
    }

    @Override
    public Relation compose(Relation other) {
        List<String> union = union(other);
        return ((RelationImpl) homogenize(union)).multiply((RelationImpl) other.homogenize(union));
    }

    /*
    matrix product over the same variable ordering
     */
    RelationImpl multiply(RelationImpl other) {
        if (!variables.equals(other.variables)) {
            throw new IllegalArgumentException("Variable orderings differ: " + variables + " vs " + other.variables);
        }
        int n = variables.size();
        Polynomial[][] result = new Polynomial[n][n];
        for (int i = 0; i < n; i++) {
            for (int k = 0; k < n; k++) {
                Polynomial sum = Polynomial.ZERO;
                for (int j = 0; j < n; j++) {
                    Polynomial a = matrix[i][j];
                    if (a.isZero()) continue;
                    Polynomial b = other.matrix[j][k];
                    if (b.isZero()) continue;
                    sum = sum.plus(a.times(b));
                }
                result[i][k] = sum;
            }
        }
        return new RelationImpl(variables, result);
    }

    @Override
    public Relation join(Relation other) {
        List<String> union = union(other);
        return ((RelationImpl) homogenize(union)).add((RelationImpl) other.homogenize(union));
    }

    RelationImpl add(RelationImpl other) {
        if (!variables.equals(other.variables)) {
            throw new IllegalArgumentException("Variable orderings differ: " + variables + " vs " + other.variables);
        }
        int n = variables.size();
        Polynomial[][] result = new Polynomial[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                result[i][j] = matrix[i][j].plus(other.matrix[i][j]);
            }
        }
        return new RelationImpl(variables, result);
    }

    @Override
    public Relation homogenize(List<String> newVariables) {
        if (newVariables.equals(variables)) return this;
        if (!newVariables.containsAll(variables)) {
            throw new IllegalArgumentException("Cannot homogenize " + variables + " to " + newVariables);
        }
        List<String> target = List.copyOf(newVariables);
        int n = target.size();
        Polynomial[][] result = new Polynomial[n][n];
        int[] old = new int[n];
        for (int i = 0; i < n; i++) {
            Integer o = indexOf.get(target.get(i));
            old[i] = o == null ? -1 : o;
        }
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (old[i] >= 0 && old[j] >= 0) {
                    result[i][j] = matrix[old[i]][old[j]];
                } else {
                    result[i][j] = i == j ? Polynomial.M : Polynomial.ZERO;
                }
            }
        }
        return new RelationImpl(target, result);
    }

    @Override
    public Relation qualify(Delta delta) {
        Monomial indicator = Monomial.of(Scalar.MAX, delta);
        int n = variables.size();
        Polynomial[][] result = new Polynomial[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                result[i][j] = matrix[i][j].times(indicator);
            }
        }
        return new RelationImpl(variables, result);
    }

    @Override
    public Relation fixpoint(int maxIterations) {
        RelationImpl current = identity(variables);
        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            RelationImpl next = current.add(current.multiply(this));
            if (next.equals(current)) {
                LOGGER.debug("Fixpoint over {} reached after {} iteration(s)", variables, iteration);
                return current;
            }
            current = next;
        }
        throw new FixpointDivergenceException(maxIterations, variables);
    }

    @Override
    public Relation withoutIndicators(Set<Integer> operations) {
        if (operations.isEmpty()) return this;
        int n = variables.size();
        Polynomial[][] result = new Polynomial[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                result[i][j] = matrix[i][j].map(m -> m.withoutIndices(operations));
            }
        }
        return new RelationImpl(variables, result);
    }

    @Override
    public Relation whileCorrection(DeltaGraph deltaGraph) {
        int n = variables.size();
        Polynomial[][] result = new Polynomial[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                boolean diagonal = i == j;
                result[i][j] = correct(matrix[i][j], m -> m.scalar() == Scalar.POLY
                                                          || diagonal && m.scalar() == Scalar.WEAK, deltaGraph);
            }
        }
        return new RelationImpl(variables, result);
    }

    private static Polynomial correct(Polynomial polynomial, Predicate<Monomial> toInfinity,
                                      DeltaGraph deltaGraph) {
        if (polynomial.stream().noneMatch(toInfinity)) return polynomial;
        return polynomial.map(m -> {
            if (toInfinity.test(m)) {
                deltaGraph.insert(m.deltas());
                return m.withScalar(Scalar.INFINITY);
            }
            return m;
        });
    }

    @Override
    public Relation loopCorrection(String bound, DeltaGraph deltaGraph) {
        if (!indexOf.containsKey(bound)) {
            List<String> extended = new ArrayList<>(variables);
            extended.add(bound);
            return homogenize(extended).loopCorrection(bound, deltaGraph);
        }
        int n = variables.size();
        int x = index(bound);
        Polynomial[][] result = new Polynomial[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                result[i][j] = i != j ? matrix[i][j] : correct(matrix[i][j],
                        m -> m.scalar() == Scalar.WEAK || m.scalar() == Scalar.POLY, deltaGraph);
            }
        }
        for (int j = 0; j < n; j++) {
            if (j == x) continue;
            List<Monomial> polys = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                matrix[i][j].stream().filter(m -> m.scalar() == Scalar.POLY).forEach(polys::add);
            }
            if (!polys.isEmpty()) {
                result[x][j] = result[x][j].plus(Polynomial.of(polys));
            }
        }
        return new RelationImpl(variables, result);
    }

    @Override
    public Scalar[][] applyChoice(int[] assignment) {
        int n = variables.size();
        Scalar[][] result = new Scalar[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                result[i][j] = matrix[i][j].eval(assignment);
            }
        }
        return result;
    }

    @Override
    public Set<List<Delta>> infinitePaths() {
        Set<List<Delta>> paths = new LinkedHashSet<>();
        for (Polynomial[] row : matrix) {
            for (Polynomial p : row) {
                p.stream().filter(m -> m.scalar() == Scalar.INFINITY).forEach(m -> paths.add(m.deltas()));
            }
        }
        return paths;
    }

    @Override
    public Set<List<Delta>> columnPaths(String target, Set<Scalar> scalars) {
        int j = index(target);
        Set<List<Delta>> paths = new LinkedHashSet<>();
        for (Polynomial[] row : matrix) {
            row[j].stream().filter(m -> scalars.contains(m.scalar())).forEach(m -> paths.add(m.deltas()));
        }
        return paths;
    }

    @Override
    public List<String> infiniteFlows(Collection<String> targets) {
        List<String> flows = new ArrayList<>();
        for (int j = 0; j < variables.size(); j++) {
            if (!targets.contains(variables.get(j))) continue;
            for (int i = 0; i < variables.size(); i++) {
                if (matrix[i][j].contains(Scalar.INFINITY)) {
                    flows.add(variables.get(i) + " ➔ " + variables.get(j));
                }
            }
        }
        return flows;
    }

    @Override
    public boolean isColumnZero(String target) {
        int j = index(target);
        for (Polynomial[] row : matrix) {
            if (!row[j].isZero()) return false;
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof RelationImpl r && variables.equals(r.variables) && Arrays.deepEquals(matrix, r.matrix);
    }

    @Override
    public int hashCode() {
        return 31 * variables.hashCode() + Arrays.deepHashCode(matrix);
    }

    /*
    one line per source variable
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < variables.size(); i++) {
            if (i > 0) sb.append('\n');
            sb.append(variables.get(i)).append(" | ");
            for (int j = 0; j < variables.size(); j++) {
                if (j > 0) sb.append(" | ");
                sb.append(matrix[i][j]);
            }
        }
        return sb.toString();
    }
}
