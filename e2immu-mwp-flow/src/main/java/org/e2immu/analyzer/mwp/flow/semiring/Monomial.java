package org.e2immu.analyzer.mwp.flow.semiring;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * A scalar multiplied by a product of deltas. The deltas are sorted and have distinct indices.
 * A monomial is active under a choice assignment when all its deltas are satisfied.
 */
public record Monomial(Scalar scalar, List<Delta> deltas) implements Comparable<Monomial> {
    public static final Monomial ZERO = new Monomial(Scalar.ZERO, List.of());

    public Monomial {
        deltas = List.copyOf(deltas);
        assert isSortedWithoutConflicts(deltas) : "Deltas not normalized: " + deltas;
    }

    public static Monomial of(Scalar scalar, Delta... deltas) {
        Delta[] copy = deltas.clone();
        Arrays.sort(copy);
        return new Monomial(scalar, Arrays.asList(copy));
    }

    private static boolean isSortedWithoutConflicts(List<Delta> deltas) {
        for (int i = 1; i < deltas.size(); i++) {
            if (deltas.get(i - 1).index() >= deltas.get(i).index()) return false;
        }
        return true;
    }

    public boolean isZero() {
        return scalar.isZero();
    }

    public Monomial withScalar(Scalar newScalar) {
        return newScalar == scalar ? this : new Monomial(newScalar, deltas);
    }

    /**
     * @return the product; {@link #ZERO} when the scalar product is zero, or when two deltas on the same
     * index have different values
     */
    public Monomial times(Monomial other) {
        Scalar product = scalar.prod(other.scalar);
        if (product.isZero()) return ZERO;
        List<Delta> merged = new ArrayList<>(deltas.size() + other.deltas.size());
        int i = 0;
        int j = 0;
        while (i < deltas.size() && j < other.deltas.size()) {
            Delta d1 = deltas.get(i);
            Delta d2 = other.deltas.get(j);
            if (d1.index() == d2.index()) {
                if (d1.value() != d2.value()) return ZERO;
                merged.add(d1);
                i++;
                j++;
            } else if (d1.index() < d2.index()) {
                merged.add(d1);
                i++;
            } else {
                merged.add(d2);
                j++;
            }
        }
        while (i < deltas.size()) merged.add(deltas.get(i++));
        while (j < other.deltas.size()) merged.add(other.deltas.get(j++));
        return new Monomial(product, merged);
    }

    /**
     * @return this monomial without the deltas on the given indices
     */
    public Monomial withoutIndices(Set<Integer> indices) {
        if (deltas.stream().noneMatch(d -> indices.contains(d.index()))) return this;
        return new Monomial(scalar, deltas.stream().filter(d -> !indices.contains(d.index())).toList());
    }

    /**
     * @return true when this monomial makes the other one redundant in a sum: its scalar is at least as large,
     * and it is active whenever the other one is
     */
    public boolean dominates(Monomial other) {
        return other.scalar.le(scalar) && isSubsetOf(deltas, other.deltas);
    }

    static boolean isSubsetOf(List<Delta> small, List<Delta> large) {
        if (small.size() > large.size()) return false;
        int j = 0;
        for (Delta d : small) {
            while (j < large.size() && large.get(j).compareTo(d) < 0) j++;
            if (j == large.size() || !large.get(j).equals(d)) return false;
            j++;
        }
        return true;
    }

    public boolean isActive(int[] assignment) {
        for (Delta delta : deltas) {
            if (!delta.isSatisfiedBy(assignment)) return false;
        }
        return true;
    }

    public Scalar eval(int[] assignment) {
        return isActive(assignment) ? scalar : Scalar.ZERO;
    }

    /*
    order of the monomials in a polynomial: first differing delta, then length, then scalar
     */
    @Override
    public int compareTo(Monomial o) {
        int c = compareDeltas(deltas, o.deltas);
        return c != 0 ? c : scalar.compareTo(o.scalar);
    }

    public static int compareDeltas(List<Delta> list1, List<Delta> list2) {
        int n = Math.min(list1.size(), list2.size());
        for (int i = 0; i < n; i++) {
            int c = list1.get(i).compareTo(list2.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(list1.size(), list2.size());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(scalar.symbol);
        for (Delta delta : deltas) sb.append('.').append(delta);
        return sb.toString();
    }
}
