package org.e2immu.analyzer.mwp.flow.semiring;

import java.util.*;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A normalized sum of monomials: sorted, without zero monomials, and without a monomial dominated by another one.
 * The empty sum is the zero polynomial. Equality is structural.
 * <p>
 * Instances are immutable.
 */
public final class Polynomial {
    public static final Polynomial ZERO = new Polynomial(List.of());
    public static final Polynomial M = of(Scalar.MAX);

    private final List<Monomial> monomials;

    private Polynomial(List<Monomial> monomials) {
        this.monomials = monomials;
    }

    public static Polynomial of(Scalar scalar) {
        return scalar.isZero() ? ZERO : new Polynomial(List.of(new Monomial(scalar, List.of())));
    }

    public static Polynomial of(Monomial... monomials) {
        return of(Arrays.asList(monomials));
    }

    public static Polynomial of(Collection<Monomial> monomials) {
        return new Polynomial(normalize(monomials));
    }

    private static List<Monomial> normalize(Collection<Monomial> monomials) {
        List<Monomial> sorted = new ArrayList<>(monomials.size());
        for (Monomial m : monomials) {
            if (!m.isZero()) sorted.add(m);
        }
        if (sorted.size() <= 1) return List.copyOf(sorted);
        // larger scalars first among equal delta lists, so that duplicates are dropped in one pass
        sorted.sort(Comparator.<Monomial, List<Delta>>comparing(Monomial::deltas, Monomial::compareDeltas)
                .thenComparing(Monomial::scalar, Comparator.reverseOrder()));
        List<Monomial> kept = new ArrayList<>(sorted.size());
        for (Monomial m : sorted) {
            boolean dominated = false;
            for (Monomial k : kept) {
                if (k.dominates(m)) {
                    dominated = true;
                    break;
                }
            }
            if (!dominated) {
                kept.removeIf(m::dominates);
                kept.add(m);
            }
        }
        Collections.sort(kept);
        return List.copyOf(kept);
    }

    public List<Monomial> monomials() {
        return monomials;
    }

    public Stream<Monomial> stream() {
        return monomials.stream();
    }

    public boolean isZero() {
        return monomials.isEmpty();
    }

    public Polynomial plus(Polynomial other) {
        if (isZero()) return other;
        if (other.isZero()) return this;
        List<Monomial> all = new ArrayList<>(monomials.size() + other.monomials.size());
        all.addAll(monomials);
        all.addAll(other.monomials);
        return of(all);
    }

    public Polynomial times(Polynomial other) {
        if (isZero() || other.isZero()) return ZERO;
        List<Monomial> products = new ArrayList<>(monomials.size() * other.monomials.size());
        for (Monomial m1 : monomials) {
            for (Monomial m2 : other.monomials) {
                Monomial product = m1.times(m2);
                if (!product.isZero()) products.add(product);
            }
        }
        return of(products);
    }

    public Polynomial times(Monomial monomial) {
        return times(new Polynomial(List.of(monomial)));
    }

    public Polynomial map(UnaryOperator<Monomial> operator) {
        return of(monomials.stream().map(operator).toList());
    }

    public Scalar eval(int[] assignment) {
        Scalar result = Scalar.ZERO;
        for (Monomial monomial : monomials) {
            result = result.sum(monomial.eval(assignment));
            if (result == Scalar.INFINITY) break;
        }
        return result;
    }

    public boolean contains(Scalar scalar) {
        return monomials.stream().anyMatch(m -> m.scalar() == scalar);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof Polynomial p && monomials.equals(p.monomials);
    }

    @Override
    public int hashCode() {
        return monomials.hashCode();
    }

    @Override
    public String toString() {
        if (monomials.isEmpty()) return Scalar.ZERO.symbol;
        return monomials.stream().map(Monomial::toString).collect(Collectors.joining("+"));
    }
}
