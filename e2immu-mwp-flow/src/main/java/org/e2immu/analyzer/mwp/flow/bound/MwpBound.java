package org.e2immu.analyzer.mwp.flow.bound;

import org.e2immu.analyzer.mwp.flow.semiring.Scalar;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * The mwp-bound of one variable: {@code max(M) + w(W) * p(P)}, where {@code M}, {@code W} and {@code P} are the
 * variables the value depends on with label m, w and p respectively. The polynomials are not computed:
 * {@code w(W)} stands for some honest polynomial in W, and {@code p(P)} for one in P.
 */
public record MwpBound(List<String> m, List<String> w, List<String> p) {

    public MwpBound {
        m = List.copyOf(m);
        w = List.copyOf(w);
        p = List.copyOf(p);
    }

    public static MwpBound of(List<String> variables, Scalar[] column) {
        assert variables.size() == column.length;
        return new MwpBound(select(variables, column, Scalar.MAX), select(variables, column, Scalar.WEAK),
                select(variables, column, Scalar.POLY));
    }

    private static List<String> select(List<String> variables, Scalar[] column, Scalar scalar) {
        return IntStream.range(0, column.length)
                .filter(i -> column[i] == scalar)
                .mapToObj(variables::get)
                .toList();
    }

    public boolean isZero() {
        return m.isEmpty() && w.isEmpty() && p.isEmpty();
    }

    @Override
    public String toString() {
        if (isZero()) return "0";
        List<String> terms = new ArrayList<>(2);
        if (m.size() == 1) terms.add(m.get(0));
        else if (!m.isEmpty()) terms.add("max(" + String.join(",", m) + ")");
        List<String> factors = new ArrayList<>(2);
        if (!w.isEmpty()) factors.add("w(" + String.join(",", w) + ")");
        if (!p.isEmpty()) factors.add("p(" + String.join(",", p) + ")");
        if (!factors.isEmpty()) terms.add(String.join("*", factors));
        return String.join("+", terms);
    }
}
