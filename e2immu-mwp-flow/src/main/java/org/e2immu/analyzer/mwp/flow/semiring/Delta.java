package org.e2immu.analyzer.mwp.flow.semiring;

/**
 * The indicator term δ(value, index): "at the derivation step with this index, case value was chosen".
 * Deltas are ordered by index first, then by value.
 */
public record Delta(int value, int index) implements Comparable<Delta> {

    public Delta {
        assert value >= 0 && index >= 0;
    }

    public boolean conflictsWith(Delta other) {
        return index == other.index && value != other.value;
    }

    public boolean isSatisfiedBy(int[] assignment) {
        return index < assignment.length && assignment[index] == value;
    }

    @Override
    public int compareTo(Delta o) {
        int c = Integer.compare(index, o.index);
        return c != 0 ? c : Integer.compare(value, o.value);
    }

    @Override
    public String toString() {
        return "δ(" + value + "," + index + ")";
    }
}
