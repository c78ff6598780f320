package org.e2immu.analyzer.mwp.flow.choice;

import org.e2immu.analyzer.mwp.flow.semiring.Delta;

import java.util.*;

/**
 * For every operation index, the non-empty set of values that may be chosen. A vector stands for the cartesian
 * product of its sets.
 */
public final class ChoiceVector {
    private final List<SortedSet<Integer>> allowed;

    public ChoiceVector(List<? extends Collection<Integer>> allowed) {
        List<SortedSet<Integer>> list = new ArrayList<>(allowed.size());
        for (Collection<Integer> values : allowed) {
            list.add(Collections.unmodifiableSortedSet(new TreeSet<>(values)));
        }
        this.allowed = List.copyOf(list);
    }

    public int size() {
        return allowed.size();
    }

    public SortedSet<Integer> allowed(int index) {
        return allowed.get(index);
    }

    public boolean isEmpty() {
        return allowed.stream().anyMatch(Set::isEmpty);
    }

    /**
     * @return true when no assignment allowed by this vector satisfies every delta of the path
     */
    public boolean avoids(List<Delta> path) {
        for (Delta delta : path) {
            if (delta.index() >= allowed.size() || !allowed.get(delta.index()).contains(delta.value())) return true;
        }
        return false;
    }

    public ChoiceVector exclude(Delta delta) {
        List<SortedSet<Integer>> list = new ArrayList<>(allowed);
        SortedSet<Integer> set = new TreeSet<>(allowed.get(delta.index()));
        set.remove(delta.value());
        list.set(delta.index(), set);
        return new ChoiceVector(list);
    }

    public boolean isContainedIn(ChoiceVector other) {
        if (other.size() != size()) return false;
        for (int i = 0; i < allowed.size(); i++) {
            if (!other.allowed.get(i).containsAll(allowed.get(i))) return false;
        }
        return true;
    }

    public boolean allows(int[] values) {
        if (values.length != allowed.size()) return false;
        for (int i = 0; i < values.length; i++) {
            if (!allowed.get(i).contains(values[i])) return false;
        }
        return true;
    }

    public int[] first() {
        return allowed.stream().mapToInt(SortedSet::first).toArray();
    }

    public List<List<Integer>> asLists() {
        return allowed.stream().map(s -> (List<Integer>) List.copyOf(s)).toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof ChoiceVector cv && allowed.equals(cv.allowed);
    }

    @Override
    public int hashCode() {
        return allowed.hashCode();
    }

    @Override
    public String toString() {
        return asLists().toString();
    }
}
