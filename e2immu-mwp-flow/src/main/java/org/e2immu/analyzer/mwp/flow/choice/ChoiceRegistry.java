package org.e2immu.analyzer.mwp.flow.choice;

import java.util.*;

/**
 * Per analyzed function, the derivation steps that introduced indicator terms, and the cases recorded for each.
 * Operation indices are allocated in increasing order starting at 0, and never reused.
 * <p>
 * Not thread-safe: one registry belongs to the analysis of one function.
 */
public class ChoiceRegistry {
    private final List<SortedSet<Integer>> cases = new ArrayList<>();
    private final Set<Integer> branches = new TreeSet<>();

    public int newOperation() {
        cases.add(new TreeSet<>());
        return cases.size() - 1;
    }

    /**
     * Convenience method: allocate an operation with cases 0, 1, ..., numberOfCases-1.
     */
    public int newOperation(int numberOfCases) {
        int index = newOperation();
        for (int c = 0; c < numberOfCases; c++) recordCase(index, c);
        return index;
    }

    /**
     * Allocate an operation with two cases for the branches of a conditional. Which branch runs is not a choice
     * of the analysis: the delta of a branch operation marks the origin of a flow, and a result must hold for
     * both cases.
     */
    public int newBranch() {
        int index = newOperation(2);
        branches.add(index);
        return index;
    }

    public boolean isBranch(int operation) {
        return branches.contains(operation);
    }

    public Set<Integer> branches() {
        return Collections.unmodifiableSet(branches);
    }

    public void recordCase(int operation, int caseIndex) {
        if (operation < 0 || operation >= cases.size()) {
            throw new IllegalArgumentException("Unknown operation " + operation);
        }
        cases.get(operation).add(caseIndex);
    }

    public SortedSet<Integer> cases(int operation) {
        return Collections.unmodifiableSortedSet(cases.get(operation));
    }

    public int size() {
        return cases.size();
    }

    public List<List<Integer>> domains() {
        return cases.stream().map(s -> (List<Integer>) List.copyOf(s)).toList();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < cases.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(i).append(':').append(cases.get(i));
        }
        return sb.toString();
    }
}
