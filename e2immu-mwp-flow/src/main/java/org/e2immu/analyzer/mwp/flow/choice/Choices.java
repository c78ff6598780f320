package org.e2immu.analyzer.mwp.flow.choice;

import java.util.*;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * The admissible choice assignments, as a minimal list of {@link ChoiceVector}s: no vector is contained in another.
 * When the list is empty, no admissible assignment exists.
 */
public final class Choices {
    private final int numberOfIndices;
    private final List<ChoiceVector> vectors;

    public Choices(int numberOfIndices, List<ChoiceVector> vectors) {
        this.numberOfIndices = numberOfIndices;
        this.vectors = List.copyOf(vectors);
        assert this.vectors.stream().allMatch(v -> v.size() == numberOfIndices);
    }

    public int numberOfIndices() {
        return numberOfIndices;
    }

    public List<ChoiceVector> vectors() {
        return vectors;
    }

    public boolean infinite() {
        return vectors.isEmpty();
    }

    public List<List<List<Integer>>> valid() {
        return vectors.stream().map(ChoiceVector::asLists).toList();
    }

    public boolean isValid(int... values) {
        for (ChoiceVector vector : vectors) {
            if (vector.allows(values)) return true;
        }
        return false;
    }

    /**
     * @return the assignment taking the smallest allowed value at each index, in the first vector
     * @throws NoSuchElementException when no admissible assignment exists
     */
    public int[] first() {
        if (vectors.isEmpty()) throw new NoSuchElementException("No admissible choice assignment");
        return vectors.get(0).first();
    }

    /**
     * Lazily enumerates every admissible assignment exactly once. Vectors may overlap: an assignment is produced
     * by the first vector that allows it.
     */
    public Stream<int[]> assignments() {
        Iterable<int[]> iterable = AssignmentIterator::new;
        return StreamSupport.stream(iterable.spliterator(), false);
    }

    private class AssignmentIterator implements Iterator<int[]> {
        private int vectorIndex;
        private int[] positions;
        private List<List<Integer>> current;
        private int[] next;

        AssignmentIterator() {
            advanceToVector(0);
        }

        private void advanceToVector(int index) {
            vectorIndex = index;
            if (index >= vectors.size()) {
                next = null;
                return;
            }
            current = vectors.get(index).asLists();
            positions = new int[numberOfIndices];
            next = valuesAt();
            skipDuplicates();
        }

        private int[] valuesAt() {
            int[] values = new int[numberOfIndices];
            for (int i = 0; i < numberOfIndices; i++) values[i] = current.get(i).get(positions[i]);
            return values;
        }

        // odometer step, last index fastest
        private boolean step() {
            for (int i = numberOfIndices - 1; i >= 0; i--) {
                if (++positions[i] < current.get(i).size()) return true;
                positions[i] = 0;
            }
            return false;
        }

        private void skipDuplicates() {
            while (next != null && allowedByEarlierVector(next)) {
                moveOn();
            }
        }

        private void moveOn() {
            if (step()) {
                next = valuesAt();
            } else {
                advanceToVector(vectorIndex + 1);
            }
        }

        private boolean allowedByEarlierVector(int[] values) {
            for (int v = 0; v < vectorIndex; v++) {
                if (vectors.get(v).allows(values)) return true;
            }
            return false;
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public int[] next() {
            if (next == null) throw new NoSuchElementException();
            int[] result = next;
            moveOn();
            skipDuplicates();
            return result;
        }
    }

    @Override
    public String toString() {
        return infinite() ? "infinite" : vectors.toString();
    }
}
