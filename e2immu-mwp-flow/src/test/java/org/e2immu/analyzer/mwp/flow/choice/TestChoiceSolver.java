package org.e2immu.analyzer.mwp.flow.choice;

import org.e2immu.analyzer.mwp.flow.CommonTest;
import org.e2immu.analyzer.mwp.flow.semiring.Delta;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TestChoiceSolver extends CommonTest {

    private static Delta d(int value, int index) {
        return new Delta(value, index);
    }

    @Test
    public void testParameterizedDomain() {
        Set<List<Delta>> infinite = Set.of(
                List.of(d(0, 0), d(0, 1)),
                List.of(d(0, 0), d(1, 1), d(3, 2)),
                List.of(d(1, 0), d(1, 1), d(3, 2)),
                List.of(d(2, 0), d(1, 1), d(3, 2)),
                List.of(d(3, 0), d(1, 1), d(3, 2)));
        Choices choices = ChoiceSolver.generate(List.of(0, 1, 2, 3), 3, infinite);
        assertFalse(choices.infinite());
        List<List<List<Integer>>> valid = choices.valid();
        assertEquals(4, valid.size());
        assertTrue(valid.contains(List.of(List.of(1, 2, 3), List.of(0, 2, 3), List.of(0, 1, 2, 3))));
        assertTrue(valid.contains(List.of(List.of(1, 2, 3), List.of(0, 1, 2, 3), List.of(0, 1, 2))));
        assertTrue(valid.contains(List.of(List.of(0, 1, 2, 3), List.of(2, 3), List.of(0, 1, 2, 3))));
        assertTrue(valid.contains(List.of(List.of(0, 1, 2, 3), List.of(1, 2, 3), List.of(0, 1, 2))));
    }

    @Test
    public void testInfinite() {
        Set<List<Delta>> infinite = Set.of(List.of(d(0, 3)), List.of(d(1, 3)), List.of(d(2, 3)));
        Choices choices = ChoiceSolver.generate(List.of(0, 1, 2), 4, infinite);
        assertTrue(choices.infinite());
        assertEquals("infinite", choices.toString());
        assertEquals(0, choices.assignments().count());
    }

    @Test
    public void testIsValid() {
        Set<List<Delta>> infinite = Set.of(List.of(d(0, 1)), List.of(d(1, 0), d(2, 1)));
        Choices choices = ChoiceSolver.generate(List.of(0, 1, 2), 2, infinite);

        assertFalse(choices.isValid(0, 0));
        assertFalse(choices.isValid(1, 0));
        assertFalse(choices.isValid(2, 0));
        assertFalse(choices.isValid(1, 2));

        assertTrue(choices.isValid(0, 1));
        assertTrue(choices.isValid(1, 1));
        assertTrue(choices.isValid(2, 1));
        assertTrue(choices.isValid(0, 2));
        assertTrue(choices.isValid(2, 2));
    }

    @Test
    public void testMinimal() {
        Set<List<Delta>> infinite = Set.of(
                List.of(d(0, 0)),
                List.of(d(1, 0)),
                List.of(d(2, 1), d(1, 2)),
                List.of(d(2, 0), d(1, 1), d(1, 2)));
        Choices choices = ChoiceSolver.generate(List.of(0, 1, 2), 3, infinite);
        List<List<List<Integer>>> valid = choices.valid();
        assertTrue(valid.contains(List.of(List.of(2), List.of(0, 1, 2), List.of(0, 2))));
        assertFalse(valid.contains(List.of(List.of(2), List.of(0, 1), List.of(0, 2))));
        assertFalse(valid.contains(List.of(List.of(2), List.of(0, 2), List.of(0, 2))));
        assertTrue(valid.contains(List.of(List.of(2), List.of(0), List.of(0, 1, 2))));
        assertEquals(2, valid.size());

        // overlapping vectors: every assignment exactly once
        List<int[]> assignments = choices.assignments().toList();
        assertEquals(7, assignments.size());
        assertEquals(7, assignments.stream().map(Arrays::toString).distinct().count());
        assertTrue(assignments.stream().allMatch(a -> choices.isValid(a)));
        assertEquals(2, choices.first()[0]);
    }

    @Test
    public void testNoPaths() {
        ChoiceRegistry registry = new ChoiceRegistry();
        registry.newOperation(3);
        registry.newOperation(2);
        Choices choices = ChoiceSolver.generate(registry, Set.of());
        assertEquals(1, choices.vectors().size());
        assertArrayEquals(new int[]{0, 0}, choices.first());
        assertEquals(6, choices.assignments().count());
    }

    @Test
    public void testPerOperationDomains() {
        ChoiceRegistry registry = new ChoiceRegistry();
        registry.newOperation(2);
        registry.newOperation(3);
        // both cases of operation 0 fuse into the empty path
        Choices infinite = ChoiceSolver.generate(registry, Set.of(List.of(d(0, 0)), List.of(d(1, 0))));
        assertTrue(infinite.infinite());

        Choices choices = ChoiceSolver.generate(registry, Set.of(List.of(d(0, 0)), List.of(d(1, 0), d(2, 1))));
        assertEquals("[[[1], [0, 1]]]", choices.toString());
        assertArrayEquals(new int[]{1, 0}, choices.first());
    }
}
