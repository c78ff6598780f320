package org.e2immu.analyzer.mwp.flow.bound;

import org.e2immu.analyzer.mwp.flow.semiring.Scalar;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.e2immu.analyzer.mwp.flow.semiring.Scalar.*;
import static org.junit.jupiter.api.Assertions.*;

public class TestMwpBound {

    private final List<String> variables = List.of("x", "y", "z", "n");

    @Test
    public void testOf() {
        assertEquals("x+w(z)*p(n)", MwpBound.of(variables, new Scalar[]{
                MAX, ZERO, WEAK, POLY}).toString());
        MwpBound max = MwpBound.of(variables, new Scalar[]{
                MAX, MAX, ZERO, ZERO});
        assertEquals("max(x,y)", max.toString());
        assertEquals(List.of("x", "y"), max.m());
        MwpBound zero = MwpBound.of(variables, new Scalar[]{
                ZERO, ZERO, ZERO, ZERO});
        assertTrue(zero.isZero());
        assertEquals("0", zero.toString());
        assertEquals("p(y,z)", MwpBound.of(variables, new Scalar[]{
                ZERO, POLY, POLY, ZERO}).toString());
    }

    @Test
    public void testBound() {
        List<String> xy = List.of("y", "x");
        Bound bound = Bound.calculate(xy, new Scalar[][]{
                {MAX, ZERO},
                {WEAK, MAX}});
        assertEquals("y+w(x)", bound.get("y").toString());
        assertEquals("x", bound.get("x").toString());
        assertEquals("x' ≤ x, y' ≤ y+w(x)", bound.toString());
    }
}
