package org.e2immu.analyzer.mwp.flow.semiring;

import org.junit.jupiter.api.Test;

import static org.e2immu.analyzer.mwp.flow.semiring.Scalar.*;
import static org.junit.jupiter.api.Assertions.*;

public class TestScalar {

    @Test
    public void testSum() {
        assertEquals(MAX, ZERO.sum(MAX));
        assertEquals(POLY, WEAK.sum(POLY));
        assertEquals(INFINITY, INFINITY.sum(MAX));
        for (Scalar s : values()) {
            assertEquals(s, s.sum(ZERO));
            assertEquals(s, s.sum(s));
        }
    }

    @Test
    public void testProd() {
        for (Scalar s : values()) {
            assertEquals(ZERO, s.prod(ZERO));
            assertEquals(ZERO, ZERO.prod(s));
            assertEquals(s, s.prod(MAX));
            if (s != ZERO) assertEquals(INFINITY, s.prod(INFINITY));
        }
        assertEquals(POLY, WEAK.prod(POLY));
        assertEquals(WEAK, WEAK.prod(WEAK));
    }

    @Test
    public void testMonotone() {
        for (Scalar a : values()) {
            for (Scalar b : values()) {
                if (!a.le(b)) continue;
                for (Scalar c : values()) {
                    assertTrue(a.sum(c).le(b.sum(c)), a + " " + b + " " + c);
                    assertTrue(a.prod(c).le(b.prod(c)), a + " " + b + " " + c);
                }
            }
        }
    }

    @Test
    public void testOf() {
        assertEquals(WEAK, Scalar.of("w"));
        assertEquals("i", INFINITY.toString());
        assertThrows(IllegalArgumentException.class, () -> Scalar.of("x"));
    }
}
