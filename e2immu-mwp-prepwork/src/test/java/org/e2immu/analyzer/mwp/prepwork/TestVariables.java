package org.e2immu.analyzer.mwp.prepwork;

import org.e2immu.analyzer.mwp.common.cst.FunctionDefinition;
import org.e2immu.analyzer.mwp.common.cst.Statement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.e2immu.analyzer.mwp.common.cst.CstFactory.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class TestVariables extends CommonTest {

    @DisplayName("parameters, then locals, then other names in order of occurrence")
    @Test
    public void test1() {
        FunctionDefinition f = function("foo", List.of("a", "b"),
                assign("y", plus(var("x"), var("a"))),
                declare("t", constant(0)),
                whileLoop(less(var("t"), var("b")), assign("z", times(var("y"), var("u"))), increment("t")));
        assertEquals("[a, b, t, y, x, z, u]", Variables.of(f).toString());
    }

    @Test
    public void test2() {
        Statement loop = countedLoop("i", "n", assign("x", plus(var("x"), var("y"))));
        assertEquals("[i, n, x, y]", Variables.of(loop).toString());
    }

    @DisplayName("variables of unsupported statements are part of the ordering")
    @Test
    public void test3() {
        FunctionDefinition f = function("foo", List.of(), unsupported("switch", "switch(k) {}", "k"),
                assign("x", constant(1)));
        assertEquals("[k, x]", Variables.of(f).toString());
    }
}
