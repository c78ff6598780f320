package org.e2immu.analyzer.mwp.prepwork;

import org.e2immu.analyzer.mwp.common.cst.Block;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.e2immu.analyzer.mwp.common.cst.CstFactory.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class TestFindLoops {

    @Test
    public void test1() {
        Block body = block(assign("x", constant(0)),
                whileLoop(less(var("x"), var("n")),
                        countedLoop("i", "n", increment("x")),
                        assign("n", minus(var("n"), constant(1)))),
                doWhile(less(var("y"), var("x")), increment("y")));
        List<FindLoops.Loop> loops = FindLoops.in(body);
        assertEquals(3, loops.size());
        assertEquals("1", loops.get(0).index());
        assertEquals("1.0.0", loops.get(1).index());
        assertEquals("2", loops.get(2).index());
        assertEquals("1.0.0: for (i = 0; i < n; i++;) { x++; }", loops.get(1).toString());
    }

    @Test
    public void test2() {
        assertEquals(List.of(), FindLoops.in(block(assign("x", var("y")))));
    }
}
