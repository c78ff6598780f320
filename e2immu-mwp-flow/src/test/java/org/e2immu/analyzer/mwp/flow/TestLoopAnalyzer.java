package org.e2immu.analyzer.mwp.flow;

import org.e2immu.analyzer.mwp.common.cst.FunctionDefinition;
import org.e2immu.analyzer.mwp.flow.impl.LoopAnalyzerImpl;
import org.e2immu.analyzer.mwp.flow.semiring.Scalar;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.e2immu.analyzer.mwp.common.cst.CstFactory.*;
import static org.junit.jupiter.api.Assertions.*;

public class TestLoopAnalyzer extends CommonTest {

    private final LoopAnalyzer loopAnalyzer = new LoopAnalyzerImpl(configurationBuilder().build());

    @Test
    public void testPartialResult() {
        FunctionDefinition f = function("f", List.of("X0", "X1", "z"),
                whileLoop(less(var("X1"), constant(10)),
                        assign("X0", times(var("X1"), var("X0"))),
                        assign("X1", plus(var("X1"), var("X0"))),
                        assign("z", plus(var("z"), constant(1))),
                        assign("u", var("X0"))));
        LoopAnalyzer.Output output = loopAnalyzer.analyze(f);
        assertEquals(1, output.loops().size());
        LoopAnalyzer.LoopResult loop = output.loops().get(0);
        assertEquals("0", loop.index());
        assertFalse(loop.isBounded());
        assertFalse(loop.variableResult("X0").isBounded());
        assertFalse(loop.variableResult("X1").isBounded());
        // u depends on X0
        assertFalse(loop.variableResult("u").isBounded());

        VariableResult z = loop.variableResult("z");
        assertEquals(Scalar.MAX, z.label());
        assertEquals("z", z.bound().toString());
    }

    @Test
    public void testBoundedAndNestedLoops() {
        FunctionDefinition f = function("f", List.of("n", "m"),
                assign("x", constant(1)),
                countedLoop("i", "n",
                        assign("x", plus(var("x"), var("y"))),
                        whileLoop(less(var("j"), var("m")), increment("j"))));
        LoopAnalyzer.Output output = loopAnalyzer.analyze(f);
        assertEquals(2, output.loops().size());

        LoopAnalyzer.LoopResult outer = output.loops().get(0);
        assertEquals("1", outer.index());
        assertEquals(Scalar.POLY, outer.variableResult("x").label());

        LoopAnalyzer.LoopResult inner = output.loops().get(1);
        assertEquals("1.1.1", inner.index());
        assertTrue(inner.isBounded());
        assertEquals(Scalar.MAX, inner.variableResult("j").label());
        assertTrue(output.analyzerExceptions().isEmpty());
        assertTrue(output.skipped().isEmpty());
    }

    @Test
    public void testStrict() {
        FunctionDefinition f = function("f", List.of("n"),
                whileLoop(less(var("i"), var("n")), unsupported("switch", "switch (i) { }", "i"), increment("i")),
                countedLoop("j", "n", assign("x", plus(var("x"), var("j")))));

        LoopAnalyzer strict = new LoopAnalyzerImpl(configurationBuilder().setStrict(true).build());
        LoopAnalyzer.Output output = strict.analyze(f);
        assertEquals(List.of("0"), output.skipped());
        assertEquals(1, output.loops().size());
        assertEquals("1", output.loops().get(0).index());
        assertEquals(Scalar.POLY, output.loops().get(0).variableResult("x").label());

        LoopAnalyzer.Output lenient = loopAnalyzer.analyze(f);
        assertTrue(lenient.skipped().isEmpty());
        assertEquals(2, lenient.loops().size());
        assertEquals(Scalar.MAX, lenient.loops().get(0).variableResult("i").label());
    }
}
