package org.e2immu.analyzer.mwp.flow;

import org.e2immu.analyzer.mwp.common.AnalyzerException;
import org.e2immu.analyzer.mwp.common.cst.FunctionDefinition;
import org.e2immu.analyzer.mwp.flow.semiring.Scalar;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.e2immu.analyzer.mwp.common.cst.CstFactory.*;
import static org.junit.jupiter.api.Assertions.*;

public class TestFunctionAnalyzer extends CommonTest {

    public TestFunctionAnalyzer() {
        super(true);
    }

    static FunctionDefinition infinite2C() {
        return function("infinite_2C", List.of("X0", "X1"),
                whileLoop(less(var("X1"), constant(10)),
                        assign("X0", times(var("X1"), var("X0"))),
                        assign("X1", plus(var("X1"), var("X0")))));
    }

    @Test
    public void testAdditive() {
        FunctionAnalyzer.Output output = analyze(function("f", List.of("x", "z"),
                assign("y", plus(var("x"), var("z")))));
        assertTrue(output.analyzerExceptions().isEmpty());
        assertTrue(output.diagnostics().isEmpty());
        FunctionResult.Bounded bounded = assertInstanceOf(FunctionResult.Bounded.class, output.result());
        assertEquals(List.of("x", "z", "y"), bounded.variables());
        assertEquals(1, bounded.indexCount());
        assertEquals("x' ≤ x, y' ≤ x+p(z), z' ≤ z", bounded.bound().toString());

        VariableResult y = bounded.variableResult("y");
        assertEquals(Scalar.WEAK, y.label());
        assertEquals("w(x,z)", y.bound().toString());
        assertTrue(y.choices().isValid(2));
        assertFalse(y.choices().isValid(0));
        assertEquals(Scalar.MAX, bounded.variableResult("x").label());
        assertEquals(Scalar.MAX, bounded.variableResult("z").label());
        assertEquals("f: bounded, x' ≤ x, y' ≤ x+p(z), z' ≤ z", bounded.toString());
    }

    @Test
    public void testConstant() {
        FunctionAnalyzer.Output output = analyze(function("f", List.of("x"), assign("x", constant(0))));
        FunctionResult.Bounded bounded = assertInstanceOf(FunctionResult.Bounded.class, output.result());
        VariableResult x = bounded.variableResult("x");
        assertEquals(Scalar.ZERO, x.label());
        assertEquals("0", x.bound().toString());
    }

    @Test
    public void testInfinite2C() {
        FunctionAnalyzer.Output output = analyze(infinite2C());
        FunctionResult.Unbounded unbounded = assertInstanceOf(FunctionResult.Unbounded.class, output.result());
        assertFalse(unbounded.isBounded());
        // stopped early: no relation, no flows
        assertNull(unbounded.relation());
        assertTrue(unbounded.infiniteFlows().isEmpty());
        assertEquals(2, unbounded.indexCount());
        assertEquals("infinite_2C: infinite", unbounded.toString());
    }

    @Test
    public void testInfinite2CToCompletion() {
        Analyzer.Configuration configuration = configurationBuilder().setStopOnInfinity(false).build();
        FunctionAnalyzer.Output output = analyze(infinite2C(), configuration, CalleeSummaries.NONE);
        FunctionResult.Unbounded unbounded = assertInstanceOf(FunctionResult.Unbounded.class, output.result());
        assertNotNull(unbounded.relation());
        assertTrue(unbounded.infiniteFlows().contains("X0 ➔ X0"), unbounded.infiniteFlows().toString());
    }

    @Test
    public void testIfElse() {
        FunctionDefinition f = function("f", List.of("x", "y"),
                ifThenElse(less(var("x"), var("y")), block(assign("x", var("y"))), block(assign("y", var("x")))));
        FunctionResult.Bounded bounded = assertInstanceOf(FunctionResult.Bounded.class, analyze(f).result());
        assertEquals(1, bounded.indexCount());
        assertTrue(bounded.choices().isValid(0));
        assertTrue(bounded.choices().isValid(1));
        // the bound holds for both branches
        assertEquals("x' ≤ max(x,y), y' ≤ max(x,y)", bounded.bound().toString());
        assertEquals(Scalar.MAX, bounded.variableResult("x").label());
        assertEquals("m.δ(0,0)", bounded.relation().get("y", "x").toString());

        Analyzer.Configuration plain = configurationBuilder().setBranchIndicators(false).build();
        FunctionResult.Bounded joined = assertInstanceOf(FunctionResult.Bounded.class,
                analyze(f, plain, CalleeSummaries.NONE).result());
        assertEquals(0, joined.indexCount());
        assertEquals("x' ≤ max(x,y), y' ≤ max(x,y)", joined.bound().toString());
    }

    @Test
    public void testIfElseSameTarget() {
        FunctionDefinition f = function("f", List.of("x", "y", "z"),
                ifThenElse(less(var("y"), var("z")), assign("x", var("y")), assign("x", var("z"))));
        FunctionResult.Bounded bounded = assertInstanceOf(FunctionResult.Bounded.class, analyze(f).result());
        assertEquals("m.δ(0,0)", bounded.relation().get("y", "x").toString());
        assertEquals("m.δ(1,0)", bounded.relation().get("z", "x").toString());
        assertFalse(bounded.choices().infinite());
        assertEquals(2L, bounded.choices().assignments().count());
        assertEquals("x' ≤ max(y,z), y' ≤ y, z' ≤ z", bounded.bound().toString());
        assertEquals(Scalar.MAX, bounded.variableResult("x").label());
        assertEquals("max(y,z)", bounded.variableResult("x").bound().toString());
    }

    @Test
    public void testLabelCoversBothBranches() {
        FunctionDefinition f = function("f", List.of("x", "y"),
                ifThenElse(less(var("x"), var("y")), assign("y", times(var("x"), var("x"))), assign("y", var("x"))));
        FunctionResult.Bounded bounded = assertInstanceOf(FunctionResult.Bounded.class, analyze(f).result());
        assertEquals("x' ≤ x, y' ≤ w(x)", bounded.bound().toString());
        VariableResult y = bounded.variableResult("y");
        assertEquals(Scalar.WEAK, y.label());
        assertEquals("w(x)", y.bound().toString());
    }

    @Test
    public void testAlternatingBranchesInLoop() {
        FunctionDefinition f = function("alternate", List.of("x", "y"),
                whileLoop(less(var("x"), var("y")),
                        ifThenElse(less(var("x"), var("y")), assign("x", var("y")),
                                assign("y", plus(var("x"), var("x"))))));
        assertInstanceOf(FunctionResult.Unbounded.class, analyze(f).result());

        Analyzer.Configuration plain = configurationBuilder().setBranchIndicators(false).build();
        assertInstanceOf(FunctionResult.Unbounded.class, analyze(f, plain, CalleeSummaries.NONE).result());

        // the same body without a conditional
        FunctionDefinition sequential = function("sequential", List.of("x", "y"),
                whileLoop(less(var("x"), var("y")),
                        assign("x", var("y")),
                        assign("y", plus(var("x"), var("x")))));
        assertInstanceOf(FunctionResult.Unbounded.class, analyze(sequential).result());
    }

    @Test
    public void testCallee() {
        FunctionDefinition f = function("f", List.of("a", "b"), assign("c", call("g", var("a"), var("b"))));
        CalleeSummaries summaries = CalleeSummaries.of(Map.of("g", List.of(Scalar.WEAK, Scalar.ZERO)));
        FunctionResult.Bounded bounded = assertInstanceOf(FunctionResult.Bounded.class,
                analyze(f, configurationBuilder().build(), summaries).result());
        VariableResult c = bounded.variableResult("c");
        assertEquals(Scalar.WEAK, c.label());
        assertEquals("w(a)", c.bound().toString());

        FunctionAnalyzer.Output unknown = analyze(f);
        assertEquals(1, unknown.diagnostics().size());
        assertEquals("no summary for function g", unknown.diagnostics().get(0).message());
        FunctionResult.Bounded identity = assertInstanceOf(FunctionResult.Bounded.class, unknown.result());
        assertEquals("c", identity.variableResult("c").bound().toString());
    }

    @Test
    public void testBoundedLoop() {
        FunctionDefinition f = function("f", List.of("n"),
                countedLoop("i", "n", assign("x", plus(var("x"), var("y")))));
        FunctionResult.Bounded bounded = assertInstanceOf(FunctionResult.Bounded.class, analyze(f).result());
        VariableResult x = bounded.variableResult("x");
        assertEquals(Scalar.POLY, x.label());
        assertEquals(List.of("x"), x.bound().m());
        assertTrue(x.bound().p().containsAll(List.of("y", "n")));
        assertArrayEquals(new int[]{0}, x.choices().first());
        assertEquals(Scalar.MAX, bounded.variableResult("y").label());
        assertEquals(Scalar.MAX, bounded.variableResult("i").label());
    }

    @Test
    public void testUnsupportedStatement() {
        FunctionDefinition f = function("f", List.of("a"),
                assign("b", var("a")),
                unsupported("switch", "switch (a) { }", "a"),
                assign("c", plus(var("a"), var("b"))));
        FunctionAnalyzer.Output output = analyze(f);
        assertEquals(1, output.diagnostics().size());
        assertEquals("1", output.diagnostics().get(0).index());
        assertTrue(output.result().isBounded());
    }

    @Test
    public void testDivergence() {
        Analyzer.Configuration configuration = configurationBuilder().setMaxFixpointIterations(1).build();
        FunctionAnalyzer.Output output = analyze(infinite2C(), configuration, CalleeSummaries.NONE);
        assertNull(output.result());
        assertEquals(1, output.analyzerExceptions().size());
        AnalyzerException ae = output.analyzerExceptions().get(0);
        assertEquals("infinite_2C", ae.getFunctionName());
        assertInstanceOf(FixpointDivergenceException.class, ae.getCause());

        Analyzer.Configuration throwing = configurationBuilder().setMaxFixpointIterations(1).setStoreErrors(false)
                .build();
        assertThrows(FixpointDivergenceException.class,
                () -> analyze(infinite2C(), throwing, CalleeSummaries.NONE));
    }
}
