package org.e2immu.analyzer.mwp.prepwork;

import org.e2immu.analyzer.mwp.common.cst.BinaryOperator;
import org.e2immu.analyzer.mwp.common.cst.Cast;
import org.e2immu.analyzer.mwp.common.cst.UnaryOperator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.e2immu.analyzer.mwp.common.cst.CstFactory.*;
import static org.junit.jupiter.api.Assertions.*;

public class TestClassifyExpression {

    @Test
    public void testLeaf() {
        assertInstanceOf(RightHandSide.Constant.class, ClassifyExpression.classify("x", constant(3)));
        assertEquals(new RightHandSide.Copy("y"), ClassifyExpression.classify("x", var("y")));
        assertInstanceOf(RightHandSide.NoOp.class, ClassifyExpression.classify("x", var("x")));
        assertEquals(new RightHandSide.Copy("y"),
                ClassifyExpression.classify("x", new Cast("long", var("y"))));
    }

    @Test
    public void testUnary() {
        assertEquals(new RightHandSide.Linear("y"),
                ClassifyExpression.classify("x", unary(UnaryOperator.POST_INCREMENT, var("y"))));
        assertEquals(new RightHandSide.Linear("y"),
                ClassifyExpression.classify("x", unary(UnaryOperator.MINUS, var("y"))));
        assertEquals(new RightHandSide.Copy("y"),
                ClassifyExpression.classify("x", unary(UnaryOperator.PLUS, var("y"))));
        assertInstanceOf(RightHandSide.Constant.class,
                ClassifyExpression.classify("x", unary(UnaryOperator.NOT, var("y"))));
        assertInstanceOf(RightHandSide.Unsupported.class,
                ClassifyExpression.classify("x", unary(UnaryOperator.ADDRESS_OF, var("y"))));
    }

    @Test
    public void testBinary() {
        assertEquals(new RightHandSide.Additive(List.of("y", "z")),
                ClassifyExpression.classify("x", plus(var("y"), var("z"))));
        assertEquals(new RightHandSide.Additive(List.of("x", "x")),
                ClassifyExpression.classify("x", minus(var("x"), var("x"))));
        assertEquals(new RightHandSide.Linear("y"),
                ClassifyExpression.classify("x", times(constant(2), var("y"))));
        assertEquals(new RightHandSide.Multiplicative(List.of("y", "z")),
                ClassifyExpression.classify("x", times(var("y"), var("z"))));
        assertEquals(new RightHandSide.Additive(List.of("a", "b", "c")),
                ClassifyExpression.classify("x", nary(BinaryOperator.PLUS, var("a"), var("b"), var("c"))));
        assertInstanceOf(RightHandSide.Constant.class, ClassifyExpression.classify("x", less(var("y"), var("z"))));
        assertInstanceOf(RightHandSide.Constant.class, ClassifyExpression.classify("x", plus(constant(1),
                constant(2))));
    }

    @Test
    public void testUnsupported() {
        RightHandSide rhs = ClassifyExpression.classify("x", binary(BinaryOperator.DIVIDE, var("y"), var("z")));
        assertFalse(rhs.isSupported());
        assertEquals("binary operator /", ((RightHandSide.Unsupported) rhs).reason());
        assertFalse(ClassifyExpression.classify("x", plus(var("y"), times(var("y"), var("z")))).isSupported());
    }

    @Test
    public void testCall() {
        assertEquals(new RightHandSide.Call("f", java.util.Arrays.asList("y", null)),
                ClassifyExpression.classify("x", call("f", var("y"), constant(1))));
    }
}
