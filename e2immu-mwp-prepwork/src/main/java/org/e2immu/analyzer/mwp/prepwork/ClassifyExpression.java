package org.e2immu.analyzer.mwp.prepwork;

import org.e2immu.analyzer.mwp.common.cst.*;

import java.util.ArrayList;
import java.util.List;

/*
The fixed classification table of the flow calculus, by operator shape.

LEAF:    constant -> Constant; variable -> Copy (NoOp when it is the target)
UNARY:   ++ -- on a variable -> Linear; - -> Linear; + -> Copy; ! sizeof -> Constant; others unsupported
BINARY, NARY:
         + - * with constant or variable operands -> Constant, Linear, Additive or Multiplicative, depending on
         the number of variable occurrences; comparisons and logical operators -> Constant; others unsupported
NARY (call): f(args) with constant or variable arguments -> Call
Casts are transparent.
 */
public class ClassifyExpression {

    private ClassifyExpression() {
    }

    public static RightHandSide classify(String target, Expression value) {
        Expression e = value.unwrapCasts();
        return switch (e.shape()) {
            case LEAF -> leaf(target, e);
            case UNARY -> unary(target, (UnaryOperation) e);
            case BINARY, NARY -> {
                if (e instanceof FunctionCall call) yield call(call);
                BinaryOperator operator = e instanceof BinaryOperation bo ? bo.operator()
                        : ((NaryOperation) e).operator();
                yield operation(e, operator);
            }
        };
    }

    private static RightHandSide leaf(String target, Expression e) {
        if (e instanceof VariableExpression ve) {
            return ve.name().equals(target) ? new RightHandSide.NoOp() : new RightHandSide.Copy(ve.name());
        }
        return new RightHandSide.Constant();
    }

    private static RightHandSide unary(String target, UnaryOperation unary) {
        Expression operand = unary.operand().unwrapCasts();
        if (operand instanceof Constant) {
            return new RightHandSide.Constant();
        }
        if (!(operand instanceof VariableExpression ve)) {
            return new RightHandSide.Unsupported(unary, "unary operator on a composite expression");
        }
        return switch (unary.operator()) {
            // the +1/-1 and the constant factor -1 are irrelevant
            case PRE_INCREMENT, POST_INCREMENT, PRE_DECREMENT, POST_DECREMENT, MINUS ->
                    new RightHandSide.Linear(ve.name());
            case PLUS -> ve.name().equals(target) ? new RightHandSide.NoOp() : new RightHandSide.Copy(ve.name());
            // the value of !y is 0 or 1; sizeof is a constant
            case NOT, SIZEOF -> new RightHandSide.Constant();
            case ADDRESS_OF, DEREFERENCE, BITWISE_NOT ->
                    new RightHandSide.Unsupported(unary, "unary operator " + unary.operator().symbol.trim());
        };
    }

    private static RightHandSide operation(Expression e, BinaryOperator operator) {
        if (operator.kind == BinaryOperator.Kind.COMPARISON) {
            return new RightHandSide.Constant();
        }
        if (!operator.isArithmetic()) {
            return new RightHandSide.Unsupported(e, "binary operator " + operator.symbol);
        }
        List<String> occurrences = new ArrayList<>();
        for (Expression operand : e.operands()) {
            Expression o = operand.unwrapCasts();
            if (o instanceof VariableExpression ve) {
                occurrences.add(ve.name());
            } else if (!(o instanceof Constant)) {
                return new RightHandSide.Unsupported(e, "nested expression " + operand);
            }
        }
        if (occurrences.isEmpty()) return new RightHandSide.Constant();
        if (occurrences.size() == 1) return new RightHandSide.Linear(occurrences.get(0));
        if (operator.kind == BinaryOperator.Kind.ADDITIVE) return new RightHandSide.Additive(occurrences);
        return new RightHandSide.Multiplicative(occurrences);
    }

    private static RightHandSide call(FunctionCall call) {
        List<String> arguments = new ArrayList<>(call.arguments().size());
        for (Expression argument : call.arguments()) {
            Expression a = argument.unwrapCasts();
            if (a instanceof VariableExpression ve) {
                arguments.add(ve.name());
            } else if (a instanceof Constant) {
                arguments.add(null);
            } else {
                return new RightHandSide.Unsupported(call, "composite argument " + argument);
            }
        }
        return new RightHandSide.Call(call.name(), arguments);
    }
}
