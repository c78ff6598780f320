package org.e2immu.analyzer.mwp.prepwork;

import org.e2immu.analyzer.mwp.common.cst.*;

import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/*
A for-statement is a bounded loop 'loop X { body }' when it has the shape

    for (i = c; i < X; i++) body        (also: i <= X, X > i, X >= i, ++i, i += 1, int i = c)

where X is a variable, and neither i nor X is assigned in the body. The counter is then bounded by X, and
the body is iterated at most X times.
 */
public class LoopCompatibility {

    private LoopCompatibility() {
    }

    /**
     * @return the bound variable X when the for-statement is a bounded loop, empty otherwise
     */
    public static Optional<String> boundVariable(ForStatement forStatement) {
        String counter = initializedCounter(forStatement.initializer());
        if (counter == null || forStatement.condition() == null) return Optional.empty();
        String bound = bound(counter, forStatement.condition().unwrapCasts());
        if (bound == null || bound.equals(counter)) return Optional.empty();
        if (!isIncrementOf(counter, forStatement.updater())) return Optional.empty();
        Set<String> assignedInBody = forStatement.body().assignedVariablesRecursively().collect(Collectors.toSet());
        if (assignedInBody.contains(counter) || assignedInBody.contains(bound)) return Optional.empty();
        return Optional.of(bound);
    }

    private static String initializedCounter(Statement initializer) {
        if (initializer instanceof Assignment a && a.operator() == AssignmentOperator.ASSIGN
            && a.value().unwrapCasts() instanceof Constant) {
            return a.target();
        }
        if (initializer instanceof LocalVariableCreation lvc && lvc.hasInitializer()
            && lvc.initializer().unwrapCasts() instanceof Constant) {
            return lvc.name();
        }
        return null;
    }

    private static String bound(String counter, Expression condition) {
        if (!(condition instanceof BinaryOperation bo)) return null;
        Expression left = bo.left().unwrapCasts();
        Expression right = bo.right().unwrapCasts();
        return switch (bo.operator()) {
            case LESS, LESS_EQUALS -> isVariable(left, counter) ? variableName(right) : null;
            case GREATER, GREATER_EQUALS -> isVariable(right, counter) ? variableName(left) : null;
            default -> null;
        };
    }

    private static boolean isIncrementOf(String counter, Statement updater) {
        if (updater instanceof ExpressionAsStatement eas && eas.expression() instanceof UnaryOperation u) {
            return u.operator().isIncrement() && isVariable(u.operand().unwrapCasts(), counter);
        }
        if (updater instanceof Assignment a && a.operator() == AssignmentOperator.PLUS_ASSIGN) {
            return a.target().equals(counter) && a.value().unwrapCasts() instanceof Constant;
        }
        return false;
    }

    private static boolean isVariable(Expression expression, String name) {
        return expression instanceof VariableExpression ve && ve.name().equals(name);
    }

    private static String variableName(Expression expression) {
        return expression instanceof VariableExpression ve ? ve.name() : null;
    }
}
