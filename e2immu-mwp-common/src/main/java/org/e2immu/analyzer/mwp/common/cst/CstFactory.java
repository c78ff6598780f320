package org.e2immu.analyzer.mwp.common.cst;

import java.util.Arrays;
import java.util.List;

/**
 * Short-hand constructors for building syntax trees in Java code, mostly used by front ends and tests.
 */
public final class CstFactory {

    private CstFactory() {
    }

    public static VariableExpression var(String name) {
        return new VariableExpression(name);
    }

    public static Constant constant(int value) {
        return new Constant(Integer.toString(value));
    }

    public static BinaryOperation plus(Expression left, Expression right) {
        return new BinaryOperation(BinaryOperator.PLUS, left, right);
    }

    public static BinaryOperation minus(Expression left, Expression right) {
        return new BinaryOperation(BinaryOperator.MINUS, left, right);
    }

    public static BinaryOperation times(Expression left, Expression right) {
        return new BinaryOperation(BinaryOperator.TIMES, left, right);
    }

    public static BinaryOperation binary(BinaryOperator operator, Expression left, Expression right) {
        return new BinaryOperation(operator, left, right);
    }

    public static NaryOperation nary(BinaryOperator operator, Expression... operands) {
        return new NaryOperation(operator, List.of(operands));
    }

    public static UnaryOperation unary(UnaryOperator operator, Expression operand) {
        return new UnaryOperation(operator, operand);
    }

    public static BinaryOperation less(Expression left, Expression right) {
        return new BinaryOperation(BinaryOperator.LESS, left, right);
    }

    public static BinaryOperation greater(Expression left, Expression right) {
        return new BinaryOperation(BinaryOperator.GREATER, left, right);
    }

    public static FunctionCall call(String name, Expression... arguments) {
        return new FunctionCall(name, List.of(arguments));
    }

    public static Assignment assign(String target, Expression value) {
        return new Assignment(target, value);
    }

    public static Assignment assign(String target, AssignmentOperator operator, Expression value) {
        return new Assignment(target, operator, value);
    }

    public static LocalVariableCreation declare(String name) {
        return new LocalVariableCreation("int", name, null);
    }

    public static LocalVariableCreation declare(String name, Expression initializer) {
        return new LocalVariableCreation("int", name, initializer);
    }

    public static ExpressionAsStatement increment(String name) {
        return new ExpressionAsStatement(new UnaryOperation(UnaryOperator.POST_INCREMENT, var(name)));
    }

    public static ExpressionAsStatement statement(Expression expression) {
        return new ExpressionAsStatement(expression);
    }

    public static Block block(Statement... statements) {
        return new Block(List.of(statements));
    }

    public static IfElseStatement ifThen(Expression condition, Statement ifBranch) {
        return new IfElseStatement(condition, ifBranch, null);
    }

    public static IfElseStatement ifThenElse(Expression condition, Statement ifBranch, Statement elseBranch) {
        return new IfElseStatement(condition, ifBranch, elseBranch);
    }

    public static WhileStatement whileLoop(Expression condition, Statement... body) {
        return new WhileStatement(condition, block(body));
    }

    public static DoStatement doWhile(Expression condition, Statement... body) {
        return new DoStatement(block(body), condition);
    }

    /**
     * @return the loop {@code for(counter = 0; counter < bound; counter++) { body }}
     */
    public static ForStatement countedLoop(String counter, String bound, Statement... body) {
        return new ForStatement(assign(counter, constant(0)), less(var(counter), var(bound)), increment(counter),
                block(body));
    }

    public static ReturnStatement returnStatement(Expression value) {
        return new ReturnStatement(value);
    }

    public static UnsupportedStatement unsupported(String kind, String source, String... variables) {
        return new UnsupportedStatement(kind, source, Arrays.asList(variables));
    }

    public static FunctionDefinition function(String name, List<String> parameters, Statement... body) {
        return new FunctionDefinition(name, parameters.stream().map(VariableDeclaration::parameter).toList(),
                block(body));
    }
}
