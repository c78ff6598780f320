package org.e2immu.analyzer.mwp.common.cst;

import java.util.List;
import java.util.stream.Stream;

public sealed interface Statement permits Assignment, LocalVariableCreation, ExpressionAsStatement, Block,
        IfElseStatement, WhileStatement, DoStatement, ForStatement, ReturnStatement, BreakStatement,
        ContinueStatement, EmptyStatement, UnsupportedStatement {

    /**
     * @return the blocks or statements nested directly in this statement, in source order; for an if-else
     * statement, the else part is the second element (and absent when there is no else)
     */
    default List<Statement> subStatements() {
        return List.of();
    }

    /**
     * @return the expressions evaluated by this statement itself, excluding those of sub-statements
     */
    default List<Expression> expressions() {
        return List.of();
    }

    /**
     * @return the variables assigned by this statement itself, excluding those of sub-statements
     */
    default Stream<String> assignedVariables() {
        return Stream.empty();
    }

    default boolean isLoop() {
        return false;
    }

    /**
     * @return this statement and all statements nested in it, depth first
     */
    default Stream<Statement> recursively() {
        return Stream.concat(Stream.of(this), subStatements().stream().flatMap(Statement::recursively));
    }

    default Stream<String> assignedVariablesRecursively() {
        return recursively().flatMap(Statement::assignedVariables);
    }

    default Stream<String> variableNamesRecursively() {
        return recursively().flatMap(s -> Stream.concat(s.assignedVariables(),
                s.expressions().stream().flatMap(Expression::variableNames)));
    }
}
