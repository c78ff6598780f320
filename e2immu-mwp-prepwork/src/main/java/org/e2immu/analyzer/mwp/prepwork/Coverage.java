package org.e2immu.analyzer.mwp.prepwork;

import org.e2immu.analyzer.mwp.common.cst.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/*
Syntax check of a function body against the statements and expressions that the flow calculus covers.
The check does not change the body; modify() returns a copy with the unsupported statements left out.
 */
public class Coverage {
    private static final Logger LOGGER = LoggerFactory.getLogger(Coverage.class);

    public record Report(List<Diagnostic> unsupported) {
        public Report {
            unsupported = List.copyOf(unsupported);
        }

        public boolean full() {
            return unsupported.isEmpty();
        }

        public boolean isUnsupported(String index) {
            return unsupported.stream().anyMatch(d -> d.index().equals(index));
        }
    }

    private final Block body;
    private final Report report;

    public Coverage(Block body) {
        this.body = body;
        List<Diagnostic> diagnostics = new ArrayList<>();
        StatementIndex.walk(body, (index, statement) -> {
            String reason = unsupportedReason(statement);
            if (reason != null) diagnostics.add(new Diagnostic(index, statement.toString(), reason));
        });
        this.report = new Report(diagnostics);
        diagnostics.forEach(d -> LOGGER.warn("Unsupported syntax at {}", d));
    }

    public Report report() {
        return report;
    }

    /**
     * @return the message explaining why the statement, considered without its sub-statements,
     * is not covered; null when it is
     */
    public static String unsupportedReason(Statement statement) {
        if (statement instanceof UnsupportedStatement us) {
            return "unsupported statement kind " + us.kind();
        }
        if (statement instanceof Assignment assignment) {
            Assignment desugared = assignment.desugar();
            return reason(desugared.target(), desugared.value());
        }
        if (statement instanceof LocalVariableCreation lvc && lvc.hasInitializer()) {
            return reason(lvc.name(), lvc.initializer());
        }
        if (statement instanceof ExpressionAsStatement eas) {
            Expression e = eas.expression().unwrapCasts();
            if (e instanceof UnaryOperation u && u.operator().isIncrementOrDecrement()
                && !(u.operand().unwrapCasts() instanceof VariableExpression)) {
                return "increment of a composite expression";
            }
        }
        return null;
    }

    private static String reason(String target, Expression value) {
        RightHandSide rhs = ClassifyExpression.classify(target, value);
        return rhs instanceof RightHandSide.Unsupported u ? u.reason() : null;
    }

    /**
     * @return the body without the unsupported statements; the body itself when the coverage is full
     */
    public Block modify() {
        if (report.full()) return body;
        return (Block) strip(body);
    }

    private static Statement strip(Statement statement) {
        if (unsupportedReason(statement) != null) return null;
        if (statement instanceof Block b) {
            List<Statement> list = new ArrayList<>(b.size());
            for (Statement s : b.statements()) {
                Statement stripped = strip(s);
                if (stripped != null) list.add(stripped);
            }
            return new Block(list);
        }
        if (statement instanceof IfElseStatement ifElse) {
            return new IfElseStatement(ifElse.condition(), orEmpty(strip(ifElse.ifBranch())),
                    ifElse.elseBranch() == null ? null : orEmpty(strip(ifElse.elseBranch())));
        }
        if (statement instanceof WhileStatement ws) {
            return new WhileStatement(ws.condition(), orEmpty(strip(ws.body())));
        }
        if (statement instanceof DoStatement ds) {
            return new DoStatement(orEmpty(strip(ds.body())), ds.condition());
        }
        if (statement instanceof ForStatement fs) {
            return new ForStatement(fs.initializer() == null ? null : strip(fs.initializer()), fs.condition(),
                    fs.updater() == null ? null : strip(fs.updater()), orEmpty(strip(fs.body())));
        }
        return statement;
    }

    private static Statement orEmpty(Statement statement) {
        return statement == null ? Block.EMPTY : statement;
    }
}
