package org.e2immu.analyzer.mwp.flow.impl;

import org.e2immu.analyzer.mwp.common.cst.*;
import org.e2immu.analyzer.mwp.flow.Analyzer;
import org.e2immu.analyzer.mwp.flow.CalleeSummaries;
import org.e2immu.analyzer.mwp.flow.Relation;
import org.e2immu.analyzer.mwp.flow.choice.ChoiceRegistry;
import org.e2immu.analyzer.mwp.flow.choice.DeltaGraph;
import org.e2immu.analyzer.mwp.flow.semiring.Delta;
import org.e2immu.analyzer.mwp.flow.semiring.Monomial;
import org.e2immu.analyzer.mwp.flow.semiring.Polynomial;
import org.e2immu.analyzer.mwp.flow.semiring.Scalar;
import org.e2immu.analyzer.mwp.prepwork.ClassifyExpression;
import org.e2immu.analyzer.mwp.prepwork.Diagnostic;
import org.e2immu.analyzer.mwp.prepwork.LoopCompatibility;
import org.e2immu.analyzer.mwp.prepwork.RightHandSide;
import org.e2immu.analyzer.mwp.prepwork.StatementIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/*
Compiles statements into relations, bottom-up. Every statement is compiled into a relation over the variables
it touches; sequences compose, branches join, loops take a fixpoint followed by a correction.

The compiler is the sole writer of the choice registry and the delta graph of one function analysis.
Once the delta graph contains the empty path, and the configuration says so, compilation stops: the relation
returned is then not the final relation of the function.

Branch indicators are only added outside loop bodies. Inside a loop, successive iterations may take different
branches; qualified branches would cancel each other in the fixpoint.
 */
public class StatementCompiler {
    private static final Logger LOGGER = LoggerFactory.getLogger(StatementCompiler.class);

    private static final Relation NO_OP = RelationImpl.identity(List.of());
    private static final Set<String> NO_OP_CALLS = Set.of("assert", "assume");

    private final Analyzer.Configuration configuration;
    private final CalleeSummaries calleeSummaries;
    private final ChoiceRegistry registry;
    private final DeltaGraph deltaGraph;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private int loopDepth;

    public StatementCompiler(Analyzer.Configuration configuration,
                             CalleeSummaries calleeSummaries,
                             ChoiceRegistry registry,
                             DeltaGraph deltaGraph) {
        this.configuration = configuration;
        this.calleeSummaries = calleeSummaries;
        this.registry = registry;
        this.deltaGraph = deltaGraph;
    }

    public List<Diagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }

    /**
     * @return true when compilation has stopped because every choice leads to unbounded growth
     */
    public boolean exit() {
        return configuration.stopOnInfinity() && deltaGraph.isFull();
    }

    public Relation compileFunction(List<String> variables, Block body) {
        Relation relation = RelationImpl.identity(variables);
        for (int i = 0; i < body.size(); i++) {
            LOGGER.debug("Compute relation of statement {} of {}", i + 1, body.size());
            relation = relation.compose(compile(StatementIndex.top(i), body.statements().get(i)));
            if (exit()) {
                LOGGER.debug("Delta graph full: infinite, exit now");
                break;
            }
        }
        return relation;
    }

    public Relation compile(String index, Statement statement) {
        if (statement instanceof Block block) {
            return compileSubBlock(index, 0, block);
        }
        if (statement instanceof Assignment assignment) {
            Assignment desugared = assignment.desugar();
            return assignment(index, statement, desugared.target(), desugared.value());
        }
        if (statement instanceof LocalVariableCreation lvc) {
            return lvc.hasInitializer() ? assignment(index, statement, lvc.name(), lvc.initializer()) : NO_OP;
        }
        if (statement instanceof ExpressionAsStatement eas) {
            return expressionAsStatement(index, eas);
        }
        if (statement instanceof IfElseStatement ifElse) {
            return ifElse(index, ifElse);
        }
        if (statement instanceof WhileStatement ws) {
            return whileLoop(index, ws.body());
        }
        if (statement instanceof DoStatement ds) {
            return whileLoop(index, ds.body());
        }
        if (statement instanceof ForStatement fs) {
            return forLoop(index, fs);
        }
        if (statement instanceof UnsupportedStatement us) {
            return unsupported(index, statement, "unsupported statement kind " + us.kind());
        }
        // return, break, continue, empty statement
        return NO_OP;
    }

    private Relation compileSubBlock(String index, int blockNumber, Statement statement) {
        if (!(statement instanceof Block block)) {
            return compile(StatementIndex.sub(index, blockNumber, 0), statement);
        }
        Relation relation = NO_OP;
        for (int i = 0; i < block.size(); i++) {
            relation = relation.compose(compile(StatementIndex.sub(index, blockNumber, i), block.statements().get(i)));
            if (exit()) break;
        }
        return relation;
    }

    private Relation expressionAsStatement(String index, ExpressionAsStatement eas) {
        Expression expression = eas.expression().unwrapCasts();
        if (expression instanceof UnaryOperation u && u.operator().isIncrementOrDecrement()) {
            if (u.operand().unwrapCasts() instanceof VariableExpression ve) {
                // y++ is y = y + 1
                return vector(ve.name(), List.of(ve.name()), linearCases());
            }
            return unsupported(index, eas, "increment of a composite expression");
        }
        // the value of other expressions, calls included, is discarded
        return NO_OP;
    }

    private Relation assignment(String index, Statement statement, String target, Expression value) {
        RightHandSide rhs = ClassifyExpression.classify(target, value);
        LOGGER.debug("Assignment to {}: {}", target, rhs);
        if (rhs instanceof RightHandSide.NoOp) {
            return NO_OP;
        }
        if (rhs instanceof RightHandSide.Constant) {
            return RelationImpl.zero(List.of(target));
        }
        if (rhs instanceof RightHandSide.Copy copy) {
            return new RelationImpl.Builder(List.of(target, copy.source()))
                    .setColumn(target, Map.of(copy.source(), Polynomial.M))
                    .build();
        }
        if (rhs instanceof RightHandSide.Linear linear) {
            return vector(target, List.of(linear.variable()), linearCases());
        }
        if (rhs instanceof RightHandSide.Additive additive) {
            return vector(target, additive.occurrences(), additiveCases(additive.occurrences().size()));
        }
        if (rhs instanceof RightHandSide.Multiplicative mult) {
            int k = mult.occurrences().size();
            return vector(target, mult.occurrences(), uniformCases(Math.max(3, k + 1), k, Scalar.WEAK));
        }
        if (rhs instanceof RightHandSide.Call call) {
            return call(index, statement, target, call);
        }
        return unsupported(index, statement, ((RightHandSide.Unsupported) rhs).reason());
    }

    private static Scalar[][] linearCases() {
        return uniformCases(3, 1, Scalar.MAX);
    }

    private static Scalar[][] uniformCases(int cases, int occurrences, Scalar scalar) {
        Scalar[][] labels = new Scalar[cases][occurrences];
        for (Scalar[] row : labels) Arrays.fill(row, scalar);
        return labels;
    }

    /*
    k occurrences, k+1 cases: in case c < k, occurrence c has m and all others p; in case k, all have w
     */
    private static Scalar[][] additiveCases(int k) {
        Scalar[][] labels = new Scalar[k + 1][k];
        for (int c = 0; c < k; c++) {
            for (int o = 0; o < k; o++) labels[c][o] = c == o ? Scalar.MAX : Scalar.POLY;
        }
        Arrays.fill(labels[k], Scalar.WEAK);
        return labels;
    }

    /*
    allocate a fresh operation index, one case per row of the label table; a variable occurring more than once
    gets the sum of the labels of its occurrences
     */
    private Relation vector(String target, List<String> occurrences, Scalar[][] labels) {
        int operation = registry.newOperation(labels.length);
        Map<String, List<Monomial>> monomials = new LinkedHashMap<>();
        for (int c = 0; c < labels.length; c++) {
            Map<String, Scalar> perVariable = new LinkedHashMap<>();
            for (int o = 0; o < occurrences.size(); o++) {
                perVariable.merge(occurrences.get(o), labels[c][o], Scalar::sum);
            }
            Delta delta = new Delta(c, operation);
            perVariable.forEach((v, s) -> monomials.computeIfAbsent(v, k -> new ArrayList<>())
                    .add(Monomial.of(s, delta)));
        }
        List<String> variables = new ArrayList<>();
        variables.add(target);
        for (String v : monomials.keySet()) {
            if (!v.equals(target)) variables.add(v);
        }
        Map<String, Polynomial> column = new HashMap<>();
        monomials.forEach((v, list) -> column.put(v, Polynomial.of(list)));
        return new RelationImpl.Builder(variables).setColumn(target, column).build();
    }

    private Relation call(String index, Statement statement, String target, RightHandSide.Call call) {
        if (NO_OP_CALLS.contains(call.function())) return NO_OP;
        CalleeSummaries.Summary summary = calleeSummaries.summary(call.function());
        if (summary == null) {
            return unsupported(index, statement, "no summary for function " + call.function());
        }
        if (summary.parameterLabels().size() != call.arguments().size()) {
            return unsupported(index, statement, "argument count mismatch calling " + call.function());
        }
        Map<String, Scalar> labels = new LinkedHashMap<>();
        for (int i = 0; i < call.arguments().size(); i++) {
            String argument = call.arguments().get(i);
            Scalar label = summary.parameterLabels().get(i);
            if (argument != null && !label.isZero()) labels.merge(argument, label, Scalar::sum);
        }
        List<String> variables = new ArrayList<>();
        variables.add(target);
        labels.keySet().stream().filter(v -> !v.equals(target)).forEach(variables::add);
        Map<String, Polynomial> column = new HashMap<>();
        labels.forEach((v, s) -> column.put(v, Polynomial.of(s)));
        return new RelationImpl.Builder(variables).setColumn(target, column).build();
    }

    private Relation unsupported(String index, Statement statement, String reason) {
        Diagnostic diagnostic = new Diagnostic(index, statement.toString(), reason);
        LOGGER.warn("Unsupported syntax, treated as no-op: {}", diagnostic);
        diagnostics.add(diagnostic);
        return NO_OP;
    }

    private Relation ifElse(String index, IfElseStatement ifElse) {
        Relation ifRelation = compileSubBlock(index, 0, ifElse.ifBranch());
        if (exit()) return ifRelation;
        Relation elseRelation = ifElse.hasElse() ? compileSubBlock(index, 1, ifElse.elseBranch()) : NO_OP;
        if (exit()) return elseRelation;
        if (!configuration.branchIndicators() || loopDepth > 0) {
            return ifRelation.join(elseRelation);
        }
        List<String> union = new ArrayList<>(ifRelation.variables());
        elseRelation.variables().stream().filter(v -> !union.contains(v)).forEach(union::add);
        int operation = registry.newBranch();
        Relation taken = ifRelation.homogenize(union).qualify(new Delta(0, operation));
        Relation notTaken = elseRelation.homogenize(union).qualify(new Delta(1, operation));
        return taken.join(notTaken);
    }

    private Relation whileLoop(String index, Statement body) {
        Relation bodyRelation = loopBody(index, 0, body, null);
        if (exit()) return bodyRelation;
        return whileCorrection(bodyRelation);
    }

    private Relation whileCorrection(Relation bodyRelation) {
        Relation fixpoint = bodyRelation.fixpoint(configuration.maxFixpointIterations());
        Relation corrected = fixpoint.whileCorrection(deltaGraph);
        deltaGraph.fusion();
        return corrected;
    }

    private Relation forLoop(String index, ForStatement fs) {
        int bodyBlock = fs.initializer() == null ? 0 : 1;
        Optional<String> bound = LoopCompatibility.boundVariable(fs);
        if (bound.isPresent()) {
            String x = bound.get();
            LOGGER.debug("Loop bounded by {}", x);
            Relation bodyRelation = loopBody(index, bodyBlock, fs.body(), null);
            if (exit()) return bodyRelation;
            Relation fixpoint = bodyRelation.fixpoint(configuration.maxFixpointIterations());
            Relation corrected = fixpoint.loopCorrection(x, deltaGraph);
            deltaGraph.fusion();
            return corrected;
        }
        // not a bounded loop: init; while(condition) { body; update; }
        Relation init = fs.initializer() == null ? NO_OP : compile(StatementIndex.sub(index, 0, 0), fs.initializer());
        if (exit()) return init;
        Relation bodyRelation = loopBody(index, bodyBlock, fs.body(), fs.updater());
        if (exit()) return bodyRelation;
        return init.compose(whileCorrection(bodyRelation));
    }

    private Relation loopBody(String index, int bodyBlock, Statement body, Statement updater) {
        loopDepth++;
        try {
            Relation bodyRelation = compileSubBlock(index, bodyBlock, body);
            if (updater == null || exit()) return bodyRelation;
            return bodyRelation.compose(compile(StatementIndex.sub(index, bodyBlock + 1, 0), updater));
        } finally {
            loopDepth--;
        }
    }
}
