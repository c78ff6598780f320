package org.e2immu.analyzer.mwp.flow.impl;

import org.e2immu.analyzer.mwp.common.AnalyzerException;
import org.e2immu.analyzer.mwp.flow.CalleeSummaries;
import org.e2immu.analyzer.mwp.flow.FunctionAnalyzer;
import org.e2immu.analyzer.mwp.flow.FunctionResult;
import org.e2immu.analyzer.mwp.flow.Relation;
import org.e2immu.analyzer.mwp.flow.VariableResult;
import org.e2immu.analyzer.mwp.flow.bound.Bound;
import org.e2immu.analyzer.mwp.flow.choice.ChoiceRegistry;
import org.e2immu.analyzer.mwp.flow.choice.Choices;
import org.e2immu.analyzer.mwp.flow.choice.DeltaGraph;
import org.e2immu.analyzer.mwp.prepwork.Diagnostic;
import org.e2immu.analyzer.mwp.prepwork.PreparedFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public class FunctionAnalyzerImpl extends CommonAnalyzerImpl implements FunctionAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(FunctionAnalyzerImpl.class);

    public FunctionAnalyzerImpl(Configuration configuration) {
        this(configuration, CalleeSummaries.NONE);
    }

    public FunctionAnalyzerImpl(Configuration configuration, CalleeSummaries calleeSummaries) {
        super(configuration, calleeSummaries);
    }

    private record OutputImpl(FunctionResult result,
                              List<Diagnostic> diagnostics,
                              List<AnalyzerException> analyzerExceptions) implements Output {
    }

    @Override
    public Output analyze(PreparedFunction preparedFunction) {
        String name = preparedFunction.name();
        List<Diagnostic> diagnostics = new ArrayList<>(preparedFunction.diagnostics());
        try {
            LOGGER.info("Analyzing {}", name);
            ChoiceRegistry registry = new ChoiceRegistry();
            DeltaGraph deltaGraph = new DeltaGraph(registry);
            StatementCompiler compiler = new StatementCompiler(configuration, calleeSummaries, registry, deltaGraph);
            Relation relation = compiler.compileFunction(preparedFunction.variables(), preparedFunction.body());
            diagnostics.addAll(compiler.diagnostics());
            FunctionResult result = result(name, preparedFunction.variables(), relation, registry, deltaGraph,
                    compiler.exit());
            LOGGER.info("Result of {}: {}", name, result);
            return new OutputImpl(result, List.copyOf(diagnostics), List.of());
        } catch (RuntimeException | AssertionError problem) {
            LOGGER.error("Caught exception/error analyzing {}: {}", name, problem.getMessage());
            if (configuration.storeErrors()) {
                AnalyzerException ae = problem instanceof AnalyzerException a ? a
                        : new AnalyzerException(name, problem);
                return new OutputImpl(null, List.copyOf(diagnostics), List.of(ae));
            }
            throw problem;
        }
    }

    private FunctionResult result(String name,
                                  List<String> variables,
                                  Relation relation,
                                  ChoiceRegistry registry,
                                  DeltaGraph deltaGraph,
                                  boolean stoppedEarly) {
        if (deltaGraph.isFull()) {
            LOGGER.debug("{}: infinite by delta graph", name);
            return unbounded(name, variables, relation, registry, stoppedEarly);
        }
        // labels and bounds must hold whichever branch of a conditional runs
        Relation unconditional = relation.withoutIndicators(registry.branches());
        Choices choices = ResultClassifier.choices(unconditional, registry);
        if (choices.infinite()) {
            LOGGER.debug("{}: no admissible choice", name);
            return unbounded(name, variables, relation, registry, stoppedEarly);
        }
        Bound bound = Bound.calculate(unconditional.variables(), unconditional.applyChoice(choices.first()));
        return new FunctionResult.Bounded(name, relation, registry.size(), choices, bound,
                ResultClassifier.classifyAll(unconditional, registry));
    }

    /*
    when the analysis stopped early, the relation is incomplete, and it is not handed out
     */
    private static FunctionResult unbounded(String name,
                                            List<String> variables,
                                            Relation relation,
                                            ChoiceRegistry registry,
                                            boolean stoppedEarly) {
        if (stoppedEarly) {
            return new FunctionResult.Unbounded(name, variables, registry.size(), null, List.of());
        }
        Relation unconditional = relation.withoutIndicators(registry.branches());
        List<String> failing = ResultClassifier.classifyAll(unconditional, registry).stream()
                .filter(vr -> !vr.isBounded())
                .map(VariableResult::variable)
                .toList();
        return new FunctionResult.Unbounded(name, variables, registry.size(), relation,
                relation.infiniteFlows(failing));
    }
}
