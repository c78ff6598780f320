package org.e2immu.analyzer.mwp.flow.impl;

import org.e2immu.analyzer.mwp.common.AnalyzerException;
import org.e2immu.analyzer.mwp.common.cst.Block;
import org.e2immu.analyzer.mwp.common.cst.FunctionDefinition;
import org.e2immu.analyzer.mwp.flow.CalleeSummaries;
import org.e2immu.analyzer.mwp.flow.LoopAnalyzer;
import org.e2immu.analyzer.mwp.flow.Relation;
import org.e2immu.analyzer.mwp.flow.VariableResult;
import org.e2immu.analyzer.mwp.flow.choice.ChoiceRegistry;
import org.e2immu.analyzer.mwp.flow.choice.DeltaGraph;
import org.e2immu.analyzer.mwp.prepwork.Coverage;
import org.e2immu.analyzer.mwp.prepwork.FindLoops;
import org.e2immu.analyzer.mwp.prepwork.PrepAnalyzer;
import org.e2immu.analyzer.mwp.prepwork.PreparedFunction;
import org.e2immu.analyzer.mwp.prepwork.Variables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public class LoopAnalyzerImpl extends CommonAnalyzerImpl implements LoopAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(LoopAnalyzerImpl.class);

    private final Configuration loopConfiguration;
    private final PrepAnalyzer prepAnalyzer;

    public LoopAnalyzerImpl(Configuration configuration) {
        this(configuration, CalleeSummaries.NONE);
    }

    public LoopAnalyzerImpl(Configuration configuration, CalleeSummaries calleeSummaries) {
        super(configuration, calleeSummaries);
        // a loop is always analyzed to completion, the partial result needs the whole relation
        this.loopConfiguration = new ConfigurationBuilder(configuration).setStopOnInfinity(false).build();
        this.prepAnalyzer = new PrepAnalyzer(new PrepAnalyzer.Options.Builder()
                .setStrict(configuration.strict()).build());
    }

    private record OutputImpl(List<LoopResult> loops,
                              List<String> skipped,
                              List<AnalyzerException> analyzerExceptions) implements Output {
    }

    @Override
    public Output analyze(FunctionDefinition functionDefinition) {
        PreparedFunction prepared = prepAnalyzer.doFunction(functionDefinition);
        List<LoopResult> loops = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<AnalyzerException> analyzerExceptions = new ArrayList<>();
        for (FindLoops.Loop loop : FindLoops.in(prepared.body())) {
            // only in strict mode does the prepared body still hold unsupported statements
            if (!prepared.analyzable() && !new Coverage(new Block(List.of(loop.statement()))).report().full()) {
                LOGGER.info("Skipping loop {} of {}: unsupported syntax in strict mode", loop.index(),
                        functionDefinition.name());
                skipped.add(loop.index());
                continue;
            }
            try {
                loops.add(analyze(loop));
            } catch (RuntimeException | AssertionError problem) {
                LOGGER.error("Caught exception/error analyzing loop {} of {}: {}", loop.index(),
                        functionDefinition.name(), problem.getMessage());
                if (configuration.storeErrors()) {
                    analyzerExceptions.add(new AnalyzerException(functionDefinition.name() + "@" + loop.index(),
                            problem));
                } else {
                    throw problem;
                }
            }
        }
        return new OutputImpl(List.copyOf(loops), List.copyOf(skipped), List.copyOf(analyzerExceptions));
    }

    private LoopResult analyze(FindLoops.Loop loop) {
        List<String> variables = Variables.of(loop.statement());
        ChoiceRegistry registry = new ChoiceRegistry();
        DeltaGraph deltaGraph = new DeltaGraph(registry);
        StatementCompiler compiler = new StatementCompiler(loopConfiguration, calleeSummaries, registry, deltaGraph);
        Relation relation = compiler.compileFunction(variables, new Block(List.of(loop.statement())))
                .withoutIndicators(registry.branches());
        List<VariableResult> variableResults = deltaGraph.isFull()
                ? ResultClassifier.classifyPartially(relation, registry)
                : ResultClassifier.classifyAll(relation, registry);
        LOGGER.debug("Loop {}: {}", loop.index(), variableResults);
        return new LoopResult(loop.index(), loop.statement().toString(), variableResults);
    }
}
