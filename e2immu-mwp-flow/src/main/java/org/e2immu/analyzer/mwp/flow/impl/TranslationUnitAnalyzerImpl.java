package org.e2immu.analyzer.mwp.flow.impl;

import org.e2immu.analyzer.mwp.common.AnalyzerException;
import org.e2immu.analyzer.mwp.common.cst.FunctionDefinition;
import org.e2immu.analyzer.mwp.common.cst.TranslationUnit;
import org.e2immu.analyzer.mwp.flow.CalleeSummaries;
import org.e2immu.analyzer.mwp.flow.FunctionAnalyzer;
import org.e2immu.analyzer.mwp.flow.FunctionResult;
import org.e2immu.analyzer.mwp.flow.TranslationUnitAnalyzer;
import org.e2immu.analyzer.mwp.prepwork.Diagnostic;
import org.e2immu.analyzer.mwp.prepwork.PrepAnalyzer;
import org.e2immu.analyzer.mwp.prepwork.PreparedFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/*
Analyzes the functions of a translation unit independently of each other. Each function analysis owns its
registry, delta graph and relations; the callee summaries are only read.
 */
public class TranslationUnitAnalyzerImpl extends CommonAnalyzerImpl implements TranslationUnitAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationUnitAnalyzerImpl.class);

    private final PrepAnalyzer prepAnalyzer;
    private final FunctionAnalyzer functionAnalyzer;

    public TranslationUnitAnalyzerImpl(Configuration configuration) {
        this(configuration, CalleeSummaries.NONE);
    }

    public TranslationUnitAnalyzerImpl(Configuration configuration, CalleeSummaries calleeSummaries) {
        super(configuration, calleeSummaries);
        this.prepAnalyzer = new PrepAnalyzer(new PrepAnalyzer.Options.Builder()
                .setStrict(configuration.strict()).build());
        this.functionAnalyzer = new FunctionAnalyzerImpl(configuration, calleeSummaries);
    }

    private record OutputImpl(List<FunctionResult> results,
                              List<String> skipped,
                              Map<String, List<Diagnostic>> diagnostics,
                              Duration duration,
                              List<AnalyzerException> analyzerExceptions) implements Output {
    }

    @Override
    public Output analyze(TranslationUnit translationUnit) {
        Instant start = Instant.now();
        LOGGER.info("Analyzing translation unit {}, {} function(s)", translationUnit.name(),
                translationUnit.functions().size());

        List<PreparedFunction> prepared = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        Map<String, List<Diagnostic>> diagnostics = new LinkedHashMap<>();
        for (FunctionDefinition fd : translationUnit.functions()) {
            PreparedFunction pf = prepAnalyzer.doFunction(fd);
            if (pf.analyzable()) {
                prepared.add(pf);
            } else {
                skipped.add(pf.name());
                if (!pf.diagnostics().isEmpty()) diagnostics.put(pf.name(), pf.diagnostics());
            }
        }

        List<FunctionAnalyzer.Output> outputs = configuration.parallelism() > 1 && prepared.size() > 1
                ? analyzeInParallel(prepared)
                : prepared.stream().map(functionAnalyzer::analyze).toList();

        List<FunctionResult> results = new ArrayList<>();
        List<AnalyzerException> analyzerExceptions = new ArrayList<>();
        for (int i = 0; i < prepared.size(); i++) {
            FunctionAnalyzer.Output output = outputs.get(i);
            if (output.result() != null) results.add(output.result());
            if (!output.diagnostics().isEmpty()) diagnostics.put(prepared.get(i).name(), output.diagnostics());
            analyzerExceptions.addAll(output.analyzerExceptions());
        }
        Duration duration = Duration.between(start, Instant.now());
        LOGGER.info("Analyzed translation unit {} in {} ms: {} result(s), {} skipped, {} exception(s)",
                translationUnit.name(), duration.toMillis(), results.size(), skipped.size(),
                analyzerExceptions.size());
        return new OutputImpl(List.copyOf(results), List.copyOf(skipped), Collections.unmodifiableMap(diagnostics),
                duration, List.copyOf(analyzerExceptions));
    }

    // results are collected in the order of the input
    private List<FunctionAnalyzer.Output> analyzeInParallel(List<PreparedFunction> prepared) {
        ExecutorService executor = Executors.newFixedThreadPool(configuration.parallelism());
        try {
            List<Future<FunctionAnalyzer.Output>> futures = prepared.stream()
                    .map(pf -> executor.submit(() -> functionAnalyzer.analyze(pf)))
                    .toList();
            List<FunctionAnalyzer.Output> outputs = new ArrayList<>(futures.size());
            for (Future<FunctionAnalyzer.Output> future : futures) {
                outputs.add(future.get());
            }
            return outputs;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while analyzing", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            if (e.getCause() instanceof Error error) throw error;
            throw new IllegalStateException(e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }
}
