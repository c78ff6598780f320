package org.e2immu.analyzer.mwp.flow.impl;

import org.e2immu.analyzer.mwp.flow.Analyzer;
import org.e2immu.analyzer.mwp.flow.CalleeSummaries;

public abstract class CommonAnalyzerImpl {

    protected final Analyzer.Configuration configuration;
    protected final CalleeSummaries calleeSummaries;

    protected CommonAnalyzerImpl(Analyzer.Configuration configuration, CalleeSummaries calleeSummaries) {
        this.configuration = configuration;
        this.calleeSummaries = calleeSummaries;
    }

    public record ConfigurationImpl(int maxFixpointIterations,
                                    boolean stopOnInfinity,
                                    boolean strict,
                                    boolean branchIndicators,
                                    int parallelism,
                                    boolean storeErrors) implements Analyzer.Configuration {
        public ConfigurationImpl {
            if (maxFixpointIterations < 1) throw new IllegalArgumentException("maxFixpointIterations < 1");
            if (parallelism < 1) throw new IllegalArgumentException("parallelism < 1");
        }
    }

    public static class ConfigurationBuilder {
        private int maxFixpointIterations = 1000;
        private boolean stopOnInfinity = true;
        private boolean strict;
        private boolean branchIndicators = true;
        private int parallelism = 1;
        private boolean storeErrors = true;

        public ConfigurationBuilder() {
        }

        public ConfigurationBuilder(Analyzer.Configuration configuration) {
            this.maxFixpointIterations = configuration.maxFixpointIterations();
            this.stopOnInfinity = configuration.stopOnInfinity();
            this.strict = configuration.strict();
            this.branchIndicators = configuration.branchIndicators();
            this.parallelism = configuration.parallelism();
            this.storeErrors = configuration.storeErrors();
        }

        public ConfigurationBuilder setMaxFixpointIterations(int maxFixpointIterations) {
            this.maxFixpointIterations = maxFixpointIterations;
            return this;
        }

        public ConfigurationBuilder setStopOnInfinity(boolean stopOnInfinity) {
            this.stopOnInfinity = stopOnInfinity;
            return this;
        }

        public ConfigurationBuilder setStrict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public ConfigurationBuilder setBranchIndicators(boolean branchIndicators) {
            this.branchIndicators = branchIndicators;
            return this;
        }

        public ConfigurationBuilder setParallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public ConfigurationBuilder setStoreErrors(boolean storeErrors) {
            this.storeErrors = storeErrors;
            return this;
        }

        public Analyzer.Configuration build() {
            return new ConfigurationImpl(maxFixpointIterations, stopOnInfinity, strict, branchIndicators,
                    parallelism, storeErrors);
        }
    }
}
