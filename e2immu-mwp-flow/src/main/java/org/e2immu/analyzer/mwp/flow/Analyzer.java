package org.e2immu.analyzer.mwp.flow;

import org.e2immu.analyzer.mwp.common.AnalyzerException;

import java.util.List;

public interface Analyzer {

    interface Configuration {
        // cap on the number of iterations of one loop fixpoint
        int maxFixpointIterations();

        // stop analyzing a function as soon as the delta graph shows that it is infinite under every choice
        boolean stopOnInfinity();

        // do not analyze functions with unsupported syntax
        boolean strict();

        // qualify the two branches of an if-statement with an indicator term each
        boolean branchIndicators();

        // number of threads analyzing the functions of one translation unit
        int parallelism();

        // when false, exceptions are thrown rather than collected
        boolean storeErrors();
    }

    interface Output {
        List<AnalyzerException> analyzerExceptions();
    }
}
