package org.e2immu.analyzer.mwp.flow;

import java.util.List;

public class FixpointDivergenceException extends RuntimeException {
    private final int iterations;

    public FixpointDivergenceException(int iterations, List<String> variables) {
        super("No fixpoint after " + iterations + " iterations, variables " + variables);
        this.iterations = iterations;
    }

    public int getIterations() {
        return iterations;
    }
}
