package org.e2immu.analyzer.mwp.flow;

import org.e2immu.analyzer.mwp.flow.semiring.Scalar;

import java.util.List;
import java.util.Map;

/**
 * Read-only lookup of precomputed summaries of called functions, shared by all function analyses.
 */
@FunctionalInterface
public interface CalleeSummaries {

    CalleeSummaries NONE = name -> null;

    /**
     * How the return value of a function depends on each of its parameters.
     *
     * @param parameterLabels one label per parameter; 0 when the return value does not depend on it
     */
    record Summary(String function, List<Scalar> parameterLabels) {
        public Summary {
            parameterLabels = List.copyOf(parameterLabels);
        }
    }

    /**
     * @return the summary of the function, or null when none is known
     */
    Summary summary(String function);

    static CalleeSummaries of(Map<String, List<Scalar>> map) {
        Map<String, List<Scalar>> copy = Map.copyOf(map);
        return name -> {
            List<Scalar> labels = copy.get(name);
            return labels == null ? null : new Summary(name, labels);
        };
    }
}
