package org.e2immu.analyzer.mwp.flow;

import org.e2immu.analyzer.mwp.common.cst.FunctionDefinition;

import java.util.List;

/**
 * Analyzes every loop of a function in isolation, over the variables of the loop, always to completion.
 */
public interface LoopAnalyzer extends Analyzer {

    record LoopResult(String index, String source, List<VariableResult> variableResults) {
        public LoopResult {
            variableResults = List.copyOf(variableResults);
        }

        public VariableResult variableResult(String variable) {
            return variableResults.stream().filter(vr -> vr.variable().equals(variable)).findFirst().orElseThrow();
        }

        public boolean isBounded() {
            return variableResults.stream().allMatch(VariableResult::isBounded);
        }
    }

    interface Output extends Analyzer.Output {
        List<LoopResult> loops();

        /**
         * @return the indices of the loops not analyzed because they contain unsupported syntax, in strict mode
         */
        List<String> skipped();
    }

    Output analyze(FunctionDefinition functionDefinition);
}
