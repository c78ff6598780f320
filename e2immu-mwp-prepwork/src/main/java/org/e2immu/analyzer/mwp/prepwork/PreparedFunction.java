package org.e2immu.analyzer.mwp.prepwork;

import org.e2immu.analyzer.mwp.common.cst.Block;
import org.e2immu.analyzer.mwp.common.cst.FunctionDefinition;

import java.util.List;

/**
 * The output of the preparation pass for one function.
 *
 * @param definition  the function as handed to the analyzer
 * @param variables   the fixed variable ordering
 * @param body        the body to analyze; unsupported statements have been removed unless strict
 * @param diagnostics one diagnostic per unsupported statement
 * @param analyzable  false in strict mode when some statement is not supported
 */
public record PreparedFunction(FunctionDefinition definition,
                               List<String> variables,
                               Block body,
                               List<Diagnostic> diagnostics,
                               boolean analyzable) {

    public PreparedFunction {
        variables = List.copyOf(variables);
        diagnostics = List.copyOf(diagnostics);
    }

    public String name() {
        return definition.name();
    }
}
