package org.e2immu.analyzer.mwp.flow;

import org.e2immu.analyzer.mwp.prepwork.Diagnostic;
import org.e2immu.analyzer.mwp.prepwork.PreparedFunction;

import java.util.List;

public interface FunctionAnalyzer extends Analyzer {

    interface Output extends Analyzer.Output {
        // null when the analysis failed
        FunctionResult result();

        List<Diagnostic> diagnostics();
    }

    Output analyze(PreparedFunction preparedFunction);
}
