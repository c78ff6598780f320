package org.e2immu.analyzer.mwp.flow;

import org.e2immu.analyzer.mwp.common.cst.TranslationUnit;
import org.e2immu.analyzer.mwp.prepwork.Diagnostic;

import java.time.Duration;
import java.util.List;
import java.util.Map;

public interface TranslationUnitAnalyzer extends Analyzer {

    interface Output extends Analyzer.Output {
        // in the order of the functions in the translation unit; skipped and failed functions are absent
        List<FunctionResult> results();

        // functions not analyzed in strict mode
        List<String> skipped();

        Map<String, List<Diagnostic>> diagnostics();

        Duration duration();

        default FunctionResult result(String function) {
            return results().stream().filter(r -> r.name().equals(function)).findFirst().orElse(null);
        }
    }

    Output analyze(TranslationUnit translationUnit);
}
