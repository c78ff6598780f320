package org.e2immu.analyzer.mwp.prepwork;

import org.e2immu.analyzer.mwp.common.cst.Block;
import org.e2immu.analyzer.mwp.common.cst.FunctionDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/*
do all the preparation of a function before the flow analysis:
- syntax check (coverage), and removal of unsupported statements
- variable ordering
 */
public class PrepAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(PrepAnalyzer.class);

    public record Options(boolean strict) {
        public static class Builder {
            boolean strict;

            public Builder setStrict(boolean strict) {
                this.strict = strict;
                return this;
            }

            public Options build() {
                return new Options(strict);
            }
        }
    }

    private final Options options;

    public PrepAnalyzer() {
        this(new Options.Builder().build());
    }

    public PrepAnalyzer(Options options) {
        this.options = options;
    }

    public PreparedFunction doFunction(FunctionDefinition functionDefinition) {
        Coverage coverage = new Coverage(functionDefinition.body());
        Coverage.Report report = coverage.report();
        List<String> variables = Variables.of(functionDefinition);
        if (!report.full() && options.strict()) {
            LOGGER.info("Skipping {}: {} unsupported statement(s) in strict mode", functionDefinition,
                    report.unsupported().size());
            return new PreparedFunction(functionDefinition, variables, functionDefinition.body(),
                    report.unsupported(), false);
        }
        Block body = coverage.modify();
        LOGGER.debug("Prepared {}: variables {}, {} unsupported statement(s) removed", functionDefinition,
                variables, report.unsupported().size());
        return new PreparedFunction(functionDefinition, variables, body, report.unsupported(), true);
    }
}
