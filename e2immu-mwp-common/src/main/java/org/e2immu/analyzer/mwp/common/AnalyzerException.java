package org.e2immu.analyzer.mwp.common;

public class AnalyzerException extends RuntimeException {
    private final String functionName;

    public AnalyzerException(String functionName, Throwable throwable) {
        super("Analysis of " + functionName + " failed: " + throwable.getMessage(), throwable);
        this.functionName = functionName;
    }

    public String getFunctionName() {
        return functionName;
    }
}
