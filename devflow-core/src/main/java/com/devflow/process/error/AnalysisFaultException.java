package com.devflow.process.error;

/**
 * Internal failure of the engine itself, such as stages disagreeing on the case count, a non-finite statistic or
 * an interrupted accumulation. Never caused by the shape of the input.
 */
public class AnalysisFaultException extends IllegalStateException implements ProcessAnalysisFailure {
    public static final String CODE = "analysis.internal-fault";

    public AnalysisFaultException(String message) {
        super(message);
    }

    public AnalysisFaultException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorCode() {
        return CODE;
    }
}
