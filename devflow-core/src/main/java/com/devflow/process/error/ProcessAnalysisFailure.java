package com.devflow.process.error;

/**
 * Marker for the fatal failures of an analysis run. Callers receive either a complete result or one of these.
 */
public interface ProcessAnalysisFailure {

    /** Stable, machine-readable code such as {@code analysis.empty-log}. */
    String errorCode();
}
