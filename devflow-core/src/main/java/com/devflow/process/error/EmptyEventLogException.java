package com.devflow.process.error;

public class EmptyEventLogException extends IllegalStateException implements ProcessAnalysisFailure {
    public static final String CODE = "analysis.empty-log";

    public EmptyEventLogException() {
        super("Event log contains no cases; duration statistics are undefined");
    }

    @Override
    public String errorCode() {
        return CODE;
    }
}
