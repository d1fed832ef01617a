package com.devflow.process.error;

/**
 * A negative wait between two consecutive events of a sorted case. Indicates a loader or clock defect upstream;
 * the value is never clamped.
 */
public class InvariantViolationException extends IllegalStateException implements ProcessAnalysisFailure {
    public static final String CODE = "analysis.invariant-violation";

    private final String caseId;
    private final String fromActivity;
    private final String toActivity;

    public InvariantViolationException(String caseId, String fromActivity, String toActivity, double waitHours) {
        super(String.format(
                "Negative wait of %s hours in case %s between %s and %s", waitHours, caseId, fromActivity, toActivity));
        this.caseId = caseId;
        this.fromActivity = fromActivity;
        this.toActivity = toActivity;
    }

    public String caseId() {
        return caseId;
    }

    public String fromActivity() {
        return fromActivity;
    }

    public String toActivity() {
        return toActivity;
    }

    @Override
    public String errorCode() {
        return CODE;
    }
}
