package com.devflow.process.error;

/**
 * Raised when an event lacks a case id or activity, or carries a timestamp that cannot be parsed.
 */
public class EventValidationException extends IllegalArgumentException implements ProcessAnalysisFailure {
    public static final String CODE = "analysis.invalid-event";
    public static final int UNKNOWN_INDEX = -1;

    private final int eventIndex;
    private final String field;

    public EventValidationException(int eventIndex, String field, String message) {
        super(message);
        this.eventIndex = eventIndex;
        this.field = field;
    }

    public EventValidationException(int eventIndex, String field, String message, Throwable cause) {
        super(message, cause);
        this.eventIndex = eventIndex;
        this.field = field;
    }

    public static EventValidationException missingField(int eventIndex, String field) {
        return new EventValidationException(
                eventIndex, field, String.format("Event #%d is missing required field '%s'", eventIndex, field));
    }

    /** 0-based position of the offending event in the input, or {@link #UNKNOWN_INDEX}. */
    public int eventIndex() {
        return eventIndex;
    }

    public String field() {
        return field;
    }

    @Override
    public String errorCode() {
        return CODE;
    }
}
