package com.devflow.engine.dfg;

/** Directly-follows edge: {@code fromActivity} immediately followed by {@code toActivity} within one case. */
public record TransitionKey(String fromActivity, String toActivity) {

    public boolean isSelfLoop() {
        return fromActivity.equals(toActivity);
    }
}
