package com.devflow.process.model;

/** Read-only summary of a directly-follows transition once all wait samples are collected. */
public record Bottleneck(String fromActivity, String toActivity, double avgWaitHours, long frequency) {

    public String label() {
        return fromActivity + " -> " + toActivity;
    }
}
