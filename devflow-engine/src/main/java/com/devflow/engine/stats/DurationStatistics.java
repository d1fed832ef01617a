package com.devflow.engine.stats;

/** Case-duration distribution, all values in hours. */
public record DurationStatistics(double median, double mean, double p90, double min, double max) {}
