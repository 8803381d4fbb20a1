package com.automagik.telemetry.model;

public enum MetricKind {
    /** Monotonic cumulative sum. */
    COUNTER,
    GAUGE,
    /** Single observation recorded into a histogram. */
    HISTOGRAM
}
