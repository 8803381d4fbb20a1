package com.automagik.telemetry.model;

/** OTLP signal a {@link TelemetryEvent} belongs to; each has its own envelope, endpoint and table. */
public enum Signal {
    TRACE,
    METRIC,
    LOG
}
