package com.automagik.telemetry.model;

import java.time.Instant;
import java.util.Objects;

public record MetricPoint(
        String name, double value, MetricKind kind, String unit, Instant timestamp, Attributes attributes)
        implements TelemetryEvent {

    public MetricPoint {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(timestamp, "timestamp");
        kind = kind == null ? MetricKind.GAUGE : kind;
        unit = unit == null ? "" : unit;
        attributes = attributes == null ? Attributes.empty() : attributes;
    }

    @Override
    public Signal signal() {
        return Signal.METRIC;
    }
}
