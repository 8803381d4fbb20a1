package com.automagik.telemetry.model;

import io.opentelemetry.api.logs.Severity;
import java.time.Instant;
import java.util.Objects;

/**
 * A structured log line.
 *
 * @param severity OpenTelemetry severity; must carry a number in 1..24
 * @param traceId optional trace correlation, {@code null} when absent
 */
public record LogRecord(String body, Severity severity, Instant timestamp, String traceId, Attributes attributes)
        implements TelemetryEvent {

    public LogRecord {
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(timestamp, "timestamp");
        severity = severity == null ? Severity.INFO : severity;
        if (severity.getSeverityNumber() < 1 || severity.getSeverityNumber() > 24) {
            throw new IllegalArgumentException("severity must be in 1..24, got " + severity);
        }
        if (traceId != null && !TraceIds.isValidTraceId(traceId)) {
            throw new IllegalArgumentException("invalid trace id " + traceId);
        }
        attributes = attributes == null ? Attributes.empty() : attributes;
    }

    /** Severity text as rendered in OTLP, e.g. {@code INFO} or {@code ERROR2}. */
    public String severityText() {
        return severity.name();
    }

    @Override
    public Signal signal() {
        return Signal.LOG;
    }
}
