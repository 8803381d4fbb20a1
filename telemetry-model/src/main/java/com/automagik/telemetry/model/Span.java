package com.automagik.telemetry.model;

import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/** A single traced operation. The client emits one per tracked event, with fresh random ids. */
public record Span(
        String traceId,
        String spanId,
        String name,
        SpanKind kind,
        Instant startTime,
        Instant endTime,
        StatusCode status,
        Attributes attributes)
        implements TelemetryEvent {

    public Span {
        Objects.requireNonNull(traceId, "traceId");
        Objects.requireNonNull(spanId, "spanId");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(startTime, "startTime");
        kind = kind == null ? SpanKind.INTERNAL : kind;
        endTime = endTime == null || endTime.isBefore(startTime) ? startTime : endTime;
        status = status == null ? StatusCode.UNSET : status;
        attributes = attributes == null ? Attributes.empty() : attributes;
    }

    /** Instantaneous internal span with new ids. */
    public static Span event(String name, Instant at, StatusCode status, Attributes attributes) {
        return new Span(
                TraceIds.newTraceId(), TraceIds.newSpanId(), name, SpanKind.INTERNAL, at, at, status, attributes);
    }

    public Duration duration() {
        return Duration.between(startTime, endTime);
    }

    @Override
    public Signal signal() {
        return Signal.TRACE;
    }

    @Override
    public Instant timestamp() {
        return startTime;
    }
}
