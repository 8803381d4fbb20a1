package com.automagik.telemetry.model;

import java.time.Instant;

/**
 * An immutable event queued by the client: a {@link Span}, {@link MetricPoint} or {@link LogRecord}.
 * Once enqueued it is only read, by the scheduler and the transports.
 */
public interface TelemetryEvent {

    Signal signal();

    /** Wall-clock time the event occurred; for spans, the start time. */
    Instant timestamp();

    Attributes attributes();
}
