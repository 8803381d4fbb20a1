package com.automagik.telemetry.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Ordered events of one flush chunk together with the client's resource. */
public record Batch(ResourceContext resource, List<TelemetryEvent> events) {

    public Batch {
        Objects.requireNonNull(resource, "resource");
        events = List.copyOf(events);
    }

    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    /** Events of one signal, enqueue order preserved. */
    public <T extends TelemetryEvent> List<T> ofSignal(Signal signal, Class<T> type) {
        List<T> out = new ArrayList<>();
        for (TelemetryEvent e : events) {
            if (e.signal() == signal && type.isInstance(e)) out.add(type.cast(e));
        }
        return out;
    }

    public List<Span> spans() {
        return ofSignal(Signal.TRACE, Span.class);
    }

    public List<MetricPoint> metrics() {
        return ofSignal(Signal.METRIC, MetricPoint.class);
    }

    public List<LogRecord> logs() {
        return ofSignal(Signal.LOG, LogRecord.class);
    }
}
