package com.automagik.telemetry.transport.otlp;

import com.automagik.telemetry.model.AttributeValue;
import com.automagik.telemetry.model.Attributes;
import com.automagik.telemetry.model.LogRecord;
import com.automagik.telemetry.model.MetricPoint;
import com.automagik.telemetry.model.ResourceContext;
import com.automagik.telemetry.model.Span;
import com.automagik.telemetry.model.Timestamps;
import com.automagik.telemetry.transport.http.EventEncodingException;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** OTLP/JSON (protobuf JSON mapping) envelopes as plain map trees, ready for Jackson. */
final class OtlpPayloads {
    static final int AGGREGATION_TEMPORALITY_CUMULATIVE = 2;

    private OtlpPayloads() {}

    static Map<String, Object> traces(ResourceContext rc, List<Map<String, Object>> spans) {
        return envelope("resourceSpans", "scopeSpans", "spans", rc, spans);
    }

    static Map<String, Object> metrics(ResourceContext rc, List<Map<String, Object>> metrics) {
        return envelope("resourceMetrics", "scopeMetrics", "metrics", rc, metrics);
    }

    static Map<String, Object> logs(ResourceContext rc, List<Map<String, Object>> logRecords) {
        return envelope("resourceLogs", "scopeLogs", "logRecords", rc, logRecords);
    }

    static Map<String, Object> span(Span s) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("traceId", s.traceId());
        out.put("spanId", s.spanId());
        out.put("name", s.name());
        out.put("kind", spanKind(s.kind()));
        out.put("startTimeUnixNano", nanos(s.startTime()));
        out.put("endTimeUnixNano", nanos(s.endTime()));
        out.put("attributes", attributes(s.attributes()));
        out.put("status", Map.of("code", statusCode(s.status())));
        return out;
    }

    static Map<String, Object> metric(MetricPoint m) throws EventEncodingException {
        if (!Double.isFinite(m.value())) {
            throw new EventEncodingException("metric " + m.name() + " has non-finite value " + m.value());
        }
        Map<String, Object> point = new LinkedHashMap<>();
        point.put("attributes", attributes(m.attributes()));
        point.put("timeUnixNano", nanos(m.timestamp()));

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("name", m.name());
        if (!m.unit().isEmpty()) out.put("unit", m.unit());
        switch (m.kind()) {
            case COUNTER -> {
                point.put("asDouble", m.value());
                Map<String, Object> sum = new LinkedHashMap<>();
                sum.put("dataPoints", List.of(point));
                sum.put("aggregationTemporality", AGGREGATION_TEMPORALITY_CUMULATIVE);
                sum.put("isMonotonic", true);
                out.put("sum", sum);
            }
            case GAUGE -> {
                point.put("asDouble", m.value());
                out.put("gauge", Map.of("dataPoints", List.of(point)));
            }
            case HISTOGRAM -> {
                point.put("count", "1");
                point.put("sum", m.value());
                point.put("min", m.value());
                point.put("max", m.value());
                point.put("bucketCounts", List.of("1"));
                point.put("explicitBounds", List.of());
                Map<String, Object> histogram = new LinkedHashMap<>();
                histogram.put("dataPoints", List.of(point));
                histogram.put("aggregationTemporality", AGGREGATION_TEMPORALITY_CUMULATIVE);
                out.put("histogram", histogram);
            }
        }
        return out;
    }

    static Map<String, Object> log(LogRecord l) {
        String ts = nanos(l.timestamp());
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("timeUnixNano", ts);
        out.put("observedTimeUnixNano", ts);
        out.put("severityNumber", l.severity().getSeverityNumber());
        out.put("severityText", l.severityText());
        out.put("body", Map.of("stringValue", l.body()));
        out.put("attributes", attributes(l.attributes()));
        if (l.traceId() != null) out.put("traceId", l.traceId());
        return out;
    }

    static List<Map<String, Object>> attributes(Attributes attrs) {
        List<Map<String, Object>> out = new ArrayList<>(attrs.size());
        attrs.forEach((k, v) -> {
            Map<String, Object> kv = new LinkedHashMap<>();
            kv.put("key", k);
            kv.put("value", anyValue(v));
            out.add(kv);
        });
        return out;
    }

    static Map<String, Object> anyValue(AttributeValue v) {
        if (v instanceof AttributeValue.IntValue i) return Map.of("intValue", Long.toString(i.value()));
        if (v instanceof AttributeValue.DoubleValue d) return Map.of("doubleValue", d.value());
        if (v instanceof AttributeValue.BoolValue b) return Map.of("boolValue", b.value());
        return Map.of("stringValue", v.asString());
    }

    static int statusCode(StatusCode code) {
        return switch (code) {
            case UNSET -> 0;
            case OK -> 1;
            case ERROR -> 2;
        };
    }

    static int spanKind(SpanKind kind) {
        return switch (kind) {
            case INTERNAL -> 1;
            case SERVER -> 2;
            case CLIENT -> 3;
            case PRODUCER -> 4;
            case CONSUMER -> 5;
        };
    }

    private static String nanos(java.time.Instant t) {
        return Long.toString(Timestamps.epochNanos(t));
    }

    private static Map<String, Object> envelope(
            String resourceKey, String scopeKey, String itemsKey, ResourceContext rc, List<Map<String, Object>> items) {
        Map<String, Object> scope = new LinkedHashMap<>();
        scope.put("name", rc.getProjectName() + ".telemetry");
        scope.put("version", rc.getVersion());

        Map<String, Object> scoped = new LinkedHashMap<>();
        scoped.put("scope", scope);
        scoped.put(itemsKey, items);

        Map<String, Object> resource = new LinkedHashMap<>();
        resource.put("resource", Map.of("attributes", attributes(rc.toAttributes())));
        resource.put(scopeKey, List.of(scoped));

        Map<String, Object> root = new LinkedHashMap<>();
        root.put(resourceKey, List.of(resource));
        return root;
    }
}
