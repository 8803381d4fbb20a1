package com.automagik.telemetry.transport.clickhouse;

import com.automagik.telemetry.model.LogRecord;
import com.automagik.telemetry.model.MetricKind;
import com.automagik.telemetry.model.MetricPoint;
import com.automagik.telemetry.model.ResourceContext;
import com.automagik.telemetry.model.Span;
import com.automagik.telemetry.model.Timestamps;
import com.automagik.telemetry.transport.http.EventEncodingException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Flattens events into rows of the traces, metrics and logs tables. Attribute maps become
 * {@code Map(String, String)}.
 */
final class ClickHouseRows {
    // DateTime64(3) for traces, DateTime for metrics and logs
    static final DateTimeFormatter MILLIS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneOffset.UTC);
    static final DateTimeFormatter SECONDS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private ClickHouseRows() {}

    static Map<String, Object> trace(Span s, ResourceContext rc) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("trace_id", s.traceId());
        row.put("span_id", s.spanId());
        row.put("parent_span_id", "");
        row.put("timestamp", MILLIS.format(s.startTime()));
        row.put("timestamp_ns", Timestamps.epochNanos(s.startTime()));
        row.put("duration_ms", s.duration().toMillis());
        row.put("service_name", rc.getProjectName());
        row.put("span_name", s.name());
        row.put("span_kind", s.kind().name());
        row.put("status_code", s.status().name());
        row.put("status_message", "");
        row.put("project_name", rc.getProjectName());
        row.put("project_version", rc.getVersion());
        row.put("environment", rc.getEnvironment());
        row.put("hostname", "");
        row.put("attributes", s.attributes().asStringMap());
        putIdentity(row, rc);
        return row;
    }

    static Map<String, Object> metric(MetricPoint m, ResourceContext rc) throws EventEncodingException {
        double v = m.value();
        if (!Double.isFinite(v)) {
            throw new EventEncodingException("metric " + m.name() + " has non-finite value " + v);
        }
        boolean histogram = m.kind() == MetricKind.HISTOGRAM;
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("metric_id", UUID.randomUUID().toString());
        row.put("metric_name", m.name());
        row.put("metric_type", metricType(m.kind()));
        row.put("metric_unit", m.unit());
        row.put("timestamp", SECONDS.format(m.timestamp()));
        row.put("timestamp_ns", Timestamps.epochNanos(m.timestamp()));
        row.put("value_int", isIntegral(v) ? (long) v : 0L);
        row.put("value_double", v);
        row.put("is_monotonic", m.kind() == MetricKind.COUNTER ? 1 : 0);
        row.put("aggregation_temporality", m.kind() == MetricKind.GAUGE ? "UNSPECIFIED" : "CUMULATIVE");
        row.put("histogram_count", histogram ? 1L : 0L);
        row.put("histogram_sum", histogram ? v : 0.0);
        row.put("histogram_min", histogram ? v : 0.0);
        row.put("histogram_max", histogram ? v : 0.0);
        row.put("project_name", rc.getProjectName());
        row.put("project_version", rc.getVersion());
        row.put("service_name", rc.getProjectName());
        row.put("environment", rc.getEnvironment());
        row.put("attributes", m.attributes().asStringMap());
        putIdentity(row, rc);
        return row;
    }

    static Map<String, Object> log(LogRecord l, ResourceContext rc) {
        Instant observed = l.timestamp();
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("log_id", UUID.randomUUID().toString());
        row.put("trace_id", l.traceId() == null ? "" : l.traceId());
        row.put("span_id", "");
        row.put("timestamp", SECONDS.format(l.timestamp()));
        row.put("timestamp_ns", Timestamps.epochNanos(l.timestamp()));
        row.put("observed_timestamp", SECONDS.format(observed));
        row.put("observed_timestamp_ns", Timestamps.epochNanos(observed));
        row.put("severity_text", l.severityText());
        row.put("severity_number", l.severity().getSeverityNumber());
        row.put("body", l.body());
        row.put("project_name", rc.getProjectName());
        row.put("project_version", rc.getVersion());
        row.put("service_name", rc.getProjectName());
        row.put("environment", rc.getEnvironment());
        row.put("attributes", l.attributes().asStringMap());
        putIdentity(row, rc);
        return row;
    }

    /** COUNTER has no column value of its own; the table stores it as SUM. */
    static String metricType(MetricKind kind) {
        return switch (kind) {
            case COUNTER -> "SUM";
            case GAUGE -> "GAUGE";
            case HISTOGRAM -> "HISTOGRAM";
        };
    }

    private static boolean isIntegral(double v) {
        return v == Math.rint(v) && Math.abs(v) < 9.0E18;
    }

    private static void putIdentity(Map<String, Object> row, ResourceContext rc) {
        row.put("user_id", rc.getUserIdHash());
        row.put("session_id", rc.getSessionId());
        row.put("os_type", rc.getOs());
        row.put("os_version", rc.getOsVersion());
        row.put("runtime_name", rc.getRuntimeName());
        row.put("runtime_version", rc.getRuntimeVersion());
    }
}
