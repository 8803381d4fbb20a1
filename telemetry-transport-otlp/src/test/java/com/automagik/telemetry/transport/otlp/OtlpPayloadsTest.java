package com.automagik.telemetry.transport.otlp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.automagik.telemetry.model.Attributes;
import com.automagik.telemetry.model.LogRecord;
import com.automagik.telemetry.model.MetricKind;
import com.automagik.telemetry.model.MetricPoint;
import com.automagik.telemetry.model.ResourceContext;
import com.automagik.telemetry.model.Span;
import com.automagik.telemetry.transport.http.EventEncodingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.api.logs.Severity;
import io.opentelemetry.api.trace.StatusCode;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class OtlpPayloadsTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Instant T0 = Instant.parse("2025-01-15T10:30:00Z");
    private static final ResourceContext RC =
            ResourceContext.builder().projectName("omni").version("1.2.3").build();

    @Test
    void span_envelope_shape() throws Exception {
        Span span = Span.event(
                "user.login",
                T0,
                StatusCode.OK,
                Attributes.builder().put("count", 3L).put("ok", true).put("ratio", 0.5).put("k", "v").build());

        JsonNode root = MAPPER.valueToTree(OtlpPayloads.traces(RC, List.of(OtlpPayloads.span(span))));

        JsonNode rs = root.path("resourceSpans").get(0);
        assertThat(rs.path("resource").path("attributes").get(0).path("key").asText()).isEqualTo("service.name");
        JsonNode scope = rs.path("scopeSpans").get(0).path("scope");
        assertThat(scope.path("name").asText()).isEqualTo("omni.telemetry");
        assertThat(scope.path("version").asText()).isEqualTo("1.2.3");

        JsonNode s = rs.path("scopeSpans").get(0).path("spans").get(0);
        assertThat(s.path("traceId").asText()).hasSize(32);
        assertThat(s.path("spanId").asText()).hasSize(16);
        assertThat(s.path("kind").asInt()).isEqualTo(1);
        assertThat(s.path("startTimeUnixNano").isTextual()).isTrue();
        assertThat(s.path("startTimeUnixNano").asText()).isEqualTo("1736937000000000000");
        assertThat(s.path("status").path("code").asInt()).isEqualTo(1);
        JsonNode attrs = s.path("attributes");
        assertThat(attrs.get(0).path("value").path("intValue").asText()).isEqualTo("3");
        assertThat(attrs.get(1).path("value").path("boolValue").asBoolean()).isTrue();
        assertThat(attrs.get(2).path("value").path("doubleValue").asDouble()).isEqualTo(0.5);
        assertThat(attrs.get(3).path("value").path("stringValue").asText()).isEqualTo("v");
    }

    @Test
    void counter_becomes_monotonic_cumulative_sum() throws Exception {
        JsonNode m = MAPPER.valueToTree(
                OtlpPayloads.metric(new MetricPoint("requests", 5, MetricKind.COUNTER, "1", T0, null)));

        assertThat(m.path("unit").asText()).isEqualTo("1");
        assertThat(m.path("sum").path("aggregationTemporality").asInt()).isEqualTo(2);
        assertThat(m.path("sum").path("isMonotonic").asBoolean()).isTrue();
        assertThat(m.path("sum").path("dataPoints").get(0).path("asDouble").asDouble()).isEqualTo(5.0);
    }

    @Test
    void gauge_and_histogram_shapes() throws Exception {
        JsonNode gauge = MAPPER.valueToTree(
                OtlpPayloads.metric(new MetricPoint("cpu", 0.7, MetricKind.GAUGE, null, T0, null)));
        JsonNode histogram = MAPPER.valueToTree(
                OtlpPayloads.metric(new MetricPoint("latency", 120, MetricKind.HISTOGRAM, "ms", T0, null)));

        assertThat(gauge.has("unit")).isFalse();
        assertThat(gauge.path("gauge").path("dataPoints").get(0).path("timeUnixNano").isTextual()).isTrue();
        JsonNode hp = histogram.path("histogram").path("dataPoints").get(0);
        assertThat(hp.path("count").asText()).isEqualTo("1");
        assertThat(hp.path("sum").asDouble()).isEqualTo(120.0);
        assertThat(hp.path("min").asDouble()).isEqualTo(120.0);
        assertThat(hp.path("max").asDouble()).isEqualTo(120.0);
        assertThat(hp.path("bucketCounts").get(0).asText()).isEqualTo("1");
        assertThat(hp.path("explicitBounds").isEmpty()).isTrue();
    }

    @Test
    void non_finite_metric_cannot_be_encoded() {
        assertThatThrownBy(() -> OtlpPayloads.metric(new MetricPoint("x", Double.NaN, MetricKind.GAUGE, "", T0, null)))
                .isInstanceOf(EventEncodingException.class);
    }

    @Test
    void log_record_shape() {
        JsonNode l = MAPPER.valueToTree(
                OtlpPayloads.log(new LogRecord("disk almost full", Severity.WARN, T0, null, Attributes.empty())));

        assertThat(l.path("severityNumber").asInt()).isEqualTo(13);
        assertThat(l.path("severityText").asText()).isEqualTo("WARN");
        assertThat(l.path("body").path("stringValue").asText()).isEqualTo("disk almost full");
        assertThat(l.path("observedTimeUnixNano").asText()).isEqualTo(l.path("timeUnixNano").asText());
        assertThat(l.has("traceId")).isFalse();
    }
}
