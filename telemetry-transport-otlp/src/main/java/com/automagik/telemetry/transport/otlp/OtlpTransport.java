package com.automagik.telemetry.transport.otlp;

import com.automagik.telemetry.model.Batch;
import com.automagik.telemetry.model.LogRecord;
import com.automagik.telemetry.model.MetricPoint;
import com.automagik.telemetry.model.ResourceContext;
import com.automagik.telemetry.model.Span;
import com.automagik.telemetry.transport.SendOutcome;
import com.automagik.telemetry.transport.http.AbstractHttpTransport;
import com.automagik.telemetry.transport.http.EventEncodingException;
import com.automagik.telemetry.transport.http.HttpTransportOptions;
import com.automagik.telemetry.transport.http.RetryExecutor;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import okhttp3.HttpUrl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Ships batches to an OTLP/HTTP collector as JSON, one POST per signal present in the batch. */
public class OtlpTransport extends AbstractHttpTransport {
    private static final Logger log = LoggerFactory.getLogger(OtlpTransport.class);
    private static final String JSON = "application/json";

    private final OtlpEndpoints endpoints;
    private final HttpUrl tracesUrl;
    private final HttpUrl metricsUrl;
    private final HttpUrl logsUrl;

    public OtlpTransport(OtlpEndpoints endpoints, HttpTransportOptions options) {
        this(endpoints, options, RetryExecutor.Sleeper.SYSTEM);
    }

    public OtlpTransport(OtlpEndpoints endpoints, HttpTransportOptions options, RetryExecutor.Sleeper sleeper) {
        super(options, sleeper);
        this.endpoints = endpoints;
        this.tracesUrl = parseUrl(endpoints.traces());
        this.metricsUrl = parseUrl(endpoints.metrics());
        this.logsUrl = parseUrl(endpoints.logs());
    }

    public OtlpEndpoints endpoints() {
        return endpoints;
    }

    @Override
    public String name() {
        return "otlp";
    }

    @Override
    public SendOutcome send(Batch batch) {
        ResourceContext rc = batch.resource();
        SendOutcome outcome = SendOutcome.empty();

        List<Map<String, Object>> spans = new ArrayList<>();
        for (Span s : batch.spans()) spans.add(OtlpPayloads.span(s));
        if (!spans.isEmpty()) {
            outcome = outcome.combine(post("traces", tracesUrl, OtlpPayloads.traces(rc, spans), spans.size()));
        }

        List<Map<String, Object>> metrics = new ArrayList<>();
        for (MetricPoint m : batch.metrics()) {
            try {
                metrics.add(OtlpPayloads.metric(m));
            } catch (EventEncodingException e) {
                reportDropped("metric " + m.name(), e);
            }
        }
        if (!metrics.isEmpty()) {
            outcome = outcome.combine(post("metrics", metricsUrl, OtlpPayloads.metrics(rc, metrics), metrics.size()));
        }

        List<Map<String, Object>> logs = new ArrayList<>();
        for (LogRecord l : batch.logs()) logs.add(OtlpPayloads.log(l));
        if (!logs.isEmpty()) {
            outcome = outcome.combine(post("logs", logsUrl, OtlpPayloads.logs(rc, logs), logs.size()));
        }
        return outcome;
    }

    private SendOutcome post(String signal, HttpUrl url, Map<String, Object> envelope, int count) {
        byte[] body;
        try {
            body = MAPPER.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize OTLP {} payload", signal, e);
            return SendOutcome.failure(0, e);
        }
        return deliver("OTLP " + signal + " export of " + count, url, body, JSON, Map.of());
    }
}
