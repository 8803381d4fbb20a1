package com.automagik.telemetry.transport.clickhouse;

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
import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import okhttp3.Credentials;
import okhttp3.HttpUrl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Inserts batches straight into ClickHouse over its HTTP interface using {@code JSONEachRow}, one
 * {@code INSERT} per signal table.
 */
public class ClickHouseTransport extends AbstractHttpTransport {
    private static final Logger log = LoggerFactory.getLogger(ClickHouseTransport.class);
    private static final String NDJSON = "application/x-ndjson";

    private final ClickHouseSettings settings;
    private final HttpUrl baseUrl;
    private final Map<String, String> headers;

    public ClickHouseTransport(ClickHouseSettings settings, HttpTransportOptions options) {
        this(settings, options, RetryExecutor.Sleeper.SYSTEM);
    }

    public ClickHouseTransport(
            ClickHouseSettings settings, HttpTransportOptions options, RetryExecutor.Sleeper sleeper) {
        super(options, sleeper);
        this.settings = settings;
        this.baseUrl = parseUrl(settings.endpoint());
        this.headers = settings.username() == null || settings.username().isBlank()
                ? Map.of()
                : Map.of("Authorization", Credentials.basic(settings.username(), settings.password()));
    }

    @Override
    public String name() {
        return "clickhouse";
    }

    HttpUrl insertUrl(String table) {
        return baseUrl.newBuilder()
                .addQueryParameter(
                        "query", "INSERT INTO " + settings.database() + "." + table + " FORMAT JSONEachRow")
                .build();
    }

    @Override
    public SendOutcome send(Batch batch) {
        ResourceContext rc = batch.resource();
        SendOutcome outcome = SendOutcome.empty();

        List<Map<String, Object>> traceRows = new ArrayList<>();
        for (Span s : batch.spans()) traceRows.add(ClickHouseRows.trace(s, rc));
        outcome = outcome.combine(insert(settings.tracesTable(), traceRows));

        List<Map<String, Object>> metricRows = new ArrayList<>();
        for (MetricPoint m : batch.metrics()) {
            try {
                metricRows.add(ClickHouseRows.metric(m, rc));
            } catch (EventEncodingException e) {
                reportDropped("metric " + m.name(), e);
            }
        }
        outcome = outcome.combine(insert(settings.metricsTable(), metricRows));

        List<Map<String, Object>> logRows = new ArrayList<>();
        for (LogRecord l : batch.logs()) logRows.add(ClickHouseRows.log(l, rc));
        return outcome.combine(insert(settings.logsTable(), logRows));
    }

    private SendOutcome insert(String table, List<Map<String, Object>> rows) {
        if (rows.isEmpty()) return SendOutcome.empty();
        byte[] body;
        try {
            body = jsonEachRow(rows);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize rows for {}.{}", settings.database(), table, e);
            return SendOutcome.failure(0, e);
        }
        return deliver(
                "ClickHouse insert of " + rows.size() + " rows into " + settings.database() + "." + table,
                insertUrl(table),
                body,
                NDJSON,
                headers);
    }

    static byte[] jsonEachRow(List<Map<String, Object>> rows) throws JsonProcessingException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(rows.size() * 512);
        for (Map<String, Object> row : rows) {
            out.writeBytes(MAPPER.writeValueAsBytes(row));
            out.write('\n');
        }
        return out.toByteArray();
    }
}
