package com.automagik.telemetry.client;

import com.automagik.telemetry.transport.Transport;
import com.automagik.telemetry.transport.clickhouse.ClickHouseTransport;
import com.automagik.telemetry.transport.otlp.OtlpEndpoints;
import com.automagik.telemetry.transport.otlp.OtlpTransport;

/** Picks the backend implementation once, at client construction. */
public final class TransportFactory {

    private TransportFactory() {}

    public static Transport create(TelemetryConfig config) {
        return switch (config.getBackend()) {
            case OTLP -> new OtlpTransport(endpoints(config), config.transportOptions());
            case CLICKHOUSE -> new ClickHouseTransport(config.clickHouseSettings(), config.transportOptions());
        };
    }

    static OtlpEndpoints endpoints(TelemetryConfig config) {
        return OtlpEndpoints.resolve(config.getEndpoint(), config.getMetricsEndpoint(), config.getLogsEndpoint());
    }
}
