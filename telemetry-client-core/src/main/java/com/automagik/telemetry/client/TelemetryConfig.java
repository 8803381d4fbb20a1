package com.automagik.telemetry.client;

import com.automagik.telemetry.transport.clickhouse.ClickHouseSettings;
import com.automagik.telemetry.transport.http.HttpTransportOptions;
import java.time.Duration;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import okhttp3.HttpUrl;

/**
 * Resolved client configuration. Telemetry is opt-in: {@code enabled} defaults to {@code false}.
 * See {@link TelemetryEnvironment} for resolution from system properties and environment variables.
 */
@Value
@Builder(toBuilder = true)
public class TelemetryConfig {
    public static final String DEFAULT_ENDPOINT = "https://telemetry.namastex.ai/v1/traces";
    static final Duration MAX_TIMEOUT = Duration.ofSeconds(60);

    String projectName;

    String version;

    @Builder.Default
    String organization = "namastex";

    @Builder.Default
    boolean enabled = false;

    @Builder.Default
    boolean verbose = false;

    @Builder.Default
    Backend backend = Backend.OTLP;

    @Builder.Default
    String endpoint = DEFAULT_ENDPOINT;

    /** Optional; derived from {@link #endpoint} when unset. */
    String metricsEndpoint;

    /** Optional; derived from {@link #endpoint} when unset. */
    String logsEndpoint;

    @Builder.Default
    Duration timeout = Duration.ofSeconds(5);

    @Builder.Default
    int batchSize = 100;

    @Builder.Default
    Duration flushInterval = Duration.ofSeconds(5);

    @Builder.Default
    boolean compressionEnabled = true;

    @Builder.Default
    int compressionThreshold = 1024;

    /** Retries after the first attempt; backoff doubles from {@link #retryBackoffBase}. */
    @Builder.Default
    int maxRetries = 3;

    @Builder.Default
    Duration retryBackoffBase = Duration.ofSeconds(1);

    @Builder.Default
    String environment = "production";

    @Builder.Default
    String clickhouseEndpoint = "http://localhost:8123";

    @Builder.Default
    String clickhouseDatabase = "telemetry";

    @Builder.Default
    String clickhouseTable = "traces";

    @Builder.Default
    String clickhouseMetricsTable = "metrics";

    @Builder.Default
    String clickhouseLogsTable = "logs";

    @Builder.Default
    String clickhouseUsername = "default";

    @ToString.Exclude
    @Builder.Default
    String clickhousePassword = "";

    /**
     * @throws TelemetryConfigException describing the first invalid field
     */
    public TelemetryConfig validate() {
        requireText("projectName", projectName);
        requireText("version", version);
        requireText("organization", organization);
        requireText("environment", environment);
        if (backend == null) throw new TelemetryConfigException("backend is required");
        requirePositive("timeout", timeout);
        if (timeout.compareTo(MAX_TIMEOUT) > 0) {
            throw new TelemetryConfigException("timeout must be at most 60s, got " + timeout);
        }
        requirePositive("flushInterval", flushInterval);
        requirePositive("retryBackoffBase", retryBackoffBase);
        if (batchSize < 1) throw new TelemetryConfigException("batchSize must be positive, got " + batchSize);
        if (maxRetries < 0) throw new TelemetryConfigException("maxRetries must not be negative, got " + maxRetries);
        if (compressionThreshold < 0) {
            throw new TelemetryConfigException("compressionThreshold must not be negative");
        }
        if (backend == Backend.OTLP) {
            requireUrl("endpoint", endpoint);
            if (hasText(metricsEndpoint)) requireUrl("metricsEndpoint", metricsEndpoint);
            if (hasText(logsEndpoint)) requireUrl("logsEndpoint", logsEndpoint);
        } else {
            requireUrl("clickhouseEndpoint", clickhouseEndpoint);
            clickHouseSettings();
        }
        return this;
    }

    public HttpTransportOptions transportOptions() {
        return new HttpTransportOptions(
                timeout, compressionEnabled, compressionThreshold, maxRetries, retryBackoffBase, verbose);
    }

    public ClickHouseSettings clickHouseSettings() {
        try {
            return ClickHouseSettings.builder()
                    .endpoint(clickhouseEndpoint)
                    .database(clickhouseDatabase)
                    .tracesTable(clickhouseTable)
                    .metricsTable(clickhouseMetricsTable)
                    .logsTable(clickhouseLogsTable)
                    .username(clickhouseUsername)
                    .password(clickhousePassword)
                    .build();
        } catch (IllegalArgumentException e) {
            throw new TelemetryConfigException("invalid ClickHouse settings: " + e.getMessage(), e);
        }
    }

    private static void requireText(String field, String value) {
        if (!hasText(value)) throw new TelemetryConfigException(field + " is required");
    }

    private static void requirePositive(String field, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new TelemetryConfigException(field + " must be a positive duration, got " + value);
        }
    }

    private static void requireUrl(String field, String value) {
        requireText(field, value);
        if (HttpUrl.parse(value.trim()) == null) {
            throw new TelemetryConfigException(field + " is not a valid http(s) URL: " + value);
        }
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
