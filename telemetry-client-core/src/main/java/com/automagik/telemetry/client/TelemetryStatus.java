package com.automagik.telemetry.client;

/**
 * Read-only diagnostics snapshot.
 *
 * @param endpoint the traces URL for OTLP, the server URL for ClickHouse
 * @param queued events waiting for the next flush
 */
public record TelemetryStatus(
        boolean enabled,
        String projectName,
        String version,
        Backend backend,
        String endpoint,
        String sessionId,
        int queued,
        boolean verbose) {}
