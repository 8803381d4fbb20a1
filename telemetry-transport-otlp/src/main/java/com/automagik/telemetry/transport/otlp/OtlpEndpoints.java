package com.automagik.telemetry.transport.otlp;

/** Per-signal OTLP/HTTP URLs derived from one base endpoint. */
public record OtlpEndpoints(String traces, String metrics, String logs) {
    static final String TRACES_PATH = "/v1/traces";
    static final String METRICS_PATH = "/v1/metrics";
    static final String LOGS_PATH = "/v1/logs";

    /**
     * Traces always go to the base. Explicit metric/log endpoints win; otherwise a base ending in
     * {@code /v1/traces} has that suffix swapped, and any other base gets the signal path appended.
     */
    public static OtlpEndpoints resolve(String endpoint, String metricsEndpoint, String logsEndpoint) {
        String base = stripTrailingSlash(endpoint);
        String root = base.endsWith(TRACES_PATH) ? base.substring(0, base.length() - TRACES_PATH.length()) : base;
        String metrics = isBlank(metricsEndpoint) ? root + METRICS_PATH : metricsEndpoint.trim();
        String logs = isBlank(logsEndpoint) ? root + LOGS_PATH : logsEndpoint.trim();
        return new OtlpEndpoints(base, metrics, logs);
    }

    private static String stripTrailingSlash(String s) {
        String out = s.trim();
        while (out.endsWith("/")) out = out.substring(0, out.length() - 1);
        return out;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
