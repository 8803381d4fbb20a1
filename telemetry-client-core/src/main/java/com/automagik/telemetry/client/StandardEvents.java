package com.automagik.telemetry.client;

/** Event names shared by every Automagik project, so dashboards can query across them. */
public final class StandardEvents {
    /** project, feature_name, feature_category */
    public static final String FEATURE_USED = "automagik.feature.used";
    /** project, endpoint, method, status */
    public static final String API_REQUEST = "automagik.api.request";
    /** project, command, subcommand */
    public static final String COMMAND_EXECUTED = "automagik.cli.command";
    /** project, operation_type, duration_ms */
    public static final String OPERATION_LATENCY = "automagik.performance.latency";
    /** Emitted by {@link TelemetryClient#trackError}. */
    public static final String ERROR_OCCURRED = "automagik.error";
    /** project, service_name, status */
    public static final String SERVICE_HEALTH = "automagik.health";

    private StandardEvents() {}
}
