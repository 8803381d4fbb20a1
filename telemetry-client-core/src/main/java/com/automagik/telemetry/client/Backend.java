package com.automagik.telemetry.client;

import java.util.Locale;

public enum Backend {
    OTLP,
    CLICKHOUSE;

    /** Case-insensitive lookup. */
    public static Backend parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new TelemetryConfigException("unknown backend '" + value + "', expected otlp or clickhouse");
        }
    }
}
