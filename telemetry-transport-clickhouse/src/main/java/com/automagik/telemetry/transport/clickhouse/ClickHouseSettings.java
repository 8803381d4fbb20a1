package com.automagik.telemetry.transport.clickhouse;

import java.util.regex.Pattern;
import lombok.Builder;

/**
 * Where and as whom to insert. Database and table names end up inside an {@code INSERT} statement, so
 * only plain identifiers are accepted.
 */
@Builder(toBuilder = true)
public record ClickHouseSettings(
        String endpoint,
        String database,
        String tracesTable,
        String metricsTable,
        String logsTable,
        String username,
        String password) {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public ClickHouseSettings {
        requireIdentifier("database", database);
        requireIdentifier("tracesTable", tracesTable);
        requireIdentifier("metricsTable", metricsTable);
        requireIdentifier("logsTable", logsTable);
        if (endpoint == null || endpoint.isBlank()) throw new IllegalArgumentException("endpoint is required");
        endpoint = endpoint.trim();
        password = password == null ? "" : password;
    }

    public static boolean isIdentifier(String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    private static void requireIdentifier(String field, String value) {
        if (!isIdentifier(value)) {
            throw new IllegalArgumentException(field + " must be a plain identifier, got '" + value + "'");
        }
    }

    @Override
    public String toString() {
        return "ClickHouseSettings[endpoint=" + endpoint + ", database=" + database + ", username=" + username + "]";
    }
}
