package com.automagik.telemetry.spring.autoconfigure;

import com.automagik.telemetry.client.Backend;
import com.automagik.telemetry.client.TelemetryConfig;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring binding for the telemetry client.
 *
 * <h3>Configuration Example:</h3>
 * <pre>{@code
 * # application.yml
 * automagik:
 *   telemetry:
 *     project-name: omni
 *     version: 1.2.0
 *     enabled: true
 *     backend: clickhouse
 *     clickhouse:
 *       endpoint: http://clickhouse:8123
 *       database: telemetry
 * }</pre>
 *
 * <p>{@code AUTOMAGIK_TELEMETRY_*} environment variables and the opt-out rules still apply on top of these
 * values when the client is created.
 */
@ConfigurationProperties(prefix = "automagik.telemetry")
public class AutomagikTelemetryProperties {

    private String projectName;
    private String version;
    private String organization = "namastex";

    /** Telemetry is opt-in. */
    private boolean enabled = false;

    private boolean verbose = false;
    private Backend backend = Backend.OTLP;
    private String endpoint = TelemetryConfig.DEFAULT_ENDPOINT;
    private String metricsEndpoint;
    private String logsEndpoint;
    private Duration timeout = Duration.ofSeconds(5);
    private int batchSize = 100;
    private Duration flushInterval = Duration.ofSeconds(5);
    private boolean compressionEnabled = true;
    private int compressionThreshold = 1024;
    private int maxRetries = 3;
    private Duration retryBackoffBase = Duration.ofSeconds(1);
    private String environment = "production";

    private final ClickHouse clickhouse = new ClickHouse();

    public TelemetryConfig toConfig() {
        return TelemetryConfig.builder()
                .projectName(projectName)
                .version(version)
                .organization(organization)
                .enabled(enabled)
                .verbose(verbose)
                .backend(backend)
                .endpoint(endpoint)
                .metricsEndpoint(metricsEndpoint)
                .logsEndpoint(logsEndpoint)
                .timeout(timeout)
                .batchSize(batchSize)
                .flushInterval(flushInterval)
                .compressionEnabled(compressionEnabled)
                .compressionThreshold(compressionThreshold)
                .maxRetries(maxRetries)
                .retryBackoffBase(retryBackoffBase)
                .environment(environment)
                .clickhouseEndpoint(clickhouse.getEndpoint())
                .clickhouseDatabase(clickhouse.getDatabase())
                .clickhouseTable(clickhouse.getTable())
                .clickhouseMetricsTable(clickhouse.getMetricsTable())
                .clickhouseLogsTable(clickhouse.getLogsTable())
                .clickhouseUsername(clickhouse.getUsername())
                .clickhousePassword(clickhouse.getPassword())
                .build();
    }

    public String getProjectName() {
        return projectName;
    }

    public void setProjectName(String projectName) {
        this.projectName = projectName;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getOrganization() {
        return organization;
    }

    public void setOrganization(String organization) {
        this.organization = organization;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    public Backend getBackend() {
        return backend;
    }

    public void setBackend(Backend backend) {
        this.backend = backend;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public String getMetricsEndpoint() {
        return metricsEndpoint;
    }

    public void setMetricsEndpoint(String metricsEndpoint) {
        this.metricsEndpoint = metricsEndpoint;
    }

    public String getLogsEndpoint() {
        return logsEndpoint;
    }

    public void setLogsEndpoint(String logsEndpoint) {
        this.logsEndpoint = logsEndpoint;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public Duration getFlushInterval() {
        return flushInterval;
    }

    public void setFlushInterval(Duration flushInterval) {
        this.flushInterval = flushInterval;
    }

    public boolean isCompressionEnabled() {
        return compressionEnabled;
    }

    public void setCompressionEnabled(boolean compressionEnabled) {
        this.compressionEnabled = compressionEnabled;
    }

    public int getCompressionThreshold() {
        return compressionThreshold;
    }

    public void setCompressionThreshold(int compressionThreshold) {
        this.compressionThreshold = compressionThreshold;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getRetryBackoffBase() {
        return retryBackoffBase;
    }

    public void setRetryBackoffBase(Duration retryBackoffBase) {
        this.retryBackoffBase = retryBackoffBase;
    }

    public String getEnvironment() {
        return environment;
    }

    public void setEnvironment(String environment) {
        this.environment = environment;
    }

    public ClickHouse getClickhouse() {
        return clickhouse;
    }

    /** Settings used when {@code backend} is {@code clickhouse}. */
    public static class ClickHouse {
        private String endpoint = "http://localhost:8123";
        private String database = "telemetry";
        private String table = "traces";
        private String metricsTable = "metrics";
        private String logsTable = "logs";
        private String username = "default";
        private String password = "";

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getDatabase() {
            return database;
        }

        public void setDatabase(String database) {
            this.database = database;
        }

        public String getTable() {
            return table;
        }

        public void setTable(String table) {
            this.table = table;
        }

        public String getMetricsTable() {
            return metricsTable;
        }

        public void setMetricsTable(String metricsTable) {
            this.metricsTable = metricsTable;
        }

        public String getLogsTable() {
            return logsTable;
        }

        public void setLogsTable(String logsTable) {
            this.logsTable = logsTable;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }
    }
}
