package com.automagik.telemetry.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class TelemetryConfigTest {

    private static TelemetryConfig.TelemetryConfigBuilder valid() {
        return TelemetryConfig.builder().projectName("omni").version("1.0.0");
    }

    @Test
    void defaults() {
        TelemetryConfig c = valid().build().validate();

        assertThat(c.isEnabled()).isFalse();
        assertThat(c.getBackend()).isEqualTo(Backend.OTLP);
        assertThat(c.getEndpoint()).isEqualTo("https://telemetry.namastex.ai/v1/traces");
        assertThat(c.getOrganization()).isEqualTo("namastex");
        assertThat(c.getBatchSize()).isEqualTo(100);
        assertThat(c.getFlushInterval()).isEqualTo(Duration.ofSeconds(5));
        assertThat(c.getTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(c.getCompressionThreshold()).isEqualTo(1024);
        assertThat(c.getMaxRetries()).isEqualTo(3);
        assertThat(c.getRetryBackoffBase()).isEqualTo(Duration.ofSeconds(1));
        assertThat(c.getClickhouseEndpoint()).isEqualTo("http://localhost:8123");
        assertThat(c.getClickhouseUsername()).isEqualTo("default");
    }

    @Test
    void rejects_missing_project() {
        assertThatThrownBy(() -> TelemetryConfig.builder().version("1").build().validate())
                .isInstanceOf(TelemetryConfigException.class)
                .hasMessageContaining("projectName");
    }

    @Test
    void rejects_bad_numbers_and_durations() {
        assertThatThrownBy(() -> valid().batchSize(0).build().validate()).isInstanceOf(TelemetryConfigException.class);
        assertThatThrownBy(() -> valid().maxRetries(-1).build().validate()).isInstanceOf(TelemetryConfigException.class);
        assertThatThrownBy(() -> valid().flushInterval(Duration.ZERO).build().validate())
                .isInstanceOf(TelemetryConfigException.class);
        assertThatThrownBy(() -> valid().timeout(Duration.ofSeconds(61)).build().validate())
                .isInstanceOf(TelemetryConfigException.class)
                .hasMessageContaining("60s");
    }

    @Test
    void zero_retries_is_allowed() {
        assertThat(valid().maxRetries(0).build().validate().transportOptions().maxRetries()).isZero();
    }

    @Test
    void rejects_invalid_urls() {
        assertThatThrownBy(() -> valid().endpoint("not a url").build().validate())
                .isInstanceOf(TelemetryConfigException.class);
        assertThatThrownBy(() -> valid().metricsEndpoint("ftp://x").build().validate())
                .isInstanceOf(TelemetryConfigException.class);
    }

    @Test
    void clickhouse_names_must_be_identifiers() {
        assertThatThrownBy(() -> valid().backend(Backend.CLICKHOUSE)
                        .clickhouseTable("traces;drop")
                        .build()
                        .validate())
                .isInstanceOf(TelemetryConfigException.class)
                .hasMessageContaining("tracesTable");
    }

    @Test
    void password_is_not_printed() {
        assertThat(valid().clickhousePassword("hunter2").build().toString()).doesNotContain("hunter2");
    }
}
