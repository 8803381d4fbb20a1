package com.automagik.telemetry.transport.otlp;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class OtlpEndpointsTest {

    @Test
    void swaps_traces_suffix_for_other_signals() {
        OtlpEndpoints e = OtlpEndpoints.resolve("https://telemetry.namastex.ai/v1/traces", null, null);

        assertThat(e.traces()).isEqualTo("https://telemetry.namastex.ai/v1/traces");
        assertThat(e.metrics()).isEqualTo("https://telemetry.namastex.ai/v1/metrics");
        assertThat(e.logs()).isEqualTo("https://telemetry.namastex.ai/v1/logs");
    }

    @Test
    void appends_signal_paths_to_a_bare_base() {
        OtlpEndpoints e = OtlpEndpoints.resolve("http://collector:4318/", "", " ");

        assertThat(e.traces()).isEqualTo("http://collector:4318");
        assertThat(e.metrics()).isEqualTo("http://collector:4318/v1/metrics");
        assertThat(e.logs()).isEqualTo("http://collector:4318/v1/logs");
    }

    @Test
    void explicit_endpoints_win() {
        OtlpEndpoints e = OtlpEndpoints.resolve(
                "http://collector:4318/v1/traces", "http://metrics:9000/in", "http://logs:9001/in");

        assertThat(e.metrics()).isEqualTo("http://metrics:9000/in");
        assertThat(e.logs()).isEqualTo("http://logs:9001/in");
    }
}
