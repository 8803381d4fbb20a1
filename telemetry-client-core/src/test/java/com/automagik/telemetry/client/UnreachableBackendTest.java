package com.automagik.telemetry.client;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class UnreachableBackendTest {

    @TempDir
    Path home;

    private static int closedPort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    @Test
    void tracking_does_not_block_on_a_dead_collector() throws Exception {
        TelemetryConfig config = TelemetryConfig.builder()
                .projectName("omni")
                .version("1.0.0")
                .enabled(true)
                .endpoint("http://127.0.0.1:" + closedPort() + "/v1/traces")
                .timeout(Duration.ofSeconds(1))
                .maxRetries(2)
                .retryBackoffBase(Duration.ofMillis(10))
                .build();
        TelemetryClient client = new TelemetryClient(config, null, home);

        long start = System.nanoTime();
        for (int i = 0; i < 50; i++) client.trackEvent("tick", Map.of("i", i));
        long trackMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();

        client.flush();
        client.shutdown();
        long totalMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertThat(trackMillis).isLessThan(500);
        assertThat(totalMillis).isLessThan(5_000);
        assertThat(client.status().queued()).isZero();
    }
}
