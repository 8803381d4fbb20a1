package com.automagik.telemetry.spring.autoconfigure;

import static org.assertj.core.api.Assertions.assertThat;

import com.automagik.telemetry.client.Backend;
import com.automagik.telemetry.client.TelemetryClient;
import com.automagik.telemetry.client.TelemetryConfig;
import com.automagik.telemetry.client.TelemetryConfigException;
import com.automagik.telemetry.client.TelemetryEnvironment;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class TelemetryAutoConfigurationTest {

    @TempDir
    Path home;

    private ApplicationContextRunner runner() {
        return new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(TelemetryAutoConfiguration.class))
                .withBean(TelemetryEnvironment.class, () -> new TelemetryEnvironment(k -> null, k -> null, home));
    }

    @Test
    void backs_off_without_project_name() {
        runner().run(ctx -> assertThat(ctx).doesNotHaveBean(TelemetryClient.class));
    }

    @Test
    void binds_properties_into_client_config() {
        runner().withPropertyValues(
                        "automagik.telemetry.project-name=omni",
                        "automagik.telemetry.version=1.2.0",
                        "automagik.telemetry.backend=clickhouse",
                        "automagik.telemetry.batch-size=25",
                        "automagik.telemetry.flush-interval=250ms",
                        "automagik.telemetry.clickhouse.database=analytics",
                        "automagik.telemetry.clickhouse.password=s3cret")
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(TelemetryClient.class);
                    TelemetryConfig config = ctx.getBean(TelemetryConfig.class);
                    assertThat(config.getBackend()).isEqualTo(Backend.CLICKHOUSE);
                    assertThat(config.getBatchSize()).isEqualTo(25);
                    assertThat(config.getFlushInterval()).isEqualTo(Duration.ofMillis(250));
                    assertThat(config.getClickhouseDatabase()).isEqualTo("analytics");
                    assertThat(config.getClickhousePassword()).isEqualTo("s3cret");
                    assertThat(config.isEnabled()).isFalse();
                    assertThat(ctx.getBean(TelemetryClient.class).isEnabled()).isFalse();
                });
    }

    @Test
    void enabled_client_is_shut_down_with_the_context() {
        runner().withPropertyValues(
                        "automagik.telemetry.project-name=omni",
                        "automagik.telemetry.version=1.2.0",
                        "automagik.telemetry.enabled=true",
                        "automagik.telemetry.endpoint=http://127.0.0.1:1/v1/traces",
                        "automagik.telemetry.timeout=1s")
                .run(ctx -> {
                    TelemetryClient client = ctx.getBean(TelemetryClient.class);
                    assertThat(client.status().enabled()).isTrue();
                    assertThat(client.status().endpoint()).isEqualTo("http://127.0.0.1:1/v1/traces");
                });
    }

    @Test
    void invalid_settings_fail_startup() {
        runner().withPropertyValues(
                        "automagik.telemetry.project-name=omni",
                        "automagik.telemetry.version=1.2.0",
                        "automagik.telemetry.max-retries=-1")
                .run(ctx -> assertThat(ctx)
                        .hasFailed()
                        .getFailure()
                        .hasRootCauseInstanceOf(TelemetryConfigException.class));
    }
}
