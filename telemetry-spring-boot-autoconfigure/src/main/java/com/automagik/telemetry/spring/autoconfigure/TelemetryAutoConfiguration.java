package com.automagik.telemetry.spring.autoconfigure;

import com.automagik.telemetry.client.TelemetryClient;
import com.automagik.telemetry.client.TelemetryConfig;
import com.automagik.telemetry.client.TelemetryEnvironment;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Registers a {@link TelemetryClient} once {@code automagik.telemetry.project-name} is set. The client is
 * shut down, flushing what is queued, when the context closes.
 */
@AutoConfiguration
@EnableConfigurationProperties(AutomagikTelemetryProperties.class)
@ConditionalOnProperty(prefix = "automagik.telemetry", name = "project-name")
public class TelemetryAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public TelemetryEnvironment telemetryEnvironment() {
        return TelemetryEnvironment.system();
    }

    @Bean
    @ConditionalOnMissingBean
    public TelemetryConfig telemetryConfig(AutomagikTelemetryProperties properties, TelemetryEnvironment environment) {
        return environment.resolve(properties.toConfig());
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public TelemetryClient telemetryClient(TelemetryConfig config, TelemetryEnvironment environment) {
        return new TelemetryClient(config, null, environment.home());
    }
}
