package com.automagik.telemetry.client;

import com.automagik.telemetry.client.batch.BatchScheduler;
import com.automagik.telemetry.client.privacy.PrivacyEngine;
import com.automagik.telemetry.model.Attributes;
import com.automagik.telemetry.model.LogRecord;
import com.automagik.telemetry.model.MetricKind;
import com.automagik.telemetry.model.MetricPoint;
import com.automagik.telemetry.model.ResourceContext;
import com.automagik.telemetry.model.Span;
import com.automagik.telemetry.model.TelemetryEvent;
import com.automagik.telemetry.transport.Transport;
import io.opentelemetry.api.logs.Severity;
import io.opentelemetry.api.trace.StatusCode;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for applications. Every {@code track*} call sanitizes its attributes, builds an event and
 * queues it; delivery happens on a background worker. Apart from construction, no method throws, and
 * only {@link #flush()} and {@link #shutdown()} block, each for at most the configured timeout.
 *
 * <pre>{@code
 * TelemetryClient telemetry = TelemetryClient.create(TelemetryConfig.builder()
 *         .projectName("omni").version("1.2.0").enabled(true).build());
 * telemetry.trackEvent(StandardEvents.FEATURE_USED, Map.of("feature_name", "export"));
 * }</pre>
 */
@Slf4j
public final class TelemetryClient implements AutoCloseable {
    static final String ERROR_TYPE = "error_type";

    private final TelemetryConfig config;
    private final boolean enabled;
    private final PrivacyEngine privacy = new PrivacyEngine();
    private final ResourceContext resource;
    private final BatchScheduler scheduler;

    /** Uses {@code config} as given; see {@link #create} to apply environment overrides first. */
    public TelemetryClient(TelemetryConfig config) {
        this(config, null, TelemetryEnvironment.system().home());
    }

    /**
     * @param transport backend to use, or {@code null} to build the one {@code config} selects
     * @param home directory holding the anonymous id file
     * @throws TelemetryConfigException if {@code config} is invalid
     */
    public TelemetryClient(TelemetryConfig config, Transport transport, Path home) {
        this.config = config.validate();
        this.enabled = config.isEnabled();
        if (!enabled) {
            this.resource = null;
            this.scheduler = null;
            log.debug("Telemetry disabled for {}", config.getProjectName());
            return;
        }
        this.resource = new ResourceContextFactory(home).create(config);
        Transport t = transport != null ? transport : TransportFactory.create(config);
        this.scheduler = new BatchScheduler(
                t, resource, config.getBatchSize(), config.getFlushInterval(), config.isVerbose());
        if (config.isVerbose()) {
            log.info(
                    "Telemetry enabled for {} {} via {} ({})",
                    config.getProjectName(),
                    config.getVersion(),
                    t.name(),
                    describeEndpoint(config));
        }
    }

    /** Resolves {@code base} against system properties, environment variables and opt-out rules. */
    public static TelemetryClient create(TelemetryConfig base) {
        TelemetryEnvironment env = TelemetryEnvironment.system();
        return new TelemetryClient(env.resolve(base), null, env.home());
    }

    public void trackEvent(String name) {
        trackEvent(name, Map.of());
    }

    public void trackEvent(String name, Map<String, ?> attributes) {
        if (!enabled) return;
        try {
            enqueue(Span.event(name, Instant.now(), StatusCode.OK, privacy.sanitize(attributes)));
        } catch (RuntimeException e) {
            swallow("trackEvent", e);
        }
    }

    public void trackMetric(String name, double value) {
        trackMetric(name, value, MetricKind.GAUGE, Map.of());
    }

    public void trackMetric(String name, double value, MetricKind kind, Map<String, ?> attributes) {
        trackMetric(name, value, kind, "", attributes);
    }

    public void trackMetric(String name, double value, MetricKind kind, String unit, Map<String, ?> attributes) {
        if (!enabled) return;
        try {
            enqueue(new MetricPoint(name, value, kind, unit, Instant.now(), privacy.sanitize(attributes)));
        } catch (RuntimeException e) {
            swallow("trackMetric", e);
        }
    }

    public void trackLog(String body) {
        trackLog(body, Severity.INFO, Map.of());
    }

    public void trackLog(String body, Severity severity, Map<String, ?> attributes) {
        if (!enabled) return;
        try {
            enqueue(new LogRecord(
                    privacy.scrubText(body), severity, Instant.now(), null, privacy.sanitize(attributes)));
        } catch (RuntimeException e) {
            swallow("trackLog", e);
        }
    }

    public void trackError(Throwable error) {
        trackError(error, Map.of());
    }

    /** Records the error's type only; its message is free text and is never sent. */
    public void trackError(Throwable error, Map<String, ?> context) {
        if (!enabled) return;
        try {
            Attributes attrs = Attributes.builder()
                    .putAll(privacy.sanitize(context))
                    .put(ERROR_TYPE, error == null ? "Unknown" : error.getClass().getSimpleName())
                    .build();
            enqueue(Span.event(StandardEvents.ERROR_OCCURRED, Instant.now(), StatusCode.ERROR, attrs));
        } catch (RuntimeException e) {
            swallow("trackError", e);
        }
    }

    /** Sends everything queued, waiting at most the configured timeout. */
    public void flush() {
        if (!enabled) return;
        try {
            if (!scheduler.flushAndWait(config.getTimeout())) {
                log.debug("Flush did not complete within {}", config.getTimeout());
            }
        } catch (RuntimeException e) {
            swallow("flush", e);
        }
    }

    /** Final flush bounded by the configured timeout; later {@code track*} calls are dropped. */
    public void shutdown() {
        if (!enabled) return;
        try {
            scheduler.shutdown(config.getTimeout());
        } catch (RuntimeException e) {
            swallow("shutdown", e);
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public TelemetryStatus status() {
        return new TelemetryStatus(
                enabled,
                config.getProjectName(),
                config.getVersion(),
                config.getBackend(),
                describeEndpoint(config),
                resource == null ? null : resource.getSessionId(),
                scheduler == null ? 0 : scheduler.pending(),
                config.isVerbose());
    }

    private void enqueue(TelemetryEvent event) {
        if (!scheduler.enqueue(event)) log.debug("Telemetry client stopped; dropping {}", event.signal());
    }

    private void swallow(String operation, RuntimeException e) {
        if (config.isVerbose()) {
            log.info("Telemetry {} failed: {}", operation, e.toString());
        } else {
            log.debug("Telemetry {} failed", operation, e);
        }
    }

    private static String describeEndpoint(TelemetryConfig config) {
        return config.getBackend() == Backend.OTLP
                ? TransportFactory.endpoints(config).traces()
                : config.getClickhouseEndpoint();
    }
}
