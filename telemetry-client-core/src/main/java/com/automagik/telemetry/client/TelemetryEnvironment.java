package com.automagik.telemetry.client;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;

/**
 * Overlays settings from system properties ({@code automagik.telemetry.*}) and environment variables
 * ({@code AUTOMAGIK_TELEMETRY_*}) onto a base config, property first. Also decides whether telemetry may
 * run at all: an explicit enabled flag wins; otherwise the opt-out file, a CI runner or a development
 * {@code ENVIRONMENT} disable it.
 */
@Slf4j
public final class TelemetryEnvironment {
    public static final String PROPERTY_PREFIX = "automagik.telemetry.";
    public static final String ENV_PREFIX = "AUTOMAGIK_TELEMETRY_";
    public static final String OPT_OUT_FILE = ".automagik-no-telemetry";

    static final List<String> CI_VARIABLES = List.of("CI", "GITHUB_ACTIONS", "TRAVIS", "JENKINS", "GITLAB_CI", "CIRCLECI");
    static final Set<String> DEVELOPMENT_ENVIRONMENTS = Set.of("development", "dev", "test", "testing");
    private static final Set<String> TRUTHY = Set.of("true", "1", "yes", "on");
    private static final Set<String> FALSY = Set.of("false", "0", "no", "off");

    private final UnaryOperator<String> properties;
    private final UnaryOperator<String> env;
    private final Path home;

    public TelemetryEnvironment(UnaryOperator<String> properties, UnaryOperator<String> env, Path home) {
        this.properties = properties;
        this.env = env;
        this.home = home;
    }

    public static TelemetryEnvironment system() {
        return new TelemetryEnvironment(
                System::getProperty, System::getenv, Path.of(System.getProperty("user.home", ".")));
    }

    public Path home() {
        return home;
    }

    /** Applies overrides and the enablement rules; does not validate. */
    public TelemetryConfig resolve(TelemetryConfig base) {
        TelemetryConfig.TelemetryConfigBuilder b = base.toBuilder();
        setting("verbose").map(v -> parseFlag("verbose", v)).ifPresent(b::verbose);
        setting("backend").map(Backend::parse).ifPresent(b::backend);
        setting("endpoint").ifPresent(b::endpoint);
        setting("metrics.endpoint").ifPresent(b::metricsEndpoint);
        setting("logs.endpoint").ifPresent(b::logsEndpoint);
        setting("timeout").map(v -> seconds("timeout", v)).ifPresent(b::timeout);
        setting("batch.size").map(v -> integer("batch.size", v)).ifPresent(b::batchSize);
        setting("flush.interval").map(v -> millis("flush.interval", v)).ifPresent(b::flushInterval);
        setting("compression.enabled").map(v -> parseFlag("compression.enabled", v)).ifPresent(b::compressionEnabled);
        setting("compression.threshold").map(v -> integer("compression.threshold", v)).ifPresent(b::compressionThreshold);
        setting("max.retries").map(v -> integer("max.retries", v)).ifPresent(b::maxRetries);
        setting("retry.backoff.base").map(v -> millis("retry.backoff.base", v)).ifPresent(b::retryBackoffBase);
        setting("environment").ifPresent(b::environment);
        setting("clickhouse.endpoint").ifPresent(b::clickhouseEndpoint);
        setting("clickhouse.database").ifPresent(b::clickhouseDatabase);
        setting("clickhouse.table").ifPresent(b::clickhouseTable);
        setting("clickhouse.metrics.table").ifPresent(b::clickhouseMetricsTable);
        setting("clickhouse.logs.table").ifPresent(b::clickhouseLogsTable);
        setting("clickhouse.username").ifPresent(b::clickhouseUsername);
        setting("clickhouse.password").ifPresent(b::clickhousePassword);
        b.enabled(isEnabled(base.isEnabled()));
        return b.build();
    }

    /** Whether telemetry may run, given what the caller asked for. */
    public boolean isEnabled(boolean requested) {
        var explicit = setting("enabled");
        if (explicit.isPresent()) return TRUTHY.contains(explicit.get().trim().toLowerCase(Locale.ROOT));
        if (Files.exists(home.resolve(OPT_OUT_FILE))) {
            log.debug("Telemetry disabled by opt-out file {}", home.resolve(OPT_OUT_FILE));
            return false;
        }
        for (String ci : CI_VARIABLES) {
            if (hasText(env.apply(ci))) {
                log.debug("Telemetry disabled on CI ({} is set)", ci);
                return false;
            }
        }
        String environment = env.apply("ENVIRONMENT");
        if (environment != null && DEVELOPMENT_ENVIRONMENTS.contains(environment.trim().toLowerCase(Locale.ROOT))) {
            return false;
        }
        return requested;
    }

    /**
     * Resolves {@code automagik.telemetry.<name>} then {@code AUTOMAGIK_TELEMETRY_<NAME>}, dots becoming
     * underscores.
     */
    Optional<String> setting(String name) {
        String sys = properties.apply(PROPERTY_PREFIX + name);
        if (hasText(sys)) return Optional.of(sys.trim());
        String envValue = env.apply(ENV_PREFIX + name.replace('.', '_').toUpperCase(Locale.ROOT));
        if (hasText(envValue)) return Optional.of(envValue.trim());
        return Optional.empty();
    }

    static boolean parseFlag(String name, String value) {
        String v = value.toLowerCase(Locale.ROOT);
        if (TRUTHY.contains(v)) return true;
        if (FALSY.contains(v)) return false;
        throw new TelemetryConfigException(name + " must be a boolean, got '" + value + "'");
    }

    private static int integer(String name, String value) {
        return parse(name, value, Integer::parseInt);
    }

    private static Duration seconds(String name, String value) {
        return parse(name, value, v -> Duration.ofMillis(Math.round(Double.parseDouble(v) * 1000)));
    }

    private static Duration millis(String name, String value) {
        return parse(name, value, v -> Duration.ofMillis(Long.parseLong(v)));
    }

    private static <T> T parse(String name, String value, Function<String, T> parser) {
        try {
            return parser.apply(value);
        } catch (NumberFormatException e) {
            throw new TelemetryConfigException(name + " is not a number: '" + value + "'", e);
        }
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
