package com.automagik.telemetry.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Process-wide identity attached to every batch. Created once per client and shared read-only.
 * {@code userIdHash} is already hashed; the raw anonymous id never leaves the host.
 */
@Value
@Builder(toBuilder = true)
public class ResourceContext {
    public static final String SDK_NAME = "automagik-telemetry";
    public static final String SDK_VERSION = "0.1.0";

    @NonNull String projectName;

    @NonNull String version;

    @Builder.Default
    String organization = "namastex";

    @Builder.Default
    String os = System.getProperty("os.name", "unknown").toLowerCase(java.util.Locale.ROOT);

    @Builder.Default
    String osVersion = System.getProperty("os.version", "");

    @Builder.Default
    String runtimeName = "java";

    @Builder.Default
    String runtimeVersion = System.getProperty("java.version", "");

    @Builder.Default
    String environment = "production";

    @Builder.Default
    String sessionId = "";

    @Builder.Default
    String userIdHash = "";

    @Builder.Default
    String sdkName = SDK_NAME;

    @Builder.Default
    String sdkVersion = SDK_VERSION;

    /** Resource attributes in the OpenTelemetry semantic-convention vocabulary. */
    public Attributes toAttributes() {
        return Attributes.builder()
                .put("service.name", projectName)
                .put("service.version", version)
                .put("project.name", projectName)
                .put("project.version", version)
                .put("service.organization", organization)
                .put("os.type", os)
                .put("os.version", osVersion)
                .put("process.runtime.name", runtimeName)
                .put("process.runtime.version", runtimeVersion)
                .put("deployment.environment", environment)
                .put("session.id", sessionId)
                .put("user.id", userIdHash)
                .put("telemetry.sdk.name", sdkName)
                .put("telemetry.sdk.version", sdkVersion)
                .build();
    }
}
