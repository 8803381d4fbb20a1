package com.automagik.telemetry.transport.http;

import java.time.Duration;
import lombok.Builder;

/**
 * Knobs shared by the HTTP backends.
 *
 * @param maxRetries retries after the first attempt; each request is tried at most {@code maxRetries + 1} times
 * @param verbose log delivery failures at WARN instead of DEBUG
 */
@Builder(toBuilder = true)
public record HttpTransportOptions(
        Duration timeout,
        boolean compressionEnabled,
        int compressionThreshold,
        int maxRetries,
        Duration retryBackoffBase,
        boolean verbose) {

    public static HttpTransportOptions defaults() {
        return new HttpTransportOptions(Duration.ofSeconds(5), true, 1024, 3, Duration.ofSeconds(1), false);
    }
}
