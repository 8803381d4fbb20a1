package com.automagik.telemetry.client;

/** Invalid client configuration. The only exception the public client API lets escape. */
public class TelemetryConfigException extends RuntimeException {

    public TelemetryConfigException(String message) {
        super(message);
    }

    public TelemetryConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
