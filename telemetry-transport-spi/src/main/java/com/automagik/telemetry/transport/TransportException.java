package com.automagik.telemetry.transport;

import java.io.IOException;

/** Non-2xx answer from a backend. Network failures stay plain {@link IOException}s. */
public class TransportException extends IOException {
    private final int statusCode;
    private final boolean retryable;

    public TransportException(String message, int statusCode, boolean retryable) {
        super(message);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    /** 5xx and 429 are worth retrying; any other status is permanent. */
    public static TransportException forStatus(int statusCode, String body) {
        boolean retryable = statusCode >= 500 || statusCode == 429;
        String detail = body == null || body.isBlank() ? "" : " - " + body;
        return new TransportException("HTTP " + statusCode + detail, statusCode, retryable);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
