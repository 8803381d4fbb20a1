package com.automagik.telemetry.transport;

/**
 * Result of delivering a batch, after retries. Internal only; never surfaced to callers.
 *
 * @param lastError the last failure seen, or {@code null}
 */
public record SendOutcome(boolean success, int attempts, Exception lastError) {

    private static final SendOutcome NOTHING_TO_SEND = new SendOutcome(true, 0, null);

    public static SendOutcome success(int attempts) {
        return new SendOutcome(true, attempts, null);
    }

    public static SendOutcome failure(int attempts, Exception lastError) {
        return new SendOutcome(false, attempts, lastError);
    }

    public static SendOutcome empty() {
        return NOTHING_TO_SEND;
    }

    /** Success only if both succeeded; attempts add up and the most recent error wins. */
    public SendOutcome combine(SendOutcome other) {
        if (other == null) return this;
        Exception err = other.lastError != null ? other.lastError : lastError;
        return new SendOutcome(success && other.success, attempts + other.attempts, err);
    }
}
